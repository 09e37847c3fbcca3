package io.fullerstack.components.discovery;

import io.fullerstack.components.registry.ComponentDescriptor;
import io.fullerstack.components.registry.ComponentRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Read-only queries over a {@link ComponentRegistry}.
 *
 * <p><b>Matching:</b> a component matches when every filter in the {@link DiscoveryQuery}
 * holds; for capabilities that means its tag set is a superset of the required tags.
 *
 * <p><b>Ordering:</b>
 * <ol>
 *   <li>more optional ("preferred") capabilities declared sorts first</li>
 *   <li>ties, and queries without optional capabilities, are in lexical name order</li>
 * </ol>
 * Optional capabilities never remove a candidate. The result is deterministic for a given
 * registry content.
 *
 * <p>Each query scans one snapshot taken under the registry's read lock; no index is kept,
 * so results always reflect the registrations at the time of the call.
 */
public final class ComponentDiscovery {

    private static final Logger logger = LoggerFactory.getLogger(ComponentDiscovery.class);

    private static final Comparator<ComponentDescriptor> BY_NAME = Comparator.comparing(ComponentDescriptor::name);

    private final ComponentRegistry registry;

    public ComponentDiscovery(ComponentRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * @param query filters and preferences
     * @return matching names, ranked
     */
    public List<String> find(DiscoveryQuery query) {
        return findDescriptors(query).stream()
            .map(ComponentDescriptor::name)
            .toList();
    }

    /**
     * Like {@link #find(DiscoveryQuery)} but returns the descriptors.
     *
     * @param query filters and preferences
     * @return matching descriptors, ranked
     */
    public List<ComponentDescriptor> findDescriptors(DiscoveryQuery query) {
        Objects.requireNonNull(query, "query");
        Comparator<ComponentDescriptor> ranking = Comparator
            .comparingInt((ComponentDescriptor descriptor) -> query.score(descriptor))
            .reversed()
            .thenComparing(BY_NAME);

        List<ComponentDescriptor> matches = registry.descriptors().stream()
            .filter(query::matches)
            .sorted(ranking)
            .toList();

        logger.debug("Discovery {} matched {} modules", query, matches.size());
        return matches;
    }

    /**
     * Names starting with the prefix.
     */
    public List<String> byPrefix(String prefix) {
        return find(DiscoveryQuery.builder().namePrefix(prefix).build());
    }

    /**
     * Names whose whole name matches the glob ({@code *}, {@code ?}).
     */
    public List<String> matching(String glob) {
        return find(DiscoveryQuery.builder().namePattern(glob).build());
    }

    /**
     * Names registered with the module type.
     */
    public List<String> byType(String moduleType) {
        return find(DiscoveryQuery.builder().moduleType(moduleType).build());
    }

    /**
     * Names declaring every one of the capabilities.
     */
    public List<String> withCapabilities(Set<String> required) {
        return find(DiscoveryQuery.builder().require(required).build());
    }

    /**
     * Names declaring every required capability, ranked by how many preferred ones they declare.
     */
    public List<String> withCapabilities(Set<String> required, Set<String> preferred) {
        return find(DiscoveryQuery.builder().require(required).prefer(preferred).build());
    }
}
