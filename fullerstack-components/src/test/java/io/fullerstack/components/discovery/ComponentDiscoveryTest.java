package io.fullerstack.components.discovery;

import io.fullerstack.components.Greeters.Counter;
import io.fullerstack.components.Greeters.EnglishGreeter;
import io.fullerstack.components.Greeters.Greeter;
import io.fullerstack.components.Greeters.SimpleCounter;
import io.fullerstack.components.registry.ComponentDescriptor;
import io.fullerstack.components.registry.ComponentFactory;
import io.fullerstack.components.registry.ComponentMetadata;
import io.fullerstack.components.registry.ComponentRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ComponentDiscovery} and {@link DiscoveryQuery}.
 */
class ComponentDiscoveryTest {

    private ComponentRegistry registry;
    private ComponentDiscovery discovery;

    @BeforeEach
    void setUp() {
        registry = new ComponentRegistry();
        discovery = new ComponentDiscovery(registry);

        greeter("greeter.english", "i18n");
        greeter("greeter.french", "i18n", "polite");
        greeter("greeter.pirate", "polite", "fun");
        greeter("greeter.formal", "i18n", "polite", "audited");
        counter("counter.simple");
        counter("counter.atomic", "thread-safe");
    }

    private void greeter(String name, String... capabilities) {
        registry.register(name, "greeter", ComponentFactory.of(Greeter.class, EnglishGreeter::new),
            ComponentMetadata.builder().capabilities(capabilities).build());
    }

    private void counter(String name, String... capabilities) {
        registry.register(name, "counter", ComponentFactory.of(Counter.class, SimpleCounter::new),
            ComponentMetadata.builder().capabilities(capabilities).build());
    }

    @Test
    @DisplayName("Required capabilities match only supersets")
    void requiredCapabilitiesMatchOnlySupersets() {
        assertThat(discovery.withCapabilities(Set.of("i18n", "polite")))
            .containsExactly("greeter.formal", "greeter.french");
    }

    @Test
    @DisplayName("Empty query returns every name in lexical order")
    void emptyQueryReturnsEverything() {
        assertThat(discovery.find(DiscoveryQuery.all()))
            .containsExactlyElementsOf(registry.list());
    }

    @Test
    @DisplayName("Optional capabilities rank but never exclude")
    void optionalCapabilitiesRankWithoutFiltering() {
        DiscoveryQuery query = DiscoveryQuery.builder()
            .moduleType("greeter")
            .prefer("polite", "audited")
            .build();

        assertThat(discovery.find(query)).containsExactly(
            "greeter.formal",   // 2 preferred
            "greeter.french",   // 1, lexically before pirate
            "greeter.pirate",   // 1
            "greeter.english"); // 0, still included
    }

    @Test
    @DisplayName("Required and preferred combine")
    void requiredAndPreferredCombine() {
        assertThat(discovery.withCapabilities(Set.of("i18n"), Set.of("audited")))
            .containsExactly("greeter.formal", "greeter.english", "greeter.french");
    }

    @Test
    void byPrefixFiltersOnNameStart() {
        assertThat(discovery.byPrefix("counter.")).containsExactly("counter.atomic", "counter.simple");
        assertThat(discovery.byPrefix("nothing.")).isEmpty();
    }

    @Test
    void byTypeFiltersOnExactModuleType() {
        assertThat(discovery.byType("counter")).containsExactly("counter.atomic", "counter.simple");
        assertThat(discovery.byType("count")).isEmpty();
    }

    @Test
    void globMatchesWholeName() {
        assertThat(discovery.matching("greeter.*")).hasSize(4);
        assertThat(discovery.matching("*.f*")).containsExactly("greeter.formal", "greeter.french");
        assertThat(discovery.matching("counter.?tomic")).containsExactly("counter.atomic");
        // '.' in the glob is literal, and the match is anchored
        assertThat(discovery.matching("greeter")).isEmpty();
        assertThat(discovery.matching("greeterXenglish")).isEmpty();
    }

    @Test
    void nameContainsCombinesWithType() {
        DiscoveryQuery query = DiscoveryQuery.builder()
            .nameContains("r.")
            .moduleType("counter")
            .build();

        assertThat(discovery.find(query)).containsExactly("counter.atomic", "counter.simple");
    }

    @Test
    void unknownCapabilityMatchesNothing() {
        assertThat(discovery.withCapabilities(Set.of("i18n", "teleport"))).isEmpty();
    }

    @Test
    void resultsReflectLaterRegistrations() {
        assertThat(discovery.byType("logger")).isEmpty();

        registry.register("logger.console", "logger", ComponentFactory.of(Counter.class, SimpleCounter::new));

        assertThat(discovery.byType("logger")).containsExactly("logger.console");
    }

    @Test
    void descriptorsCarryMetadata() {
        assertThat(discovery.findDescriptors(DiscoveryQuery.builder().require("audited").build()))
            .singleElement()
            .satisfies(descriptor -> {
                assertThat(descriptor.name()).isEqualTo("greeter.formal");
                assertThat(descriptor.metadata().hasCapability("polite")).isTrue();
            });
    }

    @Test
    void queryScoresOptionalMatches() {
        DiscoveryQuery query = DiscoveryQuery.builder().prefer("i18n", "polite", "fun").build();
        ComponentDescriptor pirate = registry.lookup("greeter.pirate").orElseThrow();

        assertThat(query.matches(pirate)).isTrue();
        assertThat(query.score(pirate)).isEqualTo(2);
    }
}
