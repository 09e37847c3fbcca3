package io.fullerstack.components.registry;

import io.fullerstack.components.security.SecurityProfile;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Descriptive, non-functional data stored alongside each registration.
 * <p>
 * Metadata feeds discovery and diagnostics only; {@link ComponentRegistry#create(String)}
 * never consults it.
 *
 * @param implementationName human-readable name of the implementing type
 * @param factoryName        name of the factory (method) that builds instances
 * @param sourceLocation     where the registration originated ({@code Class:line} when captured),
 *                           null until the registry fills it in
 * @param capabilities       declared capability tags
 * @param security           security descriptors consumed by the security layer
 */
public record ComponentMetadata(
    String implementationName,
    String factoryName,
    String sourceLocation,
    Set<String> capabilities,
    SecurityProfile security
) {

    public static final String DEFAULT_IMPLEMENTATION_NAME = "Component";
    public static final String DEFAULT_FACTORY_NAME = "factory";

    public ComponentMetadata {
        implementationName = implementationName != null ? implementationName : DEFAULT_IMPLEMENTATION_NAME;
        factoryName = factoryName != null ? factoryName : DEFAULT_FACTORY_NAME;
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        security = security != null ? security : SecurityProfile.defaults();
    }

    /**
     * Metadata with every field at its default and no source location.
     *
     * @return default metadata
     */
    public static ComponentMetadata defaults() {
        return new ComponentMetadata(null, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param capability tag
     * @return true if the tag was declared
     */
    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    /**
     * Copy with the source location replaced.
     *
     * @param location new source location
     * @return updated copy
     */
    public ComponentMetadata withSourceLocation(String location) {
        return new ComponentMetadata(implementationName, factoryName, location, capabilities, security);
    }

    /**
     * Copy with the security profile replaced.
     *
     * @param profile new profile
     * @return updated copy
     */
    public ComponentMetadata withSecurity(SecurityProfile profile) {
        return new ComponentMetadata(implementationName, factoryName, sourceLocation, capabilities, profile);
    }

    /**
     * Builder for {@link ComponentMetadata}.
     */
    public static final class Builder {

        private String implementationName;
        private String factoryName;
        private String sourceLocation;
        private final Set<String> capabilities = new LinkedHashSet<>();
        private SecurityProfile security;

        private Builder() {
        }

        public Builder implementationName(String implementationName) {
            this.implementationName = implementationName;
            return this;
        }

        /**
         * Uses the simple name of the implementing class.
         */
        public Builder implementation(Class<?> implementation) {
            this.implementationName = Objects.requireNonNull(implementation, "implementation").getSimpleName();
            return this;
        }

        public Builder factoryName(String factoryName) {
            this.factoryName = factoryName;
            return this;
        }

        public Builder sourceLocation(String sourceLocation) {
            this.sourceLocation = sourceLocation;
            return this;
        }

        public Builder capability(String capability) {
            this.capabilities.add(Objects.requireNonNull(capability, "capability"));
            return this;
        }

        public Builder capabilities(String... capabilities) {
            for (String capability : capabilities) {
                capability(capability);
            }
            return this;
        }

        public Builder capabilities(Collection<String> capabilities) {
            capabilities.forEach(this::capability);
            return this;
        }

        public Builder security(SecurityProfile security) {
            this.security = security;
            return this;
        }

        public ComponentMetadata build() {
            return new ComponentMetadata(implementationName, factoryName, sourceLocation, capabilities, security);
        }
    }
}
