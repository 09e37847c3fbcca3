package io.fullerstack.components.registry;

import java.util.Objects;

/**
 * Immutable registration record: a unique name, a type tag, the factory and its metadata.
 * <p>
 * Records are produced by {@link io.fullerstack.components.spi.ComponentProvider}s, by
 * {@link io.fullerstack.components.bootstrap.RegistrationCollector#submit(Registration)}, or
 * implicitly by {@link ComponentRegistry#register(String, String, ComponentFactory)}.
 *
 * @param name       unique key within one registry
 * @param moduleType coarse type tag for filtering
 * @param factory    builds a new instance per create call
 * @param metadata   descriptive metadata
 */
public record Registration(String name, String moduleType, ComponentFactory factory, ComponentMetadata metadata) {

    public Registration {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(moduleType, "moduleType");
        Objects.requireNonNull(factory, "factory");
        metadata = metadata != null ? metadata : ComponentMetadata.defaults();
    }

    /**
     * Registration with default metadata.
     */
    public static Registration of(String name, String moduleType, ComponentFactory factory) {
        return new Registration(name, moduleType, factory, ComponentMetadata.defaults());
    }

    /**
     * @return the registration without its factory
     */
    public ComponentDescriptor descriptor() {
        return new ComponentDescriptor(name, moduleType, metadata);
    }

    @Override
    public String toString() {
        return "Registration[name=" + name + ", moduleType=" + moduleType
            + ", implementation=" + metadata.implementationName() + "]";
    }
}
