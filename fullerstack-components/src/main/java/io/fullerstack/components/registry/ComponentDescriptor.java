package io.fullerstack.components.registry;

import java.util.Objects;

/**
 * Read-only view of a registration: everything except the factory.
 *
 * @param name       registered name
 * @param moduleType coarse type tag
 * @param metadata   descriptive metadata
 */
public record ComponentDescriptor(String name, String moduleType, ComponentMetadata metadata) {

    public ComponentDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(moduleType, "moduleType");
        Objects.requireNonNull(metadata, "metadata");
    }

    /**
     * One-line diagnostic rendering.
     *
     * @return summary text
     */
    public String summary() {
        return "Module: " + name + " (type: " + moduleType + ")"
            + " - implementation: " + metadata.implementationName()
            + ", source: " + metadata.sourceLocation()
            + ", capabilities: " + metadata.capabilities()
            + ", " + metadata.security().summary();
    }
}
