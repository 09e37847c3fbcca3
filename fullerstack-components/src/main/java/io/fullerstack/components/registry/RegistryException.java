package io.fullerstack.components.registry;

/**
 * Base class for every failure raised by the component registry.
 * <p>
 * Callers may match on the concrete subclass or switch on {@link #kind()}.
 */
public abstract class RegistryException extends RuntimeException {

    private final String componentName;

    protected RegistryException(String componentName, String message) {
        super(message);
        this.componentName = componentName;
    }

    protected RegistryException(String componentName, String message, Throwable cause) {
        super(message, cause);
        this.componentName = componentName;
    }

    /**
     * Failure category.
     *
     * @return error kind
     */
    public abstract ErrorKind kind();

    /**
     * Name of the component involved, or null when the failure is not tied to one.
     *
     * @return component name
     */
    public String componentName() {
        return componentName;
    }
}
