package io.fullerstack.components.registry;

/**
 * Thrown when a component factory fails to construct an instance.
 * The factory's own exception, if any, is attached as the cause.
 * <p>
 * Failures of registry calls made inside the factory are wrapped too: a nested
 * {@code create} of an unknown name surfaces here as FACTORY_FAILED for the outer
 * component, and the nested {@link RegistryException} (with its own {@link ErrorKind},
 * e.g. NOT_FOUND) is available from {@link #getCause()}.
 */
public class FactoryFailedException extends RegistryException {

    public FactoryFailedException(String componentName, String message) {
        super(componentName, message);
    }

    public FactoryFailedException(String componentName, Throwable cause) {
        super(componentName, "Failed to instantiate component: " + componentName, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FACTORY_FAILED;
    }
}
