package io.fullerstack.components.registry;

/**
 * Thrown when a {@link ComponentHandle} is narrowed to an interface the
 * constructed instance does not implement.
 */
public class TypeMismatchException extends RegistryException {

    private final Class<?> requestedType;
    private final Class<?> actualType;

    public TypeMismatchException(String componentName, Class<?> requestedType, Class<?> actualType) {
        super(componentName, "Component type mismatch for "
            + (componentName != null ? componentName : "unnamed component")
            + ": requested " + requestedType.getName() + " but instance is " + actualType.getName());
        this.requestedType = requestedType;
        this.actualType = actualType;
    }

    public Class<?> requestedType() {
        return requestedType;
    }

    public Class<?> actualType() {
        return actualType;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TYPE_MISMATCH;
    }
}
