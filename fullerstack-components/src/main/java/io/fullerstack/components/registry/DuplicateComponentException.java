package io.fullerstack.components.registry;

/**
 * Thrown by a {@link DuplicatePolicy#REJECT} registry when a name is registered twice.
 */
public class DuplicateComponentException extends RegistryException {

    public DuplicateComponentException(String componentName) {
        super(componentName, "Component already registered: " + componentName);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.DUPLICATE_NAME;
    }
}
