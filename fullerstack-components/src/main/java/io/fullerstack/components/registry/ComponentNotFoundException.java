package io.fullerstack.components.registry;

/**
 * Thrown when no registration exists for the requested name.
 */
public class ComponentNotFoundException extends RegistryException {

    public ComponentNotFoundException(String componentName) {
        super(componentName, "Component not found: " + componentName);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NOT_FOUND;
    }
}
