package io.fullerstack.components.security;

import io.fullerstack.components.registry.ErrorKind;
import io.fullerstack.components.registry.RegistryException;

/**
 * Raised by {@link SecureComponents#createSecure(String)} when a component fails a
 * precondition. The factory is not run.
 */
public class SecurityViolationException extends RegistryException {

    private final String check;

    public SecurityViolationException(String componentName, String check, String message) {
        super(componentName, message);
        this.check = check;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SECURITY_VIOLATION;
    }

    /**
     * @return failed check: signature, review or supply_chain
     */
    public String check() {
        return check;
    }
}
