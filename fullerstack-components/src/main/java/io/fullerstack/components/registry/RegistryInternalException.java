package io.fullerstack.components.registry;

/**
 * Signals a violated registry invariant, such as re-entering the global
 * bootstrap from inside itself.
 */
public class RegistryInternalException extends RegistryException {

    public RegistryInternalException(String message) {
        super(null, message);
    }

    public RegistryInternalException(String message, Throwable cause) {
        super(null, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
