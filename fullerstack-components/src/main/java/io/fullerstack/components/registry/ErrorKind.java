package io.fullerstack.components.registry;

/**
 * Distinguishes the failure causes reported by the registry.
 * <p>
 * Each kind implies a different fix:
 * <ul>
 *   <li>{@link #NOT_FOUND} - register the component</li>
 *   <li>{@link #DUPLICATE_NAME} - pick another name or a replacing registry</li>
 *   <li>{@link #FACTORY_FAILED} - fix the module's construction</li>
 *   <li>{@link #TYPE_MISMATCH} - fix the call site (or the registrant)</li>
 *   <li>{@link #INTERNAL} - a registry invariant was violated</li>
 *   <li>{@link #SECURITY_VIOLATION} - the module failed a security check</li>
 * </ul>
 */
public enum ErrorKind {
    NOT_FOUND,
    DUPLICATE_NAME,
    FACTORY_FAILED,
    TYPE_MISMATCH,
    INTERNAL,
    SECURITY_VIOLATION
}
