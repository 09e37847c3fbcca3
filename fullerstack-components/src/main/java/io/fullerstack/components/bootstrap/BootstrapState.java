package io.fullerstack.components.bootstrap;

/**
 * Lifecycle of a {@link GlobalRegistry}.
 */
public enum BootstrapState {

    /** Nothing built yet; the next access initializes. */
    UNINITIALIZED,

    /** One thread is draining producers into a fresh registry. */
    INITIALIZING,

    /** The registry is built; every access returns the same instance. */
    READY
}
