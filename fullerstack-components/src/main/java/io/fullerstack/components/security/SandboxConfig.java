package io.fullerstack.components.security;

import java.util.List;

/**
 * Isolation requested for a component. The registry records and logs it; enforcing it is up
 * to the host.
 */
public record SandboxConfig(
    boolean enabled,
    boolean filesystemIsolation,
    boolean networkIsolation,
    boolean processIsolation,
    boolean readOnlyFilesystem,
    List<String> allowedPaths,
    List<String> deniedPaths
) {

    public static final List<String> DEFAULT_DENIED_PATHS = List.of("/etc", "/usr/bin", "/bin");

    private static final SandboxConfig DEFAULTS =
        new SandboxConfig(true, true, true, true, true, List.of(), DEFAULT_DENIED_PATHS);

    private static final SandboxConfig DISABLED =
        new SandboxConfig(false, false, false, false, false, List.of(), List.of());

    public SandboxConfig {
        allowedPaths = allowedPaths != null ? List.copyOf(allowedPaths) : List.of();
        deniedPaths = deniedPaths != null ? List.copyOf(deniedPaths) : List.of();
    }

    /**
     * Enabled, every isolation flag on, read-only filesystem, system directories denied.
     */
    public static SandboxConfig defaults() {
        return DEFAULTS;
    }

    public static SandboxConfig disabled() {
        return DISABLED;
    }

    public SandboxConfig withAllowedPaths(List<String> paths) {
        return new SandboxConfig(enabled, filesystemIsolation, networkIsolation, processIsolation,
            readOnlyFilesystem, paths, deniedPaths);
    }
}
