package io.fullerstack.components.security;

/**
 * Access a component is granted, plus its resource limits.
 * <p>
 * Named permissions for {@link #allows(String)}: {@value #FILESYSTEM_ACCESS},
 * {@value #NETWORK_ACCESS}, {@value #PROCESS_SPAWN}, {@value #ENV_ACCESS} and
 * {@value #SYSTEM_ACCESS}.
 */
public record ModulePermissions(
    boolean filesystemAccess,
    boolean networkAccess,
    boolean processSpawn,
    boolean envAccess,
    boolean systemAccess,
    long memoryLimitMb,
    int cpuLimitPercent,
    long timeoutSeconds
) {

    public static final String FILESYSTEM_ACCESS = "filesystem_access";
    public static final String NETWORK_ACCESS = "network_access";
    public static final String PROCESS_SPAWN = "process_spawn";
    public static final String ENV_ACCESS = "env_access";
    public static final String SYSTEM_ACCESS = "system_access";

    public static final long DEFAULT_MEMORY_LIMIT_MB = 128;
    public static final int DEFAULT_CPU_LIMIT_PERCENT = 50;
    public static final long DEFAULT_TIMEOUT_SECONDS = 30;

    public ModulePermissions {
        if (memoryLimitMb <= 0) {
            throw new IllegalArgumentException("memoryLimitMb must be positive: " + memoryLimitMb);
        }
        if (cpuLimitPercent <= 0 || cpuLimitPercent > 100) {
            throw new IllegalArgumentException("cpuLimitPercent must be in 1..100: " + cpuLimitPercent);
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeoutSeconds must be positive: " + timeoutSeconds);
        }
    }

    /**
     * No access granted, default limits.
     */
    public static ModulePermissions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param permission one of the named permissions
     * @return whether it is granted; false for unknown names
     */
    public boolean allows(String permission) {
        if (permission == null) {
            return false;
        }
        return switch (permission) {
            case FILESYSTEM_ACCESS -> filesystemAccess;
            case NETWORK_ACCESS -> networkAccess;
            case PROCESS_SPAWN -> processSpawn;
            case ENV_ACCESS -> envAccess;
            case SYSTEM_ACCESS -> systemAccess;
            default -> false;
        };
    }

    public static final class Builder {

        private boolean filesystemAccess;
        private boolean networkAccess;
        private boolean processSpawn;
        private boolean envAccess;
        private boolean systemAccess;
        private long memoryLimitMb = DEFAULT_MEMORY_LIMIT_MB;
        private int cpuLimitPercent = DEFAULT_CPU_LIMIT_PERCENT;
        private long timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

        private Builder() {
        }

        public Builder filesystemAccess(boolean value) {
            this.filesystemAccess = value;
            return this;
        }

        public Builder networkAccess(boolean value) {
            this.networkAccess = value;
            return this;
        }

        public Builder processSpawn(boolean value) {
            this.processSpawn = value;
            return this;
        }

        public Builder envAccess(boolean value) {
            this.envAccess = value;
            return this;
        }

        public Builder systemAccess(boolean value) {
            this.systemAccess = value;
            return this;
        }

        public Builder memoryLimitMb(long value) {
            this.memoryLimitMb = value;
            return this;
        }

        public Builder cpuLimitPercent(int value) {
            this.cpuLimitPercent = value;
            return this;
        }

        public Builder timeoutSeconds(long value) {
            this.timeoutSeconds = value;
            return this;
        }

        public ModulePermissions build() {
            return new ModulePermissions(filesystemAccess, networkAccess, processSpawn, envAccess,
                systemAccess, memoryLimitMb, cpuLimitPercent, timeoutSeconds);
        }
    }
}
