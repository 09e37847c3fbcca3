package io.fullerstack.components.config;

import io.fullerstack.components.registry.DuplicatePolicy;

import java.util.Objects;

/**
 * Typed view of the registry configuration.
 *
 * @param duplicatePolicy         what a second registration of a name does
 * @param maxNameLength           longest accepted component name
 * @param maxModuleTypeLength     longest accepted module type
 * @param maxSourceLocationLength longest accepted source location
 * @param serviceLoaderEnabled    whether global bootstrap loads ComponentProviders via ServiceLoader
 * @param signatureExpirySeconds  age after which a module signature is no longer accepted
 * @param signatureAlgorithm      the only accepted signature algorithm
 */
public record RegistrySettings(
    DuplicatePolicy duplicatePolicy,
    int maxNameLength,
    int maxModuleTypeLength,
    int maxSourceLocationLength,
    boolean serviceLoaderEnabled,
    long signatureExpirySeconds,
    String signatureAlgorithm
) {

    public static final String DUPLICATE_POLICY = "registry.duplicate-policy";
    public static final String MAX_NAME_LENGTH = "registry.name.max-length";
    public static final String MAX_MODULE_TYPE_LENGTH = "registry.module-type.max-length";
    public static final String MAX_SOURCE_LOCATION_LENGTH = "registry.source-location.max-length";
    public static final String SERVICE_LOADER_ENABLED = "registry.bootstrap.service-loader";
    public static final String SIGNATURE_EXPIRY_SECONDS = "security.signature-expiry-seconds";
    public static final String SIGNATURE_ALGORITHM = "security.signature-algorithm";

    public static final int DEFAULT_MAX_NAME_LENGTH = 256;
    public static final int DEFAULT_MAX_MODULE_TYPE_LENGTH = 128;
    public static final int DEFAULT_MAX_SOURCE_LOCATION_LENGTH = 4096;
    public static final long DEFAULT_SIGNATURE_EXPIRY_SECONDS = 365L * 24 * 60 * 60;
    public static final String DEFAULT_SIGNATURE_ALGORITHM = "SHA256-RSA";

    public RegistrySettings {
        Objects.requireNonNull(duplicatePolicy, "duplicatePolicy");
        Objects.requireNonNull(signatureAlgorithm, "signatureAlgorithm");
        requirePositive(MAX_NAME_LENGTH, maxNameLength);
        requirePositive(MAX_MODULE_TYPE_LENGTH, maxModuleTypeLength);
        requirePositive(MAX_SOURCE_LOCATION_LENGTH, maxSourceLocationLength);
        requirePositive(SIGNATURE_EXPIRY_SECONDS, signatureExpirySeconds);
    }

    /**
     * Built-in defaults, no configuration files consulted.
     *
     * @return default settings
     */
    public static RegistrySettings defaults() {
        return new RegistrySettings(
            DuplicatePolicy.REJECT,
            DEFAULT_MAX_NAME_LENGTH,
            DEFAULT_MAX_MODULE_TYPE_LENGTH,
            DEFAULT_MAX_SOURCE_LOCATION_LENGTH,
            true,
            DEFAULT_SIGNATURE_EXPIRY_SECONDS,
            DEFAULT_SIGNATURE_ALGORITHM);
    }

    /**
     * Reads settings from configuration; absent keys take the built-in defaults.
     *
     * @param config configuration source
     * @return settings
     * @throws ConfigurationException if a present value is invalid
     */
    public static RegistrySettings from(RegistryConfig config) {
        Objects.requireNonNull(config, "config");
        DuplicatePolicy policy;
        String rawPolicy = config.getString(DUPLICATE_POLICY, DuplicatePolicy.REJECT.name());
        try {
            policy = DuplicatePolicy.parse(rawPolicy);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                "Invalid value for key '" + DUPLICATE_POLICY + "': " + rawPolicy + " in context: " + config.context(), e);
        }

        try {
            return new RegistrySettings(
                policy,
                config.getInt(MAX_NAME_LENGTH, DEFAULT_MAX_NAME_LENGTH),
                config.getInt(MAX_MODULE_TYPE_LENGTH, DEFAULT_MAX_MODULE_TYPE_LENGTH),
                config.getInt(MAX_SOURCE_LOCATION_LENGTH, DEFAULT_MAX_SOURCE_LOCATION_LENGTH),
                config.getBoolean(SERVICE_LOADER_ENABLED, true),
                config.getLong(SIGNATURE_EXPIRY_SECONDS, DEFAULT_SIGNATURE_EXPIRY_SECONDS),
                config.getString(SIGNATURE_ALGORITHM, DEFAULT_SIGNATURE_ALGORITHM));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage() + " in context: " + config.context(), e);
        }
    }

    /**
     * Copy with a different duplicate policy.
     */
    public RegistrySettings withDuplicatePolicy(DuplicatePolicy policy) {
        return new RegistrySettings(policy, maxNameLength, maxModuleTypeLength, maxSourceLocationLength,
            serviceLoaderEnabled, signatureExpirySeconds, signatureAlgorithm);
    }

    /**
     * Copy with ServiceLoader discovery switched on or off.
     */
    public RegistrySettings withServiceLoader(boolean enabled) {
        return new RegistrySettings(duplicatePolicy, maxNameLength, maxModuleTypeLength, maxSourceLocationLength,
            enabled, signatureExpirySeconds, signatureAlgorithm);
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(key + " must be positive, was " + value);
        }
    }
}
