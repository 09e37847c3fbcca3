package io.fullerstack.components.config;

import java.util.*;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Layered registry configuration backed by {@link ResourceBundle} property files.
 *
 * <p>Lookup order for every key:
 * <ol>
 *   <li>JVM system property of the same name</li>
 *   <li>{@code registry_{name}.properties} (only for {@link #forRegistry(String)})</li>
 *   <li>{@code registry.properties} (global defaults, shipped with the library)</li>
 * </ol>
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # registry.properties
 * registry.duplicate-policy=reject
 * registry.name.max-length=256
 *
 * # registry_plugins.properties
 * registry.duplicate-policy=replace
 * </pre>
 *
 * <p><strong>Usage:</strong>
 * <pre>
 * RegistryConfig config = RegistryConfig.forRegistry("plugins");
 * String policy = config.getString("registry.duplicate-policy");
 * // → "replace" (from registry_plugins.properties)
 * int maxName = config.getInt("registry.name.max-length", 128);
 * // → 256 (falls back to registry.properties)
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <pre>
 * java -Dregistry.duplicate-policy=replace -jar app.jar
 * </pre>
 */
public class RegistryConfig {

  public static final String BASE_NAME = "registry";

  private static final Pattern REGISTRY_NAME = Pattern.compile("[a-zA-Z0-9-]+");

  private static final ResourceBundle.Control NO_FALLBACK =
    ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

  private final List<ResourceBundle> layers;
  private final String context;  // For error messages

  private RegistryConfig(List<ResourceBundle> layers, String context) {
    this.layers = List.copyOf(layers);
    this.context = context;
  }

  /**
   * Get global configuration (registry.properties).
   *
   * @return Global configuration
   * @throws ConfigurationException if registry.properties is not on the classpath
   */
  public static RegistryConfig global() {
    return new RegistryConfig(List.of(load(BASE_NAME)), "global");
  }

  /**
   * Get configuration for a named registry.
   *
   * <p>Values in {@code registry_{registryName}.properties} override the global file. A missing
   * registry-specific file is not an error; the global values apply.
   *
   * @param registryName Registry name (letters, digits and '-')
   * @return Registry-specific configuration
   */
  public static RegistryConfig forRegistry(String registryName) {
    Objects.requireNonNull(registryName, "registryName cannot be null");
    if (registryName.isBlank()) {
      throw new IllegalArgumentException("registryName cannot be blank");
    }
    if (!REGISTRY_NAME.matcher(registryName).matches()) {
      throw new IllegalArgumentException("registryName must match " + REGISTRY_NAME + ": " + registryName);
    }

    List<ResourceBundle> layers = new ArrayList<>(2);
    loadOptional(BASE_NAME + "_" + registryName).ifPresent(layers::add);
    layers.add(load(BASE_NAME));
    return new RegistryConfig(layers, "registry:" + registryName);
  }

  private static ResourceBundle load(String baseName) {
    try {
      return ResourceBundle.getBundle(baseName, Locale.ROOT, NO_FALLBACK);
    } catch (MissingResourceException e) {
      throw new ConfigurationException("Missing configuration file '" + baseName + ".properties'", e);
    }
  }

  private static Optional<ResourceBundle> loadOptional(String baseName) {
    try {
      return Optional.of(ResourceBundle.getBundle(baseName, Locale.ROOT, NO_FALLBACK));
    } catch (MissingResourceException e) {
      return Optional.empty();
    }
  }

  // =========================================================================
  // Lookup
  // =========================================================================

  /**
   * Raw value of a key, trimmed. A system property wins over every file layer.
   *
   * @param key Property key
   * @return the value, or empty if no layer defines the key
   */
  public Optional<String> find(String key) {
    Objects.requireNonNull(key, "key cannot be null");
    String override = System.getProperty(key);
    if (override != null) {
      return Optional.of(override.trim());
    }
    return layers.stream()
      .filter(layer -> layer.containsKey(key))
      .findFirst()
      .map(layer -> layer.getString(key).trim());
  }

  /**
   * @param key Property key
   * @return true if a system property or any file layer defines the key
   */
  public boolean contains(String key) {
    return find(key).isPresent();
  }

  /**
   * @throws ConfigurationException if no layer defines the key
   */
  public String getString(String key) {
    return find(key).orElseThrow(() ->
      new ConfigurationException("Missing config key '" + key + "' in context: " + context));
  }

  public String getString(String key, String defaultValue) {
    return find(key).orElse(defaultValue);
  }

  // Defaults below cover absent keys only. A present value that does not parse
  // is a configuration error, never a silent fallback.

  /**
   * @throws ConfigurationException if the key is present but not an int
   */
  public int getInt(String key, int defaultValue) {
    return parsed(key, "int", Integer::valueOf).orElse(defaultValue);
  }

  /**
   * @throws ConfigurationException if the key is present but not a long
   */
  public long getLong(String key, long defaultValue) {
    return parsed(key, "long", Long::valueOf).orElse(defaultValue);
  }

  /**
   * Accepts {@code true} or {@code false}, ignoring case.
   *
   * @throws ConfigurationException if the key is present with any other value
   */
  public boolean getBoolean(String key, boolean defaultValue) {
    return parsed(key, "boolean", RegistryConfig::parseBoolean).orElse(defaultValue);
  }

  private <T> Optional<T> parsed(String key, String typeName, Function<String, T> parser) {
    Optional<String> raw = find(key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(parser.apply(raw.get()));
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid " + typeName + " value for key '" + key + "': "
        + raw.get() + " in context: " + context, e);
    }
  }

  private static Boolean parseBoolean(String value) {
    if ("true".equalsIgnoreCase(value)) {
      return Boolean.TRUE;
    }
    if ("false".equalsIgnoreCase(value)) {
      return Boolean.FALSE;
    }
    throw new IllegalArgumentException("not a boolean: " + value);
  }

  /**
   * Get configuration context (for debugging).
   *
   * @return Context description (e.g., "global", "registry:plugins")
   */
  public String context() {
    return context;
  }

  @Override
  public String toString() {
    return "RegistryConfig[context=" + context + "]";
  }
}
