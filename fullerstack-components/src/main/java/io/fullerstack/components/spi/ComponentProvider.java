package io.fullerstack.components.spi;

import io.fullerstack.components.registry.Registration;

import java.util.Collection;

/**
 * Service Provider Interface through which compiled units contribute components to the
 * global registry before it is first used.
 * <p>
 * The global bootstrap discovers implementations via {@link java.util.ServiceLoader} and
 * inserts every returned {@link Registration} exactly once, when
 * {@link io.fullerstack.components.bootstrap.GlobalRegistry#global()} is first called.
 * Providers have no ordering among themselves.
 * <p>
 * <strong>Example Implementation:</strong>
 * <pre>
 * public class StorageProviders implements ComponentProvider {
 *     &#64;Override
 *     public Collection&lt;Registration&gt; registrations() {
 *         return List.of(
 *             Registration.of("storage.postgres", "storage",
 *                 ComponentFactory.of(Storage.class, PostgresStorage::new)),
 *             Registration.of("storage.memory", "storage",
 *                 ComponentFactory.of(Storage.class, MemoryStorage::new)));
 *     }
 * }
 * </pre>
 * <p>
 * <strong>Registration:</strong>
 * Create file: {@code META-INF/services/io.fullerstack.components.spi.ComponentProvider}
 * <pre>
 * com.example.StorageProviders
 * </pre>
 *
 * @see java.util.ServiceLoader
 */
public interface ComponentProvider {

    /**
     * Registrations this unit contributes. Called once per bootstrap.
     *
     * @return registrations, never null
     */
    Collection<Registration> registrations();

    /**
     * Provider name used in logs.
     *
     * @return provider name
     */
    default String providerName() {
        return getClass().getSimpleName();
    }
}
