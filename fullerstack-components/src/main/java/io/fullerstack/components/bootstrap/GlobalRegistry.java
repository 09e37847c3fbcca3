package io.fullerstack.components.bootstrap;

import io.fullerstack.components.config.RegistryConfig;
import io.fullerstack.components.config.RegistrySettings;
import io.fullerstack.components.registry.ComponentRegistry;
import io.fullerstack.components.registry.Registration;
import io.fullerstack.components.registry.RegistryInternalException;
import io.fullerstack.components.spi.ComponentProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Lazily built, process-wide {@link ComponentRegistry}.
 * <p>
 * <strong>Bootstrap Flow</strong> (runs once, on first access):
 * <ol>
 *   <li>Read {@link RegistrySettings} from {@code registry.properties}</li>
 *   <li>Create an empty registry with those settings</li>
 *   <li>Drain the {@link RegistrationCollector}</li>
 *   <li>Load {@link ComponentProvider} implementations via {@link ServiceLoader} and insert
 *       their registrations (unless {@code registry.bootstrap.service-loader=false})</li>
 *   <li>Publish the registry; state becomes {@link BootstrapState#READY}</li>
 * </ol>
 * <p>
 * Concurrent first callers block until the initializing thread finishes, then all receive the
 * same instance. If initialization fails (for example two providers claim the same name under
 * {@code reject}), the state goes back to {@link BootstrapState#UNINITIALIZED}, the collector
 * keeps its contents and the next access retries. Calling {@code global()} from inside a
 * provider or factory during initialization is an invariant violation.
 * <p>
 * <strong>Usage:</strong>
 * <pre>
 * // Composition root: fetch once, pass the reference on
 * ComponentRegistry registry = GlobalRegistry.global();
 * new PluginHost(registry).start();
 * </pre>
 *
 * @see ComponentProvider
 * @see RegistrationCollector
 */
public final class GlobalRegistry {

    private static final Logger logger = LoggerFactory.getLogger(GlobalRegistry.class);

    private static final GlobalRegistry PROCESS = new GlobalRegistry(
        RegistrationCollector.shared(),
        GlobalRegistry::serviceLoaderProviders,
        () -> RegistrySettings.from(RegistryConfig.global()));

    private final RegistrationCollector collector;
    private final Supplier<? extends Iterable<ComponentProvider>> providers;
    private final Supplier<RegistrySettings> settings;

    private final Object monitor = new Object();
    private volatile ComponentRegistry registry;
    private volatile BootstrapState state = BootstrapState.UNINITIALIZED;

    /**
     * @param collector pre-bootstrap registrations to drain
     * @param providers source of providers (ServiceLoader for the process-wide instance)
     * @param settings  settings for the registry, read at initialization
     */
    public GlobalRegistry(
        RegistrationCollector collector,
        Supplier<? extends Iterable<ComponentProvider>> providers,
        Supplier<RegistrySettings> settings) {
        this.collector = Objects.requireNonNull(collector, "collector");
        this.providers = Objects.requireNonNull(providers, "providers");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * The process-wide registry, built on first access.
     *
     * @return the global registry
     */
    public static ComponentRegistry global() {
        return PROCESS.get();
    }

    /**
     * @return bootstrap state of the process-wide registry
     */
    public static BootstrapState globalState() {
        return PROCESS.state();
    }

    /**
     * Returns the registry, initializing it if this is the first access.
     *
     * @return the registry
     * @throws RegistryInternalException if called re-entrantly during initialization
     */
    public ComponentRegistry get() {
        ComponentRegistry ready = registry;
        if (ready != null) {
            return ready;
        }

        synchronized (monitor) {
            if (registry != null) {
                return registry;
            }
            if (state == BootstrapState.INITIALIZING) {
                // monitor is reentrant, so only the initializing thread can get here
                throw new RegistryInternalException(
                    "Global registry accessed during its own initialization by "
                        + Thread.currentThread().getName());
            }

            state = BootstrapState.INITIALIZING;
            try {
                ComponentRegistry built = initialize();
                registry = built;
                state = BootstrapState.READY;
                return built;
            } catch (RuntimeException | Error e) {
                state = BootstrapState.UNINITIALIZED;
                logger.error("Global registry initialization failed", e);
                throw e;
            }
        }
    }

    /**
     * @return current bootstrap state
     */
    public BootstrapState state() {
        return state;
    }

    private ComponentRegistry initialize() {
        logger.info("Starting component registry bootstrap...");

        RegistrySettings resolved = settings.get();
        ComponentRegistry created = new ComponentRegistry(resolved);

        List<Registration> collected = collector.drain();
        try {
            for (Registration registration : collected) {
                created.register(registration);
            }
            logger.debug("Drained {} collected registrations", collected.size());

            int provided = registerProvided(created, resolved);
            logger.info("Module registry initialized with {} modules ({} collected, {} provided)",
                created.count(), collected.size(), provided);
            return created;
        } catch (RuntimeException | Error e) {
            collector.restore(collected);
            throw e;
        }
    }

    private int registerProvided(ComponentRegistry created, RegistrySettings resolved) {
        if (!resolved.serviceLoaderEnabled()) {
            logger.debug("ServiceLoader discovery disabled");
            return 0;
        }
        int provided = 0;
        for (ComponentProvider provider : loadProviders()) {
            Collection<Registration> registrations = Objects.requireNonNull(
                provider.registrations(), "registrations() of " + provider.providerName());
            for (Registration registration : registrations) {
                created.register(registration);
            }
            provided += registrations.size();
            logger.debug("Provider {} contributed {} modules", provider.providerName(), registrations.size());
        }
        return provided;
    }

    private List<ComponentProvider> loadProviders() {
        List<ComponentProvider> loaded = new ArrayList<>();
        try {
            for (ComponentProvider provider : providers.get()) {
                loaded.add(provider);
            }
        } catch (ServiceConfigurationError e) {
            throw new RegistryInternalException("Failed to load component providers", e);
        }
        return loaded;
    }

    private static Iterable<ComponentProvider> serviceLoaderProviders() {
        return ServiceLoader.load(ComponentProvider.class);
    }

    @Override
    public String toString() {
        return "GlobalRegistry[state=" + state + "]";
    }
}
