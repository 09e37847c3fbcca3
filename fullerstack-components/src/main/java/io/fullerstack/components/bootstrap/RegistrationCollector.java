package io.fullerstack.components.bootstrap;

import io.fullerstack.components.registry.Registration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Collection point for registrations contributed before the global registry exists.
 * <p>
 * Application modules expose a registration method and the composition root calls them
 * before the first {@link GlobalRegistry#global()}:
 * <pre>
 * public static void main(String[] args) {
 *     StorageModule.contribute(RegistrationCollector.shared());
 *     MetricsModule.contribute(RegistrationCollector.shared());
 *
 *     ComponentRegistry registry = GlobalRegistry.global();  // drains the collector
 *     new Application(registry).run();
 * }
 * </pre>
 * The collector is drained exactly once. Submissions after that are refused; register with
 * the {@link io.fullerstack.components.registry.ComponentRegistry} directly instead.
 */
public final class RegistrationCollector {

    private static final Logger logger = LoggerFactory.getLogger(RegistrationCollector.class);

    private static final RegistrationCollector SHARED = new RegistrationCollector();

    private final List<Registration> pending = new ArrayList<>();
    private boolean drained;

    public RegistrationCollector() {
    }

    /**
     * The process-wide collector drained by {@link GlobalRegistry#global()}.
     *
     * @return shared collector
     */
    public static RegistrationCollector shared() {
        return SHARED;
    }

    /**
     * Contribute a registration.
     *
     * @param registration record to hand to the global registry
     * @throws IllegalStateException if the collector was already drained
     */
    public synchronized void submit(Registration registration) {
        Objects.requireNonNull(registration, "registration");
        if (drained) {
            throw new IllegalStateException("Registration collector already drained; register '"
                + registration.name() + "' with the registry directly");
        }
        pending.add(registration);
        logger.debug("Collected registration: {}", registration.name());
    }

    /**
     * @return number of registrations waiting to be drained
     */
    public synchronized int pendingCount() {
        return pending.size();
    }

    /**
     * @return true once the contents were handed to a registry
     */
    public synchronized boolean isDrained() {
        return drained;
    }

    /**
     * Atomically hands over the pending registrations and closes the collector.
     * Any later {@link #submit(Registration)} fails until {@link #restore(List)} reopens it.
     */
    synchronized List<Registration> drain() {
        List<Registration> taken = List.copyOf(pending);
        drained = true;
        pending.clear();
        return taken;
    }

    /**
     * Reopens the collector after a failed bootstrap, putting the drained
     * registrations back ahead of anything submitted since.
     */
    synchronized void restore(List<Registration> drainedRegistrations) {
        pending.addAll(0, drainedRegistrations);
        drained = false;
    }
}
