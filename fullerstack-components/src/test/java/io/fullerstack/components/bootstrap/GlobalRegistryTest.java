package io.fullerstack.components.bootstrap;

import io.fullerstack.components.Greeters.Counter;
import io.fullerstack.components.Greeters.EnglishGreeter;
import io.fullerstack.components.Greeters.Greeter;
import io.fullerstack.components.Greeters.SimpleCounter;
import io.fullerstack.components.config.RegistrySettings;
import io.fullerstack.components.registry.*;
import io.fullerstack.components.spi.ComponentProvider;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link GlobalRegistry}.
 * <p>
 * Only {@link #testGlobal_LoadsServiceLoaderProviders()} touches the process-wide instance;
 * everything else runs against private instances with explicit collaborators.
 */
class GlobalRegistryTest {

    private static Registration greeter(String name) {
        return Registration.of(name, "greeter", ComponentFactory.of(Greeter.class, EnglishGreeter::new));
    }

    private static Registration counter(String name) {
        return Registration.of(name, "counter", ComponentFactory.of(Counter.class, SimpleCounter::new));
    }

    private static ComponentProvider provider(Registration... registrations) {
        return () -> List.of(registrations);
    }

    // =========================================================================
    // Process-wide instance
    // =========================================================================

    @Test
    void testGlobal_LoadsServiceLoaderProviders() {
        ComponentRegistry registry = GlobalRegistry.global();

        assertThat(GlobalRegistry.globalState()).isEqualTo(BootstrapState.READY);
        assertThat(registry.list()).contains(TestComponentProvider.GREETER, TestComponentProvider.COUNTER);
        assertThat(registry.create(TestComponentProvider.GREETER, Greeter.class).greet("world"))
            .isEqualTo("Hello, world");
        assertThat(GlobalRegistry.global()).isSameAs(registry);
        assertThat(RegistrationCollector.shared().isDrained()).isTrue();
    }

    // =========================================================================
    // Initialization
    // =========================================================================

    @Test
    void testGet_DrainsCollectorAndProviders() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("collected.greeter"));
        GlobalRegistry global = new GlobalRegistry(collector,
            () -> List.of(provider(counter("provided.counter"), greeter("provided.greeter"))),
            RegistrySettings::defaults);

        assertThat(global.state()).isEqualTo(BootstrapState.UNINITIALIZED);

        ComponentRegistry registry = global.get();

        assertThat(global.state()).isEqualTo(BootstrapState.READY);
        assertThat(registry.list()).containsExactly("collected.greeter", "provided.counter", "provided.greeter");
        assertThat(collector.isDrained()).isTrue();
        assertThat(collector.pendingCount()).isZero();
        assertThat(global.get()).isSameAs(registry);
    }

    @Test
    void testGet_AsksEachProviderOnce() {
        ComponentProvider provider = mock(ComponentProvider.class);
        when(provider.registrations()).thenReturn(List.of(greeter("mocked.greeter")));
        GlobalRegistry global = new GlobalRegistry(new RegistrationCollector(),
            () -> List.of(provider), RegistrySettings::defaults);

        global.get();
        global.get();

        verify(provider, times(1)).registrations();
        assertThat(global.get().has("mocked.greeter")).isTrue();
    }

    @Test
    void testGet_SkipsProvidersWhenServiceLoaderDisabled() {
        AtomicInteger lookups = new AtomicInteger();
        GlobalRegistry global = new GlobalRegistry(new RegistrationCollector(),
            () -> {
                lookups.incrementAndGet();
                return List.of(provider(greeter("provided.greeter")));
            },
            () -> RegistrySettings.defaults().withServiceLoader(false));

        assertThat(global.get().count()).isZero();
        assertThat(lookups.get()).isZero();
    }

    @Test
    void testGet_AppliesConfiguredDuplicatePolicy() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(counter("shared.name"));
        GlobalRegistry global = new GlobalRegistry(collector,
            () -> List.of(provider(greeter("shared.name"))),
            () -> RegistrySettings.defaults().withDuplicatePolicy(DuplicatePolicy.REPLACE));

        ComponentRegistry registry = global.get();

        // providers are inserted after the collector, so the provider's record wins
        assertThat(registry.lookup("shared.name").orElseThrow().moduleType()).isEqualTo("greeter");
    }

    @Test
    void testGet_ConcurrentFirstAccessInitializesOnce() throws InterruptedException {
        AtomicInteger initializations = new AtomicInteger();
        GlobalRegistry global = new GlobalRegistry(new RegistrationCollector(),
            () -> {
                initializations.incrementAndGet();
                return List.of(provider(greeter("provided.greeter")));
            },
            RegistrySettings::defaults);

        int threadCount = 10;
        CountDownLatch start = new CountDownLatch(1);
        Set<ComponentRegistry> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());
        Thread[] threads = new Thread[threadCount];
        for (int i = 0; i < threadCount; i++) {
            threads[i] = new Thread(() -> {
                try {
                    start.await();
                    ComponentRegistry registry = global.get();
                    synchronized (seen) {
                        seen.add(registry);
                    }
                } catch (Throwable t) {
                    errors.add(t);
                }
            });
            threads[i].start();
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        assertThat(errors).isEmpty();
        assertThat(initializations.get()).isEqualTo(1);
        assertThat(seen).hasSize(1);
        assertThat(global.state()).isEqualTo(BootstrapState.READY);
    }

    // =========================================================================
    // Failure handling
    // =========================================================================

    @Test
    void testGet_FailureRevertsAndRetries() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("clash"));
        AtomicBoolean conflicting = new AtomicBoolean(true);
        GlobalRegistry global = new GlobalRegistry(collector,
            () -> conflicting.get()
                ? List.of(provider(counter("clash")))
                : List.of(provider(counter("no.clash"))),
            RegistrySettings::defaults);

        assertThatThrownBy(global::get).isInstanceOf(DuplicateComponentException.class);

        assertThat(global.state()).isEqualTo(BootstrapState.UNINITIALIZED);
        assertThat(collector.isDrained()).isFalse();
        assertThat(collector.pendingCount()).isEqualTo(1);

        conflicting.set(false);
        ComponentRegistry registry = global.get();

        assertThat(global.state()).isEqualTo(BootstrapState.READY);
        assertThat(registry.list()).containsExactly("clash", "no.clash");
        assertThat(collector.isDrained()).isTrue();
    }

    @Test
    void testGet_SubmissionDuringBootstrapIsRejectedNotLost() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("early.greeter"));
        AtomicBoolean submitting = new AtomicBoolean(true);
        ComponentProvider latecomer = () -> {
            if (submitting.get()) {
                collector.submit(greeter("late.greeter"));
            }
            return List.of(counter("provided.counter"));
        };
        GlobalRegistry global = new GlobalRegistry(collector,
            () -> List.of(latecomer), RegistrySettings::defaults);

        assertThatThrownBy(global::get)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("late.greeter");

        assertThat(global.state()).isEqualTo(BootstrapState.UNINITIALIZED);
        assertThat(collector.isDrained()).isFalse();
        assertThat(collector.pendingCount()).isEqualTo(1);

        submitting.set(false);
        ComponentRegistry registry = global.get();

        assertThat(registry.list()).containsExactly("early.greeter", "provided.counter");
        assertThat(collector.isDrained()).isTrue();
    }

    @Test
    void testGet_ErrorDuringInitializationRevertsAndRetries() {
        RegistrationCollector collector = new RegistrationCollector();
        collector.submit(greeter("collected.greeter"));
        AtomicBoolean failing = new AtomicBoolean(true);
        ComponentProvider flaky = () -> {
            if (failing.get()) {
                throw new AssertionError("provider not ready");
            }
            return List.of(counter("provided.counter"));
        };
        GlobalRegistry global = new GlobalRegistry(collector,
            () -> List.of(flaky), RegistrySettings::defaults);

        assertThatThrownBy(global::get)
            .isInstanceOf(AssertionError.class)
            .hasMessage("provider not ready");

        assertThat(global.state()).isEqualTo(BootstrapState.UNINITIALIZED);
        assertThat(collector.pendingCount()).isEqualTo(1);

        failing.set(false);
        ComponentRegistry registry = global.get();

        assertThat(global.state()).isEqualTo(BootstrapState.READY);
        assertThat(registry.list()).containsExactly("collected.greeter", "provided.counter");
    }

    @Test
    void testGet_ReentrantAccessIsInternalError() {
        AtomicReference<GlobalRegistry> self = new AtomicReference<>();
        ComponentProvider reentrant = () -> {
            self.get().get();
            return List.of();
        };
        GlobalRegistry global = new GlobalRegistry(new RegistrationCollector(),
            () -> List.of(reentrant), RegistrySettings::defaults);
        self.set(global);

        assertThatThrownBy(global::get)
            .isInstanceOfSatisfying(RegistryInternalException.class,
                e -> assertThat(e.kind()).isEqualTo(ErrorKind.INTERNAL))
            .hasMessageContaining("during its own initialization");

        assertThat(global.state()).isEqualTo(BootstrapState.UNINITIALIZED);
    }

    @Test
    void testGet_BrokenProviderConfigurationIsInternalError() {
        GlobalRegistry global = new GlobalRegistry(new RegistrationCollector(),
            () -> {
                throw new ServiceConfigurationError("Provider com.example.Missing not found");
            },
            RegistrySettings::defaults);

        assertThatThrownBy(global::get)
            .isInstanceOf(RegistryInternalException.class)
            .hasCauseInstanceOf(ServiceConfigurationError.class);
        assertThat(global.state()).isEqualTo(BootstrapState.UNINITIALIZED);
    }
}
