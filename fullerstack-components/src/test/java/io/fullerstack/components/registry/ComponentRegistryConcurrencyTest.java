package io.fullerstack.components.registry;

import io.fullerstack.components.Greeters.Counter;
import io.fullerstack.components.Greeters.SimpleCounter;
import org.junit.jupiter.api.Test;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Concurrent access to a shared {@link ComponentRegistry} with plain threads and latches.
 */
class ComponentRegistryConcurrencyTest {

    private static final int THREADS = 10;
    private static final int PER_THREAD = 100;

    @Test
    void shouldKeepEveryDistinctRegistrationFromConcurrentWriters() throws InterruptedException {
        ComponentRegistry registry = new ComponentRegistry();
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        runConcurrently(threadIndex -> {
            for (int i = 0; i < PER_THREAD; i++) {
                registry.register("component-" + threadIndex + "-" + i, "counter",
                    ComponentFactory.of(Counter.class, SimpleCounter::new));
            }
        }, errors);

        assertThat(errors).isEmpty();
        assertThat(registry.count()).isEqualTo(THREADS * PER_THREAD);
        assertThat(registry.list()).hasSize(THREADS * PER_THREAD).doesNotHaveDuplicates();
    }

    @Test
    void shouldReturnIndependentInstancesFromConcurrentCreates() throws InterruptedException {
        ComponentRegistry registry = new ComponentRegistry();
        AtomicInteger factoryCalls = new AtomicInteger();
        registry.register("counter", "counter", ComponentFactory.of(Counter.class, () -> {
            factoryCalls.incrementAndGet();
            return new SimpleCounter();
        }));
        Set<Counter> instances = Collections.newSetFromMap(new IdentityHashMap<>());
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        runConcurrently(threadIndex -> {
            for (int i = 0; i < PER_THREAD; i++) {
                Counter counter = registry.create("counter", Counter.class);
                // every instance starts fresh
                assertThat(counter.increment()).isEqualTo(1);
                synchronized (instances) {
                    instances.add(counter);
                }
            }
        }, errors);

        assertThat(errors).isEmpty();
        assertThat(factoryCalls.get()).isEqualTo(THREADS * PER_THREAD);
        assertThat(instances).hasSize(THREADS * PER_THREAD);
    }

    @Test
    void shouldServeReadersWhileWritersRegister() throws InterruptedException {
        ComponentRegistry registry = new ComponentRegistry();
        registry.register("seed", "counter", ComponentFactory.of(Counter.class, SimpleCounter::new));
        Set<Integer> observedCounts = ConcurrentHashMap.newKeySet();
        List<Throwable> errors = Collections.synchronizedList(new ArrayList<>());

        runConcurrently(threadIndex -> {
            for (int i = 0; i < PER_THREAD; i++) {
                if (threadIndex % 2 == 0) {
                    registry.register("writer-" + threadIndex + "-" + i, "counter",
                        ComponentFactory.of(Counter.class, SimpleCounter::new));
                } else {
                    assertThat(registry.has("seed")).isTrue();
                    assertThat(registry.create("seed", Counter.class)).isNotNull();
                    observedCounts.add(registry.list().size());
                }
            }
        }, errors);

        assertThat(errors).isEmpty();
        assertThat(registry.count()).isEqualTo(1 + (THREADS / 2) * PER_THREAD);
        assertThat(observedCounts).allSatisfy(size -> assertThat(size).isBetween(1, registry.count()));
    }

    private interface Task {
        void run(int threadIndex) throws Exception;
    }

    private static void runConcurrently(Task task, List<Throwable> errors) throws InterruptedException {
        CountDownLatch start = new CountDownLatch(1);
        Thread[] threads = new Thread[THREADS];
        for (int t = 0; t < THREADS; t++) {
            int threadIndex = t;
            threads[t] = new Thread(() -> {
                try {
                    start.await();
                    task.run(threadIndex);
                } catch (Throwable e) {
                    errors.add(e);
                }
            });
            threads[t].start();
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }
    }
}
