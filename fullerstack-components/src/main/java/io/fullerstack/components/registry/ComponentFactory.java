package io.fullerstack.components.registry;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Supplier;

/**
 * Zero-argument constructor stored in the registry and invoked on every
 * {@link ComponentRegistry#create(String)}.
 * <p>
 * A factory may do arbitrary (even slow or fallible) construction work and may call back into
 * the registry, but it must not register or remove components as a side effect of building one.
 * Anything it throws reaches the caller wrapped in a {@link FactoryFailedException}.
 */
@FunctionalInterface
public interface ComponentFactory {

    /**
     * Builds one new instance.
     *
     * @return handle holding the new instance
     * @throws Exception if construction fails
     */
    ComponentHandle create() throws Exception;

    /**
     * Factory for infallible construction.
     *
     * @param capability  capability interface the instances implement
     * @param constructor builds one instance per call
     * @param <T>         capability type
     * @return type-erasing factory
     */
    static <T> ComponentFactory of(Class<T> capability, Supplier<? extends T> constructor) {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(constructor, "constructor");
        return () -> ComponentHandle.of(capability, constructor.get());
    }

    /**
     * Factory for construction that may throw (I/O, validation, ...).
     *
     * @param capability  capability interface the instances implement
     * @param constructor builds one instance per call
     * @param <T>         capability type
     * @return type-erasing factory
     */
    static <T> ComponentFactory ofCallable(Class<T> capability, Callable<? extends T> constructor) {
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(constructor, "constructor");
        return () -> ComponentHandle.of(capability, constructor.call());
    }
}
