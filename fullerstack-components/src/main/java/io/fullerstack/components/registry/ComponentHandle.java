package io.fullerstack.components.registry;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opaque, ownership-transferring box around one constructed component.
 * <p>
 * Factories erase whatever concrete type they build into a handle so that factories for
 * unrelated capability interfaces can live in one map. The caller recovers the instance with
 * {@link #as(Class)}, which is the registry's only runtime type gate:
 * <ul>
 *   <li>the instance must implement the requested type, otherwise a
 *       {@link TypeMismatchException} is thrown and the handle stays usable</li>
 *   <li>after one successful {@code as(...)} the handle is consumed; the caller owns the
 *       instance and the handle can no longer hand it out</li>
 * </ul>
 * A handle never references the registry that produced it.
 *
 * <p><b>Thread safety:</b> consumption is atomic; if two threads race on {@code as(...)},
 * exactly one receives the instance.
 */
public final class ComponentHandle {

    private final Class<?> declaredType;
    private final Class<?> instanceType;
    private final String componentName;
    private final AtomicReference<Object> instance;

    private ComponentHandle(Class<?> declaredType, Object instance, String componentName) {
        this.declaredType = declaredType;
        this.instanceType = instance.getClass();
        this.componentName = componentName;
        this.instance = new AtomicReference<>(instance);
    }

    /**
     * Wraps an instance under the capability interface it was built for.
     *
     * @param declaredType capability interface the factory produces
     * @param instance     constructed instance
     * @param <T>          capability type
     * @return new handle
     * @throws IllegalArgumentException if the instance does not implement the declared type
     */
    public static <T> ComponentHandle of(Class<T> declaredType, T instance) {
        Objects.requireNonNull(declaredType, "declaredType");
        Objects.requireNonNull(instance, "instance");
        if (!declaredType.isInstance(instance)) {
            throw new IllegalArgumentException(
                instance.getClass().getName() + " does not implement " + declaredType.getName());
        }
        return new ComponentHandle(declaredType, instance, null);
    }

    /**
     * Wraps an instance with its own runtime class as the declared type.
     *
     * @param instance constructed instance
     * @return new handle
     */
    public static ComponentHandle of(Object instance) {
        Objects.requireNonNull(instance, "instance");
        return new ComponentHandle(instance.getClass(), instance, null);
    }

    /**
     * Narrows the handle to the requested capability and transfers ownership to the caller.
     *
     * @param type requested capability interface
     * @param <T>  capability type
     * @return the instance, typed
     * @throws TypeMismatchException if the instance does not implement {@code type}
     * @throws IllegalStateException if the handle was already consumed
     */
    public <T> T as(Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object current = instance.get();
        if (current == null) {
            throw new IllegalStateException("Handle already consumed: " + describe());
        }
        if (!type.isInstance(current)) {
            throw new TypeMismatchException(componentName, type, instanceType);
        }
        if (!instance.compareAndSet(current, null)) {
            throw new IllegalStateException("Handle already consumed: " + describe());
        }
        return type.cast(current);
    }

    /**
     * Tests whether {@link #as(Class)} would succeed for the type, without consuming.
     *
     * @param type capability interface
     * @return true if the instance implements the type and the handle is not consumed
     */
    public boolean is(Class<?> type) {
        Objects.requireNonNull(type, "type");
        return !isConsumed() && type.isAssignableFrom(instanceType);
    }

    /**
     * @return true once ownership was transferred out of this handle
     */
    public boolean isConsumed() {
        return instance.get() == null;
    }

    /**
     * @return capability interface the factory declared
     */
    public Class<?> declaredType() {
        return declaredType;
    }

    /**
     * @return runtime class of the boxed instance
     */
    public Class<?> instanceType() {
        return instanceType;
    }

    /**
     * @return name of the registration that produced this handle, or null for a handle
     *     built outside a registry
     */
    public String componentName() {
        return componentName;
    }

    /**
     * Moves the instance into a handle stamped with the registration name.
     * This handle is consumed by the move.
     */
    ComponentHandle named(String name) {
        Object current = instance.getAndSet(null);
        if (current == null) {
            throw new IllegalStateException("Handle already consumed: " + describe());
        }
        return new ComponentHandle(declaredType, current, name);
    }

    private String describe() {
        return (componentName != null ? componentName : "unnamed component")
            + " (" + declaredType.getName() + ")";
    }

    @Override
    public String toString() {
        return "ComponentHandle[" + describe() + (isConsumed() ? ", consumed" : "") + "]";
    }
}
