package io.fullerstack.components.registry;

import io.fullerstack.components.config.RegistryConfig;
import io.fullerstack.components.config.RegistrySettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Thread-safe catalog of component factories keyed by unique name.
 *
 * <p><b>Operations:</b>
 * <ul>
 *   <li>{@code register} - insert a {@link Registration}; duplicates follow the {@link DuplicatePolicy}</li>
 *   <li>{@code create} - run the factory for a name and hand back a {@link ComponentHandle}</li>
 *   <li>{@code lookup} / {@code getMetadata} / {@code list} / {@code has} - read-only queries</li>
 *   <li>{@code replaceMetadata} - swap the metadata of an existing name, keeping its factory</li>
 *   <li>{@code unregister} / {@code clear} - removal ({@code clear} is meant for test isolation)</li>
 * </ul>
 *
 * <p><b>Thread safety:</b>
 * ReadWriteLock ensures:
 * <ul>
 *   <li>Multiple concurrent readers (lookup, list, has, the lookup phase of create)</li>
 *   <li>Exclusive writer (register, replaceMetadata, unregister, clear)</li>
 *   <li>Factories run with no lock held, so they may be slow or call back into the registry</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>
 * ComponentRegistry registry = new ComponentRegistry();
 * registry.register("echo", "plugin", ComponentFactory.of(Plugin.class, EchoPlugin::new));
 *
 * Plugin plugin = registry.create("echo", Plugin.class);
 * </pre>
 */
public final class ComponentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ComponentRegistry.class);

    private final Map<String, Registration> registrations = new HashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final RegistrySettings settings;

    /**
     * Registry with built-in default settings (duplicates rejected).
     */
    public ComponentRegistry() {
        this(RegistrySettings.defaults());
    }

    /**
     * Registry with default settings and the given duplicate policy.
     *
     * @param duplicatePolicy policy for repeated names
     */
    public ComponentRegistry(DuplicatePolicy duplicatePolicy) {
        this(RegistrySettings.defaults().withDuplicatePolicy(duplicatePolicy));
    }

    /**
     * @param settings validation limits and duplicate policy
     */
    public ComponentRegistry(RegistrySettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Registry configured from property files.
     *
     * @param config configuration source
     * @return new empty registry
     */
    public static ComponentRegistry fromConfig(RegistryConfig config) {
        return new ComponentRegistry(RegistrySettings.from(config));
    }

    // -------------------- Writes --------------------

    /**
     * Register a factory with default metadata. The caller's {@code Class:line} is recorded as
     * the source location.
     *
     * @param name       unique component name
     * @param moduleType coarse type tag
     * @param factory    builds one instance per create call
     * @throws DuplicateComponentException if the name exists and the policy is REJECT
     * @throws IllegalArgumentException    if the name or type is blank or too long
     */
    public void register(String name, String moduleType, ComponentFactory factory) {
        register(new Registration(name, moduleType, factory,
            ComponentMetadata.defaults().withSourceLocation(CallerLocation.capture())));
    }

    /**
     * Register a factory with full metadata. A missing source location is filled with the
     * caller's {@code Class:line}.
     *
     * @param name       unique component name
     * @param moduleType coarse type tag
     * @param factory    builds one instance per create call
     * @param metadata   descriptive metadata
     * @throws DuplicateComponentException if the name exists and the policy is REJECT
     * @throws IllegalArgumentException    if the name, type or source location is invalid
     */
    public void register(String name, String moduleType, ComponentFactory factory, ComponentMetadata metadata) {
        Objects.requireNonNull(metadata, "metadata");
        if (metadata.sourceLocation() == null) {
            metadata = metadata.withSourceLocation(CallerLocation.capture());
        }
        register(new Registration(name, moduleType, factory, metadata));
    }

    /**
     * Register a prebuilt record.
     *
     * @param registration record to insert
     * @throws DuplicateComponentException if the name exists and the policy is REJECT
     * @throws IllegalArgumentException    if the name, type or source location is invalid
     */
    public void register(Registration registration) {
        Objects.requireNonNull(registration, "registration");
        validate(registration);

        Registration previous;
        lock.writeLock().lock();
        try {
            previous = registrations.get(registration.name());
            if (previous != null && settings.duplicatePolicy() == DuplicatePolicy.REJECT) {
                throw new DuplicateComponentException(registration.name());
            }
            registrations.put(registration.name(), registration);
        } finally {
            lock.writeLock().unlock();
        }

        if (previous != null) {
            logger.info("Replaced module: {} (type: {} -> {})",
                registration.name(), previous.moduleType(), registration.moduleType());
        } else {
            logger.info("Registered module: {} (type: {})", registration.name(), registration.moduleType());
        }
    }

    /**
     * Replace the metadata of an existing registration. The factory and module type
     * are kept, and the duplicate policy does not apply.
     * <p>
     * {@code update} runs under the write lock and must not call back into this registry.
     *
     * @param name   component name
     * @param update maps the current metadata to its replacement
     * @return the metadata now stored
     * @throws ComponentNotFoundException if no registration exists for {@code name}
     * @throws IllegalArgumentException   if the new source location is too long
     */
    public ComponentMetadata replaceMetadata(String name, UnaryOperator<ComponentMetadata> update) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(update, "update");

        Registration replacement;
        lock.writeLock().lock();
        try {
            Registration current = registrations.get(name);
            if (current == null) {
                throw new ComponentNotFoundException(name);
            }
            ComponentMetadata metadata = Objects.requireNonNull(
                update.apply(current.metadata()), "updated metadata for " + name);
            replacement = new Registration(name, current.moduleType(), current.factory(), metadata);
            validate(replacement);
            registrations.put(name, replacement);
        } finally {
            lock.writeLock().unlock();
        }

        logger.info("Updated metadata for module: {}", name);
        return replacement.metadata();
    }

    /**
     * Remove a registration.
     *
     * @param name component name
     * @return true if a registration was removed, false if none existed
     */
    public boolean unregister(String name) {
        Objects.requireNonNull(name, "name");
        Registration removed;
        lock.writeLock().lock();
        try {
            removed = registrations.remove(name);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            logger.info("Unregistered module: {}", name);
        }
        return removed != null;
    }

    /**
     * Remove every registration. Intended for test setup.
     */
    public void clear() {
        int removed;
        lock.writeLock().lock();
        try {
            removed = registrations.size();
            registrations.clear();
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Cleared {} modules", removed);
    }

    // -------------------- Creation --------------------

    /**
     * Build a new instance of the named component.
     * <p>
     * The record is read under the read lock; the factory then runs with no lock held.
     * Every call runs the factory again, so nothing is cached.
     *
     * @param name component name
     * @return handle owning the new instance
     * @throws ComponentNotFoundException if nothing is registered under the name
     * @throws FactoryFailedException     if the factory throws or returns null
     */
    public ComponentHandle create(String name) {
        Registration registration = find(name)
            .orElseThrow(() -> new ComponentNotFoundException(name));

        logger.debug("Creating module: {}", name);

        ComponentHandle handle;
        try {
            handle = registration.factory().create();
        } catch (Exception e) {
            throw new FactoryFailedException(name, e);
        }

        if (handle == null) {
            throw new FactoryFailedException(name, "Factory returned no instance for component: " + name);
        }
        return handle.named(name);
    }

    /**
     * Build a new instance and narrow it to the requested capability.
     *
     * @param name component name
     * @param type capability interface expected by the caller
     * @param <T>  capability type
     * @return the new instance
     * @throws ComponentNotFoundException if nothing is registered under the name
     * @throws FactoryFailedException     if the factory fails
     * @throws TypeMismatchException      if the instance does not implement {@code type}
     */
    public <T> T create(String name, Class<T> type) {
        Objects.requireNonNull(type, "type");
        return create(name).as(type);
    }

    // -------------------- Reads --------------------

    /**
     * Look up a registration without its factory.
     *
     * @param name component name
     * @return descriptor, or empty if not registered
     */
    public Optional<ComponentDescriptor> lookup(String name) {
        return find(name).map(Registration::descriptor);
    }

    /**
     * Metadata catalog access.
     *
     * @param name component name
     * @return metadata, present if and only if the component is registered
     */
    public Optional<ComponentMetadata> getMetadata(String name) {
        return find(name).map(Registration::metadata);
    }

    /**
     * @param name component name
     * @return true if registered
     */
    public boolean has(String name) {
        Objects.requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            return registrations.containsKey(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return registered names in lexical order
     */
    public List<String> list() {
        lock.readLock().lock();
        try {
            List<String> names = new ArrayList<>(registrations.keySet());
            Collections.sort(names);
            return Collections.unmodifiableList(names);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Consistent snapshot of every registration (without factories), taken under one
     * read lock, in lexical name order.
     *
     * @return descriptors
     */
    public List<ComponentDescriptor> descriptors() {
        lock.readLock().lock();
        try {
            return registrations.values().stream()
                .map(Registration::descriptor)
                .sorted(Comparator.comparing(ComponentDescriptor::name))
                .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return number of registrations
     */
    public int count() {
        lock.readLock().lock();
        try {
            return registrations.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return duplicate policy fixed for this registry
     */
    public DuplicatePolicy duplicatePolicy() {
        return settings.duplicatePolicy();
    }

    /**
     * @return settings this registry validates against
     */
    public RegistrySettings settings() {
        return settings;
    }

    // -------------------- Internal --------------------

    private Optional<Registration> find(String name) {
        Objects.requireNonNull(name, "name");
        lock.readLock().lock();
        try {
            return Optional.ofNullable(registrations.get(name));
        } finally {
            lock.readLock().unlock();
        }
    }

    private void validate(Registration registration) {
        requireText("name", registration.name(), settings.maxNameLength());
        requireText("moduleType", registration.moduleType(), settings.maxModuleTypeLength());
        String location = registration.metadata().sourceLocation();
        if (location != null && location.length() > settings.maxSourceLocationLength()) {
            throw new IllegalArgumentException("sourceLocation exceeds " + settings.maxSourceLocationLength()
                + " characters for component: " + registration.name());
        }
    }

    private static void requireText(String field, String value, int maxLength) {
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
        if (value.length() > maxLength) {
            throw new IllegalArgumentException(field + " exceeds " + maxLength + " characters: "
                + value.substring(0, Math.min(value.length(), 32)) + "...");
        }
    }

    @Override
    public String toString() {
        return "ComponentRegistry[size=" + count() + ", duplicatePolicy=" + settings.duplicatePolicy() + "]";
    }
}
