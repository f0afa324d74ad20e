package dev.quarry.plugins;

import dev.quarry.PluginLifecycle;
import dev.quarry.ProcessingStage;
import dev.quarry.QuarryException;
import dev.quarry.ValidationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named, prioritized plugins of one kind.
 *
 * <p>All mutations take the write lock and all lookups the read lock. Plugin code
 * ({@code initialize}, {@code shutdown}) is never invoked while either lock is held.</p>
 *
 * @param <T> plugin type
 */
public final class PluginNamespace<T extends PluginLifecycle> {
    private static final Logger LOG = LoggerFactory.getLogger(PluginNamespace.class);

    static final Comparator<PluginRegistration<?>> ORDER =
        Comparator.<PluginRegistration<?>>comparingInt(PluginRegistration::priority).reversed()
            .thenComparing(PluginRegistration::name);

    private final PluginKind kind;
    private final Map<String, PluginRegistration<T>> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    PluginNamespace(PluginKind kind) {
        this.kind = kind;
    }

    public PluginKind kind() {
        return kind;
    }

    /**
     * Register a plugin.
     *
     * @param name plugin name, trimmed
     * @param plugin plugin instance
     * @param priority ordering priority, higher first
     * @return the registration this one replaced, if any
     * @throws QuarryException {@code Validation} for a blank name, {@code Plugin} if {@code initialize()} fails
     */
    public Optional<PluginRegistration<T>> register(String name, T plugin, int priority) throws QuarryException {
        return register(name, plugin, priority, null, Set.of());
    }

    /**
     * Register a plugin with its stage or MIME types.
     *
     * @param name plugin name, trimmed
     * @param plugin plugin instance
     * @param priority ordering priority, higher first
     * @param stage post-processor stage, or null
     * @param mimeTypes document extractor MIME types, canonical
     * @return the registration this one replaced, if any
     * @throws QuarryException {@code Validation} for a blank name, {@code Plugin} if {@code initialize()} fails
     */
    public Optional<PluginRegistration<T>> register(
        String name,
        T plugin,
        int priority,
        ProcessingStage stage,
        Collection<String> mimeTypes
    ) throws QuarryException {
        String normalized = normalizeName(name);
        if (plugin == null) {
            throw new ValidationException(kind.displayName() + " '" + normalized + "' must not be null");
        }
        PluginInvoker.invoke(kind, normalized, () -> {
            plugin.initialize();
            return null;
        });
        PluginRegistration<T> registration = new PluginRegistration<>(
            normalized, plugin, priority, stage, mimeTypes != null ? Set.copyOf(mimeTypes) : Set.of());

        PluginRegistration<T> replaced;
        lock.writeLock().lock();
        try {
            replaced = entries.put(normalized, registration);
        } finally {
            lock.writeLock().unlock();
        }
        if (replaced != null) {
            LOG.warn("{} '{}' was already registered and has been replaced", kind.displayName(), normalized);
            if (replaced.plugin() != plugin) {
                shutdownQuietly(replaced);
            }
        }
        return Optional.ofNullable(replaced);
    }

    /**
     * Remove a plugin and shut it down.
     *
     * @param name plugin name
     * @return the removed registration
     * @throws QuarryException {@code Plugin} if the name is not registered or shutdown fails
     */
    public PluginRegistration<T> unregister(String name) throws QuarryException {
        String normalized = normalizeName(name);
        PluginRegistration<T> removed;
        List<String> remaining;
        lock.writeLock().lock();
        try {
            removed = entries.remove(normalized);
            remaining = sortedNames(entries.values());
        } finally {
            lock.writeLock().unlock();
        }
        if (removed == null) {
            throw new QuarryException.Plugin(normalized, kind.displayName() + " '" + normalized
                + "' is not registered. Registered " + kind.pluralName() + ": " + remaining);
        }
        PluginInvoker.invoke(kind, normalized, () -> {
            removed.plugin().shutdown();
            return null;
        });
        return removed;
    }

    /**
     * Registered names, priority descending then name.
     *
     * @return names
     */
    public List<String> list() {
        lock.readLock().lock();
        try {
            return sortedNames(entries.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Remove every plugin, then shut each one down.
     *
     * @return shutdown failures, one per failing plugin
     */
    public List<QuarryException> clear() {
        List<PluginRegistration<T>> removed;
        lock.writeLock().lock();
        try {
            removed = new ArrayList<>(entries.values());
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
        removed.sort(ORDER);
        List<QuarryException> failures = new ArrayList<>();
        for (PluginRegistration<T> registration : removed) {
            try {
                PluginInvoker.invoke(kind, registration.name(), () -> {
                    registration.plugin().shutdown();
                    return null;
                });
            } catch (QuarryException e) {
                LOG.warn("Shutdown of {} '{}' failed: {}", kind.displayName(), registration.name(), e.getMessage());
                failures.add(e);
            }
        }
        return failures;
    }

    /**
     * Immutable view of the current registrations in priority order.
     *
     * @return registrations
     */
    public List<PluginRegistration<T>> snapshot() {
        List<PluginRegistration<T>> copy;
        lock.readLock().lock();
        try {
            copy = new ArrayList<>(entries.values());
        } finally {
            lock.readLock().unlock();
        }
        copy.sort(ORDER);
        return List.copyOf(copy);
    }

    public Optional<PluginRegistration<T>> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(name.trim()));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        lock.readLock().lock();
        try {
            return entries.isEmpty();
        } finally {
            lock.readLock().unlock();
        }
    }

    private String normalizeName(String name) throws ValidationException {
        if (name == null || name.isBlank()) {
            throw new ValidationException(kind.displayName() + " name must not be blank");
        }
        return name.trim();
    }

    private void shutdownQuietly(PluginRegistration<T> registration) {
        try {
            PluginInvoker.invoke(kind, registration.name(), () -> {
                registration.plugin().shutdown();
                return null;
            });
        } catch (QuarryException e) {
            LOG.warn("Shutdown of replaced {} '{}' failed: {}", kind.displayName(), registration.name(),
                e.getMessage());
        }
    }

    private static <T> List<String> sortedNames(Collection<PluginRegistration<T>> registrations) {
        List<PluginRegistration<T>> sorted = new ArrayList<>(registrations);
        sorted.sort(ORDER);
        List<String> names = new ArrayList<>(sorted.size());
        for (PluginRegistration<T> registration : sorted) {
            names.add(registration.name());
        }
        return names;
    }
}
