package io.corekit.registry;

import static io.corekit.util.Assert.checkNotNullParam;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keyed map of shared instances.
 * <p>
 * Entries are keyed either by an explicit string key or, when no key is given, by the type the
 * entry is registered under. Registering under an existing key replaces the previous entry.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * DependencyRegistry registry = new DependencyRegistry();
 * registry.register(Transport.class, new HttpClientTransport());
 * registry.register("catalog-api", catalogConfiguration);
 *
 * Transport transport = registry.resolve(Transport.class);
 * Optional<NetworkConfiguration> config = registry.find("catalog-api", NetworkConfiguration.class);
 * }</pre>
 *
 * <h3>Thread Safety</h3>
 * All operations are thread-safe; the registry is backed by a {@link ConcurrentHashMap}.
 */
public class DependencyRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyRegistry.class);

    private final ConcurrentMap<Object, Object> dependencies = new ConcurrentHashMap<>();

    /**
     * Registers a dependency under its type.
     *
     * @param type the type consumers will look the dependency up by
     * @param dependency the instance
     * @param <T> the dependency type
     */
    public <T> void register(Class<T> type, T dependency) {
        checkNotNullParam("type", type);
        checkNotNullParam("dependency", dependency);
        put(type, dependency);
    }

    /**
     * Registers a dependency under an explicit key.
     *
     * @param key the lookup key
     * @param dependency the instance
     */
    public void register(String key, Object dependency) {
        checkNotNullParam("key", key);
        checkNotNullParam("dependency", dependency);
        put(key, dependency);
    }

    /**
     * Resolves the dependency registered under the given type.
     *
     * @param type the type the dependency was registered under
     * @param <T> the dependency type
     * @return the dependency
     * @throws DependencyNotFoundException if nothing is registered under the type
     */
    public <T> T resolve(Class<T> type) throws DependencyNotFoundException {
        checkNotNullParam("type", type);
        return lookup(type, type);
    }

    /**
     * Resolves the dependency registered under the given key.
     *
     * @param key the lookup key
     * @param type the expected type
     * @param <T> the dependency type
     * @return the dependency
     * @throws DependencyNotFoundException if nothing is registered under the key, or the entry is
     *                                     not an instance of {@code type}
     */
    public <T> T resolve(String key, Class<T> type) throws DependencyNotFoundException {
        checkNotNullParam("key", key);
        checkNotNullParam("type", type);
        return lookup(key, type);
    }

    public <T> Optional<T> find(Class<T> type) {
        try {
            return Optional.of(resolve(type));
        } catch (DependencyNotFoundException e) {
            return Optional.empty();
        }
    }

    public <T> Optional<T> find(String key, Class<T> type) {
        try {
            return Optional.of(resolve(key, type));
        } catch (DependencyNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean contains(Class<?> type) {
        return dependencies.containsKey(type);
    }

    public boolean contains(String key) {
        return dependencies.containsKey(key);
    }

    public boolean unregister(Class<?> type) {
        return dependencies.remove(type) != null;
    }

    public boolean unregister(String key) {
        return dependencies.remove(key) != null;
    }

    private void put(Object key, Object dependency) {
        Object previous = dependencies.put(key, dependency);
        if (previous != null && previous != dependency) {
            LOGGER.debug("Replaced dependency registered for {}", key);
        }
    }

    private <T> T lookup(Object key, Class<T> type) throws DependencyNotFoundException {
        Object dependency = dependencies.get(key);
        if (dependency == null) {
            throw new DependencyNotFoundException(key);
        }
        if (!type.isInstance(dependency)) {
            throw new DependencyNotFoundException(key, type, dependency.getClass());
        }
        return type.cast(dependency);
    }
}
