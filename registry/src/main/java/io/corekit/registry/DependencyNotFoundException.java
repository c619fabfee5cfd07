package io.corekit.registry;

/**
 * Thrown when a {@link DependencyRegistry} has no entry for a key, or the entry is not of the
 * requested type.
 */
public class DependencyNotFoundException extends Exception {

    private final Object key;

    public DependencyNotFoundException(Object key) {
        super("No dependency found for " + describe(key));
        this.key = key;
    }

    public DependencyNotFoundException(Object key, Class<?> requestedType, Class<?> actualType) {
        super("Dependency registered for " + describe(key) + " is a " + actualType.getName()
                + ", not a " + requestedType.getName());
        this.key = key;
    }

    /**
     * Returns the lookup key: either the {@link String} key or the {@link Class} used for the lookup.
     *
     * @return the key
     */
    public Object getKey() {
        return key;
    }

    private static String describe(Object key) {
        return key instanceof Class<?> type ? type.getName() : "key '" + key + "'";
    }
}
