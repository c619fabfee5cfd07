package io.corekit.util;

import org.jspecify.annotations.Nullable;

public final class Assert {

    private Assert() {
    }

    /**
     * Check that the named parameter is not {@code null}.
     *
     * @param name the parameter name
     * @param value the parameter value
     * @param <T> the value type
     * @return the value that was passed in
     * @throws IllegalArgumentException if the value is {@code null}
     */
    public static <T> T checkNotNullParam(String name, @Nullable T value) throws IllegalArgumentException {
        if (value == null) {
            throw new IllegalArgumentException("Parameter '" + name + "' may not be null");
        }
        return value;
    }

    /**
     * Check that the named numeric parameter is not negative.
     *
     * @param name the parameter name
     * @param value the parameter value
     * @return the value that was passed in
     * @throws IllegalArgumentException if the value is negative
     */
    public static int checkMinimumParameter(String name, int value) throws IllegalArgumentException {
        if (value < 0) {
            throw new IllegalArgumentException("Parameter '" + name + "' must not be negative: " + value);
        }
        return value;
    }
}
