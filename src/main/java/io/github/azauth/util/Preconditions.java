package io.github.azauth.util;

/**
 * Argument validation helpers shared across packages.
 */
public final class Preconditions {

    private Preconditions() {
        // Utility class
    }

    /**
     * Validates that a parameter is not null.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @param <T>   the value type
     * @return the value
     * @throws IllegalArgumentException if the value is null
     */
    public static <T> T requireNonNull(T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException("parameter '" + name + "' cannot be null");
        }
        return value;
    }

    /**
     * Validates that a string is neither null nor blank.
     *
     * @param value the value to check
     * @param name  the parameter name for the error message
     * @return the value
     * @throws IllegalArgumentException if the value is null or blank
     */
    public static String requireNonBlank(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("parameter '" + name + "' cannot be null or blank");
        }
        return value;
    }

    /**
     * Returns true when the string is null or contains only whitespace.
     */
    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Returns the first argument unless it is blank, otherwise the fallback.
     */
    public static String firstNonBlank(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }
}
