package infrastructure.util;

import java.util.Collection;

/**
 * Input validation utilities used at system boundaries (CLI argument parsing,
 * configuration building).
 *
 * <p>All methods throw {@link IllegalArgumentException} with a descriptive message
 * on invalid input so callers can propagate or display the reason to the user.
 * Internal invariants (search logic) are protected by
 * {@link domain.engine.SearchInvariantException}, not these methods.
 */
public final class ValidationUtils {

    private ValidationUtils() {
        // Prevent instantiation: static methods only
    }

    /**
     * Validates that a value is a finite number (neither NaN nor infinite).
     *
     * @param value     the value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value} is NaN or infinite
     */
    public static void validateFinite(double value, String paramName) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                paramName + " must be a finite number, got: " + value);
        }
    }

    /**
     * Validates that a value is finite and has no fractional part.
     *
     * @param value     the value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value} is not a finite integer
     */
    public static void validateIntegral(double value, String paramName) {
        validateFinite(value, paramName);
        if (value != Math.rint(value)) {
            throw new IllegalArgumentException(
                paramName + " must be an integer in INTEGER mode, got: " + value);
        }
    }

    /**
     * Validates that a value is finite and not negative.
     *
     * @param value     the value to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value < 0} or not finite
     */
    public static void validateNonNegative(double value, String paramName) {
        validateFinite(value, paramName);
        if (value < 0.0) {
            throw new IllegalArgumentException(
                paramName + " must not be negative, got: " + value);
        }
    }

    /**
     * Validates that an integer value is at least {@code min}.
     *
     * @param value     the integer value to check
     * @param min       smallest accepted value
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code value < min}
     */
    public static void validateAtLeast(int value, int min, String paramName) {
        if (value < min) {
            throw new IllegalArgumentException(
                paramName + " must be at least " + min + ", got: " + value);
        }
    }

    /**
     * Validates that a collection is non-null and has at least one element.
     *
     * @param values    the collection to check
     * @param paramName parameter name used in the error message
     * @throws IllegalArgumentException if {@code values} is null or empty
     */
    public static void validateNotEmpty(Collection<?> values, String paramName) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(paramName + " must not be empty");
        }
    }
}
