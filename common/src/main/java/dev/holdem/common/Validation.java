package dev.holdem.common;

/**
 * Validation helper methods that throw CommandRejectedError on failure.
 */
public final class Validation {

    private Validation() {}

    /**
     * Require that a value is positive (greater than zero).
     */
    public static void requirePositive(long value, String fieldName) {
        if (value <= 0) {
            throw Errors.CommandRejectedError.invalidArgument(fieldName + " must be positive");
        }
    }

    /**
     * Require that a value is non-negative (zero or greater).
     */
    public static void requireNonNegative(long value, String fieldName) {
        if (value < 0) {
            throw Errors.CommandRejectedError.invalidArgument(fieldName + " must be non-negative");
        }
    }

    /**
     * Require that a value lies within an inclusive range.
     */
    public static void requireInRange(long value, long min, long max, String fieldName) {
        if (value < min || value > max) {
            throw Errors.CommandRejectedError.invalidArgument(
                fieldName + " must be between " + min + " and " + max);
        }
    }

    /**
     * Require that a string is not empty.
     */
    public static void requireNotEmpty(String value, String fieldName) {
        if (value == null || value.isEmpty()) {
            throw Errors.CommandRejectedError.invalidArgument(fieldName + " must not be empty");
        }
    }

    /**
     * Require that a status matches an expected value.
     */
    public static <T extends Enum<T>> void requireStatus(T actual, T expected, String message) {
        if (!actual.equals(expected)) {
            throw new Errors.CommandRejectedError(message + ": expected " + expected + ", got " + actual);
        }
    }
}
