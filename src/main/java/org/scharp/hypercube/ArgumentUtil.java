package org.scharp.hypercube;

/**
 * A class with utility methods for validating arguments.
 */
abstract class ArgumentUtil {
    /**
     * Throws an exception if {@code argument} is {@code null}.
     *
     * @param argument
     *     The argument to check.
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     */
    static void checkNotNull(Object argument, String argumentName) {
        if (argument == null) {
            throw new NullPointerException(argumentName + " must not be null");
        }
    }

    /**
     * Throws an exception if {@code argument} is {@code null} or empty.
     *
     * @param argument
     *     The string to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws NullPointerException
     *     if {@code argument} is {@code null}.
     * @throws IllegalArgumentException
     *     if {@code argument} is the empty string.
     */
    static void checkNotEmpty(String argument, String argumentName) {
        checkNotNull(argument, argumentName);
        if (argument.isEmpty()) {
            throw new IllegalArgumentException(argumentName + " must not be empty");
        }
    }

    /**
     * Throws an exception if {@code argument} is negative (less than zero).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is negative
     */
    static void checkNotNegative(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 0) {
            throw new IllegalArgumentException(argumentName + " must not be negative");
        }
    }

    /**
     * Throws an exception if {@code argument} is not positive (less than one).
     *
     * @param argument
     *     The argument to check
     * @param argumentName
     *     The name of the argument. This is used to create a more informative exception message.
     *
     * @throws IllegalArgumentException
     *     if {@code argument} is zero or negative
     */
    static void checkPositive(int argument, String argumentName) {
        assert argumentName != null : "argumentName must not be null";

        if (argument < 1) {
            throw new IllegalArgumentException(argumentName + " must be positive");
        }
    }
}
