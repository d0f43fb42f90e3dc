package org.genesignature.utils.param;

/**
 * Range and sign checks for numeric parameters. Failures are reported as {@link IllegalArgumentException}.
 */
public final class ParamUtils {

    private ParamUtils() {
    }

    /**
     * Checks that the  input is positive or zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException if a {@code val} is negative
     */
    public static int isPositiveOrZero(final int val, final String message) {
        if (!(val >= 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }

    /**
     * Checks that the  input is greater than zero and returns the same value or throws an {@link IllegalArgumentException}
     * @param val value to check
     * @param message the text message that would be pass to the exception thrown
     * @return the same value
     * @throws IllegalArgumentException if a {@code val} is not positive
     */
    public static int isPositive(final int val, final String message) {
        if (!(val > 0)) {
            throw new IllegalArgumentException(message);
        }
        return val;
    }
}
