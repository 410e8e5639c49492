package org.scharp.hypercube;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Arrays;

/**
 * A class for holding utility methods.
 */
abstract class MathUtil {

    private static final BigInteger TWO_TO_THE_64 = BigInteger.ONE.shiftLeft(64);

    // private constructor to prevent anyone from instantiating the class.
    private MathUtil() {
    }

    /**
     * Computes the number of elements in an array of the given shape.
     *
     * @param rows
     *     the number of rows
     * @param columns
     *     the number of columns
     * @param bands
     *     the number of bands
     *
     * @return {@code rows * columns * bands}
     *
     * @throws IllegalArgumentException
     *     if the product doesn't fit into a Java array.
     */
    static int elementCount(int rows, int columns, int bands) {
        assert 0 <= rows && 0 <= columns && 0 <= bands : "elementCount doesn't handle negative numbers";

        long count = (long) rows * columns * bands;
        if (Integer.MAX_VALUE - 8 < count) {
            throw new IllegalArgumentException(
                "a " + rows + "x" + columns + "x" + bands + " cube has too many elements to hold in memory");
        }
        return (int) count;
    }

    /**
     * Rounds a number to the nearest integer, with ties rounded away from zero.
     *
     * @param value
     *     the number to round
     *
     * @return The rounded number.  Infinities and NaN are returned unchanged.
     */
    // Math.round() rounds ties toward positive infinity, which rounds -2.5 to -2.
    static double roundHalfAwayFromZero(double value) {
        if (Double.isNaN(value) || !(Math.abs(value) < 0x1.0p52)) {
            return value; // already an integer, infinite, or NaN
        }
        double magnitude = Math.abs(value);
        double whole = Math.floor(magnitude);
        double rounded = magnitude - whole < 0.5 ? whole : whole + 1;
        return value < 0 ? -rounded : rounded;
    }

    /**
     * Computes the median of some values.
     *
     * @param values
     *     The values.  This array is not modified.
     *
     * @return The median, or NaN if there are no values or if any value is NaN.
     */
    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted); // NaN sorts last
        if (sorted.length == 0 || Double.isNaN(sorted[sorted.length - 1])) {
            return Double.NaN;
        }
        int middle = sorted.length / 2;
        if (sorted.length % 2 == 1) {
            return sorted[middle];
        }
        return sorted[middle - 1] + (sorted[middle] - sorted[middle - 1]) / 2;
    }

    /**
     * Interprets the bits of a long as an unsigned 64-bit integer.
     *
     * @param bits
     *     the raw bits
     *
     * @return the unsigned value
     */
    static BigInteger toUnsignedBigInteger(long bits) {
        BigInteger value = BigInteger.valueOf(bits);
        return bits < 0 ? value.add(TWO_TO_THE_64) : value;
    }

    /**
     * Converts the bits of an unsigned 64-bit integer to the nearest double.
     *
     * @param bits
     *     the raw bits
     *
     * @return the unsigned value as a double
     */
    static double unsignedToDouble(long bits) {
        if (0 <= bits) {
            return bits;
        }
        // Halve the value while keeping the low bit so that the rounding is correct.
        return ((bits >>> 1) | (bits & 1)) * 2.0;
    }

    /**
     * Converts an integral BigDecimal to the bits of a 64-bit integer of the given type, saturating at the type's range.
     *
     * @param value
     *     The value to convert.  Any fraction is rounded half away from zero.
     * @param type
     *     {@link ElementType#INT64} or {@link ElementType#UINT64}
     *
     * @return The raw bits of the saturated value.
     */
    static long saturateToLong(BigDecimal value, ElementType type) {
        assert type.isStoredAsLong() : type + " is not held as a long";

        BigInteger integral = value.setScale(0, RoundingMode.HALF_UP).toBigIntegerExact();
        if (type == ElementType.INT64) {
            if (integral.compareTo(BigInteger.valueOf(Long.MAX_VALUE)) > 0) {
                return Long.MAX_VALUE;
            }
            if (integral.compareTo(BigInteger.valueOf(Long.MIN_VALUE)) < 0) {
                return Long.MIN_VALUE;
            }
            return integral.longValue();
        }

        if (integral.signum() < 0) {
            return 0;
        }
        if (integral.compareTo(TWO_TO_THE_64) >= 0) {
            return -1L; // all bits set
        }
        return integral.longValue(); // keeps the low 64 bits
    }
}
