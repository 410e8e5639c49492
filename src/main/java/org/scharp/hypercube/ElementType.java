///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

/**
 * The numeric type of the values in a {@link CubeArray}.
 * <p>
 * Every type can represent its full range exactly within a {@code CubeArray}, so converting a payload from disk to a
 * cube and back never changes a value.
 * </p>
 */
public enum ElementType {
    /** A signed 8-bit integer */
    INT8(1, true, true, Byte.MIN_VALUE, Byte.MAX_VALUE),

    /** An unsigned 8-bit integer */
    UINT8(1, true, false, 0, 0xFF),

    /** A signed 16-bit integer */
    INT16(2, true, true, Short.MIN_VALUE, Short.MAX_VALUE),

    /** An unsigned 16-bit integer */
    UINT16(2, true, false, 0, 0xFFFF),

    /** A signed 32-bit integer */
    INT32(4, true, true, Integer.MIN_VALUE, Integer.MAX_VALUE),

    /** An unsigned 32-bit integer */
    UINT32(4, true, false, 0, 0xFFFF_FFFFL),

    /** A signed 64-bit integer */
    INT64(8, true, true, Long.MIN_VALUE, Long.MAX_VALUE),

    /** An unsigned 64-bit integer */
    UINT64(8, true, false, 0, 0x1.0p64),

    /** An IEEE 754 single precision floating point number */
    FLOAT32(4, false, true, -Float.MAX_VALUE, Float.MAX_VALUE),

    /** An IEEE 754 double precision floating point number */
    FLOAT64(8, false, true, -Double.MAX_VALUE, Double.MAX_VALUE);

    private final int bytesPerElement;
    private final boolean integer;
    private final boolean signed;
    private final double minValue;
    private final double maxValue;

    ElementType(int bytesPerElement, boolean integer, boolean signed, double minValue, double maxValue) {
        this.bytesPerElement = bytesPerElement;
        this.integer = integer;
        this.signed = signed;
        this.minValue = minValue;
        this.maxValue = maxValue;
    }

    /**
     * Gets the number of bytes that one value of this type occupies in a binary payload.
     *
     * @return 1, 2, 4, or 8.
     */
    public int bytesPerElement() {
        return bytesPerElement;
    }

    /**
     * @return {@code true}, if this is one of the integer types; {@code false}, if it's a floating point type.
     */
    public boolean isInteger() {
        return integer;
    }

    /**
     * @return {@code true}, if values of this type can be negative.
     */
    public boolean isSigned() {
        return signed;
    }

    /**
     * Gets the smallest value of this type as a double.
     *
     * @return The smallest value this type can hold.
     */
    public double minValue() {
        return minValue;
    }

    /**
     * Gets the largest value of this type as a double.  For the 64-bit integer types this is rounded up to the next
     * power of two, since the exact value isn't representable as a double.
     *
     * @return The largest value this type can hold.
     */
    public double maxValue() {
        return maxValue;
    }

    /**
     * Whether values of this type are held as {@code long} bits instead of {@code double} values.
     *
     * @return {@code true} for {@link #INT64} and {@link #UINT64}.
     */
    boolean isStoredAsLong() {
        return this == INT64 || this == UINT64;
    }
}
