///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.nio.ByteOrder;

/** Utility methods for reading and writing numbers in a byte array with a given byte order */
final class ByteUtil {

    // private constructor to prevent anyone from instantiating the class.
    private ByteUtil() {
    }

    /**
     * Writes the low {@code width} bytes of a number to an array.
     *
     * @param data
     *     The array to write to.
     * @param offset
     *     The offset in the array to write to.
     * @param number
     *     The number to write.
     * @param width
     *     The number of bytes to write (1, 2, 4, or 8).
     * @param byteOrder
     *     The order in which to write the bytes.
     *
     * @return The number of bytes written.
     */
    static int write(byte[] data, int offset, long number, int width, ByteOrder byteOrder) {
        assert width == 1 || width == 2 || width == 4 || width == 8 : "unsupported width " + width;

        if (byteOrder == ByteOrder.LITTLE_ENDIAN) {
            for (int i = 0; i < width; i++) {
                data[offset + i] = (byte) (number >> (8 * i));
            }
        } else {
            for (int i = 0; i < width; i++) {
                data[offset + width - 1 - i] = (byte) (number >> (8 * i));
            }
        }
        return width;
    }

    /**
     * Reads {@code width} bytes from an array as an unsigned number.
     *
     * @param data
     *     The array to read from.
     * @param offset
     *     The offset of the first byte to read.
     * @param width
     *     The number of bytes to read (1, 2, 4, or 8).
     * @param byteOrder
     *     The order of the bytes in {@code data}.
     *
     * @return The bytes, zero-extended to a long.  For a width of 8, these are the raw bits.
     */
    static long read(byte[] data, int offset, int width, ByteOrder byteOrder) {
        assert width == 1 || width == 2 || width == 4 || width == 8 : "unsupported width " + width;

        long number = 0;
        if (byteOrder == ByteOrder.LITTLE_ENDIAN) {
            for (int i = width - 1; 0 <= i; i--) {
                number = (number << 8) | (data[offset + i] & 0xFF);
            }
        } else {
            for (int i = 0; i < width; i++) {
                number = (number << 8) | (data[offset + i] & 0xFF);
            }
        }
        return number;
    }
}
