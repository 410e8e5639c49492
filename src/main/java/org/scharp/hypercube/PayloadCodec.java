///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteOrder;

/**
 * Converts between a {@link CubeArray} and the raw bytes of an ENVI data file, as described by an {@link EnviHeader}.
 * <p>
 * The bytes are streamed through a fixed-size buffer, so the only whole copy of the data that is held in memory is the
 * {@code CubeArray} itself.
 * </p>
 */
public final class PayloadCodec {

    // The number of bytes that are read or written at once.  This is a multiple of every element width.
    static final int BUFFER_SIZE = 64 * 1024;

    // private constructor to prevent anyone from instantiating the class.
    private PayloadCodec() {
    }

    private static void checkMatches(CubeArray data, EnviHeader header) {
        if (data.rows() != header.lines() || data.columns() != header.samples() || data.bands() != header.bands()) {
            throw new ShapeMismatchException("a " + data + " doesn't match a header with " + header.lines() +
                " lines, " + header.samples() + " samples, and " + header.bands() + " bands");
        }
        if (data.elementType() != header.elementType()) {
            throw new IllegalArgumentException(
                "a " + data + " doesn't match a header with element type " + header.elementType());
        }
    }

    /**
     * Gets the bits of a value as they are written to a data file.
     */
    private static long bitsAt(CubeArray data, int index, ElementType elementType) {
        switch (elementType) {
        case FLOAT32:
            return Float.floatToRawIntBits((float) data.doubleAt(index));
        case FLOAT64:
            return Double.doubleToRawLongBits(data.doubleAt(index));
        default:
            // Every integer type is exact as a long; UINT64 is held as its raw bits.
            return data.longAt(index);
        }
    }

    /**
     * Writes the values of an array in the layout which a header describes.
     *
     * @param data
     *     The array to write.
     * @param header
     *     The header which describes the layout.
     * @param out
     *     The stream to write to.  This is not closed.
     *
     * @throws IOException
     *     if writing to {@code out} fails.
     * @throws ShapeMismatchException
     *     if the array's size doesn't match the header.
     * @throws IllegalArgumentException
     *     if the array's element type doesn't match the header.
     */
    public static void encode(CubeArray data, EnviHeader header, OutputStream out) throws IOException {
        ArgumentUtil.checkNotNull(data, "data");
        ArgumentUtil.checkNotNull(header, "header");
        ArgumentUtil.checkNotNull(out, "out");
        checkMatches(data, header);

        final ElementType elementType = header.elementType();
        final int width = elementType.bytesPerElement();
        final ByteOrder byteOrder = header.byteOrder();
        final Interleave interleave = header.interleave();
        final int count = data.elementCount();

        byte[] buffer = new byte[BUFFER_SIZE];
        int offset = 0;
        for (int position = 0; position < count; position++) {
            int index = interleave.bsqIndex(position, header.lines(), header.samples(), header.bands());
            offset += ByteUtil.write(buffer, offset, bitsAt(data, index, elementType), width, byteOrder);
            if (offset == buffer.length) {
                out.write(buffer);
                offset = 0;
            }
        }
        out.write(buffer, 0, offset);
    }

    /**
     * Converts the values of an array to the bytes of a data file in the layout which a header describes.
     *
     * @param data
     *     The array to convert.
     * @param header
     *     The header which describes the layout.
     *
     * @return A new byte array of {@link EnviHeader#dataByteCount()} bytes.
     *
     * @throws ShapeMismatchException
     *     if the array's size doesn't match the header.
     * @throws IllegalArgumentException
     *     if the array's element type doesn't match the header.
     */
    public static byte[] encode(CubeArray data, EnviHeader header) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            encode(data, header, out);
        } catch (IOException e) {
            // ByteArrayOutputStream doesn't throw IOException.
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Reads the values of an array from a stream in the layout which a header describes.
     *
     * @param in
     *     The stream, positioned at the first value (after any header offset).  This is not closed.
     * @param byteCount
     *     The number of bytes of data in the stream.
     * @param header
     *     The header which describes the layout.
     *
     * @return A new array.
     *
     * @throws MalformedHeaderException
     *     if {@code byteCount} is not the number of bytes which the header describes, or if the stream ends early.
     * @throws IOException
     *     if reading from {@code in} fails.
     */
    public static CubeArray decode(InputStream in, long byteCount, EnviHeader header) throws IOException {
        ArgumentUtil.checkNotNull(in, "in");
        ArgumentUtil.checkNotNull(header, "header");
        if (byteCount != header.dataByteCount()) {
            throw new MalformedHeaderException("data has " + byteCount + " bytes but the header describes " +
                header.dataByteCount() + " bytes (" + header.lines() + " lines x " + header.samples() +
                " samples x " + header.bands() + " bands x " + header.elementType().bytesPerElement() + " bytes)");
        }

        final ElementType elementType = header.elementType();
        final int width = elementType.bytesPerElement();
        final ByteOrder byteOrder = header.byteOrder();
        final Interleave interleave = header.interleave();
        final int count = MathUtil.elementCount(header.lines(), header.samples(), header.bands());

        double[] doubles = elementType.isStoredAsLong() ? null : new double[count];
        long[] longs = elementType.isStoredAsLong() ? new long[count] : null;

        byte[] buffer = new byte[BUFFER_SIZE];
        int limit = 0;
        int offset = 0;
        for (int position = 0; position < count; position++) {
            if (offset == limit) {
                int wanted = (int) Math.min(buffer.length, (long) (count - position) * width);
                limit = in.readNBytes(buffer, 0, wanted);
                offset = 0;
                if (limit != wanted) {
                    throw new MalformedHeaderException("data ended after " + ((long) position * width + limit) +
                        " of " + byteCount + " bytes");
                }
            }

            long bits = ByteUtil.read(buffer, offset, width, byteOrder);
            offset += width;

            int index = interleave.bsqIndex(position, header.lines(), header.samples(), header.bands());
            if (longs != null) {
                longs[index] = bits;
            } else {
                doubles[index] = toDouble(bits, elementType);
            }
        }

        return new CubeArray(elementType, header.lines(), header.samples(), header.bands(), doubles, longs);
    }

    /**
     * Converts the bytes of a data file to an array in the layout which a header describes.
     *
     * @param bytes
     *     The bytes of the data, not including any header offset.
     * @param header
     *     The header which describes the layout.
     *
     * @return A new array.
     *
     * @throws MalformedHeaderException
     *     if {@code bytes} is not exactly the length which the header describes.
     */
    public static CubeArray decode(byte[] bytes, EnviHeader header) throws MalformedHeaderException {
        ArgumentUtil.checkNotNull(bytes, "bytes");
        try {
            return decode(new ByteArrayInputStream(bytes), bytes.length, header);
        } catch (MalformedHeaderException e) {
            throw e;
        } catch (IOException e) {
            // ByteArrayInputStream doesn't throw IOException.
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Converts the (zero-extended) bits of a value which isn't held as a long.
     */
    private static double toDouble(long bits, ElementType elementType) {
        switch (elementType) {
        case INT8:
            return (byte) bits;
        case INT16:
            return (short) bits;
        case INT32:
            return (int) bits;
        case UINT8:
        case UINT16:
        case UINT32:
            return bits;
        case FLOAT32:
            return Float.intBitsToFloat((int) bits);
        case FLOAT64:
            return Double.longBitsToDouble(bits);
        default:
            throw new AssertionError(elementType + " is held as a long");
        }
    }
}
