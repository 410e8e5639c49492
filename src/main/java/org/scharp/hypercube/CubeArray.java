///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * A three-dimensional array of numbers, indexed by row, column, and band.
 * <p>
 * Instances of this class are immutable.  Every operation that changes the values or the shape returns a new
 * {@code CubeArray}.
 * </p>
 *
 * <p>
 * The size of an array is always reported as three dimensions.  Any dimension may be zero.  Element accessors use
 * 0-based indexes, like Java arrays.
 * </p>
 *
 * <p>
 * Values are held exactly for every {@link ElementType}.  When a value is stored into an integer type, it is rounded to
 * the nearest integer (ties away from zero) and saturated to the type's range, with NaN stored as 0.  When a value is
 * stored into {@link ElementType#FLOAT32}, it is rounded to single precision.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()}.  Two arrays are equal when they have the same element
 * type, the same size, and the same values.
 * </p>
 */
public final class CubeArray {

    /**
     * A function that computes the value at a position in an array.
     */
    @FunctionalInterface
    public interface ValueFunction {
        /**
         * Computes a value.
         *
         * @param row
         *     The 0-based row index.
         * @param column
         *     The 0-based column index.
         * @param band
         *     The 0-based band index.
         *
         * @return The value at the given position.
         */
        double valueAt(int row, int column, int band);
    }

    /** Maps a position in a new array to the flat index of the value to copy from this array. */
    @FunctionalInterface
    private interface SourceIndex {
        int of(int row, int column, int band);
    }

    private final ElementType elementType;
    private final int rows;
    private final int columns;
    private final int bands;

    // Exactly one of these is non-null, depending on elementType.isStoredAsLong().
    // The values are in band-sequential order: band, then row, then column.
    private final double[] doubles;
    private final long[] longs;

    /**
     * Creates an array that takes ownership of the given storage without copying it.
     */
    CubeArray(ElementType elementType, int rows, int columns, int bands, double[] doubles, long[] longs) {
        assert elementType != null;
        assert (doubles == null) == elementType.isStoredAsLong() : "wrong storage for " + elementType;
        assert (longs == null) != elementType.isStoredAsLong() : "wrong storage for " + elementType;
        assert (doubles != null ? doubles.length : longs.length) == MathUtil.elementCount(rows, columns, bands);

        this.elementType = elementType;
        this.rows = rows;
        this.columns = columns;
        this.bands = bands;
        this.doubles = doubles;
        this.longs = longs;
    }

    private static void checkShape(int rows, int columns, int bands) {
        ArgumentUtil.checkNotNegative(rows, "rows");
        ArgumentUtil.checkNotNegative(columns, "columns");
        ArgumentUtil.checkNotNegative(bands, "bands");
    }

    /**
     * Creates an array in which every element is {@code value}.
     *
     * @param elementType
     *     The type of the elements.
     * @param rows
     *     The number of rows.
     * @param columns
     *     The number of columns.
     * @param bands
     *     The number of bands.
     * @param value
     *     The value of every element.  It is converted to {@code elementType}.
     *
     * @return A new array.
     *
     * @throws NullPointerException
     *     if {@code elementType} is {@code null}.
     * @throws IllegalArgumentException
     *     if any dimension is negative or if the array would be too large.
     */
    public static CubeArray filled(ElementType elementType, int rows, int columns, int bands, double value) {
        return fromFunction(elementType, rows, columns, bands, (row, column, band) -> value);
    }

    /**
     * Creates an array of zeros.
     *
     * @param elementType
     *     The type of the elements.
     * @param rows
     *     The number of rows.
     * @param columns
     *     The number of columns.
     * @param bands
     *     The number of bands.
     *
     * @return A new array.
     */
    public static CubeArray zeros(ElementType elementType, int rows, int columns, int bands) {
        return filled(elementType, rows, columns, bands, 0);
    }

    /**
     * Creates an array of ones.
     *
     * @param elementType
     *     The type of the elements.
     * @param rows
     *     The number of rows.
     * @param columns
     *     The number of columns.
     * @param bands
     *     The number of bands.
     *
     * @return A new array.
     */
    public static CubeArray ones(ElementType elementType, int rows, int columns, int bands) {
        return filled(elementType, rows, columns, bands, 1);
    }

    /**
     * Creates an array whose values are computed by a function.
     *
     * @param elementType
     *     The type of the elements.
     * @param rows
     *     The number of rows.
     * @param columns
     *     The number of columns.
     * @param bands
     *     The number of bands.
     * @param function
     *     The function which computes the value at each position.
     *
     * @return A new array.
     *
     * @throws NullPointerException
     *     if {@code elementType} or {@code function} is {@code null}.
     * @throws IllegalArgumentException
     *     if any dimension is negative or if the array would be too large.
     */
    public static CubeArray fromFunction(ElementType elementType, int rows, int columns, int bands,
        ValueFunction function) {
        ArgumentUtil.checkNotNull(elementType, "elementType");
        ArgumentUtil.checkNotNull(function, "function");
        checkShape(rows, columns, bands);

        int count = MathUtil.elementCount(rows, columns, bands);
        double[] doubles = elementType.isStoredAsLong() ? null : new double[count];
        long[] longs = elementType.isStoredAsLong() ? new long[count] : null;

        int index = 0;
        for (int band = 0; band < bands; band++) {
            for (int row = 0; row < rows; row++) {
                for (int column = 0; column < columns; column++) {
                    double value = function.valueAt(row, column, band);
                    if (longs != null) {
                        longs[index] = toLongBits(value, elementType);
                    } else {
                        doubles[index] = toStoredDouble(value, elementType);
                    }
                    index++;
                }
            }
        }
        return new CubeArray(elementType, rows, columns, bands, doubles, longs);
    }

    /**
     * Creates an array from a Java array, indexed as {@code values[row][column][band]}.
     *
     * @param elementType
     *     The type of the elements.
     * @param values
     *     The values.  All rows must have the same number of columns and all columns the same number of bands. The
     *     values are copied.
     *
     * @return A new array.
     *
     * @throws NullPointerException
     *     if {@code elementType} or {@code values} is {@code null} or contains a {@code null}.
     * @throws IllegalArgumentException
     *     if {@code values} is ragged.
     */
    public static CubeArray of(ElementType elementType, double[][][] values) {
        ArgumentUtil.checkNotNull(values, "values");

        final int rows = values.length;
        final int columns = rows == 0 ? 0 : values[0].length;
        final int bands = columns == 0 ? 0 : values[0][0].length;
        for (double[][] row : values) {
            ArgumentUtil.checkNotNull(row, "values row");
            if (row.length != columns) {
                throw new IllegalArgumentException("values must not be ragged: every row must have " + columns + " columns");
            }
            for (double[] spectrum : row) {
                ArgumentUtil.checkNotNull(spectrum, "values column");
                if (spectrum.length != bands) {
                    throw new IllegalArgumentException("values must not be ragged: every column must have " + bands + " bands");
                }
            }
        }
        return fromFunction(elementType, rows, columns, bands, (row, column, band) -> values[row][column][band]);
    }

    /**
     * Creates an array of {@link ElementType#FLOAT64} values, indexed as {@code values[row][column][band]}.
     *
     * @param values
     *     The values.  These are copied.
     *
     * @return A new array.
     */
    public static CubeArray of(double[][][] values) {
        return of(ElementType.FLOAT64, values);
    }

    /**
     * Creates a single-band array of {@link ElementType#FLOAT64} values from a two-dimensional Java array indexed as
     * {@code values[row][column]}.
     *
     * @param values
     *     The values.  These are copied.
     *
     * @return A new array whose size is {@code rows x columns x 1}.
     */
    public static CubeArray of(double[][] values) {
        ArgumentUtil.checkNotNull(values, "values");
        double[][][] padded = new double[values.length][][];
        for (int row = 0; row < values.length; row++) {
            ArgumentUtil.checkNotNull(values[row], "values row");
            padded[row] = new double[values[row].length][];
            for (int column = 0; column < values[row].length; column++) {
                padded[row][column] = new double[] { values[row][column] };
            }
        }
        return of(ElementType.FLOAT64, padded);
    }

    /**
     * Converts a value into what would be stored for an element type that is held as a double.
     */
    static double toStoredDouble(double value, ElementType elementType) {
        assert !elementType.isStoredAsLong();

        switch (elementType) {
        case FLOAT64:
            return value;
        case FLOAT32:
            return (float) value;
        default:
            if (Double.isNaN(value)) {
                return 0;
            }
            double rounded = MathUtil.roundHalfAwayFromZero(value);
            if (rounded == 0) {
                return 0; // integers have no negative zero
            }
            return Math.max(elementType.minValue(), Math.min(elementType.maxValue(), rounded));
        }
    }

    /**
     * Converts a value into the bits that would be stored for a 64-bit integer type.
     */
    static long toLongBits(double value, ElementType elementType) {
        assert elementType.isStoredAsLong();

        if (Double.isNaN(value)) {
            return 0;
        }
        double rounded = MathUtil.roundHalfAwayFromZero(value);
        if (elementType == ElementType.INT64) {
            // A cast from double to long already saturates.
            return (long) rounded;
        }
        if (rounded <= 0) {
            return 0;
        }
        if (0x1.0p64 <= rounded) {
            return -1L;
        }
        if (rounded < 0x1.0p63) {
            return (long) rounded;
        }
        return new BigDecimal(rounded).toBigInteger().longValue();
    }

    private int index(int row, int column, int band) {
        return (band * rows + row) * columns + column;
    }

    private void checkPosition(int row, int column, int band) {
        if (row < 0 || rows <= row || column < 0 || columns <= column || band < 0 || bands <= band) {
            throw new IndexOutOfBoundsException(
                "position (" + row + ", " + column + ", " + band + ") is out of bounds for a " + this);
        }
    }

    /**
     * @return The type of this array's elements.  This is never {@code null}.
     */
    public ElementType elementType() {
        return elementType;
    }

    /**
     * @return The number of rows (the height).
     */
    public int rows() {
        return rows;
    }

    /**
     * @return The number of columns (the width).
     */
    public int columns() {
        return columns;
    }

    /**
     * @return The number of bands.
     */
    public int bands() {
        return bands;
    }

    /**
     * Gets the size of this array.
     *
     * @return A new three element array of {@code {rows, columns, bands}}.
     */
    public int[] size() {
        return new int[] { rows, columns, bands };
    }

    /**
     * @return The total number of elements.
     */
    public int elementCount() {
        return doubles != null ? doubles.length : longs.length;
    }

    /**
     * @return {@code true}, if this array has no elements.
     */
    public boolean isEmpty() {
        return elementCount() == 0;
    }

    /**
     * Gets a value as a double.  For the 64-bit integer types, this may be rounded.
     *
     * @param row
     *     The 0-based row index.
     * @param column
     *     The 0-based column index.
     * @param band
     *     The 0-based band index.
     *
     * @return The value.
     *
     * @throws IndexOutOfBoundsException
     *     if the position is outside this array.
     */
    public double getDouble(int row, int column, int band) {
        checkPosition(row, column, band);
        return doubleAt(index(row, column, band));
    }

    /**
     * Gets a value as a long.  Floating point values are truncated.  Values of {@link ElementType#UINT64} are returned
     * as their raw bits, as by {@link Long#parseUnsignedLong}.
     *
     * @param row
     *     The 0-based row index.
     * @param column
     *     The 0-based column index.
     * @param band
     *     The 0-based band index.
     *
     * @return The value.
     *
     * @throws IndexOutOfBoundsException
     *     if the position is outside this array.
     */
    public long getLong(int row, int column, int band) {
        checkPosition(row, column, band);
        return longAt(index(row, column, band));
    }

    /**
     * Gets the value at a band-sequential flat index as a double.
     */
    double doubleAt(int index) {
        if (doubles != null) {
            return doubles[index];
        }
        return elementType == ElementType.UINT64 ? MathUtil.unsignedToDouble(longs[index]) : longs[index];
    }

    /**
     * Gets the value at a band-sequential flat index as a long (raw bits for UINT64).
     */
    long longAt(int index) {
        return longs != null ? longs[index] : (long) doubles[index];
    }

    /**
     * Gets the value at a band-sequential flat index as an exact decimal.
     */
    private BigDecimal exactAt(int index) {
        if (elementType == ElementType.UINT64) {
            return new BigDecimal(MathUtil.toUnsignedBigInteger(longs[index]));
        }
        if (longs != null) {
            return BigDecimal.valueOf(longs[index]);
        }
        return new BigDecimal(doubles[index]);
    }

    /**
     * Gets the spectrum of a pixel.
     *
     * @param row
     *     The 0-based row index.
     * @param column
     *     The 0-based column index.
     *
     * @return A new array with one value for each band.
     */
    public double[] spectrum(int row, int column) {
        checkPosition(row, column, 0);
        double[] spectrum = new double[bands];
        for (int band = 0; band < bands; band++) {
            spectrum[band] = doubleAt(index(row, column, band));
        }
        return spectrum;
    }

    /**
     * Copies this array's values into a Java array.
     *
     * @return A new array indexed as {@code [row][column][band]}.
     */
    public double[][][] toArray() {
        double[][][] array = new double[rows][columns][bands];
        for (int band = 0; band < bands; band++) {
            for (int row = 0; row < rows; row++) {
                for (int column = 0; column < columns; column++) {
                    array[row][column][band] = doubleAt(index(row, column, band));
                }
            }
        }
        return array;
    }

    /**
     * Gets the smallest value.  NaN values are ignored.
     *
     * @return The smallest value, or NaN if this array is empty or holds only NaN.
     */
    public double min() {
        double min = Double.NaN;
        for (int i = 0; i < elementCount(); i++) {
            double value = doubleAt(i);
            if (Double.isNaN(min) || value < min) {
                min = value;
            }
        }
        return min;
    }

    /**
     * Gets the largest value.  NaN values are ignored.
     *
     * @return The largest value, or NaN if this array is empty or holds only NaN.
     */
    public double max() {
        double max = Double.NaN;
        for (int i = 0; i < elementCount(); i++) {
            double value = doubleAt(i);
            if (Double.isNaN(max) || max < value) {
                max = value;
            }
        }
        return max;
    }

    private CubeArray remap(int newRows, int newColumns, int newBands, SourceIndex sourceIndex) {
        int count = MathUtil.elementCount(newRows, newColumns, newBands);
        double[] newDoubles = doubles == null ? null : new double[count];
        long[] newLongs = longs == null ? null : new long[count];

        int index = 0;
        for (int band = 0; band < newBands; band++) {
            for (int row = 0; row < newRows; row++) {
                for (int column = 0; column < newColumns; column++) {
                    int source = sourceIndex.of(row, column, band);
                    if (newLongs != null) {
                        newLongs[index] = longs[source];
                    } else {
                        newDoubles[index] = doubles[source];
                    }
                    index++;
                }
            }
        }
        return new CubeArray(elementType, newRows, newColumns, newBands, newDoubles, newLongs);
    }

    /**
     * Reverses the order of the rows (flips the image upside-down).
     *
     * @return A new array.
     */
    public CubeArray flipRows() {
        return remap(rows, columns, bands, (row, column, band) -> index(rows - 1 - row, column, band));
    }

    /**
     * Reverses the order of the columns (flips the image left-to-right).
     *
     * @return A new array.
     */
    public CubeArray flipColumns() {
        return remap(rows, columns, bands, (row, column, band) -> index(row, columns - 1 - column, band));
    }

    /**
     * Rotates each band counterclockwise in 90 degree increments.
     *
     * @param k
     *     The number of times to rotate.  Negative values rotate clockwise.
     *
     * @return A new array.  When {@code k} is odd, its rows and columns are swapped.
     */
    public CubeArray rotate90(int k) {
        switch (Math.floorMod(k, 4)) {
        case 1:
            return remap(columns, rows, bands, (row, column, band) -> index(column, columns - 1 - row, band));
        case 2:
            return remap(rows, columns, bands,
                (row, column, band) -> index(rows - 1 - row, columns - 1 - column, band));
        case 3:
            return remap(columns, rows, bands, (row, column, band) -> index(rows - 1 - column, row, band));
        default:
            return this;
        }
    }

    /**
     * Repeats this array along each dimension.
     *
     * @param rowFactor
     *     The number of copies along the rows.
     * @param columnFactor
     *     The number of copies along the columns.
     * @param bandFactor
     *     The number of copies along the bands.
     *
     * @return A new array.
     *
     * @throws IllegalArgumentException
     *     if any factor is not positive or the result is too large.
     */
    public CubeArray tile(int rowFactor, int columnFactor, int bandFactor) {
        ArgumentUtil.checkPositive(rowFactor, "rowFactor");
        ArgumentUtil.checkPositive(columnFactor, "columnFactor");
        ArgumentUtil.checkPositive(bandFactor, "bandFactor");

        long newRows = (long) rows * rowFactor;
        long newColumns = (long) columns * columnFactor;
        long newBands = (long) bands * bandFactor;
        if (Integer.MAX_VALUE < newRows || Integer.MAX_VALUE < newColumns || Integer.MAX_VALUE < newBands) {
            throw new IllegalArgumentException("tiled array would be too large");
        }
        return remap((int) newRows, (int) newColumns, (int) newBands,
            (row, column, band) -> index(row % rows, column % columns, band % bands));
    }

    /**
     * Extracts a rectangular region of every band.
     *
     * @param firstRow
     *     The 0-based index of the region's first row.
     * @param firstColumn
     *     The 0-based index of the region's first column.
     * @param regionRows
     *     The number of rows in the region.
     * @param regionColumns
     *     The number of columns in the region.
     *
     * @return A new array.
     *
     * @throws IllegalArgumentException
     *     if the region is not inside this array.
     */
    public CubeArray subArray(int firstRow, int firstColumn, int regionRows, int regionColumns) {
        ArgumentUtil.checkNotNegative(firstRow, "firstRow");
        ArgumentUtil.checkNotNegative(firstColumn, "firstColumn");
        ArgumentUtil.checkNotNegative(regionRows, "regionRows");
        ArgumentUtil.checkNotNegative(regionColumns, "regionColumns");
        if (rows < (long) firstRow + regionRows || columns < (long) firstColumn + regionColumns) {
            throw new IllegalArgumentException("region is outside of the " + this);
        }
        return remap(regionRows, regionColumns, bands,
            (row, column, band) -> index(firstRow + row, firstColumn + column, band));
    }

    /**
     * Selects some bands, in the given order.  A band may be selected more than once.
     *
     * @param bandIndexes
     *     The 0-based indexes of the bands to select.
     *
     * @return A new array.
     *
     * @throws IllegalArgumentException
     *     if any index is out of range.
     */
    public CubeArray selectBands(int... bandIndexes) {
        ArgumentUtil.checkNotNull(bandIndexes, "bandIndexes");
        int[] selected = bandIndexes.clone();
        for (int bandIndex : selected) {
            if (bandIndex < 0 || bands <= bandIndex) {
                throw new IllegalArgumentException("band index " + bandIndex + " is out of range for " + this);
            }
        }
        return remap(rows, columns, selected.length, (row, column, band) -> index(row, column, selected[band]));
    }

    /**
     * Collects the spectra of some pixels into a list.
     *
     * @param rowIndexes
     *     The 0-based row indexes of the pixels.
     * @param columnIndexes
     *     The 0-based column indexes of the pixels.  This must have the same length as {@code rowIndexes}.
     *
     * @return A new array whose size is {@code N x 1 x bands}, where row {@code i} holds the spectrum of pixel
     *     {@code i}.
     *
     * @throws IllegalArgumentException
     *     if the index arrays differ in length or if any index is out of range.
     */
    public CubeArray gatherPixels(int[] rowIndexes, int[] columnIndexes) {
        ArgumentUtil.checkNotNull(rowIndexes, "rowIndexes");
        ArgumentUtil.checkNotNull(columnIndexes, "columnIndexes");
        if (rowIndexes.length != columnIndexes.length) {
            throw new IllegalArgumentException("rowIndexes and columnIndexes must have the same length");
        }
        int[] pixelRows = rowIndexes.clone();
        int[] pixelColumns = columnIndexes.clone();
        for (int i = 0; i < pixelRows.length; i++) {
            if (pixelRows[i] < 0 || rows <= pixelRows[i] || pixelColumns[i] < 0 || columns <= pixelColumns[i]) {
                throw new IllegalArgumentException(
                    "pixel (" + pixelRows[i] + ", " + pixelColumns[i] + ") is out of range for " + this);
            }
        }
        return remap(pixelRows.length, 1, bands,
            (row, column, band) -> index(pixelRows[row], pixelColumns[row], band));
    }

    /**
     * Places the spectra of a list at the given pixels of a new, zero-filled array.  This is the inverse of
     * {@link #gatherPixels}.
     *
     * @param newRows
     *     The number of rows in the new array.
     * @param newColumns
     *     The number of columns in the new array.
     * @param rowIndexes
     *     The 0-based row at which each spectrum is placed.
     * @param columnIndexes
     *     The 0-based column at which each spectrum is placed.
     *
     * @return A new array whose size is {@code newRows x newColumns x bands}.
     *
     * @throws IllegalStateException
     *     if this array is not a list of exactly {@code rowIndexes.length} spectra.
     * @throws IllegalArgumentException
     *     if any index is out of range.
     */
    public CubeArray scatterPixels(int newRows, int newColumns, int[] rowIndexes, int[] columnIndexes) {
        checkShape(newRows, newColumns, bands);
        ArgumentUtil.checkNotNull(rowIndexes, "rowIndexes");
        ArgumentUtil.checkNotNull(columnIndexes, "columnIndexes");
        if (rowIndexes.length != columnIndexes.length) {
            throw new IllegalArgumentException("rowIndexes and columnIndexes must have the same length");
        }
        if (columns != 1 || rows != rowIndexes.length) {
            throw new IllegalStateException(
                "a list of " + rowIndexes.length + " spectra must have a size of " + rowIndexes.length + "x1x" +
                    bands + ", not " + rows + "x" + columns + "x" + bands);
        }

        // -1 marks a pixel that gets no spectrum.
        int[] sourceRow = new int[MathUtil.elementCount(newRows, newColumns, 1)];
        Arrays.fill(sourceRow, -1);
        for (int i = 0; i < rowIndexes.length; i++) {
            int row = rowIndexes[i];
            int column = columnIndexes[i];
            if (row < 0 || newRows <= row || column < 0 || newColumns <= column) {
                throw new IllegalArgumentException("pixel (" + row + ", " + column + ") is out of range");
            }
            sourceRow[row * newColumns + column] = i;
        }

        int count = MathUtil.elementCount(newRows, newColumns, bands);
        double[] newDoubles = doubles == null ? null : new double[count];
        long[] newLongs = longs == null ? null : new long[count];
        int index = 0;
        for (int band = 0; band < bands; band++) {
            for (int row = 0; row < newRows; row++) {
                for (int column = 0; column < newColumns; column++) {
                    int source = sourceRow[row * newColumns + column];
                    if (source != -1) {
                        if (newLongs != null) {
                            newLongs[index] = longs[index(source, 0, band)];
                        } else {
                            newDoubles[index] = doubles[index(source, 0, band)];
                        }
                    }
                    index++;
                }
            }
        }
        return new CubeArray(elementType, newRows, newColumns, bands, newDoubles, newLongs);
    }

    /**
     * Rearranges the pixels into a new spatial shape, keeping the bands.  Pixels are taken and placed in column-major
     * order (the row index varies fastest), so reshaping to {@code area x 1} produces a list of spectra that can be
     * reshaped back.
     *
     * @param newRows
     *     The number of rows in the new array.
     * @param newColumns
     *     The number of columns in the new array.
     *
     * @return A new array.
     *
     * @throws IllegalArgumentException
     *     if {@code newRows * newColumns} differs from {@code rows * columns}.
     */
    public CubeArray reshapePixels(int newRows, int newColumns) {
        checkShape(newRows, newColumns, bands);
        if ((long) newRows * newColumns != (long) rows * columns) {
            throw new IllegalArgumentException(
                "cannot reshape " + rows + "x" + columns + " pixels into " + newRows + "x" + newColumns);
        }
        return remap(newRows, newColumns, bands, (row, column, band) -> {
            int pixel = column * newRows + row;
            return index(pixel % rows, pixel / rows, band);
        });
    }

    private ElementType reductionType() {
        return elementType == ElementType.FLOAT32 ? ElementType.FLOAT32 : ElementType.FLOAT64;
    }

    /**
     * Computes the mean spectrum of each row.
     *
     * @return A new array whose size is {@code rows x 1 x bands}.
     */
    public CubeArray rowMeans() {
        return fromFunction(reductionType(), rows, 1, bands, (row, ignored, band) -> {
            double sum = 0;
            for (int column = 0; column < columns; column++) {
                sum += doubleAt(index(row, column, band));
            }
            return sum / columns;
        });
    }

    /**
     * Computes the mean spectrum of each column.
     *
     * @return A new array whose size is {@code 1 x columns x bands}.
     */
    public CubeArray columnMeans() {
        return fromFunction(reductionType(), 1, columns, bands, (ignored, column, band) -> {
            double sum = 0;
            for (int row = 0; row < rows; row++) {
                sum += doubleAt(index(row, column, band));
            }
            return sum / rows;
        });
    }

    /**
     * Computes the mean spectrum of all pixels.
     *
     * @return A new array whose size is {@code 1 x 1 x bands}.
     */
    public CubeArray spatialMean() {
        return fromFunction(reductionType(), 1, 1, bands, (ignoredRow, ignoredColumn, band) -> {
            double sum = 0;
            for (int i = index(0, 0, band); i < index(0, 0, band) + rows * columns; i++) {
                sum += doubleAt(i);
            }
            return sum / ((double) rows * columns);
        });
    }

    /**
     * Computes the median spectrum of all pixels.
     *
     * @return A new array whose size is {@code 1 x 1 x bands}.
     */
    public CubeArray spatialMedian() {
        return fromFunction(reductionType(), 1, 1, bands, (ignoredRow, ignoredColumn, band) -> {
            double[] values = new double[rows * columns];
            for (int i = 0; i < values.length; i++) {
                values[i] = doubleAt(index(0, 0, band) + i);
            }
            return MathUtil.median(values);
        });
    }

    /**
     * Converts the values to another element type.
     *
     * @param newType
     *     The new element type.
     *
     * @return This array, if it already has {@code newType}; otherwise, a new array.
     */
    public CubeArray convert(ElementType newType) {
        ArgumentUtil.checkNotNull(newType, "newType");
        if (newType == elementType) {
            return this;
        }
        if (newType.isStoredAsLong()) {
            long[] newLongs = new long[elementCount()];
            for (int i = 0; i < newLongs.length; i++) {
                newLongs[i] = longs != null
                    ? MathUtil.saturateToLong(exactAt(i), newType)
                    : toLongBits(doubles[i], newType);
            }
            return new CubeArray(newType, rows, columns, bands, null, newLongs);
        }

        double[] newDoubles = new double[elementCount()];
        for (int i = 0; i < newDoubles.length; i++) {
            newDoubles[i] = toStoredDouble(doubleAt(i), newType);
        }
        return new CubeArray(newType, rows, columns, bands, newDoubles, null);
    }

    /**
     * Applies a function to every value.
     *
     * @param function
     *     The function to apply.
     * @param resultType
     *     The element type of the result.
     *
     * @return A new array with the same size.
     */
    public CubeArray map(DoubleUnaryOperator function, ElementType resultType) {
        ArgumentUtil.checkNotNull(function, "function");
        return fromFunction(resultType, rows, columns, bands,
            (row, column, band) -> function.applyAsDouble(doubleAt(index(row, column, band))));
    }

    /**
     * Combines this array element-wise with another array of the same size.
     * <p>
     * If both arrays have the same element type, the result has that type; otherwise it is {@code FLOAT64}.  Integer
     * results are rounded and saturated.
     * </p>
     */
    CubeArray combine(CubeArray other, ArithmeticOperator operator) {
        assert Arrays.equals(size(), other.size()) : "caller must check operand sizes";

        ElementType resultType = elementType == other.elementType ? elementType : ElementType.FLOAT64;
        int count = elementCount();
        if (resultType.isStoredAsLong()) {
            long[] result = new long[count];
            for (int i = 0; i < count; i++) {
                result[i] = MathUtil.saturateToLong(operator.applyExact(exactAt(i), other.exactAt(i)), resultType);
            }
            return new CubeArray(resultType, rows, columns, bands, null, result);
        }

        double[] result = new double[count];
        for (int i = 0; i < count; i++) {
            result[i] = toStoredDouble(operator.apply(doubleAt(i), other.doubleAt(i)), resultType);
        }
        return new CubeArray(resultType, rows, columns, bands, result, null);
    }

    /**
     * Gets a hash code for this array.
     *
     * @return This array's hash code.
     */
    @Override
    public int hashCode() {
        return Objects.hash(elementType, rows, columns, bands, Arrays.hashCode(doubles), Arrays.hashCode(longs));
    }

    /**
     * Determines if this array is equal to another object.
     * <p>
     * Two arrays are equal if and only if they have the same element type, the same size, and the same values.
     * </p>
     *
     * @param other
     *     The object with which to compare this array.
     *
     * @return {@code true}, if this array is equal to {@code other}.  {@code false}, otherwise.
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CubeArray otherArray)) {
            return false;
        }
        return elementType == otherArray.elementType &&
            rows == otherArray.rows &&
            columns == otherArray.columns &&
            bands == otherArray.bands &&
            Arrays.equals(doubles, otherArray.doubles) &&
            Arrays.equals(longs, otherArray.longs);
    }

    @Override
    public String toString() {
        return rows + "x" + columns + "x" + bands + " " + elementType + " array";
    }
}
