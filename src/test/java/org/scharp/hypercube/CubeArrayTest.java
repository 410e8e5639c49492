///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Unit tests for {@link CubeArray}. */
public class CubeArrayTest {

    /** A 2x3 single-band array: [[1, 2, 3], [4, 5, 6]] */
    private static CubeArray twoByThree() {
        return CubeArray.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });
    }

    private static double[][] band(CubeArray array, int band) {
        double[][] values = new double[array.rows()][array.columns()];
        for (int row = 0; row < array.rows(); row++) {
            for (int column = 0; column < array.columns(); column++) {
                values[row][column] = array.getDouble(row, column, band);
            }
        }
        return values;
    }

    @Test
    void testFactories() {
        CubeArray ones = CubeArray.ones(ElementType.UINT16, 3, 2, 5);
        assertEquals(ElementType.UINT16, ones.elementType());
        assertArrayEquals(new int[] { 3, 2, 5 }, ones.size());
        assertEquals(30, ones.elementCount());
        assertEquals(1.0, ones.min());
        assertEquals(1.0, ones.max());
        assertFalse(ones.isEmpty());

        CubeArray zeros = CubeArray.zeros(ElementType.FLOAT32, 2, 2, 1);
        assertEquals(0.0, zeros.max());

        CubeArray filled = CubeArray.filled(ElementType.INT64, 1, 1, 2, 7);
        assertEquals(7L, filled.getLong(0, 0, 1));

        CubeArray function = CubeArray.fromFunction(ElementType.INT32, 2, 3, 4,
            (row, column, band) -> row * 100 + column * 10 + band);
        assertEquals(123.0, function.getDouble(1, 2, 3));
        assertEquals(0.0, function.min());
        assertEquals(123.0, function.max());

        // empty arrays are allowed
        CubeArray empty = CubeArray.zeros(ElementType.UINT8, 0, 4, 3);
        assertTrue(empty.isEmpty());
        assertEquals(Double.NaN, empty.min());
        assertEquals(Double.NaN, empty.max());
    }

    @Test
    void testFactoryErrors() {
        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> CubeArray.zeros(ElementType.UINT8, -1, 1, 1));
        assertEquals("rows must not be negative", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> CubeArray.zeros(ElementType.UINT8, 1, 1, -2));
        assertEquals("bands must not be negative", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> CubeArray.zeros(null, 1, 1, 1));
        assertEquals("elementType must not be null", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> CubeArray.zeros(ElementType.UINT8, 50000, 50000, 1));
        assertEquals("a 50000x50000x1 cube has too many elements to hold in memory", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> CubeArray.of(new double[][][] { { { 1, 2 } }, { { 1, 2 }, { 3, 4 } } }));
        assertEquals("values must not be ragged: every row must have 1 columns", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> CubeArray.of(new double[][][] { { { 1, 2 }, { 3 } } }));
        assertEquals("values must not be ragged: every column must have 2 bands", exception.getMessage());

        exception = assertThrows(NullPointerException.class, () -> CubeArray.of((double[][][]) null));
        assertEquals("values must not be null", exception.getMessage());
    }

    /** Tests how values are converted when they are stored as an integer type */
    @Test
    void testIntegerStorage() {
        CubeArray array = CubeArray.of(ElementType.UINT8,
            new double[][][] { { { 3.5, -3.5, 300, Double.NaN, 2.4, Double.POSITIVE_INFINITY } } });
        assertArrayEquals(new double[] { 4, 0, 255, 0, 2, 255 }, array.spectrum(0, 0));

        array = CubeArray.of(ElementType.INT16, new double[][][] { { { -2.5, 40000, -40000, -0.4 } } });
        assertArrayEquals(new double[] { -3, Short.MAX_VALUE, Short.MIN_VALUE, 0 }, array.spectrum(0, 0));

        array = CubeArray.of(ElementType.INT64, new double[][][] { { { 1e30, -1e30, -7.5 } } });
        assertEquals(Long.MAX_VALUE, array.getLong(0, 0, 0));
        assertEquals(Long.MIN_VALUE, array.getLong(0, 0, 1));
        assertEquals(-8L, array.getLong(0, 0, 2));

        array = CubeArray.of(ElementType.UINT64, new double[][][] { { { -1, 0x1.0p63, 1e30, 12.5 } } });
        assertEquals(0L, array.getLong(0, 0, 0));
        assertEquals(Long.MIN_VALUE, array.getLong(0, 0, 1)); // 2^63 as raw bits
        assertEquals(-1L, array.getLong(0, 0, 2));
        assertEquals(13L, array.getLong(0, 0, 3));
        assertEquals(0x1.0p63, array.getDouble(0, 0, 1));

        // FLOAT32 loses precision
        array = CubeArray.of(ElementType.FLOAT32, new double[][][] { { { 0.1 } } });
        assertEquals((double) 0.1f, array.getDouble(0, 0, 0));
    }

    @Test
    void testAccessors() {
        CubeArray array = CubeArray.fromFunction(ElementType.FLOAT64, 2, 3, 4,
            (row, column, band) -> row * 100 + column * 10 + band);

        assertArrayEquals(new double[] { 120, 121, 122, 123 }, array.spectrum(1, 2));
        assertEquals(12L, array.getLong(0, 1, 2));

        double[][][] copy = array.toArray();
        assertEquals(2, copy.length);
        assertEquals(3, copy[0].length);
        assertEquals(4, copy[0][0].length);
        assertEquals(103.0, copy[1][0][3]);

        Exception exception = assertThrows(IndexOutOfBoundsException.class, () -> array.getDouble(2, 0, 0));
        assertEquals("position (2, 0, 0) is out of bounds for a 2x3x4 FLOAT64 array", exception.getMessage());

        exception = assertThrows(IndexOutOfBoundsException.class, () -> array.getLong(0, -1, 0));
        assertEquals("position (0, -1, 0) is out of bounds for a 2x3x4 FLOAT64 array", exception.getMessage());

        assertThrows(IndexOutOfBoundsException.class, () -> array.spectrum(0, 3));
    }

    @Test
    void testMinMaxIgnoreNaN() {
        CubeArray array = CubeArray.of(new double[][] { { Double.NaN, 2 }, { -1, Double.NaN } });
        assertEquals(-1.0, array.min());
        assertEquals(2.0, array.max());

        CubeArray allNaN = CubeArray.of(new double[][] { { Double.NaN } });
        assertEquals(Double.NaN, allNaN.min());
    }

    @Test
    void testFlip() {
        CubeArray array = twoByThree();

        assertArrayEquals(new double[][] { { 4, 5, 6 }, { 1, 2, 3 } }, band(array.flipRows(), 0));
        assertArrayEquals(new double[][] { { 3, 2, 1 }, { 6, 5, 4 } }, band(array.flipColumns(), 0));

        // flipping twice restores the original
        assertEquals(array, array.flipRows().flipRows());
        assertEquals(array, array.flipColumns().flipColumns());
    }

    @Test
    void testRotate90() {
        CubeArray array = twoByThree();

        CubeArray once = array.rotate90(1);
        assertArrayEquals(new int[] { 3, 2, 1 }, once.size());
        assertArrayEquals(new double[][] { { 3, 6 }, { 2, 5 }, { 1, 4 } }, band(once, 0));

        assertArrayEquals(new double[][] { { 6, 5, 4 }, { 3, 2, 1 } }, band(array.rotate90(2), 0));
        assertArrayEquals(new double[][] { { 4, 1 }, { 5, 2 }, { 6, 3 } }, band(array.rotate90(3), 0));

        // Negative turns rotate clockwise.
        assertEquals(array.rotate90(3), array.rotate90(-1));
        assertSame(array, array.rotate90(4));
        assertEquals(array, array.rotate90(1).rotate90(1).rotate90(1).rotate90(1));
    }

    @Test
    void testTile() {
        CubeArray array = CubeArray.of(new double[][][] { { { 1, 2 } }, { { 3, 4 } } }); // 2x1x2
        CubeArray tiled = array.tile(2, 3, 2);

        assertArrayEquals(new int[] { 4, 3, 4 }, tiled.size());
        assertArrayEquals(new double[] { 1, 2, 1, 2 }, tiled.spectrum(0, 2));
        assertArrayEquals(new double[] { 3, 4, 3, 4 }, tiled.spectrum(3, 1));
        assertArrayEquals(new double[] { 1, 2, 1, 2 }, tiled.spectrum(2, 0));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> array.tile(0, 1, 1));
        assertEquals("rowFactor must be positive", exception.getMessage());

        exception = assertThrows(IllegalArgumentException.class, () -> array.tile(1, 1, -1));
        assertEquals("bandFactor must be positive", exception.getMessage());
    }

    @Test
    void testSubArray() {
        CubeArray array = CubeArray.fromFunction(ElementType.INT32, 4, 5, 2,
            (row, column, band) -> row * 100 + column * 10 + band);

        CubeArray region = array.subArray(1, 2, 2, 3);
        assertArrayEquals(new int[] { 2, 3, 2 }, region.size());
        assertArrayEquals(new double[] { 120, 121 }, region.spectrum(0, 0));
        assertArrayEquals(new double[] { 240, 241 }, region.spectrum(1, 2));
        assertEquals(ElementType.INT32, region.elementType());

        assertEquals(array, array.subArray(0, 0, 4, 5));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> array.subArray(3, 0, 2, 1));
        assertEquals("region is outside of the 4x5x2 INT32 array", exception.getMessage());
    }

    @Test
    void testSelectBands() {
        CubeArray array = CubeArray.of(new double[][][] { { { 10, 20, 30 } } });

        assertArrayEquals(new double[] { 30, 10 }, array.selectBands(2, 0).spectrum(0, 0));
        assertArrayEquals(new double[] { 20, 20 }, array.selectBands(1, 1).spectrum(0, 0));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> array.selectBands(3));
        assertEquals("band index 3 is out of range for 1x1x3 FLOAT64 array", exception.getMessage());
    }

    @Test
    void testGatherAndScatterPixels() {
        CubeArray array = CubeArray.fromFunction(ElementType.UINT8, 2, 3, 2,
            (row, column, band) -> row * 100 + column * 10 + band);

        CubeArray list = array.gatherPixels(new int[] { 1, 0 }, new int[] { 2, 1 });
        assertArrayEquals(new int[] { 2, 1, 2 }, list.size());
        assertArrayEquals(new double[] { 120, 121 }, list.spectrum(0, 0));
        assertArrayEquals(new double[] { 10, 11 }, list.spectrum(1, 0));

        CubeArray image = list.scatterPixels(2, 3, new int[] { 1, 0 }, new int[] { 2, 1 });
        assertArrayEquals(new int[] { 2, 3, 2 }, image.size());
        assertArrayEquals(new double[] { 120, 121 }, image.spectrum(1, 2));
        assertArrayEquals(new double[] { 10, 11 }, image.spectrum(0, 1));
        assertArrayEquals(new double[] { 0, 0 }, image.spectrum(0, 0)); // unselected pixels are zero

        Exception exception = assertThrows(
            IllegalArgumentException.class,
            () -> array.gatherPixels(new int[] { 2 }, new int[] { 0 }));
        assertEquals("pixel (2, 0) is out of range for 2x3x2 UINT8 array", exception.getMessage());

        exception = assertThrows(
            IllegalArgumentException.class,
            () -> array.gatherPixels(new int[] { 0 }, new int[0]));
        assertEquals("rowIndexes and columnIndexes must have the same length", exception.getMessage());

        exception = assertThrows(
            IllegalStateException.class,
            () -> array.scatterPixels(2, 3, new int[] { 0 }, new int[] { 0 }));
        assertEquals("a list of 1 spectra must have a size of 1x1x2, not 2x3x2", exception.getMessage());
    }

    @Test
    void testReshapePixels() {
        CubeArray array = CubeArray.of(new double[][] { { 1, 2 }, { 3, 4 } });

        // pixels are taken in column-major order
        CubeArray list = array.reshapePixels(4, 1);
        assertArrayEquals(new double[][] { { 1 }, { 3 }, { 2 }, { 4 } }, band(list, 0));
        assertEquals(array, list.reshapePixels(2, 2));

        assertArrayEquals(new double[][] { { 1, 3, 2, 4 } }, band(array.reshapePixels(1, 4), 0));

        Exception exception = assertThrows(IllegalArgumentException.class, () -> array.reshapePixels(3, 1));
        assertEquals("cannot reshape 2x2 pixels into 3x1", exception.getMessage());
    }

    @Test
    void testMeans() {
        CubeArray array = CubeArray.of(ElementType.UINT8, new double[][][] {
            { { 1, 10 }, { 3, 20 } },
            { { 5, 30 }, { 7, 40 } } });

        CubeArray rowMeans = array.rowMeans();
        assertArrayEquals(new int[] { 2, 1, 2 }, rowMeans.size());
        assertEquals(ElementType.FLOAT64, rowMeans.elementType());
        assertArrayEquals(new double[] { 2, 15 }, rowMeans.spectrum(0, 0));
        assertArrayEquals(new double[] { 6, 35 }, rowMeans.spectrum(1, 0));

        CubeArray columnMeans = array.columnMeans();
        assertArrayEquals(new int[] { 1, 2, 2 }, columnMeans.size());
        assertArrayEquals(new double[] { 3, 20 }, columnMeans.spectrum(0, 0));
        assertArrayEquals(new double[] { 5, 30 }, columnMeans.spectrum(0, 1));

        CubeArray mean = array.spatialMean();
        assertArrayEquals(new int[] { 1, 1, 2 }, mean.size());
        assertArrayEquals(new double[] { 4, 25 }, mean.spectrum(0, 0));

        // FLOAT32 stays FLOAT32
        assertEquals(ElementType.FLOAT32, array.convert(ElementType.FLOAT32).spatialMean().elementType());
    }

    @Test
    void testSpatialMedian() {
        CubeArray array = CubeArray.of(new double[][][] {
            { { 1, 9 }, { 2, 8 }, { 100, 7 } } });

        assertArrayEquals(new double[] { 2, 8 }, array.spatialMedian().spectrum(0, 0));

        CubeArray even = CubeArray.of(new double[][] { { 1, 2 }, { 3, 10 } });
        assertArrayEquals(new double[] { 2.5 }, even.spatialMedian().spectrum(0, 0));
    }

    @Test
    void testConvert() {
        CubeArray array = CubeArray.of(new double[][] { { -1.5, 2.5, 1000 } });

        assertSame(array, array.convert(ElementType.FLOAT64));

        CubeArray bytes = array.convert(ElementType.UINT8);
        assertEquals(ElementType.UINT8, bytes.elementType());
        assertArrayEquals(new double[][] { { 0, 3, 255 } }, band(bytes, 0));

        CubeArray longs = array.convert(ElementType.INT64);
        assertEquals(-2L, longs.getLong(0, 0, 0));

        // from a 64-bit type to another one, the conversion is exact
        CubeArray big = CubeArray.filled(ElementType.INT64, 1, 1, 1, Long.MAX_VALUE).convert(ElementType.UINT64);
        assertEquals(Long.MAX_VALUE, big.getLong(0, 0, 0));
        CubeArray negative = CubeArray.filled(ElementType.INT64, 1, 1, 1, -5).convert(ElementType.UINT64);
        assertEquals(0L, negative.getLong(0, 0, 0));
    }

    @Test
    void testMap() {
        CubeArray array = CubeArray.of(ElementType.INT16, new double[][][] { { { 1, 2, 3 } } });

        CubeArray squared = array.map(value -> value * value, ElementType.FLOAT64);
        assertEquals(ElementType.FLOAT64, squared.elementType());
        assertArrayEquals(new double[] { 1, 4, 9 }, squared.spectrum(0, 0));

        CubeArray halved = array.map(value -> value / 2, ElementType.INT16);
        assertArrayEquals(new double[] { 1, 1, 2 }, halved.spectrum(0, 0));
    }

    @Test
    void testCombine() {
        CubeArray left = CubeArray.of(ElementType.UINT8, new double[][][] { { { 200, 10, 0, 7 } } });
        CubeArray right = CubeArray.of(ElementType.UINT8, new double[][][] { { { 100, 20, 0, 2 } } });

        assertArrayEquals(new double[] { 255, 30, 0, 9 }, left.combine(right, ArithmeticOperator.ADD).spectrum(0, 0));
        assertArrayEquals(new double[] { 100, 0, 0, 5 },
            left.combine(right, ArithmeticOperator.SUBTRACT).spectrum(0, 0));

        // 7 / 2 = 3.5 rounds to 4; 0 / 0 is 0
        assertArrayEquals(new double[] { 2, 1, 0, 4 },
            left.combine(right, ArithmeticOperator.DIVIDE).spectrum(0, 0));

        // mixed types produce FLOAT64
        CubeArray doubles = CubeArray.of(new double[][][] { { { 0.5, 0.5, 0.5, 0.5 } } });
        CubeArray mixed = left.combine(doubles, ArithmeticOperator.MULTIPLY);
        assertEquals(ElementType.FLOAT64, mixed.elementType());
        assertArrayEquals(new double[] { 100, 5, 0, 3.5 }, mixed.spectrum(0, 0));
    }

    @Test
    void testCombineIntegerDivisionByZero() {
        CubeArray left = CubeArray.of(ElementType.INT16, new double[][][] { { { 5, -5, 0 } } });
        CubeArray zeros = CubeArray.zeros(ElementType.INT16, 1, 1, 3);

        assertArrayEquals(new double[] { Short.MAX_VALUE, Short.MIN_VALUE, 0 },
            left.combine(zeros, ArithmeticOperator.DIVIDE).spectrum(0, 0));

        CubeArray longs = CubeArray.of(ElementType.INT64, new double[][][] { { { 5, -5, 0 } } });
        CubeArray longZeros = CubeArray.zeros(ElementType.INT64, 1, 1, 3);
        CubeArray quotient = longs.combine(longZeros, ArithmeticOperator.DIVIDE);
        assertEquals(Long.MAX_VALUE, quotient.getLong(0, 0, 0));
        assertEquals(Long.MIN_VALUE, quotient.getLong(0, 0, 1));
        assertEquals(0L, quotient.getLong(0, 0, 2));

        // Floating point division follows IEEE 754.
        CubeArray doubles = CubeArray.of(new double[][][] { { { 1, -1 } } });
        CubeArray doubleZeros = CubeArray.zeros(ElementType.FLOAT64, 1, 1, 2);
        assertArrayEquals(new double[] { Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY },
            doubles.combine(doubleZeros, ArithmeticOperator.DIVIDE).spectrum(0, 0));
    }

    @Test
    void testCombineExactLongs() {
        // 2^53 + 1 can't be represented as a double
        CubeArray left = CubeArray.filled(ElementType.INT64, 1, 1, 1, 0x1.0p53);
        CubeArray right = CubeArray.ones(ElementType.INT64, 1, 1, 1);
        assertEquals(9007199254740993L, left.combine(right, ArithmeticOperator.ADD).getLong(0, 0, 0));

        CubeArray max = CubeArray.filled(ElementType.INT64, 1, 1, 1, Long.MAX_VALUE);
        assertEquals(Long.MAX_VALUE, max.combine(max, ArithmeticOperator.MULTIPLY).getLong(0, 0, 0));

        CubeArray seven = CubeArray.filled(ElementType.UINT64, 1, 1, 1, 7);
        CubeArray two = CubeArray.filled(ElementType.UINT64, 1, 1, 1, 2);
        assertEquals(4L, seven.combine(two, ArithmeticOperator.DIVIDE).getLong(0, 0, 0));
        assertEquals(0L, two.combine(seven, ArithmeticOperator.SUBTRACT).getLong(0, 0, 0));
    }

    @Test
    void testEquals() {
        CubeArray array = twoByThree();
        CubeArray same = CubeArray.of(new double[][] { { 1, 2, 3 }, { 4, 5, 6 } });

        assertEquals(array, same);
        assertEquals(array.hashCode(), same.hashCode());
        assertEquals(array, array);

        // different type
        assertNotEquals(array, array.convert(ElementType.INT32));

        // different shape, same values
        assertNotEquals(array, array.reshapePixels(3, 2));

        // different value
        assertThat(array, not(CubeArray.of(new double[][] { { 1, 2, 3 }, { 4, 5, 7 } })));

        assertFalse(array.equals(null));
        assertFalse(array.equals("2x3x1 FLOAT64 array"));
    }

    @Test
    void testToString() {
        assertEquals("3x2x5 FLOAT64 array", CubeArray.ones(ElementType.FLOAT64, 3, 2, 5).toString());
        assertEquals("0x0x0 UINT8 array", CubeArray.zeros(ElementType.UINT8, 0, 0, 0).toString());
    }
}
