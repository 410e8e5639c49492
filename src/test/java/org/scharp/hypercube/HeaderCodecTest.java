///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/** Unit tests for {@link HeaderCodec}. */
public class HeaderCodecTest {

    private static final String COMPLETE_HEADER = "ENVI\n" +
        "samples = 2\n" +
        "lines = 3\n" +
        "bands = 5\n" +
        "header offset = 0\n" +
        "file type = ENVI Standard\n" +
        "data type = 5\n" +
        "interleave = bsq\n" +
        "byte order = 0\n" +
        "wavelength units = Band index\n" +
        "wavelength = {1.000000, 2.000000, 3.000000, 4.000000, 5.000000}\n" +
        "fwhm = {0.000000, 0.000000, 0.000000, 0.000000, 0.000000}\n";

    @Test
    void testDataTypeCodes() {
        assertEquals(1, HeaderCodec.dataTypeCode(ElementType.UINT8));
        assertEquals(1, HeaderCodec.dataTypeCode(ElementType.INT8));
        assertEquals(2, HeaderCodec.dataTypeCode(ElementType.INT16));
        assertEquals(3, HeaderCodec.dataTypeCode(ElementType.INT32));
        assertEquals(4, HeaderCodec.dataTypeCode(ElementType.FLOAT32));
        assertEquals(5, HeaderCodec.dataTypeCode(ElementType.FLOAT64));
        assertEquals(12, HeaderCodec.dataTypeCode(ElementType.UINT16));
        assertEquals(13, HeaderCodec.dataTypeCode(ElementType.UINT32));
        assertEquals(14, HeaderCodec.dataTypeCode(ElementType.INT64));
        assertEquals(15, HeaderCodec.dataTypeCode(ElementType.UINT64));

        // every type maps back to itself
        for (ElementType elementType : ElementType.values()) {
            boolean signedByte = elementType == ElementType.INT8;
            assertEquals(elementType, HeaderCodec.elementType(HeaderCodec.dataTypeCode(elementType), signedByte));
        }

        // complex types are not supported
        assertNull(HeaderCodec.elementType(6, false));
        assertNull(HeaderCodec.elementType(9, false));
        assertNull(HeaderCodec.elementType(0, false));
    }

    @Test
    void testEncode() {
        Datacube cube = Datacube.builder(CubeArray.ones(ElementType.UINT16, 3, 2, 2)).
            wavelength(450.5, 550.25).
            wavelengthUnit("nm").
            fwhm(10, 12).
            quantity("Counts").
            build();

        EnviHeader header = HeaderCodec.encode(cube);
        assertEquals(2, header.samples());
        assertEquals(3, header.lines());
        assertEquals(2, header.bands());
        assertEquals(0, header.headerOffset());
        assertEquals(EnviHeader.ENVI_STANDARD, header.fileType());
        assertEquals(ElementType.UINT16, header.elementType());
        assertEquals(Interleave.BSQ, header.interleave());
        assertEquals(ByteOrder.nativeOrder(), header.byteOrder());
        assertEquals("nm", header.wavelengthUnits());
        assertArrayEquals(new double[] { 450.5, 550.25 }, header.wavelength());
        assertArrayEquals(new double[] { 10, 12 }, header.fwhm());
        assertEquals("", header.description());
        assertEquals(24, header.dataByteCount());
    }

    @Test
    void testFormat() {
        EnviHeader header = EnviHeader.builder().
            samples(2).
            lines(3).
            bands(5).
            elementType(ElementType.FLOAT64).
            wavelengthUnits("Band index").
            build();
        assertEquals(COMPLETE_HEADER, HeaderCodec.format(header));

        EnviHeader signed = EnviHeader.builder().
            samples(1).
            lines(1).
            bands(2).
            headerOffset(128).
            elementType(ElementType.INT8).
            interleave(Interleave.BIP).
            byteOrder(ByteOrder.BIG_ENDIAN).
            wavelengthUnits("nm").
            wavelength(400.123456789, 1e4).
            fwhm(0.5, 1).
            description("calibrated scan").
            build();
        assertEquals("ENVI\n" +
                "description = {calibrated scan}\n" +
                "samples = 1\n" +
                "lines = 1\n" +
                "bands = 2\n" +
                "header offset = 128\n" +
                "file type = ENVI Standard\n" +
                "data type = 1\n" +
                "pixel type = signedbyte\n" +
                "interleave = bip\n" +
                "byte order = 1\n" +
                "wavelength units = nm\n" +
                "wavelength = {400.123457, 10000.000000}\n" +
                "fwhm = {0.500000, 1.000000}\n",
            HeaderCodec.format(signed));
    }

    @Test
    void testDecode() throws MalformedHeaderException {
        try (LogCapture logCapture = new LogCapture(HeaderCodec.class)) {
            EnviHeader header = HeaderCodec.decode(COMPLETE_HEADER);
            assertThat(logCapture.messages(Level.WARN), empty());

            assertEquals(2, header.samples());
            assertEquals(3, header.lines());
            assertEquals(5, header.bands());
            assertEquals(ElementType.FLOAT64, header.elementType());
            assertEquals(Interleave.BSQ, header.interleave());
            assertEquals(ByteOrder.LITTLE_ENDIAN, header.byteOrder());
            assertEquals("Band index", header.wavelengthUnits());
            assertArrayEquals(new double[] { 1, 2, 3, 4, 5 }, header.wavelength());
            assertArrayEquals(new double[5], header.fwhm());
        }
    }

    @Test
    void testDecodeIsLenient() throws MalformedHeaderException {
        String text = "ENVI\r\n" +
            "; a comment\r\n" +
            "Description = {A scan\r\n" +
            "  of a leaf}\r\n" +
            "SAMPLES=4\r\n" +
            "lines   =   1\r\n" +
            "bands = 3\r\n" +
            "data  type = 1\r\n" +
            "pixel type = SignedByte\r\n" +
            "Interleave = BIL\r\n" +
            "byte order = 1\r\n" +
            "header offset = 16\r\n" +
            "sensor type = Unknown\r\n" +
            "\r\n" +
            "wavelength units = Nanometers\r\n" +
            "wavelength = {\r\n" +
            "  400.5, 500,\r\n" +
            "  6.5e2 }\r\n" +
            "fwhm = {1,1,1}\r\n";

        EnviHeader header = HeaderCodec.decode(text);
        assertEquals(4, header.samples());
        assertEquals(ElementType.INT8, header.elementType());
        assertEquals(Interleave.BIL, header.interleave());
        assertEquals(ByteOrder.BIG_ENDIAN, header.byteOrder());
        assertEquals(16, header.headerOffset());
        assertEquals("Nanometers", header.wavelengthUnits());
        assertArrayEquals(new double[] { 400.5, 500, 650 }, header.wavelength());
        assertArrayEquals(new double[] { 1, 1, 1 }, header.fwhm());
        assertEquals("A scan of a leaf", header.description());
    }

    @Test
    void testDecodeDefaults() throws MalformedHeaderException {
        String text = "ENVI\nsamples = 1\nlines = 1\nbands = 2\ndata type = 4\n";

        try (LogCapture logCapture = new LogCapture(HeaderCodec.class)) {
            EnviHeader header = HeaderCodec.decode(text);

            assertEquals(
                List.of(
                    "Interleave not given, assuming bsq.",
                    "Byte order not given, assuming little-endian.",
                    "Wavelengths not given, using band numbering.",
                    "Wavelength unit not given, setting to \"Band index\".",
                    "FWHM values not given, setting to zero."),
                logCapture.messages(Level.WARN));

            assertEquals(Interleave.BSQ, header.interleave());
            assertEquals(ByteOrder.LITTLE_ENDIAN, header.byteOrder());
            assertEquals(0, header.headerOffset());
            assertArrayEquals(new double[] { 1, 2 }, header.wavelength());
            assertEquals("Band index", header.wavelengthUnits());
            assertArrayEquals(new double[] { 0, 0 }, header.fwhm());
        }

        // wavelengths without units
        try (LogCapture logCapture = new LogCapture(HeaderCodec.class)) {
            EnviHeader header = HeaderCodec.decode(text + "wavelength = {1.5, 2.5}\ninterleave = bsq\nbyte order = 0\n");

            assertEquals(
                List.of(
                    "Wavelength unit not given, setting to \"Unknown\".",
                    "FWHM values not given, setting to zero."),
                logCapture.messages(Level.WARN));
            assertEquals("Unknown", header.wavelengthUnits());
        }
    }

    @Test
    void testDecodeWithoutSignature() throws MalformedHeaderException {
        try (LogCapture logCapture = new LogCapture(HeaderCodec.class)) {
            EnviHeader header = HeaderCodec.decode(COMPLETE_HEADER.substring("ENVI\n".length()));
            assertEquals(List.of("Header does not begin with \"ENVI\"."), logCapture.messages(Level.WARN));
            assertEquals(5, header.bands());
        }
    }

    @Test
    void testDecodeDuplicateKeyUsesLastValue() throws MalformedHeaderException {
        try (LogCapture logCapture = new LogCapture(HeaderCodec.class)) {
            EnviHeader header = HeaderCodec.decode(COMPLETE_HEADER + "data type = 4\n");
            assertEquals(ElementType.FLOAT32, header.elementType());
            assertEquals(List.of("Header key \"data type\" appears more than once; using the last value."),
                logCapture.messages(Level.DEBUG));
        }
    }

    @Test
    void testDecodeCollectsAllProblems() {
        String text = "ENVI\n" +
            "samples = abc\n" +
            "lines = 2\n" +
            "this line has no equals sign\n" +
            "data type = 99\n" +
            "interleave = bxq\n" +
            "byte order = 2\n";

        MalformedHeaderException exception = assertThrows(
            MalformedHeaderException.class,
            () -> HeaderCodec.decode(text));
        assertEquals(
            List.of(
                "line 4 is not a \"key = value\" pair: this line has no equals sign",
                "invalid value for \"samples\": abc",
                "missing mandatory key \"bands\"",
                "unsupported data type: 99",
                "invalid value for \"interleave\": bxq",
                "invalid value for \"byte order\": 2"),
            exception.problems());
        assertEquals("Malformed ENVI header: line 4 is not a \"key = value\" pair: this line has no equals sign; " +
                "invalid value for \"samples\": abc; missing mandatory key \"bands\"; unsupported data type: 99; " +
                "invalid value for \"interleave\": bxq; invalid value for \"byte order\": 2",
            exception.getMessage());
    }

    @Test
    void testDecodeBadLists() {
        String prefix = "ENVI\nsamples = 1\nlines = 1\nbands = 3\ndata type = 2\ninterleave = bsq\nbyte order = 0\n";

        MalformedHeaderException exception = assertThrows(
            MalformedHeaderException.class,
            () -> HeaderCodec.decode(prefix + "wavelength = {1, 2}\n"));
        assertEquals(List.of("\"wavelength\" has 2 values but there are 3 bands"), exception.problems());

        exception = assertThrows(
            MalformedHeaderException.class,
            () -> HeaderCodec.decode(prefix + "fwhm = {1, two, 3}\n"));
        assertEquals(List.of("invalid number in \"fwhm\": two"), exception.problems());

        exception = assertThrows(
            MalformedHeaderException.class,
            () -> HeaderCodec.decode(prefix + "wavelength = 1, 2, 3\n"));
        assertEquals(List.of("value of \"wavelength\" must be a list in braces: 1, 2, 3"), exception.problems());

        exception = assertThrows(
            MalformedHeaderException.class,
            () -> HeaderCodec.decode(prefix + "wavelength = {1, 2,\n3\n"));
        assertEquals(List.of("value of \"wavelength\" on line 8 is missing a '}'"), exception.problems());
    }

    @Test
    void testDecodeBadNumbers() {
        MalformedHeaderException exception = assertThrows(
            MalformedHeaderException.class,
            () -> HeaderCodec.decode("ENVI\nsamples = -1\nlines = 1\nbands = 1\ndata type = x\nheader offset = -4\n"));
        assertEquals(
            List.of(
                "invalid value for \"samples\": -1",
                "invalid value for \"data type\": x",
                "invalid value for \"header offset\": -4"),
            exception.problems());

        exception = assertThrows(MalformedHeaderException.class, () -> HeaderCodec.decode(""));
        assertEquals(
            List.of(
                "missing mandatory key \"samples\"",
                "missing mandatory key \"lines\"",
                "missing mandatory key \"bands\"",
                "missing mandatory key \"data type\""),
            exception.problems());
    }

    @Test
    void testFormatThenDecode() throws MalformedHeaderException {
        for (ElementType elementType : ElementType.values()) {
            for (Interleave interleave : Interleave.values()) {
                EnviHeader header = EnviHeader.builder().
                    samples(7).
                    lines(3).
                    bands(2).
                    headerOffset(32).
                    elementType(elementType).
                    interleave(interleave).
                    byteOrder(ByteOrder.BIG_ENDIAN).
                    wavelengthUnits("nm").
                    wavelength(400.25, 700.5).
                    fwhm(3, 4).
                    description("test").
                    build();
                assertEquals(header, HeaderCodec.decode(HeaderCodec.format(header)), header.toString());
            }
        }
    }
}
