///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Converts between {@link EnviHeader} objects and the text of an ENVI header file.
 * <p>
 * The text is a sequence of {@code key = value} lines which begins with the line "ENVI".  Keys are case-insensitive.
 * List values are written as {@code {v1, v2, ...}} and may span several lines.  Lines that start with ";" are
 * comments.
 * </p>
 */
public final class HeaderCodec {

    private static final Logger log = LoggerFactory.getLogger(HeaderCodec.class);

    static final String SIGNATURE = "ENVI";

    // The ENVI "pixel type" value which marks data type 1 as signed.
    static final String SIGNED_BYTE = "signedbyte";

    // private constructor to prevent anyone from instantiating the class.
    private HeaderCodec() {
    }

    /**
     * Gets the ENVI "data type" code of an element type.
     *
     * @param elementType
     *     The element type.
     *
     * @return The ENVI code.  {@link ElementType#INT8} has the same code as {@link ElementType#UINT8}; it is
     *     distinguished by a "pixel type" of "signedbyte".
     */
    static int dataTypeCode(ElementType elementType) {
        switch (elementType) {
        case INT8:
        case UINT8:
            return 1;
        case INT16:
            return 2;
        case INT32:
            return 3;
        case FLOAT32:
            return 4;
        case FLOAT64:
            return 5;
        case UINT16:
            return 12;
        case UINT32:
            return 13;
        case INT64:
            return 14;
        case UINT64:
            return 15;
        default:
            throw new AssertionError("unknown element type " + elementType);
        }
    }

    /**
     * Gets the element type of an ENVI "data type" code.
     *
     * @param code
     *     The ENVI code.
     * @param signedByte
     *     Whether the header marks byte data as signed.
     *
     * @return The element type, or {@code null} if {@code code} is not supported.
     */
    static ElementType elementType(int code, boolean signedByte) {
        switch (code) {
        case 1:
            return signedByte ? ElementType.INT8 : ElementType.UINT8;
        case 2:
            return ElementType.INT16;
        case 3:
            return ElementType.INT32;
        case 4:
            return ElementType.FLOAT32;
        case 5:
            return ElementType.FLOAT64;
        case 12:
            return ElementType.UINT16;
        case 13:
            return ElementType.UINT32;
        case 14:
            return ElementType.INT64;
        case 15:
            return ElementType.UINT64;
        default:
            return null; // complex numbers (6, 9) and anything else
        }
    }

    /**
     * Derives the header that describes how a cube is written.  The data is band sequential, in the host's byte
     * order, starting at the beginning of the data file.
     *
     * @param cube
     *     The cube.
     *
     * @return A new header.
     */
    public static EnviHeader encode(Datacube cube) {
        ArgumentUtil.checkNotNull(cube, "cube");
        return EnviHeader.builder().
            samples(cube.width()).
            lines(cube.height()).
            bands(cube.bandCount()).
            headerOffset(0).
            fileType(EnviHeader.ENVI_STANDARD).
            elementType(cube.elementType()).
            interleave(Interleave.BSQ).
            byteOrder(ByteOrder.nativeOrder()).
            wavelengthUnits(cube.wavelengthUnit()).
            wavelength(cube.wavelength()).
            fwhm(cube.fwhm()).
            build();
    }

    private static String formatList(double[] values) {
        StringBuilder text = new StringBuilder("{");
        for (int i = 0; i < values.length; i++) {
            if (i != 0) {
                text.append(", ");
            }
            text.append(String.format(Locale.ROOT, "%.6f", values[i]));
        }
        return text.append('}').toString();
    }

    /**
     * Formats a header as the text of an ENVI header file.
     *
     * @param header
     *     The header.
     *
     * @return The header text.  Lines are terminated by "\n".
     */
    public static String format(EnviHeader header) {
        ArgumentUtil.checkNotNull(header, "header");

        StringBuilder text = new StringBuilder();
        text.append(SIGNATURE).append('\n');
        if (!header.description().isEmpty()) {
            text.append("description = {").append(header.description()).append("}\n");
        }
        text.append("samples = ").append(header.samples()).append('\n');
        text.append("lines = ").append(header.lines()).append('\n');
        text.append("bands = ").append(header.bands()).append('\n');
        text.append("header offset = ").append(header.headerOffset()).append('\n');
        text.append("file type = ").append(header.fileType()).append('\n');
        text.append("data type = ").append(dataTypeCode(header.elementType())).append('\n');
        if (header.elementType() == ElementType.INT8) {
            text.append("pixel type = ").append(SIGNED_BYTE).append('\n');
        }
        text.append("interleave = ").append(header.interleave().headerValue()).append('\n');
        text.append("byte order = ").append(header.byteOrder() == ByteOrder.BIG_ENDIAN ? 1 : 0).append('\n');
        text.append("wavelength units = ").append(header.wavelengthUnits()).append('\n');
        text.append("wavelength = ").append(formatList(header.wavelength())).append('\n');
        text.append("fwhm = ").append(formatList(header.fwhm())).append('\n');
        return text.toString();
    }

    /**
     * Splits header text into its key/value pairs.  Keys are lower case with their whitespace normalized.
     */
    private static Map<String, String> parse(String text, List<String> problems) {
        Map<String, String> values = new LinkedHashMap<>();

        String[] lines = text.split("\\r?\\n|\\r");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty() || line.startsWith(";")) {
                continue;
            }
            if (line.equalsIgnoreCase(SIGNATURE)) {
                continue;
            }

            int equals = line.indexOf('=');
            if (equals < 0) {
                problems.add("line " + (i + 1) + " is not a \"key = value\" pair: " + line);
                continue;
            }

            String key = line.substring(0, equals).trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
            String value = line.substring(equals + 1).trim();
            if (value.startsWith("{")) {
                // brace values may continue on the following lines
                int firstLine = i;
                StringBuilder braced = new StringBuilder(value);
                while (braced.indexOf("}") < 0 && i + 1 < lines.length) {
                    i++;
                    braced.append(' ').append(lines[i].trim());
                }
                if (braced.indexOf("}") < 0) {
                    problems.add("value of \"" + key + "\" on line " + (firstLine + 1) + " is missing a '}'");
                    continue;
                }
                value = braced.toString();
            }

            if (values.put(key, value) != null) {
                log.debug("Header key \"{}\" appears more than once; using the last value.", key);
            }
        }
        return values;
    }

    private static Integer parseCount(Map<String, String> values, String key, List<String> problems) {
        String value = values.get(key);
        if (value == null) {
            problems.add("missing mandatory key \"" + key + "\"");
            return null;
        }
        try {
            int count = Integer.parseInt(value.trim());
            if (count < 0) {
                problems.add("invalid value for \"" + key + "\": " + value);
                return null;
            }
            return count;
        } catch (NumberFormatException e) {
            problems.add("invalid value for \"" + key + "\": " + value);
            return null;
        }
    }

    private static double[] parseList(String key, String value, Integer expectedLength, List<String> problems) {
        String trimmed = value.trim();
        if (!trimmed.startsWith("{") || !trimmed.endsWith("}")) {
            problems.add("value of \"" + key + "\" must be a list in braces: " + value);
            return null;
        }

        String contents = trimmed.substring(1, trimmed.length() - 1).trim();
        String[] items = contents.isEmpty() ? new String[0] : contents.split(",");
        double[] list = new double[items.length];
        for (int i = 0; i < items.length; i++) {
            try {
                list[i] = Double.parseDouble(items[i].trim());
            } catch (NumberFormatException e) {
                problems.add("invalid number in \"" + key + "\": " + items[i].trim());
                return null;
            }
        }

        if (expectedLength != null && list.length != expectedLength) {
            problems.add(
                "\"" + key + "\" has " + list.length + " values but there are " + expectedLength + " bands");
            return null;
        }
        return list;
    }

    private static String unbrace(String value) {
        String trimmed = value.trim();
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            return trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    /**
     * Decodes the text of an ENVI header file.
     * <p>
     * The "samples", "lines", "bands", and "data type" keys are mandatory.  If the wavelength, FWHM, or wavelength
     * units are absent, the same defaults as {@link Datacube#builder(CubeArray)} are used and a warning is logged for
     * each.  An absent byte order is taken to be little-endian.
     * </p>
     *
     * @param text
     *     The header text.
     *
     * @return The decoded header.
     *
     * @throws MalformedHeaderException
     *     if any mandatory key is missing or any value is invalid.  The exception lists every problem that was found.
     */
    public static EnviHeader decode(String text) throws MalformedHeaderException {
        ArgumentUtil.checkNotNull(text, "text");

        List<String> problems = new ArrayList<>();
        if (!text.stripLeading().regionMatches(true, 0, SIGNATURE, 0, SIGNATURE.length())) {
            log.warn("Header does not begin with \"{}\".", SIGNATURE);
        }
        Map<String, String> values = parse(text, problems);

        Integer samples = parseCount(values, "samples", problems);
        Integer lines = parseCount(values, "lines", problems);
        Integer bands = parseCount(values, "bands", problems);

        ElementType elementType = null;
        String dataType = values.get("data type");
        if (dataType == null) {
            problems.add("missing mandatory key \"data type\"");
        } else {
            boolean signedByte = SIGNED_BYTE.equalsIgnoreCase(values.getOrDefault("pixel type", "").trim());
            try {
                elementType = elementType(Integer.parseInt(dataType.trim()), signedByte);
                if (elementType == null) {
                    problems.add("unsupported data type: " + dataType);
                }
            } catch (NumberFormatException e) {
                problems.add("invalid value for \"data type\": " + dataType);
            }
        }

        long headerOffset = 0;
        String headerOffsetValue = values.get("header offset");
        if (headerOffsetValue != null) {
            try {
                headerOffset = Long.parseLong(headerOffsetValue.trim());
                if (headerOffset < 0) {
                    problems.add("invalid value for \"header offset\": " + headerOffsetValue);
                }
            } catch (NumberFormatException e) {
                problems.add("invalid value for \"header offset\": " + headerOffsetValue);
            }
        }

        Interleave interleave = Interleave.BSQ;
        String interleaveValue = values.get("interleave");
        if (interleaveValue == null) {
            log.warn("Interleave not given, assuming {}.", Interleave.BSQ.headerValue());
        } else {
            interleave = Interleave.fromHeaderValue(interleaveValue);
            if (interleave == null) {
                problems.add("invalid value for \"interleave\": " + interleaveValue);
            }
        }

        ByteOrder byteOrder = ByteOrder.LITTLE_ENDIAN;
        String byteOrderValue = values.get("byte order");
        if (byteOrderValue == null) {
            log.warn("Byte order not given, assuming little-endian.");
        } else if ("1".equals(byteOrderValue.trim())) {
            byteOrder = ByteOrder.BIG_ENDIAN;
        } else if (!"0".equals(byteOrderValue.trim())) {
            problems.add("invalid value for \"byte order\": " + byteOrderValue);
        }

        double[] wavelength = null;
        String wavelengthValue = values.get("wavelength");
        if (wavelengthValue != null) {
            wavelength = parseList("wavelength", wavelengthValue, bands, problems);
        }

        double[] fwhm = null;
        String fwhmValue = values.get("fwhm");
        if (fwhmValue != null) {
            fwhm = parseList("fwhm", fwhmValue, bands, problems);
        }

        String description = unbrace(values.getOrDefault("description", ""));
        if (description.contains("}")) {
            problems.add("invalid value for \"description\": " + values.get("description"));
        }

        if (!problems.isEmpty()) {
            throw new MalformedHeaderException(problems);
        }

        EnviHeader.Builder builder = EnviHeader.builder().
            samples(samples).
            lines(lines).
            bands(bands).
            headerOffset(headerOffset).
            fileType(values.getOrDefault("file type", EnviHeader.ENVI_STANDARD).trim()).
            elementType(elementType).
            interleave(interleave).
            byteOrder(byteOrder).
            description(description);

        if (wavelength == null) {
            log.warn("Wavelengths not given, using band numbering.");
        } else {
            builder.wavelength(wavelength);
        }

        String wavelengthUnits = values.get("wavelength units");
        if (wavelengthUnits != null) {
            builder.wavelengthUnits(wavelengthUnits.trim());
        } else if (wavelength == null) {
            log.warn("Wavelength unit not given, setting to \"{}\".", Datacube.BAND_INDEX_UNIT);
            builder.wavelengthUnits(Datacube.BAND_INDEX_UNIT);
        } else {
            log.warn("Wavelength unit not given, setting to \"{}\".", Datacube.UNKNOWN);
            builder.wavelengthUnits(Datacube.UNKNOWN);
        }

        if (fwhm == null) {
            log.warn("FWHM values not given, setting to zero.");
        } else {
            builder.fwhm(fwhm);
        }

        return builder.build();
    }
}
