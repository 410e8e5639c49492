///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Objects;

/**
 * The typed contents of an ENVI header file, which describes the layout of its data file.
 * <p>
 * Instances of this class are immutable.  They are created with a {@link EnviHeader.Builder}, by
 * {@link HeaderCodec#encode(Datacube)}, or by {@link HeaderCodec#decode(String)}.
 * </p>
 *
 * <p>
 * This class supports {@code equals()} and {@code hashCode()}.
 * </p>
 */
public final class EnviHeader {

    /** The only file type which this library reads and writes */
    public static final String ENVI_STANDARD = "ENVI Standard";

    private final int samples;
    private final int lines;
    private final int bands;
    private final long headerOffset;
    private final String fileType;
    private final ElementType elementType;
    private final Interleave interleave;
    private final ByteOrder byteOrder;
    private final String wavelengthUnits;
    private final double[] wavelength;
    private final double[] fwhm;
    private final String description;

    /**
     * A builder class for {@link EnviHeader}.
     */
    public final static class Builder {
        private int samples;
        private int lines;
        private int bands;
        private long headerOffset;
        private String fileType;
        private ElementType elementType;
        private Interleave interleave;
        private ByteOrder byteOrder;
        private String wavelengthUnits;
        private double[] wavelength;
        private double[] fwhm;
        private String description;

        private Builder() {
            this.samples = -1; // required parameter
            this.lines = -1; // required parameter
            this.bands = -1; // required parameter
            this.elementType = null; // required parameter

            this.headerOffset = 0;
            this.fileType = ENVI_STANDARD;
            this.interleave = Interleave.BSQ;
            this.byteOrder = ByteOrder.LITTLE_ENDIAN;
            this.wavelengthUnits = Datacube.UNKNOWN;
            this.wavelength = null; // defaults to band numbering
            this.fwhm = null; // defaults to zeros
            this.description = "";
        }

        /**
         * Sets the number of samples (columns) in each line.
         *
         * @param samples
         *     The number of samples.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code samples} is negative.
         */
        public Builder samples(int samples) {
            ArgumentUtil.checkNotNegative(samples, "samples");
            this.samples = samples;
            return this;
        }

        /**
         * Sets the number of lines (rows).
         *
         * @param lines
         *     The number of lines.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code lines} is negative.
         */
        public Builder lines(int lines) {
            ArgumentUtil.checkNotNegative(lines, "lines");
            this.lines = lines;
            return this;
        }

        /**
         * Sets the number of bands.
         *
         * @param bands
         *     The number of bands.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code bands} is negative.
         */
        public Builder bands(int bands) {
            ArgumentUtil.checkNotNegative(bands, "bands");
            this.bands = bands;
            return this;
        }

        /**
         * Sets the number of bytes before the first value in the data file.
         *
         * @param headerOffset
         *     The offset.
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code headerOffset} is negative.
         */
        public Builder headerOffset(long headerOffset) {
            if (headerOffset < 0) {
                throw new IllegalArgumentException("headerOffset must not be negative");
            }
            this.headerOffset = headerOffset;
            return this;
        }

        /**
         * Sets the file type, which is "ENVI Standard" by default.
         *
         * @param fileType
         *     The file type.
         *
         * @return This builder
         */
        public Builder fileType(String fileType) {
            ArgumentUtil.checkNotNull(fileType, "fileType");
            this.fileType = fileType;
            return this;
        }

        /**
         * Sets the type of the values in the data file.
         *
         * @param elementType
         *     The element type.
         *
         * @return This builder
         */
        public Builder elementType(ElementType elementType) {
            ArgumentUtil.checkNotNull(elementType, "elementType");
            this.elementType = elementType;
            return this;
        }

        /**
         * Sets the order of the values in the data file, which is {@link Interleave#BSQ} by default.
         *
         * @param interleave
         *     The interleave.
         *
         * @return This builder
         */
        public Builder interleave(Interleave interleave) {
            ArgumentUtil.checkNotNull(interleave, "interleave");
            this.interleave = interleave;
            return this;
        }

        /**
         * Sets the byte order of the values in the data file, which is little-endian by default.
         *
         * @param byteOrder
         *     The byte order.
         *
         * @return This builder
         */
        public Builder byteOrder(ByteOrder byteOrder) {
            ArgumentUtil.checkNotNull(byteOrder, "byteOrder");
            this.byteOrder = byteOrder;
            return this;
        }

        /**
         * Sets the unit of the wavelength and FWHM values.
         *
         * @param wavelengthUnits
         *     The unit.
         *
         * @return This builder
         */
        public Builder wavelengthUnits(String wavelengthUnits) {
            ArgumentUtil.checkNotNull(wavelengthUnits, "wavelengthUnits");
            this.wavelengthUnits = wavelengthUnits;
            return this;
        }

        /**
         * Sets the center wavelength of each band.  If this isn't set, the band numbers are used.
         *
         * @param wavelength
         *     The wavelengths.  This is copied.
         *
         * @return This builder
         */
        public Builder wavelength(double... wavelength) {
            ArgumentUtil.checkNotNull(wavelength, "wavelength");
            this.wavelength = wavelength.clone();
            return this;
        }

        /**
         * Sets the FWHM of each band.  If this isn't set, zeros are used.
         *
         * @param fwhm
         *     The FWHM values.  This is copied.
         *
         * @return This builder
         */
        public Builder fwhm(double... fwhm) {
            ArgumentUtil.checkNotNull(fwhm, "fwhm");
            this.fwhm = fwhm.clone();
            return this;
        }

        /**
         * Sets a free-form description.
         *
         * @param description
         *     The description.  This must not contain a "}".
         *
         * @return This builder
         *
         * @throws IllegalArgumentException
         *     if {@code description} contains a "}".
         */
        public Builder description(String description) {
            ArgumentUtil.checkNotNull(description, "description");
            if (description.contains("}")) {
                throw new IllegalArgumentException("description must not contain a '}'");
            }
            this.description = description;
            return this;
        }

        /**
         * Builds an immutable {@code EnviHeader}.
         *
         * @return a new {@code EnviHeader}
         *
         * @throws IllegalStateException
         *     if the samples, lines, bands, or element type haven't been set.
         * @throws ShapeMismatchException
         *     if the wavelength or FWHM doesn't have one value per band.
         */
        public EnviHeader build() {
            if (samples < 0) {
                throw new IllegalStateException("samples must be set");
            }
            if (lines < 0) {
                throw new IllegalStateException("lines must be set");
            }
            if (bands < 0) {
                throw new IllegalStateException("bands must be set");
            }
            if (elementType == null) {
                throw new IllegalStateException("elementType must be set");
            }

            double[] newWavelength = wavelength;
            if (newWavelength == null) {
                newWavelength = new double[bands];
                for (int i = 0; i < bands; i++) {
                    newWavelength[i] = i + 1;
                }
            }
            double[] newFwhm = fwhm != null ? fwhm : new double[bands];
            MetadataValidator.checkBandCount(newWavelength, bands, "wavelength");
            MetadataValidator.checkBandCount(newFwhm, bands, "fwhm");

            return new EnviHeader(samples, lines, bands, headerOffset, fileType, elementType, interleave, byteOrder,
                wavelengthUnits, newWavelength, newFwhm, description);
        }
    }

    /**
     * Creates a new builder.  The samples, lines, bands, and element type must be set before invoking
     * {@link Builder#build() build()}.
     *
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    private EnviHeader(int samples, int lines, int bands, long headerOffset, String fileType,
        ElementType elementType, Interleave interleave, ByteOrder byteOrder, String wavelengthUnits,
        double[] wavelength, double[] fwhm, String description) {
        this.samples = samples;
        this.lines = lines;
        this.bands = bands;
        this.headerOffset = headerOffset;
        this.fileType = fileType;
        this.elementType = elementType;
        this.interleave = interleave;
        this.byteOrder = byteOrder;
        this.wavelengthUnits = wavelengthUnits;
        this.wavelength = wavelength;
        this.fwhm = fwhm;
        this.description = description;
    }

    /**
     * @return The number of samples (columns) in each line.
     */
    public int samples() {
        return samples;
    }

    /**
     * @return The number of lines (rows).
     */
    public int lines() {
        return lines;
    }

    /**
     * @return The number of bands.
     */
    public int bands() {
        return bands;
    }

    /**
     * @return The number of bytes before the first value in the data file.
     */
    public long headerOffset() {
        return headerOffset;
    }

    /**
     * @return The file type.
     */
    public String fileType() {
        return fileType;
    }

    /**
     * @return The type of the values in the data file.
     */
    public ElementType elementType() {
        return elementType;
    }

    /**
     * @return The order of the values in the data file.
     */
    public Interleave interleave() {
        return interleave;
    }

    /**
     * @return The byte order of the values in the data file.
     */
    public ByteOrder byteOrder() {
        return byteOrder;
    }

    /**
     * @return The unit of the wavelength and FWHM values.
     */
    public String wavelengthUnits() {
        return wavelengthUnits;
    }

    /**
     * @return A copy of the center wavelength of each band.
     */
    public double[] wavelength() {
        return wavelength.clone();
    }

    /**
     * @return A copy of the FWHM of each band.
     */
    public double[] fwhm() {
        return fwhm.clone();
    }

    /**
     * @return The free-form description.  This is empty if there is none.
     */
    public String description() {
        return description;
    }

    /**
     * Computes the number of bytes of data that this header describes, not counting the header offset.
     *
     * @return {@code samples * lines * bands * elementType.bytesPerElement()}
     */
    public long dataByteCount() {
        return (long) samples * lines * bands * elementType.bytesPerElement();
    }

    @Override
    public int hashCode() {
        return Objects.hash(samples, lines, bands, headerOffset, fileType, elementType, interleave, byteOrder,
            wavelengthUnits, Arrays.hashCode(wavelength), Arrays.hashCode(fwhm), description);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof EnviHeader otherHeader)) {
            return false;
        }
        return samples == otherHeader.samples &&
            lines == otherHeader.lines &&
            bands == otherHeader.bands &&
            headerOffset == otherHeader.headerOffset &&
            fileType.equals(otherHeader.fileType) &&
            elementType == otherHeader.elementType &&
            interleave == otherHeader.interleave &&
            byteOrder.equals(otherHeader.byteOrder) &&
            wavelengthUnits.equals(otherHeader.wavelengthUnits) &&
            Arrays.equals(wavelength, otherHeader.wavelength) &&
            Arrays.equals(fwhm, otherHeader.fwhm) &&
            description.equals(otherHeader.description);
    }

    @Override
    public String toString() {
        return "EnviHeader[" + lines + "x" + samples + "x" + bands + " " + elementType + " " +
            interleave.headerValue() + " " + byteOrder + "]";
    }
}
