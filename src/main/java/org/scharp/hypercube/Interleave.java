///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

/**
 * The order in which the values of a cube are laid out in an ENVI data file.
 */
public enum Interleave {
    /** Band sequential: each band is a complete image. */
    BSQ("bsq") {
        @Override
        int bsqIndex(int position, int lines, int samples, int bands) {
            return position;
        }
    },

    /** Band interleaved by line: each line holds one row of every band in turn. */
    BIL("bil") {
        @Override
        int bsqIndex(int position, int lines, int samples, int bands) {
            int line = position / (bands * samples);
            int band = position / samples % bands;
            int sample = position % samples;
            return (band * lines + line) * samples + sample;
        }
    },

    /** Band interleaved by pixel: each pixel's spectrum is stored contiguously. */
    BIP("bip") {
        @Override
        int bsqIndex(int position, int lines, int samples, int bands) {
            int pixel = position / bands;
            int band = position % bands;
            return band * lines * samples + pixel;
        }
    };

    private final String headerValue;

    Interleave(String headerValue) {
        this.headerValue = headerValue;
    }

    /**
     * @return The value of the {@code interleave} key in an ENVI header, like "bsq".
     */
    public String headerValue() {
        return headerValue;
    }

    /**
     * Maps the position of a value in a data file to its position in band sequential order.
     *
     * @param position
     *     The 0-based index of the value in the data file, counted in values, not bytes.
     * @param lines
     *     The number of lines (rows).
     * @param samples
     *     The number of samples (columns).
     * @param bands
     *     The number of bands.
     *
     * @return The index of the same value in band sequential order.
     */
    abstract int bsqIndex(int position, int lines, int samples, int bands);

    /**
     * Finds the interleave for a value of the {@code interleave} header key.
     *
     * @param headerValue
     *     The header value.  Case and surrounding whitespace are ignored.
     *
     * @return The matching interleave, or {@code null} if there isn't one.
     */
    static Interleave fromHeaderValue(String headerValue) {
        String normalized = headerValue.trim();
        for (Interleave interleave : values()) {
            if (interleave.headerValue.equalsIgnoreCase(normalized)) {
                return interleave;
            }
        }
        return null;
    }
}
