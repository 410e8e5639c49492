///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

/**
 * The checks which every {@link Datacube} must pass when it is created.
 */
final class MetadataValidator {

    // private constructor to prevent anyone from instantiating the class.
    private MetadataValidator() {
    }

    /**
     * Throws an exception if the given cube fields are not consistent with each other.
     *
     * @param data
     *     The cube's data.
     * @param wavelength
     *     The wavelength of each band.
     * @param fwhm
     *     The FWHM of each band.
     * @param wavelengthUnit
     *     The unit of {@code wavelength} and {@code fwhm}.
     * @param quantity
     *     The physical quantity of the data.
     *
     * @throws NullPointerException
     *     if any argument is {@code null}.
     * @throws ShapeMismatchException
     *     if {@code wavelength} or {@code fwhm} doesn't have one value per band.
     * @throws IllegalArgumentException
     *     if {@code quantity} is empty.
     */
    static void validate(CubeArray data, double[] wavelength, double[] fwhm, String wavelengthUnit, String quantity) {
        ArgumentUtil.checkNotNull(data, "data");
        ArgumentUtil.checkNotNull(wavelength, "wavelength");
        ArgumentUtil.checkNotNull(fwhm, "fwhm");
        ArgumentUtil.checkNotNull(wavelengthUnit, "wavelengthUnit");
        ArgumentUtil.checkNotEmpty(quantity, "quantity");

        checkBandCount(wavelength, data.bands(), "wavelength");
        checkBandCount(fwhm, data.bands(), "fwhm");
    }

    /**
     * Throws an exception if {@code values} doesn't have exactly one value per band.
     *
     * @param values
     *     The per-band values.
     * @param bandCount
     *     The number of bands.
     * @param name
     *     The name of the values, for the exception message.
     *
     * @throws ShapeMismatchException
     *     if {@code values.length != bandCount}.
     */
    static void checkBandCount(double[] values, int bandCount, String name) {
        if (values.length != bandCount) {
            throw new ShapeMismatchException(
                name + " has " + values.length + " values but there are " + bandCount + " bands");
        }
    }
}
