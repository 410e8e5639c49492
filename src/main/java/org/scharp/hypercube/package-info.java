///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
/**
 * <p>
 * This library holds hyperspectral image cubes together with their metadata, and reads and writes them in the ENVI
 * format.
 * </p>
 *
 * <p>
 * See the documentation for {@link org.scharp.hypercube.Datacube} for sample code on building a cube, and
 * {@link org.scharp.hypercube.EnviFormat} for sample code on writing one.
 * </p>
 *
 * <h2>Hyperspectral Cubes for Java Programmers</h2>
 *
 * <p>
 * A hyperspectral camera records, for each pixel, a spectrum of many narrow wavelength bands instead of three broad
 * color channels.  The result is a three-dimensional array, or "cube", indexed by row, column, and band.  Each band has
 * a center wavelength and a spectral resolution, given as the full width at half maximum (FWHM) of its response.
 * Without these, the values of a band can't be interpreted, which is why a {@code Datacube} never lets them get out of
 * step with its data.
 * </p>
 *
 * <p>
 * A cube's values measure some physical quantity, such as radiance (light leaving a surface) or reflectance (the
 * fraction of light that a surface reflects).  Dividing a radiance cube by an irradiance cube of the same scene gives a
 * reflectance cube, so the arithmetic methods record a quantity like "(Radiance / Irradiance)" unless told otherwise.
 * </p>
 *
 * <p>
 * Every {@code Datacube} also carries a {@link org.scharp.hypercube.ProvenanceLog} of how it was made.  Each method
 * that returns a new cube appends one entry, so the log of a processed cube can be used to audit or replay the
 * processing.
 * </p>
 *
 * <h2>The ENVI Format</h2>
 *
 * <p>
 * ENVI stores a cube as two files.  The header is a text file of {@code key = value} lines that describes the size, the
 * numeric type, the byte order, and the order of the values (band sequential, band interleaved by line, or band
 * interleaved by pixel).  The data file is the raw values with no framing at all, so a header that disagrees with its
 * data file can't be detected except by its length.  This library checks that length exactly.
 * </p>
 *
 * <p>
 * ENVI has no way to store a cube's quantity or history.  To keep those, save the cube with
 * {@link org.scharp.hypercube.CubeArchive} instead.
 * </p>
 */
package org.scharp.hypercube;
