///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * A hyperspectral image cube together with the metadata that gives it meaning.
 * <p>
 * The data is a {@link CubeArray} indexed by row, column, and band.  Each band has a wavelength and a FWHM (full width
 * at half maximum), given in the cube's wavelength unit.  The cube also knows the physical quantity of its values, the
 * files it was read from, and a {@link ProvenanceLog} of how it was made.
 * </p>
 *
 * <p>
 * Instances of this class are immutable.  They are created with a {@link Datacube.Builder}:
 * </p>
 *
 * <pre>
 * Datacube reflectance = Datacube.builder(CubeArray.ones(ElementType.FLOAT64, 3, 2, 5)).
 *     wavelength(10, 20, 30, 40, 50).
 *     wavelengthUnit("nm").
 *     fwhm(0, 0, 0, 0, 0).
 *     quantity("Reflectance").
 *     build();
 * </pre>
 *
 * <p>
 * Every transformation returns a new cube whose history is exactly one entry longer than this cube's history.
 * </p>
 *
 * <p>
 * Methods which take image coordinates use 1-based {@code [x, y]} pairs, where {@code x} is the column and {@code y} is
 * the row.  Band numbers are also 1-based.
 * </p>
 */
public final class Datacube {

    /**
     * The structural version of this class.  It is recorded in every new cube and in every archive written by
     * {@link CubeArchive}.
     */
    public static final String SCHEMA_VERSION = "1.0.0";

    static final String UNKNOWN = "Unknown";
    static final String BAND_INDEX_UNIT = "Band index";

    private static final Logger log = LoggerFactory.getLogger(Datacube.class);

    private final CubeArray data;
    private final double[] wavelength;
    private final double[] fwhm;
    private final String wavelengthUnit;
    private final String quantity;
    private final List<Path> files;
    private final ProvenanceLog history;
    private final String schemaVersion;

    /**
     * A builder class for {@link Datacube}.
     * <p>
     * A builder either constructs a new cube from array data or updates a copy of an existing cube.  When updating,
     * only the fields that are explicitly set are replaced.
     * </p>
     */
    public final static class Builder {
        private final Datacube source;

        private CubeArray data;
        private double[] wavelength;
        private double[] fwhm;
        private String wavelengthUnit;
        private String quantity;
        private final List<Path> files;
        private ProvenanceLog history;

        private Builder(Datacube source, CubeArray data) {
            this.source = source;
            this.data = data;

            // null means "not given"
            this.wavelength = null;
            this.fwhm = null;
            this.wavelengthUnit = null;
            this.quantity = null;
            this.history = null;

            this.files = new ArrayList<>();
        }

        /**
         * Replaces the data.  This is only useful when updating an existing cube.  If the number of bands changes,
         * then the wavelength and FWHM must also be set.
         *
         * @param data
         *     The new data.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code data} is {@code null}.
         */
        public Builder data(CubeArray data) {
            ArgumentUtil.checkNotNull(data, "data");
            this.data = data;
            return this;
        }

        /**
         * Sets the center wavelength of each band.
         *
         * @param wavelength
         *     The wavelengths.  There must be one per band.  This is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code wavelength} is {@code null}.
         */
        public Builder wavelength(double... wavelength) {
            ArgumentUtil.checkNotNull(wavelength, "wavelength");
            this.wavelength = wavelength.clone();
            return this;
        }

        /**
         * Sets the full width at half maximum of each band.
         *
         * @param fwhm
         *     The FWHM values.  There must be one per band.  This is copied.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code fwhm} is {@code null}.
         */
        public Builder fwhm(double... fwhm) {
            ArgumentUtil.checkNotNull(fwhm, "fwhm");
            this.fwhm = fwhm.clone();
            return this;
        }

        /**
         * Sets the unit of the wavelength and FWHM values, like "nm".
         *
         * @param wavelengthUnit
         *     The unit.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code wavelengthUnit} is {@code null}.
         */
        public Builder wavelengthUnit(String wavelengthUnit) {
            ArgumentUtil.checkNotNull(wavelengthUnit, "wavelengthUnit");
            this.wavelengthUnit = wavelengthUnit;
            return this;
        }

        /**
         * Sets the physical quantity of the data, like "Reflectance" or "Radiance".
         *
         * @param quantity
         *     The quantity.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code quantity} is {@code null}.
         * @throws IllegalArgumentException
         *     if {@code quantity} is empty.
         */
        public Builder quantity(String quantity) {
            ArgumentUtil.checkNotEmpty(quantity, "quantity");
            this.quantity = quantity;
            return this;
        }

        /**
         * Adds a file from which the data originates.  Files are appended to the existing list.
         *
         * @param file
         *     The file.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code file} is {@code null}.
         */
        public Builder file(Path file) {
            ArgumentUtil.checkNotNull(file, "file");
            files.add(file);
            return this;
        }

        /**
         * Adds several files from which the data originates.
         *
         * @param files
         *     The files.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code files} is {@code null} or contains a {@code null}.
         */
        public Builder files(List<Path> files) {
            ArgumentUtil.checkNotNull(files, "files");
            for (Path file : files) {
                file(file);
            }
            return this;
        }

        /**
         * Sets the provenance of the data.  The new cube's history is this log followed by a
         * {@link Operation#CONSTRUCT} entry.  This can only be set when constructing a new cube.
         *
         * @param history
         *     The log.
         *
         * @return This builder
         *
         * @throws NullPointerException
         *     if {@code history} is {@code null}.
         * @throws IllegalStateException
         *     if this builder updates an existing cube.
         */
        public Builder history(ProvenanceLog history) {
            ArgumentUtil.checkNotNull(history, "history");
            if (source != null) {
                throw new IllegalStateException("the history of an existing cube cannot be replaced");
            }
            this.history = history;
            return this;
        }

        /**
         * Builds an immutable {@code Datacube}.
         * <p>
         * When constructing a new cube, each metadata field which was not set gets a default value and a warning is
         * logged.
         * </p>
         *
         * @return a new {@code Datacube}
         *
         * @throws ShapeMismatchException
         *     if the wavelength or FWHM doesn't have one value per band.
         */
        public Datacube build() {
            return source == null ? construct() : update();
        }

        private Datacube construct() {
            final double[] newWavelength;
            if (wavelength == null) {
                log.warn("Wavelengths not given, using band numbering.");
                newWavelength = new double[data.bands()];
                for (int i = 0; i < newWavelength.length; i++) {
                    newWavelength[i] = i + 1;
                }
            } else {
                newWavelength = wavelength;
            }

            final String newUnit;
            if (wavelengthUnit != null) {
                newUnit = wavelengthUnit;
            } else if (wavelength == null) {
                log.warn("Wavelength unit not given, setting to \"{}\".", BAND_INDEX_UNIT);
                newUnit = BAND_INDEX_UNIT;
            } else {
                log.warn("Wavelength unit not given, setting to \"{}\".", UNKNOWN);
                newUnit = UNKNOWN;
            }

            final double[] newFwhm;
            if (fwhm == null) {
                log.warn("FWHM values not given, setting to zero.");
                newFwhm = new double[data.bands()];
            } else {
                newFwhm = fwhm;
            }

            final String newQuantity;
            if (quantity == null) {
                log.warn("Quantity not given, setting to {}.", UNKNOWN);
                newQuantity = UNKNOWN;
            } else {
                newQuantity = quantity;
            }

            Map<String, Object> parameters = new LinkedHashMap<>();
            parameters.put("size", List.of(data.rows(), data.columns(), data.bands()));
            parameters.put("elementType", data.elementType().name());
            parameters.put("wavelengthUnit", newUnit);
            parameters.put("quantity", newQuantity);

            ProvenanceLog newHistory = (history == null ? ProvenanceLog.created() : history).append(
                "Cube constructed from array data",
                Operation.CONSTRUCT,
                Collections.unmodifiableMap(parameters));

            return new Datacube(data, newWavelength, newFwhm, newUnit, newQuantity, List.copyOf(files), newHistory,
                SCHEMA_VERSION);
        }

        private Datacube update() {
            List<String> updatedFields = new ArrayList<>();
            if (data != source.data) {
                if (!source.data.isEmpty() && data.elementType() != source.data.elementType()) {
                    log.warn("Data type changes from {} to {}", source.data.elementType(), data.elementType());
                }
                updatedFields.add("data");
            }

            String newUnit = source.wavelengthUnit;
            if (wavelength != null) {
                newUnit = UNKNOWN;
                updatedFields.add("wavelength");
            }
            if (wavelengthUnit != null) {
                newUnit = wavelengthUnit;
                updatedFields.add("wavelengthUnit");
            }
            if (fwhm != null) {
                updatedFields.add("fwhm");
            }
            if (quantity != null) {
                updatedFields.add("quantity");
            }
            if (!files.isEmpty()) {
                updatedFields.add("files");
            }

            List<Path> newFiles = new ArrayList<>(source.files);
            newFiles.addAll(files);

            return new Datacube(
                data,
                wavelength != null ? wavelength : source.wavelength,
                fwhm != null ? fwhm : source.fwhm,
                newUnit,
                quantity != null ? quantity : source.quantity,
                List.copyOf(newFiles),
                source.history.append("Metadata updated", Operation.UPDATE_METADATA, List.copyOf(updatedFields)),
                source.schemaVersion);
        }
    }

    /**
     * Creates a builder for a new cube that holds the given data.
     * <p>
     * Any metadata which isn't set on the builder is given a default: the wavelengths are the band numbers, the FWHM
     * values are zero, the wavelength unit is "Band index" (or "Unknown" if the wavelengths were given), and the
     * quantity is "Unknown".
     * </p>
     *
     * @param data
     *     The cube's data.
     *
     * @return A new builder.
     *
     * @throws NullPointerException
     *     if {@code data} is {@code null}.
     */
    public static Builder builder(CubeArray data) {
        ArgumentUtil.checkNotNull(data, "data");
        return new Builder(null, data);
    }

    /**
     * Creates a builder for a copy of an existing cube with some fields replaced.
     * <p>
     * Setting the wavelength without also setting the wavelength unit sets the unit to "Unknown".  Files which are
     * added to the builder are appended to the source cube's files.  The copy's history is the source cube's history
     * plus an {@link Operation#UPDATE_METADATA} entry.
     * </p>
     *
     * @param source
     *     The cube to copy.
     *
     * @return A new builder.
     *
     * @throws NullPointerException
     *     if {@code source} is {@code null}.
     */
    public static Builder builder(Datacube source) {
        ArgumentUtil.checkNotNull(source, "source");
        return new Builder(source, source.data);
    }

    /**
     * Creates a builder for a copy of this cube with some fields replaced.
     *
     * @return A new builder.
     *
     * @see #builder(Datacube)
     */
    public Builder toBuilder() {
        return builder(this);
    }

    private Datacube(CubeArray data, double[] wavelength, double[] fwhm, String wavelengthUnit, String quantity,
        List<Path> files, ProvenanceLog history, String schemaVersion) {
        MetadataValidator.validate(data, wavelength, fwhm, wavelengthUnit, quantity);

        this.data = data;
        this.wavelength = wavelength;
        this.fwhm = fwhm;
        this.wavelengthUnit = wavelengthUnit;
        this.quantity = quantity;
        this.files = files;
        this.history = history;
        this.schemaVersion = schemaVersion;
    }

    /**
     * Re-creates a cube exactly as it was saved, without logging and without appending to its history.
     */
    static Datacube restore(CubeArray data, double[] wavelength, double[] fwhm, String wavelengthUnit,
        String quantity, List<Path> files, ProvenanceLog history, String schemaVersion) {
        ArgumentUtil.checkNotNull(files, "files");
        ArgumentUtil.checkNotNull(history, "history");
        ArgumentUtil.checkNotNull(schemaVersion, "schemaVersion");
        return new Datacube(data, wavelength.clone(), fwhm.clone(), wavelengthUnit, quantity, List.copyOf(files),
            history, schemaVersion);
    }

    /**
     * Creates a cube that is derived from this one by an operation.
     */
    private Datacube derive(CubeArray newData, double[] newWavelength, double[] newFwhm, String newQuantity,
        List<Path> newFiles, String description, Operation operation, Object parameters) {
        if (!data.isEmpty() && newData.elementType() != data.elementType()) {
            log.warn("Data type changes from {} to {}", data.elementType(), newData.elementType());
        }
        return new Datacube(newData, newWavelength, newFwhm, wavelengthUnit, newQuantity, newFiles,
            history.append(description, operation, parameters), schemaVersion);
    }

    private Datacube derive(CubeArray newData, String description, Operation operation, Object parameters) {
        return derive(newData, wavelength, fwhm, quantity, files, description, operation, parameters);
    }

    //
    // Accessors
    //

    /**
     * @return The cube's data.  This is never {@code null}.
     */
    public CubeArray data() {
        return data;
    }

    /**
     * @return A copy of the center wavelength of each band.
     */
    public double[] wavelength() {
        return wavelength.clone();
    }

    /**
     * @return A copy of the full width at half maximum of each band.
     */
    public double[] fwhm() {
        return fwhm.clone();
    }

    /**
     * @return The unit of the wavelength and FWHM values.  This is never {@code null}.
     */
    public String wavelengthUnit() {
        return wavelengthUnit;
    }

    /**
     * @return The physical quantity of the data.  This is never empty.
     */
    public String quantity() {
        return quantity;
    }

    /**
     * @return An unmodifiable list of the files from which the data originates.
     */
    public List<Path> files() {
        return files;
    }

    /**
     * @return The provenance log of this cube.
     */
    public ProvenanceLog history() {
        return history;
    }

    /**
     * @return The value of {@link #SCHEMA_VERSION} when this cube was first created.
     */
    public String schemaVersion() {
        return schemaVersion;
    }

    /**
     * @return A new array of {@code {height, width, bandCount}}.  This always has three elements.
     */
    public int[] size() {
        return data.size();
    }

    /**
     * @return The number of columns.
     */
    public int width() {
        return data.columns();
    }

    /**
     * @return The number of rows.
     */
    public int height() {
        return data.rows();
    }

    /**
     * @return The number of bands.
     */
    public int bandCount() {
        return data.bands();
    }

    /**
     * @return The number of pixels, {@code width() * height()}.
     */
    public int area() {
        return data.rows() * data.columns();
    }

    /**
     * @return The type of the data's values.
     */
    public ElementType elementType() {
        return data.elementType();
    }

    /**
     * @return The smallest value in the data, ignoring NaN.
     */
    public double min() {
        return data.min();
    }

    /**
     * @return The largest value in the data, ignoring NaN.
     */
    public double max() {
        return data.max();
    }

    /**
     * @return A new array of the band numbers, {@code 1..bandCount()}.
     */
    public int[] bandIndices() {
        int[] bandIndices = new int[bandCount()];
        for (int i = 0; i < bandIndices.length; i++) {
            bandIndices[i] = i + 1;
        }
        return bandIndices;
    }

    //
    // Rearrangement
    //

    /**
     * Flips the image upside-down.
     *
     * @return A new cube.
     */
    public Datacube flipUpDown() {
        return derive(data.flipRows(), "Flipped upside-down", Operation.FLIP_UP_DOWN, null);
    }

    /**
     * Flips the image left-to-right.
     *
     * @return A new cube.
     */
    public Datacube flipLeftRight() {
        return derive(data.flipColumns(), "Flipped left-to-right", Operation.FLIP_LEFT_RIGHT, null);
    }

    /**
     * Rotates the image 90 degrees counterclockwise.
     *
     * @return A new cube.
     */
    public Datacube rotate90() {
        return rotate90(1);
    }

    /**
     * Rotates the image counterclockwise in 90 degree increments.
     *
     * @param k
     *     The number of times to rotate.  Negative values rotate clockwise.
     *
     * @return A new cube.
     */
    public Datacube rotate90(int k) {
        return derive(data.rotate90(k), "Rotated counterclockwise k times", Operation.ROTATE_90, k);
    }

    /**
     * Repeats the data along each dimension.  When the bands are repeated, the wavelengths and FWHM values are repeated
     * with them.
     *
     * @param rowFactor
     *     The number of copies along the height.
     * @param columnFactor
     *     The number of copies along the width.
     * @param bandFactor
     *     The number of copies along the bands.
     *
     * @return A new cube.
     *
     * @throws IllegalArgumentException
     *     if any factor is less than 1.
     */
    public Datacube tile(int rowFactor, int columnFactor, int bandFactor) {
        CubeArray tiled = data.tile(rowFactor, columnFactor, bandFactor);
        return derive(tiled, repeat(wavelength, bandFactor), repeat(fwhm, bandFactor), quantity, files,
            "Repeated data", Operation.TILE, List.of(rowFactor, columnFactor, bandFactor));
    }

    private static double[] repeat(double[] values, int times) {
        double[] repeated = new double[values.length * times];
        for (int i = 0; i < times; i++) {
            System.arraycopy(values, 0, repeated, i * values.length, values.length);
        }
        return repeated;
    }

    /**
     * Reshapes the image into a list of spectra.  The pixels are listed column by column.
     *
     * @return A new cube whose size is {@code area() x 1 x bandCount()}.
     */
    public Datacube toSpectraList() {
        return derive(data.reshapePixels(area(), 1), "Reshaped to a list of spectra", Operation.TO_SPECTRA_LIST, null);
    }

    /**
     * Reshapes a list of spectra into a rectangular image.  This is the inverse of {@link #toSpectraList()}.
     *
     * @param width
     *     The width of the new image.
     * @param height
     *     The height of the new image.
     *
     * @return A new cube whose size is {@code height x width x bandCount()}.
     *
     * @throws IllegalArgumentException
     *     if {@code width * height} is not the number of pixels in this cube.
     */
    public Datacube fromSpectraList(int width, int height) {
        ArgumentUtil.checkNotNegative(width, "width");
        ArgumentUtil.checkNotNegative(height, "height");
        if ((long) width * height != area()) {
            throw new IllegalArgumentException(
                "a " + width + "x" + height + " image doesn't have the same number of pixels as " + area() + " spectra");
        }
        return derive(data.reshapePixels(height, width), "Reshaped from a list of spectra",
            Operation.FROM_SPECTRA_LIST, List.of(width, height));
    }

    //
    // Slicing
    //

    private static int[] checkPoint(int[] point, String name) {
        ArgumentUtil.checkNotNull(point, name);
        if (point.length != 2) {
            throw new IllegalArgumentException(name + " must be an [x, y] pair");
        }
        return point.clone();
    }

    private void checkPixelInBounds(int[] point, String name) {
        if (point[0] < 1 || width() < point[0] || point[1] < 1 || height() < point[1]) {
            throw new IllegalArgumentException(name + " " + Arrays.toString(point) + " is out of bounds for a " +
                width() + "x" + height() + " image");
        }
    }

    /**
     * Crops the image to a rectangle.
     *
     * @param topLeft
     *     The 1-based {@code [x, y]} coordinates of the top-left corner of the rectangle.
     * @param bottomRight
     *     The 1-based {@code [x, y]} coordinates of the bottom-right corner of the rectangle.  This pixel is included.
     *
     * @return A new cube.
     *
     * @throws NullPointerException
     *     if either corner is {@code null}.
     * @throws IllegalArgumentException
     *     if either corner is not an {@code [x, y]} pair within the image or if {@code bottomRight} is above or to the
     *     left of {@code topLeft}.
     */
    public Datacube crop(int[] topLeft, int[] bottomRight) {
        int[] tl = checkPoint(topLeft, "topLeft");
        int[] br = checkPoint(bottomRight, "bottomRight");
        checkPixelInBounds(tl, "topLeft");
        checkPixelInBounds(br, "bottomRight");
        if (br[0] < tl[0] || br[1] < tl[1]) {
            throw new IllegalArgumentException("bottomRight must not be above or to the left of topLeft");
        }

        CubeArray cropped = data.subArray(tl[1] - 1, tl[0] - 1, br[1] - tl[1] + 1, br[0] - tl[0] + 1);
        return derive(cropped, "Cropped spatially", Operation.CROP,
            List.of(List.of(tl[0], tl[1]), List.of(br[0], br[1])));
    }

    /**
     * Selects bands, in the given order, along with their wavelengths and FWHM values.
     *
     * @param bandNumbers
     *     The 1-based numbers of the bands to select.  A band may be selected more than once.
     *
     * @return A new cube.
     *
     * @throws IllegalArgumentException
     *     if no bands are given or if any band number is out of range.
     */
    public Datacube selectBands(int... bandNumbers) {
        ArgumentUtil.checkNotNull(bandNumbers, "bandNumbers");
        if (bandNumbers.length == 0) {
            throw new IllegalArgumentException("bandNumbers must not be empty");
        }

        int[] bandIndexes = new int[bandNumbers.length];
        double[] newWavelength = new double[bandNumbers.length];
        double[] newFwhm = new double[bandNumbers.length];
        List<Integer> selected = new ArrayList<>(bandNumbers.length);
        for (int i = 0; i < bandNumbers.length; i++) {
            int band = bandNumbers[i];
            if (band < 1 || bandCount() < band) {
                throw new IllegalArgumentException("band " + band + " is out of range 1.." + bandCount());
            }
            bandIndexes[i] = band - 1;
            newWavelength[i] = wavelength[band - 1];
            newFwhm[i] = fwhm[band - 1];
            selected.add(band);
        }

        return derive(data.selectBands(bandIndexes), newWavelength, newFwhm, quantity, files, "Selected bands",
            Operation.SELECT_BANDS, List.copyOf(selected));
    }

    private int[][] maskedPixels(boolean[][] mask) {
        ArgumentUtil.checkNotNull(mask, "mask");

        int count = 0;
        for (boolean[] row : mask) {
            ArgumentUtil.checkNotNull(row, "mask row");
            for (boolean selected : row) {
                count += selected ? 1 : 0;
            }
        }

        // column-major, to match the order of toSpectraList()
        int maskColumns = mask.length == 0 ? 0 : mask[0].length;
        int[] rows = new int[count];
        int[] columns = new int[count];
        int i = 0;
        for (int column = 0; column < maskColumns; column++) {
            for (int row = 0; row < mask.length; row++) {
                if (mask[row].length != maskColumns) {
                    throw new IllegalArgumentException("mask must not be ragged");
                }
                if (mask[row][column]) {
                    rows[i] = row;
                    columns[i] = column;
                    i++;
                }
            }
        }
        return new int[][] { rows, columns };
    }

    private static List<List<Boolean>> maskParameter(boolean[][] mask) {
        List<List<Boolean>> copy = new ArrayList<>(mask.length);
        for (boolean[] row : mask) {
            List<Boolean> rowCopy = new ArrayList<>(row.length);
            for (boolean selected : row) {
                rowCopy.add(selected);
            }
            copy.add(Collections.unmodifiableList(rowCopy));
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Selects the spectra of the pixels where a mask is {@code true}.
     *
     * @param mask
     *     A {@code height() x width()} array, indexed as {@code mask[row][column]}.
     *
     * @return A new cube whose size is {@code N x 1 x bandCount()}, where {@code N} is the number of {@code true}
     *     values in the mask.  The spectra are in the same order as {@link #toSpectraList()}.
     *
     * @throws ShapeMismatchException
     *     if the mask's size is not the image's size.
     */
    public Datacube maskSpatial(boolean[][] mask) {
        ArgumentUtil.checkNotNull(mask, "mask");
        int maskColumns = mask.length == 0 ? 0 : mask[0].length;
        if (mask.length != height() || maskColumns != width()) {
            throw new ShapeMismatchException("a " + mask.length + "x" + maskColumns + " mask doesn't match a " +
                height() + "x" + width() + " image");
        }

        int[][] pixels = maskedPixels(mask);
        return derive(data.gatherPixels(pixels[0], pixels[1]), "Masked spatially", Operation.MASK,
            maskParameter(mask));
    }

    /**
     * Places a list of spectra back into an image at the pixels where a mask is {@code true}.  This is the inverse of
     * {@link #maskSpatial(boolean[][])}.  All other pixels are zero.
     *
     * @param mask
     *     A mask indexed as {@code mask[row][column]}, whose size is the size of the new image.
     *
     * @return A new cube with the mask's size.
     *
     * @throws ShapeMismatchException
     *     if this cube is not a list with one spectrum for each {@code true} value in the mask.
     */
    public Datacube unmask(boolean[][] mask) {
        int[][] pixels = maskedPixels(mask);
        int count = pixels[0].length;
        if (width() != 1 || height() != count) {
            throw new ShapeMismatchException("a mask with " + count + " pixels doesn't match a " + height() + "x" +
                width() + " list of spectra");
        }

        int maskColumns = mask.length == 0 ? 0 : mask[0].length;
        CubeArray unmasked = data.scatterPixels(mask.length, maskColumns, pixels[0], pixels[1]);
        return derive(unmasked, "Unmasked to a spatial image", Operation.UNMASK, maskParameter(mask));
    }

    /**
     * Selects the spectra of some pixels.
     *
     * @param coordinates
     *     The 1-based {@code [x, y]} coordinates of each pixel.
     *
     * @return A new cube whose size is {@code N x 1 x bandCount()}, with the spectra in the given order.
     *
     * @throws IllegalArgumentException
     *     if no coordinates are given or if any coordinate is not an {@code [x, y]} pair within the image.
     */
    public Datacube selectPixels(int[]... coordinates) {
        ArgumentUtil.checkNotNull(coordinates, "coordinates");
        if (coordinates.length == 0) {
            throw new IllegalArgumentException("coordinates must not be empty");
        }

        int[] rows = new int[coordinates.length];
        int[] columns = new int[coordinates.length];
        List<List<Integer>> selected = new ArrayList<>(coordinates.length);
        for (int i = 0; i < coordinates.length; i++) {
            int[] point = checkPoint(coordinates[i], "coordinates");
            checkPixelInBounds(point, "pixel");
            columns[i] = point[0] - 1;
            rows[i] = point[1] - 1;
            selected.add(List.of(point[0], point[1]));
        }

        return derive(data.gatherPixels(rows, columns), "Selected pixels", Operation.SELECT_PIXELS,
            Collections.unmodifiableList(selected));
    }

    /**
     * Takes the first spectra in the order of {@link #toSpectraList()}.
     *
     * @param n
     *     The number of spectra to take.
     *
     * @return A new cube whose size is {@code n x 1 x bandCount()}.
     *
     * @throws IllegalArgumentException
     *     if {@code n} is less than 1 or greater than {@code area()}.
     */
    public Datacube takeFirstN(int n) {
        ArgumentUtil.checkPositive(n, "n");
        if (area() < n) {
            throw new IllegalArgumentException("cannot take " + n + " spectra from a cube with " + area() + " pixels");
        }
        CubeArray taken = data.reshapePixels(area(), 1).subArray(0, 0, n, 1);
        return derive(taken, "Took the first n spectra", Operation.TAKE, n);
    }

    //
    // Arithmetic
    //

    /**
     * Throws an exception if two cubes can't be combined by an arithmetic operation.
     *
     * @param left
     *     The left operand.
     * @param right
     *     The right operand.
     *
     * @throws NullPointerException
     *     if either operand is {@code null}.
     * @throws OperandIncompatibleException
     *     if the operands' sizes differ.
     */
    public static void checkOperands(Datacube left, Datacube right) {
        ArgumentUtil.checkNotNull(left, "left");
        ArgumentUtil.checkNotNull(right, "right");
        if (!Arrays.equals(left.size(), right.size())) {
            throw new OperandIncompatibleException(left.size(), right.size());
        }
    }

    private Datacube combine(Datacube other, ArithmeticOperator operator, String explicitQuantity) {
        checkOperands(this, other);
        String newQuantity = explicitQuantity != null
            ? explicitQuantity
            : "(" + quantity + " " + operator.symbol() + " " + other.quantity + ")";

        return derive(data.combine(other.data, operator), wavelength, fwhm, newQuantity, other.files,
            operator.description(), operator.operation(), other.history);
    }

    /**
     * Adds another cube to this one, element by element.
     * <p>
     * The result's metadata is copied from this cube, except that its files are the other cube's files and its
     * quantity is "(a + b)".  If both cubes have the same element type, then the result has that type, with integer
     * results saturated at the type's range.  Otherwise, the result is {@link ElementType#FLOAT64}.
     * </p>
     *
     * @param other
     *     The right operand.
     *
     * @return A new cube.
     *
     * @throws OperandIncompatibleException
     *     if the cubes have different sizes.
     */
    public Datacube add(Datacube other) {
        return combine(other, ArithmeticOperator.ADD, null);
    }

    /**
     * Adds another cube to this one, element by element, giving the result an explicit quantity.
     *
     * @param other
     *     The right operand.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube.
     *
     * @throws OperandIncompatibleException
     *     if the cubes have different sizes.
     * @see #add(Datacube)
     */
    public Datacube add(Datacube other, String quantity) {
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        return combine(other, ArithmeticOperator.ADD, quantity);
    }

    /**
     * Subtracts another cube from this one, element by element.
     *
     * @param other
     *     The right operand.
     *
     * @return A new cube whose quantity is "(a - b)".
     *
     * @throws OperandIncompatibleException
     *     if the cubes have different sizes.
     * @see #add(Datacube)
     */
    public Datacube subtract(Datacube other) {
        return combine(other, ArithmeticOperator.SUBTRACT, null);
    }

    /**
     * Subtracts another cube from this one, element by element, giving the result an explicit quantity.
     *
     * @param other
     *     The right operand.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube.
     */
    public Datacube subtract(Datacube other, String quantity) {
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        return combine(other, ArithmeticOperator.SUBTRACT, quantity);
    }

    /**
     * Multiplies this cube by another cube, element by element.
     *
     * @param other
     *     The right operand.
     *
     * @return A new cube whose quantity is "(a * b)".
     *
     * @throws OperandIncompatibleException
     *     if the cubes have different sizes.
     * @see #add(Datacube)
     */
    public Datacube multiplyElementwise(Datacube other) {
        return combine(other, ArithmeticOperator.MULTIPLY, null);
    }

    /**
     * Multiplies this cube by another cube, element by element, giving the result an explicit quantity.
     *
     * @param other
     *     The right operand.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube.
     */
    public Datacube multiplyElementwise(Datacube other, String quantity) {
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        return combine(other, ArithmeticOperator.MULTIPLY, quantity);
    }

    /**
     * Divides this cube by another cube, element by element.
     * <p>
     * Floating point division follows IEEE 754.  Integer division rounds to the nearest integer and a division by zero
     * saturates to the type's largest value (or smallest, for a negative dividend), with {@code 0/0} giving 0.
     * </p>
     *
     * @param other
     *     The right operand.
     *
     * @return A new cube whose quantity is "(a / b)".
     *
     * @throws OperandIncompatibleException
     *     if the cubes have different sizes.
     * @see #add(Datacube)
     */
    public Datacube divideElementwise(Datacube other) {
        return combine(other, ArithmeticOperator.DIVIDE, null);
    }

    /**
     * Divides this cube by another cube, element by element, giving the result an explicit quantity.
     *
     * @param other
     *     The right operand.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube.
     */
    public Datacube divideElementwise(Datacube other, String quantity) {
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        return combine(other, ArithmeticOperator.DIVIDE, quantity);
    }

    //
    // Mapping
    //

    private ElementType floatingType() {
        return data.elementType() == ElementType.FLOAT32 ? ElementType.FLOAT32 : ElementType.FLOAT64;
    }

    /**
     * Applies a function to every value.  The result is {@link ElementType#FLOAT32} if this cube is
     * {@code FLOAT32} and {@link ElementType#FLOAT64} otherwise.
     *
     * @param function
     *     The function.
     *
     * @return A new cube with the same quantity.
     */
    public Datacube map(DoubleUnaryOperator function) {
        return map(function, quantity);
    }

    /**
     * Applies a function to every value and gives the result a new quantity.
     *
     * @param function
     *     The function.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube.
     *
     * @see #map(DoubleUnaryOperator)
     */
    public Datacube map(DoubleUnaryOperator function, String quantity) {
        ArgumentUtil.checkNotNull(function, "function");
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        return derive(data.map(function, floatingType()), wavelength, fwhm, quantity, files,
            "Mapped a function over the data", Operation.MAP, quantity);
    }

    /**
     * Applies a function to the spectrum of every pixel.  The function must return a spectrum with the same number of
     * bands.
     *
     * @param function
     *     The function.  It's given a copy of each spectrum, which it may modify.
     *
     * @return A new cube.
     *
     * @throws ShapeMismatchException
     *     if the function returns a spectrum with a different number of bands.
     */
    public Datacube mapSpectra(UnaryOperator<double[]> function) {
        return mapSpectra(function, wavelength, fwhm, quantity);
    }

    /**
     * Applies a function to the spectrum of every pixel, producing spectra with new bands.
     *
     * @param function
     *     The function.  It's given a copy of each spectrum, which it may modify.
     * @param newWavelength
     *     The wavelengths of the bands which {@code function} returns.
     * @param newFwhm
     *     The FWHM values of the bands which {@code function} returns.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube.
     *
     * @throws ShapeMismatchException
     *     if {@code newWavelength} and {@code newFwhm} differ in length or if the function returns a spectrum whose
     *     length is not the length of {@code newWavelength}.
     */
    public Datacube mapSpectra(UnaryOperator<double[]> function, double[] newWavelength, double[] newFwhm,
        String quantity) {
        ArgumentUtil.checkNotNull(function, "function");
        ArgumentUtil.checkNotNull(newWavelength, "newWavelength");
        ArgumentUtil.checkNotNull(newFwhm, "newFwhm");
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        MetadataValidator.checkBandCount(newFwhm, newWavelength.length, "fwhm");

        final int newBands = newWavelength.length;
        double[][] spectra = new double[area()][];
        for (int row = 0; row < height(); row++) {
            for (int column = 0; column < width(); column++) {
                double[] spectrum = function.apply(data.spectrum(row, column));
                if (spectrum == null) {
                    throw new NullPointerException("function must not return null");
                }
                if (spectrum.length != newBands) {
                    throw new ShapeMismatchException(
                        "function returned " + spectrum.length + " values for " + newBands + " bands");
                }
                spectra[row * width() + column] = spectrum;
            }
        }

        CubeArray mapped = CubeArray.fromFunction(floatingType(), height(), width(), newBands,
            (row, column, band) -> spectra[row * width() + column][band]);
        return derive(mapped, newWavelength.clone(), newFwhm.clone(), quantity, files,
            "Mapped a function over each spectrum", Operation.MAP_SPECTRA, quantity);
    }

    /**
     * Applies a function to the image of every band.  The function may change the image's size, but it must return
     * images of the same size for every band.
     *
     * @param function
     *     The function.  It's given a copy of each band's {@code height() x width()} image, indexed as
     *     {@code image[row][column]}, which it may modify.
     * @param quantity
     *     The quantity of the result.
     *
     * @return A new cube with the same bands.
     *
     * @throws ShapeMismatchException
     *     if the function returns a ragged image or images of different sizes.
     * @see #mapBands(Function, String, int)
     */
    public Datacube mapBands(UnaryOperator<double[][]> function, String quantity) {
        ArgumentUtil.checkNotNull(function, "function");
        return mapBands(image -> new double[][][] { function.apply(image) }, quantity, 1);
    }

    /**
     * Applies a function to the image of every band, where each band produces several images.
     * <p>
     * The result has {@code bandCount() * bandMultiplier} bands.  Like {@link #tile(int, int, int)}, the first
     * {@code bandCount()} bands are the first image of each band, the next {@code bandCount()} bands are the second
     * image of each band, and so on, so the wavelength and FWHM values are repeated {@code bandMultiplier} times.
     * </p>
     *
     * @param function
     *     The function.  It's given a copy of each band's image, indexed as {@code image[row][column]}, and returns
     *     {@code bandMultiplier} images.
     * @param quantity
     *     The quantity of the result.
     * @param bandMultiplier
     *     The number of images that {@code function} returns for each band.
     *
     * @return A new cube.
     *
     * @throws IllegalArgumentException
     *     if {@code bandMultiplier} is not positive.
     * @throws ShapeMismatchException
     *     if the function doesn't return {@code bandMultiplier} images or returns images of different sizes.
     */
    public Datacube mapBands(Function<double[][], double[][][]> function, String quantity, int bandMultiplier) {
        ArgumentUtil.checkNotNull(function, "function");
        ArgumentUtil.checkNotEmpty(quantity, "quantity");
        ArgumentUtil.checkPositive(bandMultiplier, "bandMultiplier");

        final int bands = bandCount();
        final double[][][] images = new double[bands * bandMultiplier][][];
        int newHeight = height();
        int newWidth = width();
        for (int band = 0; band < bands; band++) {
            double[][] image = new double[height()][width()];
            for (int row = 0; row < height(); row++) {
                for (int column = 0; column < width(); column++) {
                    image[row][column] = data.getDouble(row, column, band);
                }
            }

            double[][][] results = function.apply(image);
            if (results == null) {
                throw new NullPointerException("function must not return null");
            }
            if (results.length != bandMultiplier) {
                throw new ShapeMismatchException(
                    "function returned " + results.length + " images but the band multiplier is " + bandMultiplier);
            }
            for (int layer = 0; layer < bandMultiplier; layer++) {
                double[][] result = results[layer];
                if (result == null) {
                    throw new NullPointerException("function must not return a null image");
                }
                if (band == 0 && layer == 0) {
                    newHeight = result.length;
                    newWidth = result.length == 0 || result[0] == null ? 0 : result[0].length;
                }
                checkImageSize(result, newHeight, newWidth);
                images[layer * bands + band] = result;
            }
        }

        CubeArray mapped = CubeArray.fromFunction(floatingType(), newHeight, newWidth, images.length,
            (row, column, band) -> images[band][row][column]);

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("quantity", quantity);
        parameters.put("bandMultiplier", bandMultiplier);
        return derive(mapped, repeat(wavelength, bandMultiplier), repeat(fwhm, bandMultiplier), quantity, files,
            "Mapped a function over each band", Operation.MAP_BANDS, Collections.unmodifiableMap(parameters));
    }

    private static void checkImageSize(double[][] image, int height, int width) {
        if (image.length != height) {
            throw new ShapeMismatchException(
                "function returned an image with " + image.length + " rows instead of " + height);
        }
        for (double[] row : image) {
            if (row == null || row.length != width) {
                throw new ShapeMismatchException("function returned an image whose rows don't all have " + width +
                    " columns");
            }
        }
    }

    //
    // Reductions
    //

    /**
     * Computes the spatial mean spectrum.  A NaN value makes the mean of its band NaN.
     *
     * @return A new cube whose size is {@code 1 x 1 x bandCount()}.
     */
    public Datacube spatialMean() {
        return derive(data.spatialMean(), "Reduced to spatial mean", Operation.MEAN, null);
    }

    /**
     * Computes the mean spectrum of each row.
     *
     * @return A new cube whose size is {@code height() x 1 x bandCount()}.
     */
    public Datacube meanOverRows() {
        return derive(data.rowMeans(), "Reduced to spatially rowwise means", Operation.MEAN_OVER_ROWS, null);
    }

    /**
     * Computes the mean spectrum of each column.
     *
     * @return A new cube whose size is {@code 1 x width() x bandCount()}.
     */
    public Datacube meanOverColumns() {
        return derive(data.columnMeans(), "Reduced to spatially columnwise means", Operation.MEAN_OVER_COLUMNS, null);
    }

    /**
     * Computes the spatial median spectrum.  A NaN value makes the median of its band NaN.
     *
     * @return A new cube whose size is {@code 1 x 1 x bandCount()}.
     */
    public Datacube spatialMedian() {
        return derive(data.spatialMedian(), "Reduced to spatial median", Operation.MEDIAN, null);
    }

    //
    // Utilities
    //

    /**
     * Determines whether coordinates are within this cube.
     * <p>
     * Each coordinate is either an {@code [x, y]} pair or an {@code [x, y, band]} triple, all 1-based.  A coordinate is
     * within the cube if {@code x <= width()}, {@code y <= height()} and, for a triple, {@code band <= bandCount()}.
     * </p>
     *
     * @param coordinates
     *     The coordinates to check.
     *
     * @return {@code true}, if every coordinate is within this cube.
     *
     * @throws IllegalArgumentException
     *     if any coordinate doesn't have two or three values or if any value is not a positive integer.
     */
    public boolean inBounds(double[]... coordinates) {
        ArgumentUtil.checkNotNull(coordinates, "coordinates");
        for (double[] coordinate : coordinates) {
            ArgumentUtil.checkNotNull(coordinate, "coordinate");
            if (coordinate.length != 2 && coordinate.length != 3) {
                throw new IllegalArgumentException("coordinates must be [x, y] or [x, y, band]");
            }
            for (double value : coordinate) {
                if (!(1 <= value) || value != Math.rint(value) || Double.isInfinite(value)) {
                    throw new IllegalArgumentException("Coordinate values must be natural numbers");
                }
            }
        }

        for (double[] coordinate : coordinates) {
            if (width() < coordinate[0] || height() < coordinate[1]) {
                return false;
            }
            if (coordinate.length == 3 && bandCount() < coordinate[2]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Datacube[" + height() + "x" + width() + "x" + bandCount() + " " + elementType() + ", quantity=" +
            quantity + ", wavelengthUnit=" + wavelengthUnit + "]";
    }
}
