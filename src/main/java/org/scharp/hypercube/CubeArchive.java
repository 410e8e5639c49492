///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteOrder;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Saves and loads whole {@link Datacube} objects, including their quantity, files, and history.
 * <p>
 * An archive is a JSON document which holds one or more cubes and the {@link Datacube#SCHEMA_VERSION} of the library
 * that wrote it.  The data of each cube is stored as its little-endian, band sequential bytes.  Unlike the ENVI
 * format, an archive restores a cube exactly as it was saved.
 * </p>
 *
 * <p>
 * An archive which was written by a different schema version is still loaded.  Callers can check
 * {@link LoadResult#isCompatible()} to decide whether to trust it.
 * </p>
 */
public final class CubeArchive {

    private static final Logger log = LoggerFactory.getLogger(CubeArchive.class);

    /** The extension that is added to archive file names which don't have one */
    public static final String DEFAULT_EXTENSION = ".cb";

    private static final ObjectMapper MAPPER = new ObjectMapper().
        configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    // The JSON layout of an archive.
    record ArchiveDocument(String schemaVersion, List<CubeDocument> cubes) {
    }

    record CubeDocument(
        String schemaVersion,
        ElementType elementType,
        int rows,
        int columns,
        int bands,
        byte[] data,
        double[] wavelength,
        double[] fwhm,
        String wavelengthUnit,
        String quantity,
        List<String> files,
        List<EntryDocument> history) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record EntryDocument(
        String description,
        Operation operation,
        JsonNode parameters,
        List<EntryDocument> operandHistory) {
    }

    /**
     * The cubes that were loaded from an archive, together with the schema version that wrote them.
     */
    public static final class LoadResult {
        private final List<Datacube> cubes;
        private final String storedSchemaVersion;

        LoadResult(List<Datacube> cubes, String storedSchemaVersion) {
            this.cubes = List.copyOf(cubes);
            this.storedSchemaVersion = storedSchemaVersion;
        }

        /**
         * @return An unmodifiable list of the cubes, in the order in which they were saved.
         */
        public List<Datacube> cubes() {
            return cubes;
        }

        /**
         * @return The schema version that is recorded in the archive.
         */
        public String storedSchemaVersion() {
            return storedSchemaVersion;
        }

        /**
         * Determines whether the archive was written with the current schema version.
         *
         * @return {@code true}, if the stored schema version is {@link Datacube#SCHEMA_VERSION}.
         */
        public boolean isCompatible() {
            return Datacube.SCHEMA_VERSION.equals(storedSchemaVersion);
        }
    }

    // private constructor to prevent anyone from instantiating the class.
    private CubeArchive() {
    }

    /**
     * Gets the path to which an archive is written, adding {@link #DEFAULT_EXTENSION} if the file name has no
     * extension.
     *
     * @param path
     *     The requested path.
     *
     * @return The path of the archive.
     */
    static Path archivePath(Path path) {
        String fileName = path.getFileName().toString();
        return fileName.indexOf('.') < 0 ? path.resolveSibling(fileName + DEFAULT_EXTENSION) : path;
    }

    private static EnviHeader payloadLayout(ElementType elementType, int rows, int columns, int bands) {
        return EnviHeader.builder().
            samples(columns).
            lines(rows).
            bands(bands).
            elementType(elementType).
            interleave(Interleave.BSQ).
            byteOrder(ByteOrder.LITTLE_ENDIAN).
            build();
    }

    private static List<EntryDocument> toDocuments(ProvenanceLog history) {
        List<EntryDocument> entries = new ArrayList<>(history.size());
        for (ProvenanceEntry entry : history) {
            Object parameters = entry.parameters();
            if (parameters instanceof ProvenanceLog operandHistory) {
                entries.add(new EntryDocument(entry.description(), entry.operation(), null,
                    toDocuments(operandHistory)));
            } else {
                entries.add(new EntryDocument(entry.description(), entry.operation(), toJson(parameters), null));
            }
        }
        return entries;
    }

    private static JsonNode toJson(Object parameters) {
        if (parameters == null) {
            return null;
        }
        try {
            return MAPPER.valueToTree(parameters);
        } catch (IllegalArgumentException e) {
            log.warn("Provenance parameters of type {} can't be saved as JSON; saving their text instead.",
                parameters.getClass().getName(), e);
            return MAPPER.getNodeFactory().textNode(parameters.toString());
        }
    }

    private static CubeDocument toDocument(Datacube cube) {
        CubeArray data = cube.data();
        EnviHeader layout = payloadLayout(data.elementType(), data.rows(), data.columns(), data.bands());

        List<String> files = new ArrayList<>(cube.files().size());
        for (Path file : cube.files()) {
            files.add(file.toString());
        }

        return new CubeDocument(
            cube.schemaVersion(),
            data.elementType(),
            data.rows(),
            data.columns(),
            data.bands(),
            PayloadCodec.encode(data, layout),
            cube.wavelength(),
            cube.fwhm(),
            cube.wavelengthUnit(),
            cube.quantity(),
            files,
            toDocuments(cube.history()));
    }

    /**
     * Saves cubes to an archive without overwriting an existing file.
     *
     * @param path
     *     The path of the archive.  If its file name has no extension, ".cb" is added.
     * @param cubes
     *     The cubes to save.
     *
     * @return The path of the archive that was written.
     *
     * @throws FileAlreadyExistsException
     *     if the archive already exists.
     * @throws IOException
     *     if the archive can't be written.
     */
    public static Path save(Path path, Datacube... cubes) throws IOException {
        ArgumentUtil.checkNotNull(cubes, "cubes");
        return save(path, false, List.of(cubes));
    }

    /**
     * Saves cubes to an archive.
     *
     * @param path
     *     The path of the archive.  If its file name has no extension, ".cb" is added.
     * @param overwrite
     *     Whether an existing archive may be replaced.
     * @param cubes
     *     The cubes to save.
     *
     * @return The path of the archive that was written.
     *
     * @throws NullPointerException
     *     if {@code path} or {@code cubes} is {@code null} or if {@code cubes} contains a {@code null}.
     * @throws IllegalArgumentException
     *     if {@code cubes} is empty.
     * @throws FileAlreadyExistsException
     *     if {@code overwrite} is {@code false} and the archive already exists.
     * @throws IOException
     *     if the archive can't be written.
     */
    public static Path save(Path path, boolean overwrite, List<Datacube> cubes) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");
        ArgumentUtil.checkNotNull(cubes, "cubes");
        if (cubes.isEmpty()) {
            throw new IllegalArgumentException("cubes must not be empty");
        }

        Path archivePath = archivePath(path);
        if (!overwrite && Files.exists(archivePath)) {
            throw new FileAlreadyExistsException(archivePath.toString(), null,
                "archive already exists; save with overwrite to replace it");
        }

        List<CubeDocument> documents = new ArrayList<>(cubes.size());
        for (Datacube cube : cubes) {
            ArgumentUtil.checkNotNull(cube, "cubes entry");
            documents.add(toDocument(cube));
        }

        log.info("Saving {} cube(s) to {}", documents.size(), archivePath);
        try (OutputStream out = Files.newOutputStream(archivePath)) {
            MAPPER.writeValue(out, new ArchiveDocument(Datacube.SCHEMA_VERSION, documents));
        }
        return archivePath;
    }

    private static ProvenanceLog toHistory(List<EntryDocument> documents) throws JsonProcessingException {
        List<ProvenanceEntry> entries = new ArrayList<>(documents.size());
        for (EntryDocument document : documents) {
            Object parameters;
            if (document.operandHistory() != null) {
                parameters = toHistory(document.operandHistory());
            } else if (document.parameters() == null || document.parameters().isNull()) {
                parameters = null;
            } else {
                parameters = MAPPER.treeToValue(document.parameters(), Object.class);
            }
            entries.add(new ProvenanceEntry(document.description(), document.operation(), parameters));
        }
        return ProvenanceLog.of(entries);
    }

    private static Datacube toCube(CubeDocument document) throws IOException {
        if (document.elementType() == null || document.data() == null || document.history() == null) {
            throw new IOException("archive entry is missing its element type, data, or history");
        }
        try {
            EnviHeader layout = payloadLayout(document.elementType(), document.rows(), document.columns(),
                document.bands());
            CubeArray data = PayloadCodec.decode(document.data(), layout);

            List<Path> files = new ArrayList<>();
            if (document.files() != null) {
                for (String file : document.files()) {
                    files.add(Path.of(file));
                }
            }

            return Datacube.restore(
                data,
                document.wavelength(),
                document.fwhm(),
                document.wavelengthUnit(),
                document.quantity(),
                files,
                toHistory(document.history()),
                document.schemaVersion() != null ? document.schemaVersion() : Datacube.UNKNOWN);
        } catch (MalformedHeaderException | IllegalArgumentException | IllegalStateException | NullPointerException e) {
            throw new IOException("archive holds an invalid cube: " + e.getMessage(), e);
        }
    }

    /**
     * Loads all cubes from an archive.
     *
     * @param path
     *     The path of the archive.
     *
     * @return The cubes and the archive's schema version.
     *
     * @throws IOException
     *     if the archive can't be read or is not a valid archive.
     */
    public static LoadResult load(Path path) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");

        log.info("Loading cube data from {}", path);
        ArchiveDocument archive;
        try (InputStream in = Files.newInputStream(path)) {
            archive = MAPPER.readValue(in, ArchiveDocument.class);
        }
        if (archive == null || archive.cubes() == null) {
            throw new IOException(path + " is not a cube archive");
        }

        List<Datacube> cubes = new ArrayList<>(archive.cubes().size());
        for (CubeDocument document : archive.cubes()) {
            cubes.add(toCube(document));
        }
        log.info("Loaded {} cube(s).", cubes.size());

        LoadResult result = new LoadResult(cubes, archive.schemaVersion());
        if (!result.isCompatible()) {
            log.debug("Archive has schema version {}, while the current version is {}.",
                archive.schemaVersion(), Datacube.SCHEMA_VERSION);
        }
        return result;
    }
}
