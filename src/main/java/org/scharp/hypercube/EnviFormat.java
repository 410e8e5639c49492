///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads and writes a {@link Datacube} as an ENVI header/data file pair.
 * <p>
 * A cube written to {@code base} is stored in two sibling files: the header text in {@code base.hdr} and the raw
 * values in {@code base.dat}.  The ENVI format does not store the cube's quantity, its history, or its files.
 * </p>
 *
 * <p>
 * Sample code for writing a cube and reading it back:
 * </p>
 *
 * <pre>
 * EnviFormat.write(cube, Path.of("scan"));            // writes scan.hdr and scan.dat
 * Datacube copy = EnviFormat.read(Path.of("scan.dat"), "Reflectance");
 * </pre>
 */
public final class EnviFormat {

    private static final Logger log = LoggerFactory.getLogger(EnviFormat.class);

    static final String HEADER_EXTENSION = ".hdr";
    static final String DATA_EXTENSION = ".dat";

    // private constructor to prevent anyone from instantiating the class.
    private EnviFormat() {
    }

    /**
     * Gets a path without its ".hdr" or ".dat" extension.  Any other extension is kept.
     *
     * @param path
     *     The path.
     *
     * @return The path without its ENVI extension.
     */
    static Path basePath(Path path) {
        String fileName = path.getFileName().toString();
        String lowerCase = fileName.toLowerCase(Locale.ROOT);
        if ((lowerCase.endsWith(HEADER_EXTENSION) || lowerCase.endsWith(DATA_EXTENSION)) &&
            HEADER_EXTENSION.length() < fileName.length()) {
            return path.resolveSibling(fileName.substring(0, fileName.length() - HEADER_EXTENSION.length()));
        }
        return path;
    }

    private static Path withoutExtension(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? path : path.resolveSibling(fileName.substring(0, dot));
    }

    private static Path withSuffix(Path path, String suffix) {
        return path.resolveSibling(path.getFileName().toString() + suffix);
    }

    /**
     * Gets the path of the header file that is written for a path.
     *
     * @param path
     *     The path given to {@link #write}.
     *
     * @return The header path.
     */
    static Path headerPath(Path path) {
        return withSuffix(basePath(path), HEADER_EXTENSION);
    }

    /**
     * Gets the path of the data file that is written for a path.
     *
     * @param path
     *     The path given to {@link #write}.
     *
     * @return The data path.
     */
    static Path dataPath(Path path) {
        return withSuffix(basePath(path), DATA_EXTENSION);
    }

    /**
     * Writes a cube without overwriting any existing file.
     *
     * @param cube
     *     The cube to write.
     * @param path
     *     The path of the files to write.  Any ".hdr" or ".dat" extension is replaced.
     *
     * @throws HeaderExistsException
     *     if the header file already exists.
     * @throws DataExistsException
     *     if the data file already exists.
     * @throws IOException
     *     if the files can't be written.
     * @see #write(Datacube, Path, boolean)
     */
    public static void write(Datacube cube, Path path) throws IOException {
        write(cube, path, false);
    }

    /**
     * Writes a cube as a header file and a data file.
     * <p>
     * The values are written band sequential in the host's byte order.  The header is written first, then the data.
     * The pair is not written atomically: if writing the data fails, then the header that was already written is left
     * on disk.
     * </p>
     *
     * @param cube
     *     The cube to write.
     * @param path
     *     The path of the files to write.  Any ".hdr" or ".dat" extension is replaced.
     * @param overwrite
     *     Whether existing files may be replaced.
     *
     * @throws HeaderExistsException
     *     if {@code overwrite} is {@code false} and the header file already exists.  Nothing is written.
     * @throws DataExistsException
     *     if {@code overwrite} is {@code false} and the data file already exists.  Nothing is written.
     * @throws IOException
     *     if the files can't be written.
     */
    public static void write(Datacube cube, Path path, boolean overwrite) throws IOException {
        ArgumentUtil.checkNotNull(cube, "cube");
        ArgumentUtil.checkNotNull(path, "path");

        Path headerPath = headerPath(path);
        Path dataPath = dataPath(path);
        if (!overwrite) {
            if (Files.exists(headerPath)) {
                throw new HeaderExistsException(headerPath);
            }
            if (Files.exists(dataPath)) {
                throw new DataExistsException(dataPath);
            }
        }

        EnviHeader header = HeaderCodec.encode(cube);
        try (Writer writer = Files.newBufferedWriter(headerPath, StandardCharsets.UTF_8)) {
            writer.write(HeaderCodec.format(header));
        }
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(dataPath))) {
            PayloadCodec.encode(cube.data(), header, out);
        }
        log.debug("Wrote {} to {} and {}", header, headerPath, dataPath);
    }

    /**
     * Reads a cube whose quantity is unknown.
     *
     * @param path
     *     The path of the data file or the header file.
     *
     * @return A new cube with the quantity "Unknown".
     *
     * @throws HeaderNotFoundException
     *     if there is no header file for {@code path}.
     * @throws MalformedHeaderException
     *     if the header is malformed or doesn't describe the data file.
     * @throws IOException
     *     if the files can't be read.
     * @see #read(Path, String)
     */
    public static Datacube read(Path path) throws IOException {
        return read(path, Datacube.UNKNOWN);
    }

    /**
     * Reads a cube from a header file and a data file.
     * <p>
     * The header is located with {@link #findHeader(Path)}.  If {@code path} is the header, then the data file is its
     * ".dat" sibling.  The returned cube's files list holds the data file.
     * </p>
     *
     * @param path
     *     The path of the data file or the header file.
     * @param quantity
     *     The quantity of the data, which the ENVI format doesn't store.
     *
     * @return A new cube.
     *
     * @throws HeaderNotFoundException
     *     if there is no header file for {@code path}.
     * @throws MalformedHeaderException
     *     if the header is malformed or doesn't describe the data file.
     * @throws IOException
     *     if the files can't be read.
     */
    public static Datacube read(Path path, String quantity) throws IOException {
        ArgumentUtil.checkNotNull(path, "path");
        ArgumentUtil.checkNotEmpty(quantity, "quantity");

        Path headerPath = findHeader(path);
        Path dataPath = path.equals(headerPath) || !Files.exists(path) ? dataPath(path) : path;

        EnviHeader header = HeaderCodec.decode(readHeaderText(headerPath));

        long payloadSize = Files.size(dataPath) - header.headerOffset();
        if (payloadSize < 0) {
            throw new MalformedHeaderException(
                "header offset " + header.headerOffset() + " is beyond the end of " + dataPath);
        }

        CubeArray data;
        try (InputStream in = new BufferedInputStream(Files.newInputStream(dataPath))) {
            in.skipNBytes(header.headerOffset());
            data = PayloadCodec.decode(in, payloadSize, header);
        }
        log.debug("Read {} from {} and {}", header, headerPath, dataPath);

        return Datacube.builder(data).
            wavelength(header.wavelength()).
            wavelengthUnit(header.wavelengthUnits()).
            fwhm(header.fwhm()).
            quantity(quantity).
            file(dataPath).
            build();
    }

    /**
     * Reads the text of a header file.  Headers are written as UTF-8, but headers written by other programs may hold
     * single-byte text (such as a Latin-1 "µm"), which is read as ISO-8859-1.
     *
     * @param headerPath
     *     The header file.
     *
     * @return The text of the header.
     *
     * @throws IOException
     *     if the file can't be read.
     */
    static String readHeaderText(Path headerPath) throws IOException {
        byte[] bytes = Files.readAllBytes(headerPath);
        try {
            return StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            log.debug("{} is not UTF-8, reading it as ISO-8859-1", headerPath);
            return new String(bytes, StandardCharsets.ISO_8859_1);
        }
    }

    /**
     * Finds the header file that belongs to a path.
     * <p>
     * The candidates are tried in order: the path with its ".hdr" or ".dat" extension replaced by ".hdr", the path
     * with ".hdr" appended, and the path with any other extension replaced by ".hdr" (so "scan.img" finds "scan.hdr").
     * </p>
     *
     * @param path
     *     The path of a data file or header file.
     *
     * @return The path of the header file.
     *
     * @throws HeaderNotFoundException
     *     if no header file exists.
     */
    public static Path findHeader(Path path) throws HeaderNotFoundException {
        ArgumentUtil.checkNotNull(path, "path");

        Path replaced = headerPath(path);
        if (Files.isRegularFile(replaced)) {
            return replaced;
        }
        Path appended = withSuffix(path, HEADER_EXTENSION);
        if (Files.isRegularFile(appended)) {
            return appended;
        }
        Path sibling = withSuffix(withoutExtension(path), HEADER_EXTENSION);
        if (Files.isRegularFile(sibling)) {
            return sibling;
        }
        throw new HeaderNotFoundException(path);
    }
}
