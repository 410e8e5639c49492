///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;

/**
 * Thrown when writing a cube would replace an existing data file and overwriting was not requested.
 */
public class DataExistsException extends FileAlreadyExistsException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param dataPath
     *     The data file that already exists.
     */
    public DataExistsException(Path dataPath) {
        super(dataPath.toString(), null, "data file already exists");
    }
}
