///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Path;

/**
 * Thrown when writing a cube would replace an existing header file and overwriting was not requested.
 */
public class HeaderExistsException extends FileAlreadyExistsException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param headerPath
     *     The header file that already exists.
     */
    public HeaderExistsException(Path headerPath) {
        super(headerPath.toString(), null, "header file already exists");
    }
}
