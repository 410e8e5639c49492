///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Thrown when the header file that belongs to a data file can't be found.
 */
public class HeaderNotFoundException extends NoSuchFileException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param path
     *     The path whose header was searched for.
     */
    public HeaderNotFoundException(Path path) {
        super(path.toString(), null, "no header file found");
    }
}
