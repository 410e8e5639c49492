///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

/**
 * Thrown when metadata disagrees with the dimensions of a cube's data, for example when the number of wavelengths is
 * not the number of bands.
 */
public class ShapeMismatchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    /**
     * Creates a new exception.
     *
     * @param message
     *     A description of the mismatch.
     */
    public ShapeMismatchException(String message) {
        super(message);
    }
}
