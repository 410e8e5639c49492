///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.util.Arrays;

/**
 * Thrown when two cubes are combined by an arithmetic operation but their sizes differ.
 */
public class OperandIncompatibleException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final int[] leftSize;
    private final int[] rightSize;

    /**
     * Creates a new exception.
     *
     * @param leftSize
     *     The size of the left operand as {@code {rows, columns, bands}}.
     * @param rightSize
     *     The size of the right operand as {@code {rows, columns, bands}}.
     */
    public OperandIncompatibleException(int[] leftSize, int[] rightSize) {
        super("Operand sizes " + Arrays.toString(leftSize) + " and " + Arrays.toString(rightSize) + " are incompatible");
        this.leftSize = leftSize.clone();
        this.rightSize = rightSize.clone();
    }

    /**
     * @return The size of the left operand.
     */
    public int[] leftSize() {
        return leftSize.clone();
    }

    /**
     * @return The size of the right operand.
     */
    public int[] rightSize() {
        return rightSize.clone();
    }
}
