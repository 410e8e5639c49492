///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.io.IOException;
import java.util.List;

/**
 * Thrown when an ENVI header can't be decoded or doesn't describe its data file.
 * <p>
 * All problems that were found are reported together.
 * </p>
 */
public class MalformedHeaderException extends IOException {
    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    /**
     * Creates a new exception.
     *
     * @param problems
     *     A description of every problem that was found.  This must not be empty.
     */
    public MalformedHeaderException(List<String> problems) {
        super("Malformed ENVI header: " + String.join("; ", problems));
        assert !problems.isEmpty() : "an exception needs at least one problem";
        this.problems = List.copyOf(problems);
    }

    /**
     * Creates a new exception for a single problem.
     *
     * @param problem
     *     A description of the problem.
     */
    public MalformedHeaderException(String problem) {
        this(List.of(problem));
    }

    /**
     * @return An unmodifiable list which describes each problem that was found.
     */
    public List<String> problems() {
        return problems;
    }
}
