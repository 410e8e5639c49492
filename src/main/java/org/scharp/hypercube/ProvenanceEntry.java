///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.util.Objects;

/**
 * One record in a {@link ProvenanceLog}.
 * <p>
 * Instances of this class are immutable, provided that the parameters are.
 * </p>
 */
public final class ProvenanceEntry {
    private final String description;
    private final Operation operation;
    private final Object parameters;

    /**
     * Creates a new provenance entry.
     *
     * @param description
     *     A human-readable description of what was done, like "Flipped upside-down".
     * @param operation
     *     The operation that was done.
     * @param parameters
     *     The arguments that were given to the operation.  This may be {@code null} if the operation had no
     *     arguments.  For the arithmetic operations, this is the right operand's entire {@link ProvenanceLog}.
     *
     * @throws NullPointerException
     *     if {@code description} or {@code operation} is {@code null}.
     */
    public ProvenanceEntry(String description, Operation operation, Object parameters) {
        ArgumentUtil.checkNotNull(description, "description");
        ArgumentUtil.checkNotNull(operation, "operation");

        this.description = description;
        this.operation = operation;
        this.parameters = parameters;
    }

    /**
     * @return This entry's description.  This is never {@code null}.
     */
    public String description() {
        return description;
    }

    /**
     * @return The operation which this entry records.  This is never {@code null}.
     */
    public Operation operation() {
        return operation;
    }

    /**
     * @return The operation's parameters.  This may be {@code null}.
     */
    public Object parameters() {
        return parameters;
    }

    @Override
    public int hashCode() {
        return Objects.hash(description, operation, parameters);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ProvenanceEntry otherEntry)) {
            return false;
        }
        return description.equals(otherEntry.description) &&
            operation == otherEntry.operation &&
            Objects.equals(parameters, otherEntry.parameters);
    }

    @Override
    public String toString() {
        return operation + ": " + description + (parameters == null ? "" : " " + parameters);
    }
}
