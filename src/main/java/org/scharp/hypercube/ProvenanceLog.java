///////////////////////////////////////////////////////////////////////////////
// Copyright (c) 2025 Fred Hutch Cancer Center
// Licensed under the MIT License - see LICENSE file for details
///////////////////////////////////////////////////////////////////////////////
package org.scharp.hypercube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An append-only record of the operations that produced a {@link Datacube}.
 * <p>
 * The first entry of every log is an {@link Operation#CREATE} entry.  Instances of this class are immutable; appending
 * an entry returns a new log that is exactly one entry longer.
 * </p>
 * <p>
 * A log is kept for auditing and replay.  Nothing in this library inspects a log to decide what to do.
 * </p>
 */
public final class ProvenanceLog implements Iterable<ProvenanceEntry> {

    static final String CREATED_DESCRIPTION = "Object created";

    private static final ProvenanceLog CREATED = new ProvenanceLog(
        List.of(new ProvenanceEntry(CREATED_DESCRIPTION, Operation.CREATE, null)));

    private final List<ProvenanceEntry> entries;

    private ProvenanceLog(List<ProvenanceEntry> entries) {
        this.entries = entries;
    }

    /**
     * Gets a log that holds only the creation marker.
     *
     * @return A log with one {@link Operation#CREATE} entry.
     */
    public static ProvenanceLog created() {
        return CREATED;
    }

    /**
     * Creates a log from a list of entries.
     *
     * @param entries
     *     The entries.  This is copied.
     *
     * @return A new log.
     *
     * @throws NullPointerException
     *     if {@code entries} is {@code null} or contains a {@code null}.
     * @throws IllegalArgumentException
     *     if {@code entries} is empty or if its first entry is not an {@link Operation#CREATE} entry.
     */
    public static ProvenanceLog of(List<ProvenanceEntry> entries) {
        ArgumentUtil.checkNotNull(entries, "entries");
        List<ProvenanceEntry> copy = List.copyOf(entries); // throws NPE on null entries
        if (copy.isEmpty()) {
            throw new IllegalArgumentException("entries must not be empty");
        }
        if (copy.get(0).operation() != Operation.CREATE) {
            throw new IllegalArgumentException("the first entry must be a " + Operation.CREATE + " entry");
        }
        return new ProvenanceLog(copy);
    }

    /**
     * Returns a new log with an additional entry at the end.
     *
     * @param description
     *     A human-readable description of the operation.
     * @param operation
     *     The operation.
     * @param parameters
     *     The operation's arguments, or {@code null}.
     *
     * @return A new log that is one entry longer than this one.
     */
    public ProvenanceLog append(String description, Operation operation, Object parameters) {
        ProvenanceEntry entry = new ProvenanceEntry(description, operation, parameters);
        List<ProvenanceEntry> newEntries = new ArrayList<>(entries.size() + 1);
        newEntries.addAll(entries);
        newEntries.add(entry);
        return new ProvenanceLog(Collections.unmodifiableList(newEntries));
    }

    /**
     * @return The number of entries in this log.  This is always at least 1.
     */
    public int size() {
        return entries.size();
    }

    /**
     * Gets an entry.
     *
     * @param index
     *     The 0-based index of the entry.
     *
     * @return The entry.
     *
     * @throws IndexOutOfBoundsException
     *     if {@code index} is out of range.
     */
    public ProvenanceEntry get(int index) {
        return entries.get(index);
    }

    /**
     * @return The most recent entry.
     */
    public ProvenanceEntry last() {
        return entries.get(entries.size() - 1);
    }

    /**
     * @return An unmodifiable list of this log's entries, oldest first.
     */
    public List<ProvenanceEntry> entries() {
        return entries;
    }

    @Override
    public Iterator<ProvenanceEntry> iterator() {
        return entries.iterator();
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof ProvenanceLog otherLog && entries.equals(otherLog.entries));
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
