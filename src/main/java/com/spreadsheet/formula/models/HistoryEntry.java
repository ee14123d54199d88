package com.spreadsheet.formula.models;

import java.time.Instant;

/**
 * One committed version of a sheet. Sequence numbers increase with every commit
 * and are never reused, even after redo entries are discarded.
 */
public final class HistoryEntry {
    private final long sequence;
    private final Instant timestamp;
    private final String description;
    private final SheetSnapshot snapshot;

    public HistoryEntry(long sequence, Instant timestamp, String description, SheetSnapshot snapshot) {
        this.sequence = sequence;
        this.timestamp = timestamp;
        this.description = description;
        this.snapshot = snapshot;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getDescription() {
        return description;
    }

    public SheetSnapshot getSnapshot() {
        return snapshot;
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + description;
    }
}
