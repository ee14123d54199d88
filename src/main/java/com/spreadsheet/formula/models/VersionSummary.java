package com.spreadsheet.formula.models;

import java.time.Instant;

/**
 * One line of a sheet's version history, without the snapshot itself.
 */
public class VersionSummary {
    private final long sequence;
    private final Instant timestamp;
    private final String description;
    private final boolean current;

    public VersionSummary(long sequence, Instant timestamp, String description, boolean current) {
        this.sequence = sequence;
        this.timestamp = timestamp;
        this.description = description;
        this.current = current;
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

    public boolean isCurrent() {
        return current;
    }
}
