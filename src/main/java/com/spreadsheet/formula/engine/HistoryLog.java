package com.spreadsheet.formula.engine;

import com.spreadsheet.formula.models.HistoryEntry;
import com.spreadsheet.formula.models.SheetSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Linear undo/redo history of full sheet snapshots with a cursor.
 * Committing after an undo discards the entries that could have been redone.
 */
public class HistoryLog {

    private final List<HistoryEntry> entries = new ArrayList<>();
    // 0 = unbounded
    private final int limit;
    private int cursor = -1;
    private long nextSequence = 1;

    public HistoryLog() {
        this(0);
    }

    public HistoryLog(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("History limit can't be negative: " + limit);
        }
        this.limit = limit;
    }

    /**
     * Appends a snapshot after the cursor and moves the cursor onto it.
     */
    public HistoryEntry commit(SheetSnapshot snapshot, String description) {
        // Prune the redo branch
        while (entries.size() > cursor + 1) {
            entries.remove(entries.size() - 1);
        }
        HistoryEntry entry = new HistoryEntry(nextSequence++, Instant.now(), description, snapshot);
        entries.add(entry);
        cursor = entries.size() - 1;

        if (limit > 0 && entries.size() > limit) {
            entries.remove(0);
            cursor--;
        }
        return entry;
    }

    /**
     * Steps back one entry. Returns empty (and stays put) at the oldest entry.
     */
    public Optional<HistoryEntry> undo() {
        if (cursor <= 0) {
            return Optional.empty();
        }
        cursor--;
        return Optional.of(entries.get(cursor));
    }

    /**
     * Steps forward one entry. Returns empty (and stays put) at the newest entry.
     */
    public Optional<HistoryEntry> redo() {
        if (cursor >= entries.size() - 1) {
            return Optional.empty();
        }
        cursor++;
        return Optional.of(entries.get(cursor));
    }

    public boolean canUndo() {
        return cursor > 0;
    }

    public boolean canRedo() {
        return cursor < entries.size() - 1;
    }

    public Optional<HistoryEntry> current() {
        return cursor < 0 ? Optional.empty() : Optional.of(entries.get(cursor));
    }

    public Optional<HistoryEntry> find(long sequence) {
        for (HistoryEntry entry : entries) {
            if (entry.getSequence() == sequence) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    /**
     * All retained entries, oldest first.
     */
    public List<HistoryEntry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
