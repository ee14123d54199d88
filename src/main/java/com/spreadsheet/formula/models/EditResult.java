package com.spreadsheet.formula.models;

import java.util.Map;

/**
 * Outcome of a single edit: the recomputed cells and the token of the history
 * entry to persist alongside the edit.
 * A rejected edit (syntax error or cycle) carries only the edited cell and the
 * token of the unchanged current history entry.
 */
public final class EditResult {
    private final Map<Coordinate, CellValue> updatedCells;
    private final long historyToken;
    private final boolean accepted;

    public EditResult(Map<Coordinate, CellValue> updatedCells, long historyToken, boolean accepted) {
        this.updatedCells = updatedCells;
        this.historyToken = historyToken;
        this.accepted = accepted;
    }

    public Map<Coordinate, CellValue> getUpdatedCells() {
        return updatedCells;
    }

    public long getHistoryToken() {
        return historyToken;
    }

    public boolean isAccepted() {
        return accepted;
    }
}
