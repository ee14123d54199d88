package com.spreadsheet.formula.models;

import java.util.Map;

/**
 * JSON body returned after a cell edit, keyed by A1-style address.
 */
public class EditResponse {
    private final Map<String, CellValue> updatedCells;
    private final long historyToken;
    private final boolean accepted;

    public EditResponse(Map<String, CellValue> updatedCells, long historyToken, boolean accepted) {
        this.updatedCells = updatedCells;
        this.historyToken = historyToken;
        this.accepted = accepted;
    }

    public Map<String, CellValue> getUpdatedCells() {
        return updatedCells;
    }

    public long getHistoryToken() {
        return historyToken;
    }

    public boolean isAccepted() {
        return accepted;
    }
}
