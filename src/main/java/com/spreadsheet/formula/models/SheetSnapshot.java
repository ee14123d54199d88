package com.spreadsheet.formula.models;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable copy of a sheet's cells at one point in time:
 * the raw input of every non-empty cell, plus the value and error of every present cell.
 * A cell can be present with no raw input (an empty cell flagged by a rejected edit),
 * or hold an error over its last good value; the recorded state covers both.
 */
public final class SheetSnapshot {
    private final SortedMap<Coordinate, String> rawInputs;
    private final SortedMap<Coordinate, CellValue> cells;

    public SheetSnapshot(SortedMap<Coordinate, String> rawInputs, SortedMap<Coordinate, CellValue> cells) {
        this.rawInputs = Collections.unmodifiableSortedMap(new TreeMap<>(rawInputs));
        this.cells = Collections.unmodifiableSortedMap(new TreeMap<>(cells));
    }

    public static SheetSnapshot of(Sheet sheet) {
        SortedMap<Coordinate, String> rawInputs = new TreeMap<>();
        SortedMap<Coordinate, CellValue> cells = new TreeMap<>();
        for (Cell cell : sheet.getCells()) {
            if (!cell.getRawInput().isEmpty()) {
                rawInputs.put(cell.getCoordinate(), cell.getRawInput());
            }
            cells.put(cell.getCoordinate(), cell.toCellValue());
        }
        return new SheetSnapshot(rawInputs, cells);
    }

    public SortedMap<Coordinate, String> getRawInputs() {
        return rawInputs;
    }

    /**
     * Last computed value and error flag of every present cell.
     */
    public SortedMap<Coordinate, CellValue> getCells() {
        return cells;
    }

    /**
     * The value each present cell showed: its error token while flagged, otherwise its value.
     */
    public SortedMap<Coordinate, String> getValues() {
        SortedMap<Coordinate, String> values = new TreeMap<>();
        for (Map.Entry<Coordinate, CellValue> entry : cells.entrySet()) {
            values.put(entry.getKey(), entry.getValue().getShownValue());
        }
        return Collections.unmodifiableSortedMap(values);
    }
}
