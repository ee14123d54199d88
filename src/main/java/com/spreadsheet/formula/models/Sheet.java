package com.spreadsheet.formula.models;

import com.spreadsheet.formula.functions.CellValueSource;

import java.util.*;

/**
 * Represents the cell map of one spreadsheet:
 * - fixed bounds (column and row count)
 * - a sparse, row-major ordered map of coordinate -> Cell
 * Absent cells read as the empty string.
 */
public class Sheet implements CellValueSource {

    private final SheetBounds bounds;
    // Only non-empty cells live here; clearing a cell removes it
    private final NavigableMap<Coordinate, Cell> cells = new TreeMap<>();

    public Sheet(SheetBounds bounds) {
        this.bounds = bounds;
    }

    public SheetBounds getBounds() {
        return bounds;
    }

    /**
     * Retrieves the cell at the coordinate, or null if it was never written (or was cleared).
     */
    public Cell getCell(Coordinate coordinate) {
        return cells.get(coordinate);
    }

    /**
     * Inserts or replaces a cell.
     */
    public void putCell(Cell cell) {
        cells.put(cell.getCoordinate(), cell);
    }

    public void removeCell(Coordinate coordinate) {
        cells.remove(coordinate);
    }

    public void clear() {
        cells.clear();
    }

    /**
     * Read-only, row-major view of all present cells.
     */
    public Collection<Cell> getCells() {
        return Collections.unmodifiableCollection(cells.values());
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    /**
     * The value a formula sees when it reads this coordinate.
     * Errors do not cascade: an erroring cell still yields its last good value.
     */
    @Override
    public String valueAt(Coordinate coordinate) {
        Cell cell = cells.get(coordinate);
        return cell == null ? "" : cell.getDisplayValue();
    }
}
