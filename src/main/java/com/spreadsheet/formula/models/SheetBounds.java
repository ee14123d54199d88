package com.spreadsheet.formula.models;

/**
 * Fixed size of a sheet: column count C and row count R.
 * Coordinates outside these bounds are invalid inputs, not cells.
 */
public final class SheetBounds {
    private final int columns;
    private final int rows;

    public SheetBounds(int columns, int rows) {
        if (columns <= 0 || rows <= 0) {
            throw new IllegalArgumentException("Sheet bounds must be positive, got " + columns + "x" + rows);
        }
        this.columns = columns;
        this.rows = rows;
    }

    public int getColumns() {
        return columns;
    }

    public int getRows() {
        return rows;
    }

    public boolean contains(Coordinate coordinate) {
        return coordinate.getColumn() < columns && coordinate.getRow() < rows;
    }

    @Override
    public String toString() {
        return columns + "x" + rows;
    }
}
