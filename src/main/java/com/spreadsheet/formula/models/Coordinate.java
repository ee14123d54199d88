package com.spreadsheet.formula.models;

import com.spreadsheet.formula.references.ReferenceResolver;

/**
 * Zero-based (column, row) position of a cell.
 * Coordinates sort row-major: first by row, then by column,
 * which is the tie-break order used when scheduling recalculation.
 */
public final class Coordinate implements Comparable<Coordinate> {
    private final int column;
    private final int row;

    public Coordinate(int column, int row) {
        if (column < 0 || row < 0) {
            throw new IllegalArgumentException("Negative coordinate: (" + column + ", " + row + ")");
        }
        this.column = column;
        this.row = row;
    }

    public static Coordinate of(int column, int row) {
        return new Coordinate(column, row);
    }

    public int getColumn() {
        return column;
    }

    public int getRow() {
        return row;
    }

    @Override
    public int compareTo(Coordinate other) {
        if (row != other.row) {
            return Integer.compare(row, other.row);
        }
        return Integer.compare(column, other.column);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Coordinate)) {
            return false;
        }
        Coordinate other = (Coordinate) o;
        return column == other.column && row == other.row;
    }

    @Override
    public int hashCode() {
        return 31 * row + column;
    }

    /**
     * Returns the A1-style address, e.g. "B3" for (1, 2).
     */
    @Override
    public String toString() {
        return ReferenceResolver.formatAddress(this);
    }
}
