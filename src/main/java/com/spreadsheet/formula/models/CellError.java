package com.spreadsheet.formula.models;

/**
 * A cell that ended up in an error state during a bulk load.
 */
public final class CellError {
    private final Coordinate coordinate;
    private final ErrorCode code;

    public CellError(Coordinate coordinate, ErrorCode code) {
        this.coordinate = coordinate;
        this.code = code;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    public ErrorCode getCode() {
        return code;
    }

    @Override
    public String toString() {
        return coordinate + ": " + code.getCode();
    }
}
