package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.Coordinate;

public final class CellReference implements Expression {
    private final Coordinate coordinate;

    public CellReference(Coordinate coordinate) {
        this.coordinate = coordinate;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitCell(this);
    }

    @Override
    public String toString() {
        return coordinate.toString();
    }
}
