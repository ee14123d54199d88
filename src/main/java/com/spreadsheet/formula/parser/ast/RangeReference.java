package com.spreadsheet.formula.parser.ast;

import com.spreadsheet.formula.models.Coordinate;

import java.util.List;

/**
 * A rectangular range such as A1:B5. Only valid as an aggregate argument.
 * {@link #getCells()} lists the covered coordinates row-major.
 */
public final class RangeReference implements Expression {
    private final Coordinate start;
    private final Coordinate end;
    private final List<Coordinate> cells;

    public RangeReference(Coordinate start, Coordinate end, List<Coordinate> cells) {
        this.start = start;
        this.end = end;
        this.cells = List.copyOf(cells);
    }

    public Coordinate getStart() {
        return start;
    }

    public Coordinate getEnd() {
        return end;
    }

    public List<Coordinate> getCells() {
        return cells;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitRange(this);
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
