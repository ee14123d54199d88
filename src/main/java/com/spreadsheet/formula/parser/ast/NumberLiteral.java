package com.spreadsheet.formula.parser.ast;

public final class NumberLiteral implements Expression {
    private final double value;
    private final String text;

    public NumberLiteral(double value, String text) {
        this.value = value;
        this.text = text;
    }

    public double getValue() {
        return value;
    }

    /** The literal as written in the formula. */
    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
