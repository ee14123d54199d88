package com.spreadsheet.formula.parser.ast;

/**
 * The first argument of IF: two operands (references or literals) and a comparison.
 */
public final class Condition {
    private final Expression left;
    private final ComparisonOperator operator;
    private final Expression right;

    public Condition(Expression left, ComparisonOperator operator, Expression right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() {
        return left;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

    @Override
    public String toString() {
        return left + operator.getSymbol() + right;
    }
}
