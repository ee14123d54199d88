package com.spreadsheet.formula.parser.ast;

public final class IfCall implements Expression {
    private final Condition condition;
    private final Expression whenTrue;
    private final Expression whenFalse;

    public IfCall(Condition condition, Expression whenTrue, Expression whenFalse) {
        this.condition = condition;
        this.whenTrue = whenTrue;
        this.whenFalse = whenFalse;
    }

    public Condition getCondition() {
        return condition;
    }

    public Expression getWhenTrue() {
        return whenTrue;
    }

    public Expression getWhenFalse() {
        return whenFalse;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIf(this);
    }

    @Override
    public String toString() {
        return "IF(" + condition + "," + whenTrue + "," + whenFalse + ")";
    }
}
