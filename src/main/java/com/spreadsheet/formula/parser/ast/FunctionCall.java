package com.spreadsheet.formula.parser.ast;

import java.util.List;

/**
 * A call to one of the aggregate functions (SUM, AVERAGE, COUNT, MIN, MAX).
 * IF has its own node, {@link IfCall}.
 */
public final class FunctionCall implements Expression {
    private final FunctionName name;
    private final List<Expression> arguments;

    public FunctionCall(FunctionName name, List<Expression> arguments) {
        if (name == FunctionName.IF) {
            throw new IllegalArgumentException("IF is represented by IfCall");
        }
        this.name = name;
        this.arguments = List.copyOf(arguments);
    }

    public FunctionName getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name.name()).append('(');
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(arguments.get(i));
        }
        return sb.append(')').toString();
    }
}
