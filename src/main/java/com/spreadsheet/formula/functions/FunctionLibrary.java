package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Coordinate;
import com.spreadsheet.formula.parser.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates parsed formulas against a {@link CellValueSource}.
 * All functions are pure: the only input is the source passed in, the only output the returned string.
 */
public class FunctionLibrary {

    /**
     * Evaluates a formula to the string a cell displays.
     */
    public String evaluate(Formula formula, CellValueSource source) {
        return evaluate(formula.getRoot(), source);
    }

    public String evaluate(Expression expression, CellValueSource source) {
        return expression.accept(new Evaluator(source));
    }

    /**
     * Sum of all values; non-numeric values count as 0.
     */
    public double sum(List<String> values) {
        double total = 0;
        for (String value : values) {
            total += Values.toNumber(value);
        }
        return total;
    }

    /**
     * Sum divided by the number of all values (non-numeric ones included, as 0), or 0 when there are none.
     */
    public double average(List<String> values) {
        return values.isEmpty() ? 0 : sum(values) / values.size();
    }

    /**
     * Number of values that are numeric. Empty and text values are skipped.
     */
    public double count(List<String> values) {
        int count = 0;
        for (String value : values) {
            if (Values.isNumeric(value)) {
                count++;
            }
        }
        return count;
    }

    /**
     * Smallest numeric value, or 0 when there is none.
     */
    public double min(List<String> values) {
        return extreme(values, true);
    }

    /**
     * Largest numeric value, or 0 when there is none.
     */
    public double max(List<String> values) {
        return extreme(values, false);
    }

    private double extreme(List<String> values, boolean smallest) {
        boolean found = false;
        double result = 0;
        for (String value : values) {
            if (!Values.isNumeric(value)) {
                continue;
            }
            double n = Values.toNumber(value);
            if (!found || (smallest ? n < result : n > result)) {
                result = n;
                found = true;
            }
        }
        return result;
    }

    /**
     * Compares two operands numerically; text operands count as 0.
     */
    public boolean compare(String left, ComparisonOperator operator, String right) {
        double l = Values.toNumber(left);
        double r = Values.toNumber(right);
        switch (operator) {
            case GREATER:
                return l > r;
            case LESS:
                return l < r;
            case GREATER_OR_EQUAL:
                return l >= r;
            case LESS_OR_EQUAL:
                return l <= r;
            case EQUAL:
                return l == r;
            case NOT_EQUAL:
                return l != r;
            default:
                throw new IllegalStateException("Unhandled operator: " + operator);
        }
    }

    private double aggregate(FunctionName name, List<String> values) {
        switch (name) {
            case SUM:
                return sum(values);
            case AVERAGE:
                return average(values);
            case COUNT:
                return count(values);
            case MIN:
                return min(values);
            case MAX:
                return max(values);
            case IF:
            default:
                throw new IllegalStateException(name + " is not an aggregate");
        }
    }

    /**
     * Walks the expression tree. Only the selected IF branch is evaluated.
     */
    private final class Evaluator implements ExpressionVisitor<String> {
        private final CellValueSource source;

        Evaluator(CellValueSource source) {
            this.source = source;
        }

        @Override
        public String visitNumber(NumberLiteral literal) {
            return Values.format(literal.getValue());
        }

        @Override
        public String visitText(TextLiteral literal) {
            return literal.getText();
        }

        @Override
        public String visitCell(CellReference reference) {
            return source.valueAt(reference.getCoordinate());
        }

        @Override
        public String visitRange(RangeReference range) {
            // The parser only accepts ranges as aggregate arguments
            throw new IllegalStateException("Range " + range + " outside an aggregate");
        }

        @Override
        public String visitFunction(FunctionCall call) {
            List<String> values = new ArrayList<>();
            for (Expression argument : call.getArguments()) {
                if (argument instanceof RangeReference) {
                    for (Coordinate cell : ((RangeReference) argument).getCells()) {
                        values.add(source.valueAt(cell));
                    }
                } else {
                    values.add(argument.accept(this));
                }
            }
            return Values.format(aggregate(call.getName(), values));
        }

        @Override
        public String visitIf(IfCall call) {
            Condition condition = call.getCondition();
            boolean result = compare(
                    condition.getLeft().accept(this),
                    condition.getOperator(),
                    condition.getRight().accept(this));
            return result ? call.getWhenTrue().accept(this) : call.getWhenFalse().accept(this);
        }
    }
}
