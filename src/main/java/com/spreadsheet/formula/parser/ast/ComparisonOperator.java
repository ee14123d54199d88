package com.spreadsheet.formula.parser.ast;

/**
 * Comparison operators allowed in an IF condition.
 * "=" and "==" both mean equality, "!=" and "<>" both mean inequality.
 */
public enum ComparisonOperator {
    GREATER(">"),
    LESS("<"),
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    EQUAL("=", "=="),
    NOT_EQUAL("!=", "<>");

    private final String[] symbols;

    ComparisonOperator(String... symbols) {
        this.symbols = symbols;
    }

    public String getSymbol() {
        return symbols[0];
    }

    /**
     * Returns the operator written as the given symbol, or null if there is none.
     */
    public static ComparisonOperator fromSymbol(String symbol) {
        for (ComparisonOperator op : values()) {
            for (String s : op.symbols) {
                if (s.equals(symbol)) {
                    return op;
                }
            }
        }
        return null;
    }
}
