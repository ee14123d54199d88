package com.spreadsheet.formula.parser.ast;

/**
 * A node of a parsed formula. The node kinds are closed:
 * literals, cell and range references, aggregate calls and IF.
 */
public interface Expression {

    <R> R accept(ExpressionVisitor<R> visitor);
}
