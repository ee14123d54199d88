package com.spreadsheet.formula.parser.ast;

/**
 * One method per expression kind, so every evaluator has to handle all of them.
 */
public interface ExpressionVisitor<R> {

    R visitNumber(NumberLiteral literal);

    R visitText(TextLiteral literal);

    R visitCell(CellReference reference);

    R visitRange(RangeReference range);

    R visitFunction(FunctionCall call);

    R visitIf(IfCall call);
}
