package com.spreadsheet.formula.parser.ast;

/**
 * A quoted string literal, stored without its quotes.
 */
public final class TextLiteral implements Expression {
    private final String text;

    public TextLiteral(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitText(this);
    }

    @Override
    public String toString() {
        return "\"" + text + "\"";
    }
}
