package com.spreadsheet.formula.parser;

/**
 * A lexical token: its type, its text (strings without quotes) and where it starts.
 */
final class Token {
    final TokenType type;
    final String text;
    final int position;

    Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    boolean is(TokenType other) {
        return type == other;
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + position;
    }
}
