package com.spreadsheet.formula.parser;

enum TokenType {
    WORD,
    NUMBER,
    STRING,
    LEFT_PAREN,
    RIGHT_PAREN,
    COMMA,
    COLON,
    OPERATOR,
    END
}
