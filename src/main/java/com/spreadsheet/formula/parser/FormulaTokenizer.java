package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits formula text into tokens. Whitespace only separates tokens.
 * A '+' or '-' is a sign and belongs to the number that follows it.
 */
final class FormulaTokenizer {

    private FormulaTokenizer() {
    }

    static List<Token> tokenize(String source) {
        List<Token> tokens = new ArrayList<>();
        int len = source.length();
        int i = 0;
        while (i < len) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (isLetter(c)) {
                int start = i;
                while (i < len && (isLetter(source.charAt(i)) || isDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new Token(TokenType.WORD, source.substring(start, i), start));
            } else if (isDigit(c) || c == '.' || ((c == '-' || c == '+') && startsNumber(source, i + 1))) {
                int start = i;
                i = scanNumber(source, i);
                tokens.add(new Token(TokenType.NUMBER, source.substring(start, i), start));
            } else if (c == '"' || c == '\'') {
                int start = i;
                int close = source.indexOf(c, i + 1);
                if (close < 0) {
                    throw new FormulaSyntaxException("Unterminated string", source.substring(start), start);
                }
                tokens.add(new Token(TokenType.STRING, source.substring(start + 1, close), start));
                i = close + 1;
            } else if (c == '(') {
                tokens.add(new Token(TokenType.LEFT_PAREN, "(", i++));
            } else if (c == ')') {
                tokens.add(new Token(TokenType.RIGHT_PAREN, ")", i++));
            } else if (c == ',') {
                tokens.add(new Token(TokenType.COMMA, ",", i++));
            } else if (c == ':') {
                tokens.add(new Token(TokenType.COLON, ":", i++));
            } else if (c == '<' || c == '>' || c == '=' || c == '!') {
                int start = i;
                i = scanOperator(source, i);
                tokens.add(new Token(TokenType.OPERATOR, source.substring(start, i), start));
            } else {
                throw new FormulaSyntaxException("Unexpected character", String.valueOf(c), i);
            }
        }
        tokens.add(new Token(TokenType.END, "", len));
        return tokens;
    }

    private static int scanNumber(String source, int i) {
        int len = source.length();
        int start = i;
        if (source.charAt(i) == '-' || source.charAt(i) == '+') {
            i++;
        }
        int digits = 0;
        while (i < len && isDigit(source.charAt(i))) {
            i++;
            digits++;
        }
        if (i < len && source.charAt(i) == '.') {
            i++;
            while (i < len && isDigit(source.charAt(i))) {
                i++;
                digits++;
            }
        }
        if (digits == 0) {
            throw new FormulaSyntaxException("Malformed number", source.substring(start, i), start);
        }
        if (i < len && (source.charAt(i) == 'e' || source.charAt(i) == 'E')) {
            int exponent = i + 1;
            if (exponent < len && (source.charAt(exponent) == '-' || source.charAt(exponent) == '+')) {
                exponent++;
            }
            if (exponent < len && isDigit(source.charAt(exponent))) {
                i = exponent;
                while (i < len && isDigit(source.charAt(i))) {
                    i++;
                }
            }
        }
        return i;
    }

    private static int scanOperator(String source, int i) {
        char first = source.charAt(i);
        char second = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
        if (second == '=' || (first == '<' && second == '>')) {
            return i + 2;
        }
        return i + 1;
    }

    private static boolean startsNumber(String source, int i) {
        return i < source.length() && (isDigit(source.charAt(i)) || source.charAt(i) == '.');
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
