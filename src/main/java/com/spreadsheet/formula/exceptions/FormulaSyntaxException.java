package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a formula can't be parsed: unknown function, wrong number of
 * arguments, unbalanced parentheses or a malformed reference.
 * Carries the offending text and its zero-based position in the formula.
 */
public class FormulaSyntaxException extends RuntimeException {
    private final String offendingText;
    private final int position;

    public FormulaSyntaxException(String message, String offendingText, int position) {
        super(message + " at position " + position + ": '" + offendingText + "'");
        this.offendingText = offendingText;
        this.position = position;
    }

    public FormulaSyntaxException(String message, String offendingText, int position, Throwable cause) {
        this(message, offendingText, position);
        initCause(cause);
    }

    public String getOffendingText() {
        return offendingText;
    }

    public int getPosition() {
        return position;
    }
}
