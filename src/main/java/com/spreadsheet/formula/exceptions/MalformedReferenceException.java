package com.spreadsheet.formula.exceptions;

/**
 * Thrown when an address or range token can't be resolved to cells
 * of the sheet (e.g. "1A", "A0", or a column beyond the sheet's bounds).
 */
public class MalformedReferenceException extends RuntimeException {
    private final String token;

    public MalformedReferenceException(String token, String message) {
        super(message);
        this.token = token;
    }

    public String getToken() {
        return token;
    }
}
