package com.spreadsheet.formula.exceptions;

/**
 * Thrown when restoring a history sequence number that is no longer
 * (or never was) in a sheet's version history.
 */
public class VersionNotFoundException extends RuntimeException {
    public VersionNotFoundException(String message) {
        super(message);
    }
}
