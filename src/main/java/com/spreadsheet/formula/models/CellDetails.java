package com.spreadsheet.formula.models;

/**
 * Everything known about one cell, for GET /sheet/{id}/cell/{address}.
 * 'formula' is null when the cell holds a literal.
 */
public class CellDetails {
    private final String address;
    private final String rawInput;
    private final String formula;
    private final String value;
    private final ErrorCode error;

    public CellDetails(String address, String rawInput, String formula, String value, ErrorCode error) {
        this.address = address;
        this.rawInput = rawInput;
        this.formula = formula;
        this.value = value;
        this.error = error;
    }

    public String getAddress() {
        return address;
    }

    public String getRawInput() {
        return rawInput;
    }

    public String getFormula() {
        return formula;
    }

    public String getValue() {
        return value;
    }

    public ErrorCode getError() {
        return error;
    }
}
