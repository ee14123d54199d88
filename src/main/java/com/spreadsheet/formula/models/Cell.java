package com.spreadsheet.formula.models;

import com.spreadsheet.formula.parser.ast.Formula;

/**
 * Represents a single spreadsheet cell.
 * Stores:
 * - its coordinate
 * - rawInput (literal text or a formula starting with '=')
 * - formula (parsed form of rawInput, only while it is accepted)
 * - displayValue (the last computed value, never null)
 * - errorState (overrides displayValue when set)
 */
public class Cell {
    public static final String FORMULA_MARKER = "=";

    private final Coordinate coordinate;
    private String rawInput;
    private Formula formula;
    private String displayValue = "";
    private ErrorCode errorState;

    public Cell(Coordinate coordinate, String rawInput) {
        this.coordinate = coordinate;
        this.rawInput = rawInput == null ? "" : rawInput;
    }

    public static boolean isFormulaInput(String rawInput) {
        return rawInput != null && rawInput.startsWith(FORMULA_MARKER);
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    public String getRawInput() {
        return rawInput;
    }

    public void setRawInput(String rawInput) {
        this.rawInput = rawInput == null ? "" : rawInput;
    }

    public boolean isFormulaInput() {
        return isFormulaInput(rawInput);
    }

    public Formula getFormula() {
        return formula;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    public void setFormula(Formula formula) {
        this.formula = formula;
    }

    public String getDisplayValue() {
        return displayValue;
    }

    /**
     * Stores a freshly computed value; a successful evaluation clears any error.
     */
    public void setComputedValue(String value) {
        this.displayValue = value == null ? "" : value;
        this.errorState = null;
    }

    public ErrorCode getErrorState() {
        return errorState;
    }

    public void setErrorState(ErrorCode errorState) {
        this.errorState = errorState;
    }

    /**
     * What a user sees: the error token while an error is set, otherwise the value.
     */
    public String getShownValue() {
        return errorState != null ? errorState.getToken() : displayValue;
    }

    public CellValue toCellValue() {
        return new CellValue(displayValue, errorState);
    }
}
