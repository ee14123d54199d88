package com.spreadsheet.formula.models;

import java.util.Objects;

/**
 * Value and optional error of one cell, as reported to callers after an edit.
 */
public final class CellValue {
    private final String value;
    private final ErrorCode error;

    public CellValue(String value, ErrorCode error) {
        this.value = value == null ? "" : value;
        this.error = error;
    }

    public String getValue() {
        return value;
    }

    public ErrorCode getError() {
        return error;
    }

    public String getShownValue() {
        return error != null ? error.getToken() : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return value.equals(other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? value : value + " [" + error.getCode() + "]";
    }
}
