package com.spreadsheet.formula.models;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk load: every displayed value plus the cells left in an error state.
 */
public final class LoadResult {
    private final Map<Coordinate, String> values;
    private final List<CellError> errors;

    public LoadResult(Map<Coordinate, String> values, List<CellError> errors) {
        this.values = values;
        this.errors = errors;
    }

    public Map<Coordinate, String> getValues() {
        return values;
    }

    public List<CellError> getErrors() {
        return errors;
    }
}
