package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.Coordinate;

/**
 * Read-only access to cell values during evaluation.
 * Unset cells read as the empty string.
 */
@FunctionalInterface
public interface CellValueSource {

    String valueAt(Coordinate coordinate);
}
