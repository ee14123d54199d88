package com.spreadsheet.formula.models;

import java.util.Map;

/**
 * JSON body returned after a bulk load or a version restore.
 * For example:
 * {
 *   "values": { "A1": "1", "B1": "#CYCLE!" },
 *   "errors": { "B1": "CircularReference" }
 * }
 */
public class LoadResponse {
    private final Map<String, String> values;
    private final Map<String, ErrorCode> errors;

    public LoadResponse(Map<String, String> values, Map<String, ErrorCode> errors) {
        this.values = values;
        this.errors = errors;
    }

    public Map<String, String> getValues() {
        return values;
    }

    public Map<String, ErrorCode> getErrors() {
        return errors;
    }
}
