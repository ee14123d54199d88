package com.spreadsheet.formula.parser.ast;

import java.util.Locale;

/**
 * The closed set of functions a formula may call.
 */
public enum FunctionName {
    SUM,
    AVERAGE,
    COUNT,
    MIN,
    MAX,
    IF;

    /**
     * Case-insensitive lookup; returns null for names outside the set.
     */
    public static FunctionName fromName(String name) {
        String upper = name.toUpperCase(Locale.ROOT);
        for (FunctionName fn : values()) {
            if (fn.name().equals(upper)) {
                return fn;
            }
        }
        return null;
    }
}
