package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Cell-level error states. Each code has a short token
 * that is shown in place of the cell's value while the error is set.
 */
public enum ErrorCode {
    MALFORMED_REFERENCE("MalformedReference", "#REF!"),
    FORMULA_SYNTAX_ERROR("FormulaSyntaxError", "#ERROR!"),
    CIRCULAR_REFERENCE("CircularReference", "#CYCLE!"),
    // Reserved: none of the supported functions divide.
    DIVISION_OR_DOMAIN_ERROR("DivisionOrDomainError", "#DIV/0!");

    private final String code;
    private final String token;

    ErrorCode(String code, String token) {
        this.code = code;
        this.token = token;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getToken() {
        return token;
    }
}
