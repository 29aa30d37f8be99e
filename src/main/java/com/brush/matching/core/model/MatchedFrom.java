package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which part of the input produced the winning match.
 */
public enum MatchedFrom {
    FULL_STRING("full_string"),
    HANDLE_PART("handle_part"),
    KNOT_PART("knot_part");

    private final String wireValue;

    MatchedFrom(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
