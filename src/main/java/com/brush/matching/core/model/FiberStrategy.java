package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the reported fiber came from.
 */
public enum FiberStrategy {
    /** The user named the fiber and it was accepted. */
    USER_INPUT("user_input"),
    /** The user named nothing; the catalog value was used. */
    DEFAULT("default"),
    /** The user named a different fiber; the catalog value was kept. */
    YAML("yaml");

    private final String wireValue;

    FiberStrategy(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
