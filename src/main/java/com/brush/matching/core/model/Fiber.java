package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Bristle material of a brush knot.
 */
public enum Fiber {
    BADGER("Badger"),
    BOAR("Boar"),
    SYNTHETIC("Synthetic"),
    HORSE("Horse"),
    MIXED("Mixed"),
    UNKNOWN("Unknown");

    private final String displayName;

    Fiber(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String displayName() {
        return displayName;
    }

    /**
     * Parses a fiber value as written in a catalog file.
     * Values such as {@code "Mixed Badger/Boar"} map to {@link #MIXED}.
     *
     * @throws IllegalArgumentException if the value names no known fiber
     */
    public static Fiber fromCatalog(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fiber value is blank");
        }
        String lower = value.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("mixed")) {
            return MIXED;
        }
        for (Fiber fiber : values()) {
            if (fiber.displayName.toLowerCase(Locale.ROOT).equals(lower)) {
                return fiber;
            }
        }
        throw new IllegalArgumentException("Unknown fiber: " + value);
    }
}
