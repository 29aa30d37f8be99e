package com.brush.matching.core.model;

import java.util.Objects;

/**
 * One record handed over by the extraction stage.
 *
 * @param original   the text as the user wrote it, carried through untouched
 * @param normalized the cleaned text that matching operates on
 */
public record BrushInput(String original, String normalized) {

    public BrushInput {
        Objects.requireNonNull(normalized, "normalized is required");
        if (original == null) {
            original = normalized;
        }
    }

    /**
     * Creates an input whose normalized form is the stripped original.
     */
    public static BrushInput of(String text) {
        Objects.requireNonNull(text, "text is required");
        return new BrushInput(text, text.strip());
    }
}
