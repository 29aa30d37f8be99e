package com.brush.matching.correct;

import com.brush.matching.core.model.Fiber;

import java.util.Objects;

/**
 * One curated override, keyed by lowercase normalized text.
 *
 * @param kind        what the override describes
 * @param key         lowercase lookup key
 * @param brand       brand or handle maker (not used by {@link Kind#SPLIT})
 * @param model       model (not used by {@link Kind#SPLIT})
 * @param fiber       explicit knot fiber, or {@code null}
 * @param knotSizeMm  explicit knot size, or {@code null}
 * @param handleText  handle text of a split, or {@code null}
 * @param knotText    knot text of a split, or {@code null}
 */
public record CorrectMatchEntry(
        Kind kind,
        String key,
        String brand,
        String model,
        Fiber fiber,
        Double knotSizeMm,
        String handleText,
        String knotText
) {
    public enum Kind {
        /** Complete brush. */
        BRUSH,
        /** Handle only. */
        HANDLE,
        /** Knot only. */
        KNOT,
        /** Pre-split handle and knot texts. */
        SPLIT
    }

    public CorrectMatchEntry {
        Objects.requireNonNull(kind, "kind is required");
        Objects.requireNonNull(key, "key is required");
        if (kind == Kind.SPLIT) {
            if (handleText == null && knotText == null) {
                throw new IllegalArgumentException("split entry '" + key + "' needs a handle or knot text");
            }
        } else {
            Objects.requireNonNull(brand, "brand is required");
        }
    }

    public static CorrectMatchEntry brush(String key, String brand, String model) {
        return new CorrectMatchEntry(Kind.BRUSH, key, brand, model, null, null, null, null);
    }

    public static CorrectMatchEntry handle(String key, String maker, String model) {
        return new CorrectMatchEntry(Kind.HANDLE, key, maker, model, null, null, null, null);
    }

    public static CorrectMatchEntry knot(String key, String brand, String model, Fiber fiber, Double knotSizeMm) {
        return new CorrectMatchEntry(Kind.KNOT, key, brand, model, fiber, knotSizeMm, null, null);
    }

    public static CorrectMatchEntry split(String key, String handleText, String knotText) {
        return new CorrectMatchEntry(Kind.SPLIT, key, null, null, null, null, handleText, knotText);
    }
}
