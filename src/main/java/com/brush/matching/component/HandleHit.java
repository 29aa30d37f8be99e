package com.brush.matching.component;

import com.brush.matching.catalog.CompiledPattern;
import com.brush.matching.catalog.HandlePatternEntry;

import java.util.Objects;

/**
 * A handle maker identified in some text.
 *
 * @param maker    handle maker
 * @param model    handle model, or {@code null}
 * @param section  handle catalog section, or {@code correct_matches}
 * @param priority section priority of the matching entry
 * @param pattern  the pattern that matched
 */
public record HandleHit(String maker, String model, String section, int priority, String pattern) {

    public HandleHit {
        Objects.requireNonNull(maker, "maker is required");
    }

    public static HandleHit of(HandlePatternEntry entry, CompiledPattern pattern) {
        return new HandleHit(entry.maker(), entry.model(), entry.section(), entry.priority(), pattern.source());
    }

    public static HandleHit exact(String maker, String model) {
        return new HandleHit(maker, model, "correct_matches", 0, CatalogHit.EXACT_PATTERN);
    }
}
