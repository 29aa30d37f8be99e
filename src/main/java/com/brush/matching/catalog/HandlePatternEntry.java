package com.brush.matching.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A handle maker (optionally a specific handle model) with its patterns.
 *
 * @param maker    handle maker name
 * @param model    handle model, or {@code null} for maker-level patterns
 * @param section  handle catalog section the entry was declared in
 * @param priority section priority; higher wins and scores more when splitting
 * @param patterns compiled patterns, longest first
 */
public record HandlePatternEntry(
        String maker,
        String model,
        String section,
        int priority,
        List<CompiledPattern> patterns
) {
    public HandlePatternEntry {
        Objects.requireNonNull(maker, "maker is required");
        Objects.requireNonNull(section, "section is required");
        if (priority < 0) {
            throw new IllegalArgumentException("priority must be >= 0");
        }
        patterns = patterns.stream()
                .sorted(Comparator.comparingInt((CompiledPattern p) -> p.source().length()).reversed())
                .toList();
    }

    public Optional<CompiledPattern> firstMatch(String text) {
        for (CompiledPattern pattern : patterns) {
            if (pattern.matches(text)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }
}
