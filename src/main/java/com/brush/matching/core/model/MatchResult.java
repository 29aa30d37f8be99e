package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Outcome of matching one input string.
 * A result with a {@code null} {@code matched} record is a normal outcome,
 * not an error.
 *
 * @param original  the input text, carried through for traceability
 * @param matched   the matched brush record, or {@code null}
 * @param matchType how the match was obtained; {@link MatchType#NONE} when unmatched
 * @param pattern   the pattern that produced the match, or {@code null}
 */
@JsonPropertyOrder({"original", "matched", "match_type", "pattern"})
public record MatchResult(
        @JsonProperty("original") String original,
        @JsonProperty("matched") BrushMatch matched,
        @JsonProperty("match_type") MatchType matchType,
        @JsonProperty("pattern") String pattern
) {
    public MatchResult {
        Objects.requireNonNull(matchType, "matchType is required");
        if (matched == null && matchType != MatchType.NONE) {
            throw new IllegalArgumentException("matchType must be NONE when nothing matched");
        }
        if (matched != null && matchType == MatchType.NONE) {
            throw new IllegalArgumentException("matchType NONE requires an empty match");
        }
    }

    /**
     * Creates a no-match result.
     */
    public static MatchResult noMatch(String original) {
        return new MatchResult(original, null, MatchType.NONE, null);
    }

    public static MatchResult of(String original, BrushMatch matched, MatchType matchType, String pattern) {
        Objects.requireNonNull(matched, "matched is required");
        return new MatchResult(original, matched, matchType, pattern);
    }

    /**
     * Returns true if a brush record was produced.
     */
    public boolean hasMatch() {
        return matched != null;
    }

    /**
     * Returns a copy carrying a different original text.
     */
    public MatchResult withOriginal(String newOriginal) {
        if (Objects.equals(original, newOriginal)) {
            return this;
        }
        return new MatchResult(newOriginal, matched, matchType, pattern);
    }
}
