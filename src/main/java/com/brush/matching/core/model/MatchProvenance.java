package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Records how a match was produced.
 *
 * @param strategy           name of the strategy that produced the match
 * @param pattern            the literal catalog pattern that matched, if any
 * @param sourceText         the text the winning pattern was applied to
 * @param matchedFrom        which part of the input produced the match
 * @param originalHandleText handle substring before matching, when a split occurred
 * @param originalKnotText   knot substring before matching, when a split occurred
 * @param delimiter          delimiter that produced the split, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MatchProvenance(
        @JsonProperty("_matched_by_strategy") String strategy,
        @JsonProperty("_pattern_used") String pattern,
        @JsonProperty("_source_text") String sourceText,
        @JsonProperty("_matched_from") MatchedFrom matchedFrom,
        @JsonProperty("_original_handle_text") String originalHandleText,
        @JsonProperty("_original_knot_text") String originalKnotText,
        @JsonProperty("_delimiter") String delimiter
) {
    public MatchProvenance {
        Objects.requireNonNull(strategy, "strategy is required");
        Objects.requireNonNull(matchedFrom, "matchedFrom is required");
    }

    /**
     * Provenance for a match made against the whole input string.
     */
    public static MatchProvenance fullString(String strategy, String pattern, String sourceText) {
        return new MatchProvenance(strategy, pattern, sourceText, MatchedFrom.FULL_STRING,
                null, null, null);
    }

    @JsonIgnore
    public boolean isSplit() {
        return originalHandleText != null || originalKnotText != null;
    }
}
