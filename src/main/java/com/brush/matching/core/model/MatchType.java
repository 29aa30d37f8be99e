package com.brush.matching.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a {@link MatchResult} was obtained.
 * {@link #NONE} is written as JSON {@code null}.
 */
public enum MatchType {
    /** Curated correct-match override. */
    EXACT,
    /** Model-level catalog pattern, split or composite match. */
    REGEX,
    /** Bare model code resolved to its home brand. */
    ALIAS,
    /** Brand-level fallback without a specific model. */
    BRAND,
    NONE;

    @JsonValue
    public String wireValue() {
        return this == NONE ? null : name().toLowerCase(Locale.ROOT);
    }
}
