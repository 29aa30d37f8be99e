package com.brush.matching.core.model;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Semantic class of a handle/knot delimiter. The class decides how the two sides
 * of a split are assigned their roles.
 */
public enum DelimiterClass {
    /** {@code w/} and {@code with}: both sides are scored. */
    KNOT_AMBIGUOUS(List.of(
            Pattern.compile("\\s+w/\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+with\\s+", Pattern.CASE_INSENSITIVE))),
    /** {@code in}: left side is the knot, right side is the handle. */
    HANDLE_PRIMARY(List.of(
            Pattern.compile("\\s+in\\s+", Pattern.CASE_INSENSITIVE))),
    /** {@code /}, {@code -} and {@code +}: scored, tried only after full-string matching fails. */
    NEUTRAL(List.of(
            Pattern.compile("(?<!\\bw)\\s*/\\s*", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\s+-\\s+"),
            Pattern.compile("\\s+\\+\\s+")));

    private final List<Pattern> delimiters;

    DelimiterClass(List<Pattern> delimiters) {
        this.delimiters = delimiters;
    }

    public List<Pattern> delimiters() {
        return delimiters;
    }

    public boolean isScored() {
        return this != HANDLE_PRIMARY;
    }
}
