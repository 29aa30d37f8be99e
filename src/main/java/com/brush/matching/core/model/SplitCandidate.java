package com.brush.matching.core.model;

import java.util.Objects;

/**
 * A proposed handle/knot split of one input string.
 *
 * @param handleText     text assigned the handle role
 * @param knotText       text assigned the knot role
 * @param delimiter      the delimiter text as it appeared, trimmed
 * @param delimiterClass class of the delimiter that produced the split
 * @param handleScore    handle-likelihood of the handle side
 * @param knotScore      knot-likelihood of the knot side
 */
public record SplitCandidate(
        String handleText,
        String knotText,
        String delimiter,
        DelimiterClass delimiterClass,
        int handleScore,
        int knotScore
) {
    public SplitCandidate {
        Objects.requireNonNull(handleText, "handleText is required");
        Objects.requireNonNull(knotText, "knotText is required");
        Objects.requireNonNull(delimiterClass, "delimiterClass is required");
    }

    public int totalScore() {
        return handleScore + knotScore;
    }
}
