package com.brush.matching.compose;

import com.brush.matching.core.model.SplitCandidate;

/**
 * The handle and knot substrings of a split, verbatim.
 *
 * @param handleText handle substring, or {@code null} when the split names only a knot
 * @param knotText   knot substring, or {@code null} when the split names only a handle
 * @param delimiter  delimiter that produced the split, or {@code null} for curated splits
 */
public record SplitParts(String handleText, String knotText, String delimiter) {

    public SplitParts {
        if (handleText == null && knotText == null) {
            throw new IllegalArgumentException("a split needs a handle or a knot text");
        }
    }

    public static SplitParts of(SplitCandidate candidate) {
        return new SplitParts(candidate.handleText(), candidate.knotText(), candidate.delimiter());
    }

    public static SplitParts curated(String handleText, String knotText) {
        return new SplitParts(handleText, knotText, null);
    }
}
