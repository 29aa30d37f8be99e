package com.brush.matching.correct;

/**
 * A human-reviewed handle/knot split for one exact input.
 *
 * @param original       the input text the split applies to
 * @param handle         handle text, or {@code null}
 * @param knot           knot text, or {@code null}
 * @param shouldNotSplit true if the input must never be split at a delimiter
 */
public record CuratedSplit(String original, String handle, String knot, boolean shouldNotSplit) {
}
