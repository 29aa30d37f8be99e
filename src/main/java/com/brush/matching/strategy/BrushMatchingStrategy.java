package com.brush.matching.strategy;

import com.brush.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * One step of the matching chain.
 * Returns a complete result or nothing; exceptions propagate to the caller.
 */
public interface BrushMatchingStrategy {

    /**
     * Attempts to match lowercase, normalized text.
     */
    Optional<MatchResult> match(String text);

    /**
     * Stable name recorded in provenance and metrics.
     */
    String getName();
}
