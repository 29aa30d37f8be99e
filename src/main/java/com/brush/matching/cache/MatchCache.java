package com.brush.matching.cache;

import com.brush.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * Cache of match results keyed by normalized (lowercase) text.
 */
public interface MatchCache {

    /**
     * Gets a cached result.
     *
     * @param normalizedText the normalized input text
     * @return the cached result, or empty if not cached
     */
    Optional<MatchResult> get(String normalizedText);

    /**
     * Caches a result.
     */
    void put(String normalizedText, MatchResult result);

    /**
     * Drops every entry, for example after the catalog has been reloaded.
     */
    void invalidateAll();

    CacheStats getStats();
}
