package com.brush.matching.cache;

import com.brush.matching.core.model.MatchResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Default when caching is disabled.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<MatchResult> get(String normalizedText) {
        return Optional.empty();
    }

    @Override
    public void put(String normalizedText, MatchResult result) {
        // nothing to store
    }

    @Override
    public void invalidateAll() {
        // nothing to drop
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
