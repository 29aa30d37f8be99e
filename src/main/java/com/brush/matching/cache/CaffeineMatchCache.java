package com.brush.matching.cache;

import com.brush.matching.core.model.MatchResult;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed result cache. Safe to share across matching threads.
 */
public class CaffeineMatchCache implements MatchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<String, MatchResult> cache;

    public CaffeineMatchCache(CacheConfig config) {
        Caffeine<Object, Object> builder = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .recordStats();
        if (config.expireAfterAccessSeconds() > 0) {
            builder.expireAfterAccess(Duration.ofSeconds(config.expireAfterAccessSeconds()));
        }
        this.cache = builder.build();
        log.info("cache.initialized maxSize={} expireAfterAccess={}s",
                config.maxSize(), config.expireAfterAccessSeconds());
    }

    @Override
    public Optional<MatchResult> get(String normalizedText) {
        return Optional.ofNullable(cache.getIfPresent(normalizedText));
    }

    @Override
    public void put(String normalizedText, MatchResult result) {
        cache.put(normalizedText, result);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("cache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), cache.estimatedSize());
    }
}
