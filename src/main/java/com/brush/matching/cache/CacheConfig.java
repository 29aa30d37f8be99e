package com.brush.matching.cache;

/**
 * Result cache settings.
 *
 * @param maxSize                    maximum number of cached results
 * @param expireAfterAccessSeconds   idle time before an entry expires; 0 keeps entries until evicted
 * @param enabled                    whether a cache is created at all
 */
public record CacheConfig(int maxSize, int expireAfterAccessSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (expireAfterAccessSeconds < 0) {
            throw new IllegalArgumentException("expireAfterAccessSeconds must be >= 0");
        }
    }

    /**
     * 50,000 entries without expiry. The catalog is immutable, so results only go stale on reload.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 0, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 0, false);
    }
}
