package com.brush.matching.cache;

/**
 * Snapshot of result cache counters.
 *
 * @param hitCount       lookups answered from the cache
 * @param missCount      lookups that ran the strategy chain
 * @param evictionCount  entries removed for size or expiry
 * @param size           approximate number of entries
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Fraction of lookups served from the cache, 0.0 when nothing was looked up.
     */
    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 0.0 : (double) hitCount / requests;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
