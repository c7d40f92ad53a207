package com.identity.matching.cache;

/**
 * Configuration for the match cache. Whether a matcher caches at all is decided by
 * its options, not here.
 *
 * @param maxSize    maximum number of entries
 * @param ttlSeconds time-to-live in seconds for each entry
 */
public record CacheConfig(int maxSize, int ttlSeconds) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * 10,000 entries, 300s TTL.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(10_000, 300);
    }
}
