package com.knowledge.resolution.cache;

/**
 * Configuration for the embedding cache.
 *
 * @param maxSize    maximum number of cached vectors
 * @param ttlSeconds time-to-live in seconds for each vector
 * @param enabled    whether caching is enabled
 */
public record CacheConfig(int maxSize, int ttlSeconds, boolean enabled) {

    public CacheConfig {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be > 0");
        }
    }

    /**
     * Default: 50,000 vectors, one hour TTL, enabled.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(50_000, 3_600, true);
    }

    public static CacheConfig disabled() {
        return new CacheConfig(1, 1, false);
    }
}
