package com.knowledge.resolution.cache;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when {@link CacheConfig#enabled()} is false.
 */
public class NoOpEmbeddingCache implements EmbeddingCache {

    @Override
    public Optional<float[]> get(String text) {
        return Optional.empty();
    }

    @Override
    public void put(String text, float[] vector) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
