package com.knowledge.resolution.cache;

import java.util.Optional;

/**
 * Cache of embedding vectors keyed by exact mention text.
 */
public interface EmbeddingCache {

    /**
     * Gets a cached vector.
     *
     * @param text the mention text
     * @return the cached vector, or empty if not cached
     */
    Optional<float[]> get(String text);

    /**
     * Caches a vector for the given text.
     */
    void put(String text, float[] vector);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    /**
     * Returns cache statistics.
     */
    CacheStats getStats();
}
