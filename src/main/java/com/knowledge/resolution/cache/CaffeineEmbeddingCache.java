package com.knowledge.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine-backed embedding cache, bounded by entry count and expiring entries after write.
 * Vectors are stored as given; callers must not mutate them afterwards.
 */
public class CaffeineEmbeddingCache implements EmbeddingCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineEmbeddingCache.class);

    private final Cache<String, float[]> cache;

    public CaffeineEmbeddingCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("CaffeineEmbeddingCache initialized: maxSize={}, ttl={}s",
                config.maxSize(), config.ttlSeconds());
    }

    /**
     * Creates the cache the config asks for: Caffeine when enabled, no-op otherwise.
     */
    public static EmbeddingCache create(CacheConfig config) {
        return config.enabled() ? new CaffeineEmbeddingCache(config) : new NoOpEmbeddingCache();
    }

    @Override
    public Optional<float[]> get(String text) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(cache.getIfPresent(text));
    }

    @Override
    public void put(String text, float[] vector) {
        if (text == null || vector == null) {
            return;
        }
        cache.put(text, vector);
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("Invalidated all embedding cache entries");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
