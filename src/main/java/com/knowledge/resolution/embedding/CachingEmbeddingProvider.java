package com.knowledge.resolution.embedding;

import com.knowledge.resolution.cache.EmbeddingCache;
import com.knowledge.resolution.metrics.MetricsService;
import com.knowledge.resolution.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Decorator that memoises vectors by exact text.
 * Batch calls forward only the texts missing from the cache, each distinct text once.
 */
public class CachingEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(CachingEmbeddingProvider.class);

    private final EmbeddingProvider delegate;
    private final EmbeddingCache cache;
    private final MetricsService metricsService;

    public CachingEmbeddingProvider(EmbeddingProvider delegate, EmbeddingCache cache) {
        this(delegate, cache, new NoOpMetricsService());
    }

    public CachingEmbeddingProvider(EmbeddingProvider delegate, EmbeddingCache cache,
                                    MetricsService metricsService) {
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    @Override
    public float[] embed(String text) {
        Optional<float[]> cached = cache.get(text);
        if (cached.isPresent()) {
            metricsService.recordCacheHit();
            return cached.get();
        }
        metricsService.recordCacheMiss();
        float[] vector = delegate.embed(text);
        cache.put(text, vector);
        return vector;
    }

    @Override
    public List<float[]> embedBatch(List<String> texts) {
        Map<String, float[]> resolved = new HashMap<>();
        Set<String> misses = new LinkedHashSet<>();
        for (String text : texts) {
            if (resolved.containsKey(text) || misses.contains(text)) {
                continue;
            }
            Optional<float[]> cached = cache.get(text);
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                resolved.put(text, cached.get());
            } else {
                metricsService.recordCacheMiss();
                misses.add(text);
            }
        }

        if (!misses.isEmpty()) {
            List<String> missList = new ArrayList<>(misses);
            List<float[]> fetched = delegate.embedBatch(missList);
            if (fetched.size() != missList.size()) {
                throw new EmbeddingException("Provider " + delegate.getProviderName()
                        + " returned " + fetched.size() + " vectors for " + missList.size() + " texts");
            }
            for (int i = 0; i < missList.size(); i++) {
                cache.put(missList.get(i), fetched.get(i));
                resolved.put(missList.get(i), fetched.get(i));
            }
            log.debug("embedding.cache.batch requested={} fetched={}", texts.size(), missList.size());
        }

        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(resolved.get(text));
        }
        return vectors;
    }

    @Override
    public double cosineSimilarity(float[] a, float[] b) {
        return delegate.cosineSimilarity(a, b);
    }

    @Override
    public String getProviderName() {
        return "Caching(" + delegate.getProviderName() + ")";
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }
}
