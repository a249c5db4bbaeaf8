package com.knowledge.resolution.embedding;

import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Vectors for every mention of one batch, fetched with a single provider call.
 *
 * <p>All provider failures are absorbed here: a failed batch yields an index with no
 * vectors, and a failed or ill-formed pair comparison yields no similarity for that pair.</p>
 */
public final class EmbeddingIndex {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingIndex.class);

    private static final EmbeddingIndex EMPTY = new EmbeddingIndex(null, Map.of());

    private final EmbeddingProvider provider;
    private final Map<String, float[]> vectorsByMentionId;

    private EmbeddingIndex(EmbeddingProvider provider, Map<String, float[]> vectorsByMentionId) {
        this.provider = provider;
        this.vectorsByMentionId = vectorsByMentionId;
    }

    /**
     * Index with no vectors; every pair lookup is empty.
     */
    public static EmbeddingIndex empty() {
        return EMPTY;
    }

    /**
     * Embeds the distinct surface texts of {@code mentions} in one batch.
     * Returns {@link #empty()} when there is no usable provider or the batch call fails.
     */
    public static EmbeddingIndex build(EmbeddingProvider provider, List<EntityMention> mentions,
                                       MetricsService metricsService) {
        if (provider == null || mentions.size() < 2) {
            return EMPTY;
        }
        String providerName = nameOf(provider);

        boolean available;
        try {
            available = provider.isAvailable();
        } catch (RuntimeException e) {
            metricsService.incrementEmbeddingFailure();
            log.warn("embedding.availability.failed provider={} error={}", providerName, e.getMessage());
            return EMPTY;
        }
        if (!available) {
            log.debug("embedding.provider.unavailable provider={}", providerName);
            return EMPTY;
        }

        List<String> texts = new ArrayList<>(new LinkedHashSet<>(
                mentions.stream().map(EntityMention::getMention).toList()));

        List<float[]> vectors;
        try {
            vectors = provider.embedBatch(texts);
        } catch (RuntimeException e) {
            metricsService.incrementEmbeddingFailure();
            log.warn("embedding.batch.failed provider={} texts={} error={}",
                    providerName, texts.size(), e.getMessage());
            return EMPTY;
        }
        if (vectors == null || vectors.size() != texts.size()) {
            metricsService.incrementEmbeddingFailure();
            log.warn("embedding.batch.mismatch provider={} texts={} vectors={}",
                    providerName, texts.size(), vectors == null ? 0 : vectors.size());
            return EMPTY;
        }

        Map<String, float[]> byText = new HashMap<>();
        for (int i = 0; i < texts.size(); i++) {
            float[] vector = vectors.get(i);
            // zero vectors carry no direction, so they never count as similar
            if (vector != null && !VectorMath.isZero(vector)) {
                byText.put(texts.get(i), vector);
            }
        }

        Map<String, float[]> byMention = new HashMap<>();
        for (EntityMention mention : mentions) {
            float[] vector = byText.get(mention.getMention());
            if (vector != null) {
                byMention.put(mention.getId(), vector);
            }
        }
        log.debug("embedding.batch.completed provider={} texts={} embedded={}",
                providerName, texts.size(), byText.size());
        return new EmbeddingIndex(provider, byMention);
    }

    private static String nameOf(EmbeddingProvider provider) {
        try {
            String name = provider.getProviderName();
            return name != null ? name : provider.getClass().getSimpleName();
        } catch (RuntimeException e) {
            return provider.getClass().getSimpleName();
        }
    }

    /**
     * Cosine similarity between the vectors of two mentions, if both have one and
     * the provider can compare them.
     */
    public OptionalDouble similarity(String mentionIdA, String mentionIdB) {
        float[] a = vectorsByMentionId.get(mentionIdA);
        float[] b = vectorsByMentionId.get(mentionIdB);
        if (a == null || b == null) {
            return OptionalDouble.empty();
        }
        try {
            double cos = provider.cosineSimilarity(a, b);
            return Double.isNaN(cos) ? OptionalDouble.empty() : OptionalDouble.of(cos);
        } catch (RuntimeException e) {
            log.debug("embedding.compare.failed a={} b={} error={}", mentionIdA, mentionIdB, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public boolean hasVector(String mentionId) {
        return vectorsByMentionId.containsKey(mentionId);
    }

    public int size() {
        return vectorsByMentionId.size();
    }

    public boolean isEmpty() {
        return vectorsByMentionId.isEmpty();
    }
}
