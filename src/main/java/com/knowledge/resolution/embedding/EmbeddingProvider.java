package com.knowledge.resolution.embedding;

import java.util.ArrayList;
import java.util.List;

/**
 * Injected capability that turns mention text into vectors.
 * The resolution core never constructs a provider; callers pass one in, or leave it out
 * and matching falls back to lexical signals only.
 *
 * <p>Implementations may be network-bound. The graph builder calls {@link #embedBatch(List)}
 * once per build rather than per pair.</p>
 */
public interface EmbeddingProvider {

    /**
     * Embeds a single text.
     *
     * @throws EmbeddingException if the provider cannot produce a vector
     */
    float[] embed(String text);

    /**
     * Embeds several texts. The result has one vector per input text, in input order.
     *
     * @throws EmbeddingException if the provider cannot produce the vectors
     */
    default List<float[]> embedBatch(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    /**
     * Cosine similarity between two vectors, in [-1, 1].
     */
    default double cosineSimilarity(float[] a, float[] b) {
        return VectorMath.cosine(a, b);
    }

    /**
     * Returns the name/identifier of this provider.
     */
    String getProviderName();

    /**
     * Whether the provider can be called at all. Unavailable providers are skipped without a call.
     */
    default boolean isAvailable() {
        return true;
    }
}
