package com.knowledge.resolution.embedding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedding provider for when no model is configured.
 * Reports itself unavailable, so the graph builder never asks it for vectors.
 */
public class NoOpEmbeddingProvider implements EmbeddingProvider {
    private static final Logger log = LoggerFactory.getLogger(NoOpEmbeddingProvider.class);

    private static final float[] EMPTY = new float[0];

    @Override
    public float[] embed(String text) {
        log.debug("NoOp embedding provider called for '{}'", text);
        return EMPTY;
    }

    @Override
    public String getProviderName() {
        return "NoOp";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
