package com.knowledge.resolution.embedding;

/**
 * Raised by an {@link EmbeddingProvider} when it cannot produce vectors.
 * Never escapes a graph build: the affected pairs are scored lexically instead.
 */
public class EmbeddingException extends RuntimeException {

    public EmbeddingException(String message) {
        super(message);
    }

    public EmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }
}
