package com.knowledge.resolution.core.model;

/**
 * How a mention came to share a canonical ID with another mention.
 */
public enum ResolutionMethod {
    /** The mention is the representative of its cluster. */
    CANONICAL,
    /** Case-insensitive identical surface text. */
    EXACT,
    /** One surface text contains the other, case-insensitively. */
    CONTAINMENT,
    /** Embedding cosine similarity at or above the configured threshold. */
    EMBEDDING,
    /** Joined only through other members of the cluster. */
    TRANSITIVE
}
