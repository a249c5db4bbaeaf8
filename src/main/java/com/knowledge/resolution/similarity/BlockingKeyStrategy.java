package com.knowledge.resolution.similarity;

import java.util.Set;

/**
 * Strategy interface for generating blocking keys from mention text.
 * Mentions that share at least one key become candidate pairs; mentions sharing
 * none are never compared.
 */
public interface BlockingKeyStrategy {

    /**
     * Generates blocking keys for a mention's surface text.
     *
     * @param mention raw surface text
     * @return set of blocking keys (never null, may be empty)
     */
    Set<String> generateKeys(String mention);
}
