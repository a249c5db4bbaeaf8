package com.knowledge.resolution.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merged view of one equivalence class.
 *
 * @param canonicalId   the cluster's representative mention ID
 * @param mention       surface text of the representative
 * @param types         types kept by majority vote across members
 * @param attributes    attributes merged across members, longer mentions winning, in merge order
 * @param memberCount   number of mentions in the cluster
 * @param minSimilarity weakest match score inside the cluster, 1.0 for singletons
 * @param methods       match signals that formed the cluster
 */
public record ResolvedEntity(
        String canonicalId,
        String mention,
        List<String> types,
        Map<String, Object> attributes,
        int memberCount,
        double minSimilarity,
        Set<ResolutionMethod> methods
) {
    public ResolvedEntity {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(mention, "mention is required");
        types = List.copyOf(types);
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        methods = Set.copyOf(methods);
        if (memberCount <= 0) {
            throw new IllegalArgumentException("memberCount must be positive");
        }
    }

    public boolean isSingleton() {
        return memberCount == 1;
    }
}
