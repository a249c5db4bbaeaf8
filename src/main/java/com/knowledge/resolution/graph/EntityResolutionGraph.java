package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.MentionRecord;
import com.knowledge.resolution.core.model.ResolutionStats;
import com.knowledge.resolution.core.model.ResolvedEntity;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable result of resolving one batch: the canonical mapping, mention provenance
 * per canonical entity, merged entity views and summary statistics.
 *
 * <p>Lookups never throw for unknown IDs; they return empty results.</p>
 */
public final class EntityResolutionGraph {

    private final Map<String, String> canonicalMapping;
    private final Map<String, List<MentionRecord>> mentionsByCanonical;
    private final Map<String, ResolvedEntity> resolvedEntities;
    private final ResolutionStats stats;
    private final Instant createdAt;

    EntityResolutionGraph(Map<String, String> canonicalMapping,
                          Map<String, List<MentionRecord>> mentionsByCanonical,
                          Map<String, ResolvedEntity> resolvedEntities,
                          int relationCount,
                          Instant createdAt) {
        this.canonicalMapping = canonicalMapping;
        this.mentionsByCanonical = mentionsByCanonical;
        this.resolvedEntities = resolvedEntities;
        this.createdAt = createdAt;
        this.stats = new ResolutionStats(
                canonicalMapping.size(),
                relationCount,
                mentionsByCanonical.size(),
                resolvedEntities.size());
    }

    /**
     * Canonical ID of a mention, or empty if the mention was not part of the batch.
     */
    public Optional<String> getCanonicalId(String mentionId) {
        return mentionId == null ? Optional.empty() : Optional.ofNullable(canonicalMapping.get(mentionId));
    }

    /**
     * Provenance records of a canonical entity in input order, or an empty list for unknown IDs.
     */
    public List<MentionRecord> getMentionsForEntity(String canonicalId) {
        if (canonicalId == null) {
            return List.of();
        }
        return mentionsByCanonical.getOrDefault(canonicalId, List.of());
    }

    public Optional<ResolvedEntity> getResolvedEntity(String canonicalId) {
        return canonicalId == null ? Optional.empty() : Optional.ofNullable(resolvedEntities.get(canonicalId));
    }

    /**
     * Merged entities, one per cluster, in order of first appearance.
     */
    public Collection<ResolvedEntity> getResolvedEntities() {
        return resolvedEntities.values();
    }

    public Set<String> getCanonicalIds() {
        return mentionsByCanonical.keySet();
    }

    /**
     * Total mapping from every input mention ID to its canonical ID, in input order.
     */
    public Map<String, String> getCanonicalMapping() {
        return canonicalMapping;
    }

    public Map<String, List<MentionRecord>> getMentionsByCanonical() {
        return mentionsByCanonical;
    }

    public boolean isCanonical(String mentionId) {
        return mentionId != null && mentionId.equals(canonicalMapping.get(mentionId));
    }

    public ResolutionStats getStats() {
        return stats;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "EntityResolutionGraph{" + stats + ", createdAt=" + createdAt + '}';
    }
}
