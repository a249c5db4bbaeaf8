package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.EntityMention;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Picks one representative mention ID per cluster and maps every member to it.
 * The representative maps to itself, so the mapping covers every input mention.
 */
public class CanonicalAssigner {

    private final CanonicalSelection selection;

    public CanonicalAssigner(CanonicalSelection selection) {
        this.selection = Objects.requireNonNull(selection, "selection is required");
    }

    /**
     * Canonical ID for one cluster.
     *
     * @param cluster  input positions of the cluster's members
     * @param mentions all mentions of the batch, in input order
     */
    public String assign(List<Integer> cluster, List<EntityMention> mentions) {
        if (cluster.isEmpty()) {
            throw new IllegalArgumentException("cluster must not be empty");
        }
        return mentions.get(selection.select(cluster, mentions)).getId();
    }

    /**
     * Assigns every cluster and returns the total mention-to-canonical mapping.
     */
    public Assignment assignAll(Clusters clusters) {
        List<EntityMention> mentions = clusters.mentions();
        int[] representatives = new int[clusters.size()];
        for (int c = 0; c < clusters.size(); c++) {
            representatives[c] = selection.select(clusters.members(c), mentions);
        }

        Map<String, String> mapping = new LinkedHashMap<>();
        for (int i = 0; i < mentions.size(); i++) {
            int representative = representatives[clusters.clusterOf(i)];
            mapping.put(mentions.get(i).getId(), mentions.get(representative).getId());
        }
        return new Assignment(representatives, Collections.unmodifiableMap(mapping));
    }

    public CanonicalSelection getSelection() {
        return selection;
    }

    /**
     * Result of {@link #assignAll(Clusters)}.
     *
     * @param representatives input position of each cluster's canonical mention, by cluster index
     * @param mapping         mention ID to canonical ID, in input order
     */
    public record Assignment(int[] representatives, Map<String, String> mapping) {

        public int representative(int cluster) {
            return representatives[cluster];
        }
    }
}
