package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.ResolvedEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds a cluster's mentions into a single {@link ResolvedEntity}.
 *
 * <ul>
 *   <li>Types: kept when carried by at least half the members; if no type reaches that,
 *       the canonical mention's types are used.</li>
 *   <li>Attributes: first non-null value per key, visiting longer mentions first
 *       (ties in input order).</li>
 * </ul>
 */
final class ClusterMerger {

    private ClusterMerger() {
    }

    static ResolvedEntity merge(Clusters clusters, int cluster, int canonical) {
        List<EntityMention> mentions = clusters.mentions();
        List<Integer> members = clusters.members(cluster);
        EntityMention representative = mentions.get(canonical);

        Map<String, Integer> typeVotes = new LinkedHashMap<>();
        for (int member : members) {
            for (String type : mentions.get(member).getTypes()) {
                typeVotes.merge(type, 1, Integer::sum);
            }
        }
        int quorum = Math.max(1, (members.size() + 1) / 2);
        List<String> types = new ArrayList<>();
        typeVotes.forEach((type, votes) -> {
            if (votes >= quorum) {
                types.add(type);
            }
        });
        if (types.isEmpty()) {
            types.addAll(representative.getTypes());
        }

        List<Integer> byLength = new ArrayList<>(members);
        byLength.sort(Comparator
                .comparingInt((Integer m) -> mentions.get(m).getMention().length()).reversed()
                .thenComparingInt(m -> m));
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int member : byLength) {
            mentions.get(member).getAttributes().forEach((key, value) -> {
                if (value != null) {
                    attributes.putIfAbsent(key, value);
                }
            });
        }

        return new ResolvedEntity(
                representative.getId(),
                representative.getMention(),
                types,
                attributes,
                members.size(),
                clusters.minSimilarity(cluster),
                clusters.methods(cluster)
        );
    }
}
