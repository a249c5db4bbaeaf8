package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.MentionRecord;
import com.knowledge.resolution.core.model.ResolutionMethod;
import com.knowledge.resolution.similarity.MatchSignal;
import com.knowledge.resolution.similarity.MentionSimilarityScorer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Records which original mentions collapsed into each canonical ID.
 *
 * <p>Records are grouped by canonical ID and keep input order inside each group.
 * A mention's chunk index is carried through from the extraction stage; mentions
 * without one get their input position. Confidence is the mention's own match score
 * against the canonical mention, or the cluster's weakest edge when the two are joined
 * only transitively.</p>
 */
public class ProvenanceIndex {

    private final MentionSimilarityScorer scorer;

    public ProvenanceIndex(MentionSimilarityScorer scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
    }

    public Map<String, List<MentionRecord>> index(Clusters clusters, CanonicalAssigner.Assignment assignment) {
        List<EntityMention> mentions = clusters.mentions();
        Map<String, List<MentionRecord>> grouped = new LinkedHashMap<>();

        for (int i = 0; i < mentions.size(); i++) {
            EntityMention mention = mentions.get(i);
            int cluster = clusters.clusterOf(i);
            int canonical = assignment.representative(cluster);
            String canonicalId = mentions.get(canonical).getId();

            double confidence;
            ResolutionMethod method;
            if (i == canonical) {
                confidence = 1.0;
                method = ResolutionMethod.CANONICAL;
            } else {
                MatchSignal signal = scorer.score(mention, mentions.get(canonical));
                if (signal.matched()) {
                    confidence = signal.score();
                    method = signal.method();
                } else {
                    confidence = clusters.minSimilarity(cluster);
                    method = ResolutionMethod.TRANSITIVE;
                }
            }

            int chunkIndex = mention.getChunkIndex().orElse(i);
            grouped.computeIfAbsent(canonicalId, k -> new ArrayList<>())
                    .add(new MentionRecord(mention.getId(), mention.getMention(), chunkIndex, confidence, method));
        }

        Map<String, List<MentionRecord>> frozen = new LinkedHashMap<>();
        grouped.forEach((canonicalId, records) -> frozen.put(canonicalId, List.copyOf(records)));
        return Collections.unmodifiableMap(frozen);
    }
}
