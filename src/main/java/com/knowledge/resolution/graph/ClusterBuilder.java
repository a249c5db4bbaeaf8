package com.knowledge.resolution.graph;

import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.metrics.MetricsService;
import com.knowledge.resolution.metrics.NoOpMetricsService;
import com.knowledge.resolution.similarity.AllPairsGenerator;
import com.knowledge.resolution.similarity.CandidatePairGenerator;
import com.knowledge.resolution.similarity.MatchSignal;
import com.knowledge.resolution.similarity.MentionSimilarityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups mentions into equivalence classes by transitive closure of pairwise matches.
 *
 * <p>Each mention starts in its own set. Every candidate pair is scored and matching
 * pairs are unioned, so A~B and B~C put A, B and C together even when A and C do not
 * match directly. Pairs already in the same set are still scored so that every
 * matching pair is kept as an edge; the cluster summaries then do not depend on input
 * order. Relations play no part in clustering.</p>
 */
public class ClusterBuilder {
    private static final Logger log = LoggerFactory.getLogger(ClusterBuilder.class);

    private final MentionSimilarityScorer scorer;
    private final CandidatePairGenerator pairGenerator;
    private final MetricsService metricsService;

    public ClusterBuilder(MentionSimilarityScorer scorer) {
        this(scorer, new AllPairsGenerator(), new NoOpMetricsService());
    }

    public ClusterBuilder(MentionSimilarityScorer scorer, CandidatePairGenerator pairGenerator,
                          MetricsService metricsService) {
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.pairGenerator = pairGenerator != null ? pairGenerator : new AllPairsGenerator();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    public Clusters build(List<EntityMention> mentions) {
        List<EntityMention> batch = List.copyOf(mentions);
        UnionFind sets = new UnionFind(batch.size());
        List<Clusters.MatchEdge> edges = new ArrayList<>();
        long[] compared = {0};

        pairGenerator.generate(batch, (i, j) -> {
            if (i == j) {
                return;
            }
            compared[0]++;
            EntityMention a = batch.get(i);
            EntityMention b = batch.get(j);
            MatchSignal signal = scorer.score(a, b);
            if (signal.matched()) {
                sets.union(i, j);
                edges.add(new Clusters.MatchEdge(i, j, signal.method(), signal.score()));
                metricsService.incrementMatch(signal.method());
                log.debug("match.accepted a={} b={} method={} score={}",
                        a.getId(), b.getId(), signal.method(), signal.score());
            }
        });

        // number clusters by their first member so output order follows input order
        int[] clusterOf = new int[batch.size()];
        Map<Integer, Integer> clusterByRoot = new HashMap<>();
        List<List<Integer>> members = new ArrayList<>(sets.componentCount());
        for (int i = 0; i < batch.size(); i++) {
            int root = sets.find(i);
            Integer cluster = clusterByRoot.get(root);
            if (cluster == null) {
                cluster = members.size();
                clusterByRoot.put(root, cluster);
                members.add(new ArrayList<>());
            }
            members.get(cluster).add(i);
            clusterOf[i] = cluster;
        }

        List<List<Integer>> frozen = new ArrayList<>(members.size());
        for (List<Integer> cluster : members) {
            frozen.add(List.copyOf(cluster));
        }

        log.debug("clusters.built mentions={} compared={} edges={} clusters={}",
                batch.size(), compared[0], edges.size(), frozen.size());
        return new Clusters(batch, List.copyOf(frozen), clusterOf, List.copyOf(edges));
    }
}
