package com.knowledge.resolution.graph;

import com.knowledge.resolution.api.EntityResolutionConfig;
import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.KnowledgeGraph;
import com.knowledge.resolution.core.model.MentionRecord;
import com.knowledge.resolution.core.model.ResolvedEntity;
import com.knowledge.resolution.embedding.EmbeddingIndex;
import com.knowledge.resolution.embedding.EmbeddingProvider;
import com.knowledge.resolution.logging.LogContext;
import com.knowledge.resolution.metrics.MetricsService;
import com.knowledge.resolution.metrics.NoOpMetricsService;
import com.knowledge.resolution.similarity.AllPairsGenerator;
import com.knowledge.resolution.similarity.BlockingKeyStrategy;
import com.knowledge.resolution.similarity.CandidatePairGenerator;
import com.knowledge.resolution.similarity.DefaultBlockingKeyStrategy;
import com.knowledge.resolution.similarity.MentionSimilarityScorer;
import com.knowledge.resolution.similarity.TokenBlockingPairGenerator;
import com.knowledge.resolution.tracing.NoOpTracingService;
import com.knowledge.resolution.tracing.Span;
import com.knowledge.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds an {@link EntityResolutionGraph} from one {@link KnowledgeGraph} snapshot.
 *
 * <p>Pipeline: batch-embed mention texts (if a provider is configured), cluster mentions
 * by transitive pairwise matching, pick a canonical ID per cluster, then index mention
 * provenance and merge each cluster into a {@link ResolvedEntity}.</p>
 *
 * <p>A build is a synchronous computation with no side effects beyond logging and
 * metrics. It never fails on well-typed input: embedding failures degrade to lexical
 * matching, and relations are only counted.</p>
 *
 * <pre>
 * EntityResolutionGraphBuilder builder = EntityResolutionGraphBuilder.builder()
 *     .config(EntityResolutionConfig.defaults())
 *     .embeddingProvider(provider)
 *     .build();
 * EntityResolutionGraph erg = builder.build(knowledgeGraph);
 * </pre>
 */
public class EntityResolutionGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(EntityResolutionGraphBuilder.class);

    private final EntityResolutionConfig config;
    private final EmbeddingProvider embeddingProvider;
    private final BlockingKeyStrategy blockingKeyStrategy;
    private final CandidatePairGenerator pairGenerator;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    private EntityResolutionGraphBuilder(Builder builder) {
        this.config = builder.config != null ? builder.config : EntityResolutionConfig.defaults();
        this.embeddingProvider = builder.embeddingProvider;
        this.blockingKeyStrategy = builder.blockingKeyStrategy != null
                ? builder.blockingKeyStrategy : new DefaultBlockingKeyStrategy();
        this.pairGenerator = builder.pairGenerator;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
    }

    public EntityResolutionGraph build(KnowledgeGraph knowledgeGraph) {
        return build(knowledgeGraph, LogContext.generateRunId());
    }

    /**
     * Resolves a batch, tagging logs with the caller's run ID.
     */
    public EntityResolutionGraph build(KnowledgeGraph knowledgeGraph, String runId) {
        Objects.requireNonNull(knowledgeGraph, "knowledgeGraph is required");

        try (LogContext ctx = LogContext.forBuild(runId);
             Span span = tracingService.startBuildSpan(runId, knowledgeGraph)) {
            try {
                EntityResolutionGraph graph = resolve(knowledgeGraph, span);
                span.setStatus(Span.SpanStatus.OK);
                return graph;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private EntityResolutionGraph resolve(KnowledgeGraph knowledgeGraph, Span span) {
        List<EntityMention> mentions = knowledgeGraph.getEntities();
        Instant start = Instant.now();
        span.setAttribute("similarityThreshold", config.getSimilarityThreshold());

        EmbeddingIndex embeddings = EmbeddingIndex.build(embeddingProvider, mentions, metricsService);
        MentionSimilarityScorer scorer = new MentionSimilarityScorer(config, embeddings);

        CandidatePairGenerator generator = selectPairGenerator(mentions.size());
        Clusters clusters = new ClusterBuilder(scorer, generator, metricsService).build(mentions);

        CanonicalAssigner.Assignment assignment =
                new CanonicalAssigner(config.getCanonicalSelection()).assignAll(clusters);
        Map<String, List<MentionRecord>> provenance = new ProvenanceIndex(scorer).index(clusters, assignment);

        Map<String, ResolvedEntity> resolved = new LinkedHashMap<>();
        for (int c = 0; c < clusters.size(); c++) {
            ResolvedEntity entity = ClusterMerger.merge(clusters, c, assignment.representative(c));
            resolved.put(entity.canonicalId(), entity);
        }

        EntityResolutionGraph graph = new EntityResolutionGraph(
                assignment.mapping(),
                provenance,
                Collections.unmodifiableMap(resolved),
                knowledgeGraph.getRelations().size(),
                Instant.now());

        Duration duration = Duration.between(start, Instant.now());
        metricsService.recordBuildDuration(duration);
        metricsService.recordBuildSize(graph.getStats().mentionCount(), graph.getStats().clusterCount());
        span.setAttribute("clusterCount", graph.getStats().clusterCount());
        span.setAttribute("embeddedMentions", embeddings.size());

        log.info("erg.build.completed mentions={} relations={} clusters={} embedded={} durationMs={}",
                graph.getStats().mentionCount(), graph.getStats().relationCount(),
                graph.getStats().clusterCount(), embeddings.size(), duration.toMillis());
        return graph;
    }

    private CandidatePairGenerator selectPairGenerator(int mentionCount) {
        if (pairGenerator != null) {
            return pairGenerator;
        }
        if (config.isBlockingEnabled() && mentionCount >= config.getBlockingMinEntities()) {
            log.debug("erg.build.blocking mentions={} maxBlockSize={}", mentionCount, config.getMaxBlockSize());
            return new TokenBlockingPairGenerator(blockingKeyStrategy, config.getMaxBlockSize());
        }
        return new AllPairsGenerator();
    }

    public EntityResolutionConfig getConfig() {
        return config;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityResolutionConfig config;
        private EmbeddingProvider embeddingProvider;
        private BlockingKeyStrategy blockingKeyStrategy;
        private CandidatePairGenerator pairGenerator;
        private MetricsService metricsService;
        private TracingService tracingService;

        public Builder config(EntityResolutionConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Optional; without a provider only exact and containment matches fire.
         */
        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        public Builder blockingKeyStrategy(BlockingKeyStrategy blockingKeyStrategy) {
            this.blockingKeyStrategy = blockingKeyStrategy;
            return this;
        }

        /**
         * Overrides candidate selection entirely, ignoring the blocking settings of the config.
         */
        public Builder pairGenerator(CandidatePairGenerator pairGenerator) {
            this.pairGenerator = pairGenerator;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public EntityResolutionGraphBuilder build() {
            return new EntityResolutionGraphBuilder(this);
        }
    }
}
