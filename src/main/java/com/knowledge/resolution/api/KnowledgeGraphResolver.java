package com.knowledge.resolution.api;

import com.knowledge.resolution.cache.CacheConfig;
import com.knowledge.resolution.cache.CaffeineEmbeddingCache;
import com.knowledge.resolution.core.model.KnowledgeGraph;
import com.knowledge.resolution.core.model.Relation;
import com.knowledge.resolution.embedding.CachingEmbeddingProvider;
import com.knowledge.resolution.embedding.EmbeddingProvider;
import com.knowledge.resolution.graph.EntityResolutionGraph;
import com.knowledge.resolution.graph.EntityResolutionGraphBuilder;
import com.knowledge.resolution.linking.LinkingResult;
import com.knowledge.resolution.linking.RelationLinker;
import com.knowledge.resolution.logging.LogContext;
import com.knowledge.resolution.metrics.MetricsService;
import com.knowledge.resolution.metrics.NoOpMetricsService;
import com.knowledge.resolution.tracing.NoOpTracingService;
import com.knowledge.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Main entry point: resolves a {@link KnowledgeGraph} batch into an
 * {@link EntityResolutionGraph} and a deduplicated list of canonical relations.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * KnowledgeGraphResolver resolver = KnowledgeGraphResolver.builder()
 *     .config(EntityResolutionConfig.load())
 *     .embeddingProvider(provider)
 *     .cacheConfig(CacheConfig.defaults())
 *     .build();
 *
 * ResolutionOutcome outcome = resolver.resolve(knowledgeGraph);
 * outcome.erg().getCanonicalId("gunners_1");
 * outcome.relations();
 * </pre>
 *
 * <p>Instances are stateless apart from the optional embedding cache and may be reused
 * across batches. Each call is an independent computation over one snapshot.</p>
 */
public class KnowledgeGraphResolver {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphResolver.class);

    private final EntityResolutionGraphBuilder graphBuilder;
    private final RelationLinker relationLinker;

    private KnowledgeGraphResolver(Builder builder) {
        EmbeddingProvider provider = builder.embeddingProvider;
        if (provider != null && builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            provider = new CachingEmbeddingProvider(
                    provider, CaffeineEmbeddingCache.create(builder.cacheConfig), builder.metricsService);
        }
        this.graphBuilder = EntityResolutionGraphBuilder.builder()
                .config(builder.config)
                .embeddingProvider(provider)
                .metricsService(builder.metricsService)
                .tracingService(builder.tracingService)
                .build();
        this.relationLinker = new RelationLinker(builder.metricsService, builder.tracingService);
    }

    /**
     * Builds the graph, links relations against it and deduplicates them.
     */
    public ResolutionOutcome resolve(KnowledgeGraph knowledgeGraph) {
        Objects.requireNonNull(knowledgeGraph, "knowledgeGraph is required");
        String runId = LogContext.generateRunId();
        log.debug("resolve.started runId={} mentions={} relations={}",
                runId, knowledgeGraph.getEntities().size(), knowledgeGraph.getRelations().size());

        EntityResolutionGraph erg = graphBuilder.build(knowledgeGraph, runId);
        LinkingResult linkingResult = relationLinker.linkRelations(knowledgeGraph.getRelations(), erg, runId);
        List<Relation> relations = relationLinker.deduplicateLinked(linkingResult);

        return new ResolutionOutcome(runId, erg, linkingResult, relations);
    }

    /**
     * Builds only the entity resolution graph.
     */
    public EntityResolutionGraph buildGraph(KnowledgeGraph knowledgeGraph) {
        return graphBuilder.build(knowledgeGraph);
    }

    public EntityResolutionConfig getConfig() {
        return graphBuilder.getConfig();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityResolutionConfig config = EntityResolutionConfig.defaults();
        private EmbeddingProvider embeddingProvider;
        private CacheConfig cacheConfig;
        private MetricsService metricsService = new NoOpMetricsService();
        private TracingService tracingService = new NoOpTracingService();

        public Builder config(EntityResolutionConfig config) {
            this.config = Objects.requireNonNull(config, "config is required");
            return this;
        }

        public Builder embeddingProvider(EmbeddingProvider embeddingProvider) {
            this.embeddingProvider = embeddingProvider;
            return this;
        }

        /**
         * Wraps the embedding provider in a Caffeine cache. Ignored without a provider.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = Objects.requireNonNull(metricsService, "metricsService is required");
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = Objects.requireNonNull(tracingService, "tracingService is required");
            return this;
        }

        public KnowledgeGraphResolver build() {
            return new KnowledgeGraphResolver(this);
        }
    }
}
