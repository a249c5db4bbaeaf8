package com.knowledge.resolution.metrics;

import com.knowledge.resolution.core.model.ResolutionMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code erg.build.duration}: Timer</li>
 *   <li>{@code erg.mentions}, {@code erg.clusters}: DistributionSummary per build</li>
 *   <li>{@code erg.match}: Counter (tag: method)</li>
 *   <li>{@code erg.embedding.failures}: Counter</li>
 *   <li>{@code erg.relations.linked}, {@code erg.relations.remapped}, {@code erg.relations.duplicates}: Counters</li>
 *   <li>{@code erg.embedding.cache.hit}, {@code erg.embedding.cache.miss}: Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer buildTimer;
    private final DistributionSummary mentionSummary;
    private final DistributionSummary clusterSummary;
    private final Map<ResolutionMethod, Counter> matchCounters = new EnumMap<>(ResolutionMethod.class);
    private final Counter embeddingFailureCounter;
    private final Counter linkedCounter;
    private final Counter remappedCounter;
    private final Counter duplicateCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.buildTimer = Timer.builder("erg.build.duration")
                .description("Duration of entity resolution graph builds")
                .register(registry);
        this.mentionSummary = DistributionSummary.builder("erg.mentions")
                .description("Mentions per resolution build")
                .register(registry);
        this.clusterSummary = DistributionSummary.builder("erg.clusters")
                .description("Canonical entities per resolution build")
                .register(registry);
        for (ResolutionMethod method : ResolutionMethod.values()) {
            matchCounters.put(method, Counter.builder("erg.match")
                    .description("Mention pairs matched, by signal")
                    .tag("method", method.name())
                    .register(registry));
        }
        this.embeddingFailureCounter = Counter.builder("erg.embedding.failures")
                .description("Embedding batches that failed and fell back to lexical matching")
                .register(registry);
        this.linkedCounter = Counter.builder("erg.relations.linked")
                .description("Relations passed through the relation linker")
                .register(registry);
        this.remappedCounter = Counter.builder("erg.relations.remapped")
                .description("Relation endpoints rewritten to a different canonical id")
                .register(registry);
        this.duplicateCounter = Counter.builder("erg.relations.duplicates")
                .description("Linked relations dropped as duplicates")
                .register(registry);
        this.cacheHitCounter = Counter.builder("erg.embedding.cache.hit")
                .description("Embedding cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("erg.embedding.cache.miss")
                .description("Embedding cache misses")
                .register(registry);
    }

    @Override
    public void recordBuildDuration(Duration duration) {
        buildTimer.record(duration);
    }

    @Override
    public void recordBuildSize(int mentionCount, int clusterCount) {
        mentionSummary.record(mentionCount);
        clusterSummary.record(clusterCount);
    }

    @Override
    public void incrementMatch(ResolutionMethod method) {
        matchCounters.get(method).increment();
    }

    @Override
    public void incrementEmbeddingFailure() {
        embeddingFailureCounter.increment();
    }

    @Override
    public void recordRelationsLinked(int relationCount, int remappedEndpoints) {
        linkedCounter.increment(relationCount);
        remappedCounter.increment(remappedEndpoints);
    }

    @Override
    public void recordDuplicatesDropped(int count) {
        duplicateCounter.increment(count);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
