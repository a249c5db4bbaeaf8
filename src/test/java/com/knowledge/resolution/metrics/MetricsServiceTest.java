package com.knowledge.resolution.metrics;

import com.knowledge.resolution.core.model.ResolutionMethod;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallable() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordBuildDuration(Duration.ofMillis(5));
                noOp.recordBuildSize(7, 5);
                noOp.incrementMatch(ResolutionMethod.EXACT);
                noOp.incrementEmbeddingFailure();
                noOp.recordRelationsLinked(3, 2);
                noOp.recordDuplicatesDropped(1);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Build duration and sizes are recorded")
        void buildMetrics() {
            metrics.recordBuildDuration(Duration.ofMillis(40));
            metrics.recordBuildSize(7, 5);
            metrics.recordBuildSize(3, 3);

            Timer timer = registry.find("erg.build.duration").timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
            assertEquals(40.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);

            DistributionSummary mentions = registry.find("erg.mentions").summary();
            DistributionSummary clusters = registry.find("erg.clusters").summary();
            assertEquals(10.0, mentions.totalAmount());
            assertEquals(8.0, clusters.totalAmount());
            assertEquals(2, clusters.count());
        }

        @Test
        @DisplayName("Match counter is tagged by method")
        void matchCounter() {
            metrics.incrementMatch(ResolutionMethod.EXACT);
            metrics.incrementMatch(ResolutionMethod.EXACT);
            metrics.incrementMatch(ResolutionMethod.EMBEDDING);

            assertEquals(2.0, registry.find("erg.match").tag("method", "EXACT").counter().count());
            assertEquals(1.0, registry.find("erg.match").tag("method", "EMBEDDING").counter().count());
            assertEquals(0.0, registry.find("erg.match").tag("method", "CONTAINMENT").counter().count());
        }

        @Test
        @DisplayName("Relation counters accumulate")
        void relationCounters() {
            metrics.recordRelationsLinked(3, 2);
            metrics.recordRelationsLinked(1, 0);
            metrics.recordDuplicatesDropped(2);

            assertEquals(4.0, registry.find("erg.relations.linked").counter().count());
            assertEquals(2.0, registry.find("erg.relations.remapped").counter().count());
            assertEquals(2.0, registry.find("erg.relations.duplicates").counter().count());
        }

        @Test
        @DisplayName("Embedding failure and cache counters increment")
        void embeddingCounters() {
            metrics.incrementEmbeddingFailure();
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(1.0, registry.find("erg.embedding.failures").counter().count());
            assertEquals(2.0, registry.find("erg.embedding.cache.hit").counter().count());
            assertEquals(1.0, registry.find("erg.embedding.cache.miss").counter().count());
        }
    }
}
