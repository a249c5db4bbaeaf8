package com.knowledge.resolution.metrics;

import com.knowledge.resolution.core.model.ResolutionMethod;

import java.time.Duration;

/**
 * Interface for recording resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordBuildDuration(Duration duration);

    void recordBuildSize(int mentionCount, int clusterCount);

    void incrementMatch(ResolutionMethod method);

    void incrementEmbeddingFailure();

    void recordRelationsLinked(int relationCount, int remappedEndpoints);

    void recordDuplicatesDropped(int count);

    void recordCacheHit();

    void recordCacheMiss();
}
