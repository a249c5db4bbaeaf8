package com.knowledge.resolution.metrics;

import com.knowledge.resolution.core.model.ResolutionMethod;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordBuildDuration(Duration duration) {
    }

    @Override
    public void recordBuildSize(int mentionCount, int clusterCount) {
    }

    @Override
    public void incrementMatch(ResolutionMethod method) {
    }

    @Override
    public void incrementEmbeddingFailure() {
    }

    @Override
    public void recordRelationsLinked(int relationCount, int remappedEndpoints) {
    }

    @Override
    public void recordDuplicatesDropped(int count) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
