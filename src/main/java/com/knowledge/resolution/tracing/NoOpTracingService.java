package com.knowledge.resolution.tracing;

import com.knowledge.resolution.core.model.KnowledgeGraph;

/**
 * Used when no tracer is configured. Every call returns one shared span that ignores all input.
 */
public class NoOpTracingService implements TracingService {

    static final Span DISCARDING_SPAN = new DiscardingSpan();

    @Override
    public Span startBuildSpan(String runId, KnowledgeGraph knowledgeGraph) {
        return DISCARDING_SPAN;
    }

    @Override
    public Span startLinkSpan(String runId, int relationCount) {
        return DISCARDING_SPAN;
    }

    private static final class DiscardingSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
