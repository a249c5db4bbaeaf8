package com.knowledge.resolution.tracing;

/**
 * A traced unit of work. Closing the span ends it, so spans fit try-with-resources:
 * <pre>
 * try (Span span = tracingService.startBuildSpan(runId, knowledgeGraph)) {
 *     span.setAttribute("clusterCount", clusters.size());
 *     ...
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records {@code t} and marks the span as failed.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
