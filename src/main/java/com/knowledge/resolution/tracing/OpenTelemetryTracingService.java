package com.knowledge.resolution.tracing;

import com.knowledge.resolution.core.model.KnowledgeGraph;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Objects;

/**
 * {@link TracingService} that reports build and linking spans to OpenTelemetry.
 * Requires {@code opentelemetry-api} on the classpath (optional dependency).
 *
 * <p>Spans are {@link SpanKind#INTERNAL}; resolution never crosses a process boundary.</p>
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.knowledge.resolution";

    static final AttributeKey<String> RUN_ID_KEY = AttributeKey.stringKey(RUN_ID);
    static final AttributeKey<Long> MENTION_COUNT_KEY = AttributeKey.longKey(MENTION_COUNT);
    static final AttributeKey<Long> RELATION_COUNT_KEY = AttributeKey.longKey(RELATION_COUNT);

    private final Tracer tracer;

    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(Objects.requireNonNull(openTelemetry, "openTelemetry is required").getTracer(INSTRUMENTATION_SCOPE));
    }

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = Objects.requireNonNull(tracer, "tracer is required");
    }

    @Override
    public Span startBuildSpan(String runId, KnowledgeGraph knowledgeGraph) {
        io.opentelemetry.api.trace.Span span = tracer.spanBuilder(BUILD_SPAN)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(RUN_ID_KEY, runId)
                .setAttribute(MENTION_COUNT_KEY, (long) knowledgeGraph.getEntities().size())
                .setAttribute(RELATION_COUNT_KEY, (long) knowledgeGraph.getRelations().size())
                .startSpan();
        return new ResolutionSpan(span);
    }

    @Override
    public Span startLinkSpan(String runId, int relationCount) {
        io.opentelemetry.api.trace.Span span = tracer.spanBuilder(LINK_SPAN)
                .setSpanKind(SpanKind.INTERNAL)
                .setAttribute(RUN_ID_KEY, runId)
                .setAttribute(RELATION_COUNT_KEY, (long) relationCount)
                .startSpan();
        return new ResolutionSpan(span);
    }

    private static final class ResolutionSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;

        ResolutionSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(AttributeKey.stringKey(key), value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(AttributeKey.longKey(key), value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(AttributeKey.doubleKey(key), value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            if (status == SpanStatus.OK) {
                delegate.setStatus(StatusCode.OK);
            } else {
                delegate.setStatus(StatusCode.ERROR, "resolution failed");
            }
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
