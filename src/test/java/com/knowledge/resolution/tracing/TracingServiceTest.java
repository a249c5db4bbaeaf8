package com.knowledge.resolution.tracing;

import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.KnowledgeGraph;
import com.knowledge.resolution.core.model.Relation;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TracingService Tests")
class TracingServiceTest {

    private static final KnowledgeGraph BATCH = KnowledgeGraph.of(
            List.of(EntityMention.of("arsenal_0", "Arsenal", "SportsTeam"),
                    EntityMention.of("arsenal_2", "arsenal", "SportsTeam"),
                    EntityMention.of("saka", "Bukayo Saka", "Person")),
            List.of(Relation.of("saka", "memberOf", "arsenal_2")));

    @Nested
    @DisplayName("NoOpTracingService")
    class NoOpTests {

        @Test
        @DisplayName("Build and link spans accept every call")
        void spanLifecycle() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertDoesNotThrow(() -> {
                try (Span span = noOp.startBuildSpan("r1", BATCH)) {
                    span.setAttribute("clusterCount", 2L);
                    span.setAttribute("similarityThreshold", 0.85);
                    span.setAttribute("provider", "none");
                    span.fail(new IllegalStateException("ignored"));
                }
            });
        }

        @Test
        @DisplayName("Build and link share one discarding span")
        void sharedSpan() {
            NoOpTracingService noOp = new NoOpTracingService();

            assertSame(noOp.startBuildSpan("r1", BATCH), noOp.startLinkSpan("r1", 1));
        }
    }

    @Nested
    @DisplayName("OpenTelemetryTracingService")
    class OTelTests {

        private Tracer tracer;
        private SpanBuilder spanBuilder;
        private io.opentelemetry.api.trace.Span otelSpan;
        private OpenTelemetryTracingService service;

        @BeforeEach
        void setUp() {
            tracer = mock(Tracer.class);
            spanBuilder = mock(SpanBuilder.class, RETURNS_SELF);
            otelSpan = mock(io.opentelemetry.api.trace.Span.class);
            when(tracer.spanBuilder(anyString())).thenReturn(spanBuilder);
            when(spanBuilder.startSpan()).thenReturn(otelSpan);
            service = new OpenTelemetryTracingService(tracer);
        }

        @Test
        @DisplayName("Build span carries the run ID and the batch size")
        void buildSpan() {
            service.startBuildSpan("r1", BATCH);

            verify(tracer).spanBuilder("erg.build");
            verify(spanBuilder).setSpanKind(SpanKind.INTERNAL);
            verify(spanBuilder).setAttribute(AttributeKey.stringKey("runId"), "r1");
            verify(spanBuilder).setAttribute(AttributeKey.longKey("mentionCount"), 3L);
            verify(spanBuilder).setAttribute(AttributeKey.longKey("relationCount"), 1L);
            verify(spanBuilder).startSpan();
        }

        @Test
        @DisplayName("Link span carries the run ID and the relation count")
        void linkSpan() {
            service.startLinkSpan("r2", 4);

            verify(tracer).spanBuilder("erg.link");
            verify(spanBuilder).setAttribute(AttributeKey.stringKey("runId"), "r2");
            verify(spanBuilder).setAttribute(AttributeKey.longKey("relationCount"), 4L);
        }

        @Test
        @DisplayName("Result attributes of every type reach the OpenTelemetry span")
        void attributes() {
            Span span = service.startBuildSpan("r1", BATCH);
            span.setAttribute("provider", "zero");
            span.setAttribute("clusterCount", 2L);
            span.setAttribute("similarityThreshold", 0.6);

            verify(otelSpan).setAttribute(AttributeKey.stringKey("provider"), "zero");
            verify(otelSpan).setAttribute(AttributeKey.longKey("clusterCount"), 2L);
            verify(otelSpan).setAttribute(AttributeKey.doubleKey("similarityThreshold"), 0.6);
        }

        @Test
        @DisplayName("A failed span records the exception, reports ERROR and ends on close")
        void failAndClose() {
            RuntimeException failure = new RuntimeException("pair generation broke");
            try (Span span = service.startBuildSpan("r1", BATCH)) {
                span.fail(failure);
            }

            verify(otelSpan).recordException(failure);
            verify(otelSpan).setStatus(StatusCode.ERROR, "resolution failed");
            verify(otelSpan).end();
        }

        @Test
        @DisplayName("A successful span reports OK")
        void okStatus() {
            try (Span span = service.startLinkSpan("r1", 0)) {
                span.setStatus(Span.SpanStatus.OK);
            }

            verify(otelSpan).setStatus(StatusCode.OK);
        }
    }
}
