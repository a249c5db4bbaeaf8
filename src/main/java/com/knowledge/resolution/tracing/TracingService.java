package com.knowledge.resolution.tracing;

import com.knowledge.resolution.core.model.KnowledgeGraph;

/**
 * Interface for distributed tracing integration.
 * Resolution opens one span per graph build ({@code erg.build}) and one per
 * linking pass ({@code erg.link}). The default {@link NoOpTracingService} records nothing.
 */
public interface TracingService {

    String BUILD_SPAN = "erg.build";
    String LINK_SPAN = "erg.link";

    String RUN_ID = "runId";
    String MENTION_COUNT = "mentionCount";
    String RELATION_COUNT = "relationCount";

    /**
     * Starts the span for one graph build, tagged with the run ID and the batch size.
     */
    Span startBuildSpan(String runId, KnowledgeGraph knowledgeGraph);

    /**
     * Starts the span for one linking pass over {@code relationCount} relations.
     */
    Span startLinkSpan(String runId, int relationCount);
}
