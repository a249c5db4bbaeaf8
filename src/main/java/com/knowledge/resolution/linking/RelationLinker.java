package com.knowledge.resolution.linking;

import com.knowledge.resolution.core.model.Relation;
import com.knowledge.resolution.core.model.RelationObject;
import com.knowledge.resolution.graph.EntityResolutionGraph;
import com.knowledge.resolution.logging.LogContext;
import com.knowledge.resolution.metrics.MetricsService;
import com.knowledge.resolution.metrics.NoOpMetricsService;
import com.knowledge.resolution.tracing.NoOpTracingService;
import com.knowledge.resolution.tracing.Span;
import com.knowledge.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites relation endpoints to canonical IDs and removes duplicates that
 * canonicalization produces.
 *
 * <p>IDs without a canonical mapping keep their original value. Self-referential and
 * dangling relations are linked like any other; nothing here throws on well-typed input.</p>
 */
public class RelationLinker {
    private static final Logger log = LoggerFactory.getLogger(RelationLinker.class);

    private final MetricsService metricsService;
    private final TracingService tracingService;

    public RelationLinker() {
        this(new NoOpMetricsService(), new NoOpTracingService());
    }

    public RelationLinker(MetricsService metricsService, TracingService tracingService) {
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    public LinkingResult linkRelations(List<Relation> relations, EntityResolutionGraph erg) {
        return linkRelations(relations, erg, LogContext.generateRunId());
    }

    /**
     * Canonicalizes every relation against the graph's mapping, preserving input order.
     */
    public LinkingResult linkRelations(List<Relation> relations, EntityResolutionGraph erg, String runId) {
        Objects.requireNonNull(relations, "relations is required");
        Objects.requireNonNull(erg, "erg is required");

        try (LogContext ctx = LogContext.forLinking(runId);
             Span span = tracingService.startLinkSpan(runId, relations.size())) {
            try {
                LinkingResult result = link(relations, erg, span);
                span.setStatus(Span.SpanStatus.OK);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        }
    }

    private LinkingResult link(List<Relation> relations, EntityResolutionGraph erg, Span span) {
        List<LinkedRelation> linked = new ArrayList<>(relations.size());
        int remapped = 0;
        int literals = 0;
        int unmapped = 0;

        for (Relation relation : relations) {
            String subject = relation.subjectId();
            Optional<String> mappedSubject = erg.getCanonicalId(subject);
            if (mappedSubject.isEmpty()) {
                unmapped++;
            }
            String canonicalSubject = mappedSubject.orElse(subject);

            RelationObject object = relation.object();
            RelationObject canonicalObject;
            if (object.isLiteral()) {
                literals++;
                canonicalObject = object;
            } else {
                String objectId = object.getReferenceId();
                Optional<String> mappedObject = erg.getCanonicalId(objectId);
                if (mappedObject.isEmpty()) {
                    unmapped++;
                }
                String canonicalObjectId = mappedObject.orElse(objectId);
                canonicalObject = canonicalObjectId.equals(objectId)
                        ? object : RelationObject.reference(canonicalObjectId);
            }

            LinkedRelation linkedRelation = new LinkedRelation(
                    relation,
                    canonicalSubject,
                    relation.predicate(),
                    canonicalObject,
                    !canonicalSubject.equals(subject),
                    !canonicalObject.equals(object));
            remapped += linkedRelation.remappedEndpoints();
            linked.add(linkedRelation);
        }

        if (unmapped > 0) {
            log.debug("link.unmapped endpoints={}", unmapped);
        }

        metricsService.recordRelationsLinked(relations.size(), remapped);
        span.setAttribute("remappedCount", remapped);
        span.setAttribute("literalObjectCount", literals);

        log.info("link.completed relations={} remapped={} literals={} unmapped={}",
                relations.size(), remapped, literals, unmapped);
        return new LinkingResult(linked, remapped, literals);
    }

    /**
     * Keeps the first relation per {@code subject|predicate|object} key, in input order,
     * and strips the linking bookkeeping.
     */
    public List<Relation> deduplicateLinked(LinkingResult linkingResult) {
        Objects.requireNonNull(linkingResult, "linkingResult is required");

        Set<String> seen = new HashSet<>();
        List<Relation> unique = new ArrayList<>();
        for (LinkedRelation linked : linkingResult.linkedRelations()) {
            if (seen.add(linked.dedupKey())) {
                unique.add(linked.toRelation());
            }
        }

        int dropped = linkingResult.size() - unique.size();
        if (dropped > 0) {
            metricsService.recordDuplicatesDropped(dropped);
            log.debug("link.deduplicated kept={} dropped={}", unique.size(), dropped);
        }
        return List.copyOf(unique);
    }
}
