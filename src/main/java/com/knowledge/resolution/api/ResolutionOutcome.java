package com.knowledge.resolution.api;

import com.knowledge.resolution.core.model.Relation;
import com.knowledge.resolution.diagram.MermaidDiagramRenderer;
import com.knowledge.resolution.graph.EntityResolutionGraph;
import com.knowledge.resolution.linking.LinkingResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything one resolution run produces.
 *
 * @param runId         identifier carried in the logs of this run
 * @param erg           the entity resolution graph
 * @param linkingResult relations with canonical endpoints, before deduplication
 * @param relations     canonical relations after deduplication, in input order
 */
public record ResolutionOutcome(
        String runId,
        EntityResolutionGraph erg,
        LinkingResult linkingResult,
        List<Relation> relations
) {
    public ResolutionOutcome {
        Objects.requireNonNull(runId, "runId is required");
        Objects.requireNonNull(erg, "erg is required");
        Objects.requireNonNull(linkingResult, "linkingResult is required");
        relations = relations != null ? List.copyOf(relations) : List.of();
    }

    /**
     * Relations dropped as duplicates after canonicalization.
     */
    public int duplicatesDropped() {
        return linkingResult.size() - relations.size();
    }

    /**
     * Mermaid diagram of the graph including canonical relation edges.
     */
    public String toDiagram() {
        return new MermaidDiagramRenderer().render(erg, linkingResult);
    }
}
