package com.knowledge.resolution.linking;

import java.util.List;

/**
 * Output of one linking pass.
 *
 * @param linkedRelations    one entry per input relation, in input order
 * @param remappedCount      total endpoints rewritten across all relations
 * @param literalObjectCount relations whose object is a number or boolean literal
 */
public record LinkingResult(
        List<LinkedRelation> linkedRelations,
        int remappedCount,
        int literalObjectCount
) {
    public LinkingResult {
        linkedRelations = linkedRelations != null ? List.copyOf(linkedRelations) : List.of();
        if (remappedCount < 0 || literalObjectCount < 0) {
            throw new IllegalArgumentException("counts must be >= 0");
        }
    }

    public static LinkingResult empty() {
        return new LinkingResult(List.of(), 0, 0);
    }

    public int size() {
        return linkedRelations.size();
    }

    @Override
    public String toString() {
        return "LinkingResult{" +
                "relations=" + linkedRelations.size() +
                ", remapped=" + remappedCount +
                ", literals=" + literalObjectCount +
                '}';
    }
}
