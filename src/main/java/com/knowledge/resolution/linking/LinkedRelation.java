package com.knowledge.resolution.linking;

import com.knowledge.resolution.core.model.Relation;
import com.knowledge.resolution.core.model.RelationObject;

import java.util.Objects;

/**
 * A relation with its endpoints rewritten to canonical IDs.
 *
 * @param original           the relation as extracted
 * @param canonicalSubjectId canonical ID of the subject, or the original subject ID when unmapped
 * @param canonicalPredicate always equal to the original predicate
 * @param canonicalObject    canonical reference, the unmapped original reference, or the literal unchanged
 * @param subjectRemapped    true when the canonical subject differs from the original
 * @param objectRemapped     true when the canonical object differs from the original; never true for literals
 */
public record LinkedRelation(
        Relation original,
        String canonicalSubjectId,
        String canonicalPredicate,
        RelationObject canonicalObject,
        boolean subjectRemapped,
        boolean objectRemapped
) {
    public LinkedRelation {
        Objects.requireNonNull(original, "original is required");
        Objects.requireNonNull(canonicalSubjectId, "canonicalSubjectId is required");
        Objects.requireNonNull(canonicalPredicate, "canonicalPredicate is required");
        Objects.requireNonNull(canonicalObject, "canonicalObject is required");
    }

    /**
     * Number of endpoints rewritten, 0 to 2.
     */
    public int remappedEndpoints() {
        return (subjectRemapped ? 1 : 0) + (objectRemapped ? 1 : 0);
    }

    /**
     * Composite key {@code subject|predicate|object} used for duplicate detection.
     */
    public String dedupKey() {
        return canonicalSubjectId + "|" + canonicalPredicate + "|" + canonicalObject.stringify();
    }

    /**
     * Fresh relation carrying only the canonical endpoints.
     */
    public Relation toRelation() {
        return new Relation(canonicalSubjectId, canonicalPredicate, canonicalObject);
    }
}
