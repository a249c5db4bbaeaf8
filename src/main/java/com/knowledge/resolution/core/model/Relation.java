package com.knowledge.resolution.core.model;

import java.util.Objects;

/**
 * A subject-predicate-object statement between extracted mentions.
 * The subject is always a mention ID; the predicate is a URI string and is never rewritten.
 *
 * <p>Subject and object IDs are not checked against any entity list: a relation may
 * point at something that was never extracted as an entity.</p>
 */
public record Relation(String subjectId, String predicate, RelationObject object) {

    public Relation {
        Objects.requireNonNull(subjectId, "subjectId is required");
        Objects.requireNonNull(predicate, "predicate is required");
        Objects.requireNonNull(object, "object is required");
    }

    /**
     * Creates a relation whose object is another mention.
     */
    public static Relation of(String subjectId, String predicate, String objectId) {
        return new Relation(subjectId, predicate, RelationObject.reference(objectId));
    }

    /**
     * Creates a relation whose object is a number or boolean literal.
     */
    public static Relation withLiteral(String subjectId, String predicate, Object literal) {
        return new Relation(subjectId, predicate, RelationObject.literal(literal));
    }
}
