package com.knowledge.resolution.core.model;

import java.util.Objects;

/**
 * Object position of a {@link Relation}: either a reference to another mention by ID,
 * or a literal scalar (number or boolean) that is never canonicalized.
 */
public final class RelationObject {

    private final Object value;
    private final boolean reference;

    private RelationObject(Object value, boolean reference) {
        this.value = value;
        this.reference = reference;
    }

    /**
     * Creates an object that points at another mention.
     */
    public static RelationObject reference(String mentionId) {
        Objects.requireNonNull(mentionId, "mentionId is required");
        return new RelationObject(mentionId, true);
    }

    /**
     * Creates a literal object. Only numbers and booleans are literals; strings are always references.
     */
    public static RelationObject literal(Object value) {
        Objects.requireNonNull(value, "literal value is required");
        if (!(value instanceof Number) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException(
                    "Literal must be a number or boolean, got " + value.getClass().getSimpleName());
        }
        return new RelationObject(value, false);
    }

    /**
     * Classifies a raw value: strings become references, numbers and booleans become literals.
     */
    public static RelationObject of(Object value) {
        if (value instanceof String s) {
            return reference(s);
        }
        return literal(value);
    }

    public boolean isReference() {
        return reference;
    }

    public boolean isLiteral() {
        return !reference;
    }

    /**
     * Returns the referenced mention ID.
     *
     * @throws IllegalStateException if this object is a literal
     */
    public String getReferenceId() {
        if (!reference) {
            throw new IllegalStateException("Literal object has no reference id: " + value);
        }
        return (String) value;
    }

    public Object getValue() {
        return value;
    }

    /**
     * String form used when comparing relations for duplicates.
     */
    public String stringify() {
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RelationObject that = (RelationObject) o;
        return reference == that.reference && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, reference);
    }

    @Override
    public String toString() {
        return reference ? "ref:" + value : "literal:" + value;
    }
}
