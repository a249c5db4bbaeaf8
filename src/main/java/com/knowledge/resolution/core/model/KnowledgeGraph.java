package com.knowledge.resolution.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One input batch: extracted mentions and relations, both in extraction order.
 * Order matters for canonical tie-breaking and for default chunk indices.
 */
public final class KnowledgeGraph {

    private final List<EntityMention> entities;
    private final List<Relation> relations;

    public KnowledgeGraph(List<EntityMention> entities, List<Relation> relations) {
        this.entities = List.copyOf(Objects.requireNonNull(entities, "entities is required"));
        this.relations = List.copyOf(Objects.requireNonNull(relations, "relations is required"));

        Set<String> seen = new HashSet<>();
        for (EntityMention entity : this.entities) {
            if (!seen.add(entity.getId())) {
                throw new IllegalArgumentException("Duplicate mention id in batch: " + entity.getId());
            }
        }
    }

    public static KnowledgeGraph of(List<EntityMention> entities, List<Relation> relations) {
        return new KnowledgeGraph(entities, relations);
    }

    public static KnowledgeGraph empty() {
        return new KnowledgeGraph(List.of(), List.of());
    }

    public List<EntityMention> getEntities() {
        return entities;
    }

    public List<Relation> getRelations() {
        return relations;
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relations.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        KnowledgeGraph that = (KnowledgeGraph) o;
        return entities.equals(that.entities) && relations.equals(that.relations);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entities, relations);
    }

    @Override
    public String toString() {
        return "KnowledgeGraph{entities=" + entities.size() + ", relations=" + relations.size() + '}';
    }
}
