package com.knowledge.resolution.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One extracted occurrence of an entity, as produced by the upstream extraction stage.
 * Immutable; the resolution core only ever reads it.
 *
 * <p>Attribute values are opaque scalars and are never inspected during matching.</p>
 */
public final class EntityMention {

    private final String id;
    private final String mention;
    private final Set<String> types;
    private final Map<String, Object> attributes;
    private final Integer chunkIndex;

    private EntityMention(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        this.mention = Objects.requireNonNull(builder.mention, "mention is required");
        this.types = builder.types != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(builder.types)) : Set.of();
        this.attributes = builder.attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes)) : Map.of();
        if (builder.chunkIndex != null && builder.chunkIndex < 0) {
            throw new IllegalArgumentException("chunkIndex must be >= 0, got " + builder.chunkIndex);
        }
        this.chunkIndex = builder.chunkIndex;
    }

    /**
     * Creates a mention with the given types and no attributes.
     */
    public static EntityMention of(String id, String mention, String... types) {
        return builder()
                .id(id)
                .mention(mention)
                .types(new LinkedHashSet<>(Arrays.asList(types)))
                .build();
    }

    public String getId() {
        return id;
    }

    public String getMention() {
        return mention;
    }

    public Set<String> getTypes() {
        return types;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    /**
     * Source chunk this mention was extracted from, when the extraction stage recorded one.
     */
    public Optional<Integer> getChunkIndex() {
        return Optional.ofNullable(chunkIndex);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityMention that = (EntityMention) o;
        return id.equals(that.id)
                && mention.equals(that.mention)
                && types.equals(that.types)
                && attributes.equals(that.attributes)
                && Objects.equals(chunkIndex, that.chunkIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, mention, types, attributes, chunkIndex);
    }

    @Override
    public String toString() {
        return "EntityMention{" +
                "id='" + id + '\'' +
                ", mention='" + mention + '\'' +
                ", types=" + types +
                ", chunkIndex=" + chunkIndex +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String mention;
        private Set<String> types;
        private Map<String, Object> attributes;
        private Integer chunkIndex;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder mention(String mention) {
            this.mention = mention;
            return this;
        }

        public Builder types(Set<String> types) {
            this.types = types != null ? new LinkedHashSet<>(types) : null;
            return this;
        }

        public Builder type(String type) {
            if (this.types == null) {
                this.types = new LinkedHashSet<>();
            }
            this.types.add(type);
            return this;
        }

        public Builder attributes(Map<String, Object> attributes) {
            this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : null;
            return this;
        }

        public Builder attribute(String key, Object value) {
            if (this.attributes == null) {
                this.attributes = new LinkedHashMap<>();
            }
            this.attributes.put(key, value);
            return this;
        }

        public Builder chunkIndex(Integer chunkIndex) {
            this.chunkIndex = chunkIndex;
            return this;
        }

        public EntityMention build() {
            return new EntityMention(this);
        }
    }
}
