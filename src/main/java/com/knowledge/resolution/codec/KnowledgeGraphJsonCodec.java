package com.knowledge.resolution.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.knowledge.resolution.api.ResolutionOutcome;
import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.KnowledgeGraph;
import com.knowledge.resolution.core.model.MentionRecord;
import com.knowledge.resolution.core.model.Relation;
import com.knowledge.resolution.core.model.RelationObject;
import com.knowledge.resolution.core.model.ResolutionStats;
import com.knowledge.resolution.core.model.ResolvedEntity;
import com.knowledge.resolution.graph.EntityResolutionGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Jackson codec for the extraction stage's JSON batch and the resolution report.
 *
 * <p>Input format:</p>
 * <pre>
 * {
 *   "entities": [
 *     {"id": "arsenal_0", "mention": "Arsenal", "types": ["SportsTeam"], "attributes": {}, "chunkIndex": 0}
 *   ],
 *   "relations": [
 *     {"subjectId": "saka", "predicate": "memberOf", "object": "arsenal_0"},
 *     {"subjectId": "saka", "predicate": "shirtNumber", "object": 7}
 *   ]
 * }
 * </pre>
 *
 * <p>String objects are mention references; numbers and booleans are literals. Any other
 * object value is rejected.</p>
 */
public class KnowledgeGraphJsonCodec {
    private static final Logger log = LoggerFactory.getLogger(KnowledgeGraphJsonCodec.class);
    private static final TypeReference<LinkedHashMap<String, Object>> ATTRIBUTES_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public KnowledgeGraphJsonCodec() {
        this(new ObjectMapper());
    }

    public KnowledgeGraphJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper is required");
    }

    public KnowledgeGraph read(InputStream input) {
        Objects.requireNonNull(input, "input is required");
        try {
            return toKnowledgeGraph(objectMapper.readTree(input));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse knowledge graph JSON", e);
        }
    }

    public KnowledgeGraph read(String json) {
        Objects.requireNonNull(json, "json is required");
        try {
            return toKnowledgeGraph(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse knowledge graph JSON", e);
        }
    }

    /**
     * Serializes a batch back to the input format.
     */
    public String write(KnowledgeGraph knowledgeGraph) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode entities = root.putArray("entities");
        for (EntityMention mention : knowledgeGraph.getEntities()) {
            ObjectNode node = entities.addObject();
            node.put("id", mention.getId());
            node.put("mention", mention.getMention());
            ArrayNode types = node.putArray("types");
            mention.getTypes().forEach(types::add);
            node.set("attributes", objectMapper.valueToTree(mention.getAttributes()));
            mention.getChunkIndex().ifPresent(chunk -> node.put("chunkIndex", chunk));
        }
        ArrayNode relations = root.putArray("relations");
        knowledgeGraph.getRelations().forEach(relation -> relations.add(relationNode(relation)));
        return serialize(root, "knowledge graph");
    }

    /**
     * Report for the web/API layer: stats, canonical mapping, provenance, merged entities
     * and canonical relations.
     */
    public String writeReport(ResolutionOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome is required");
        EntityResolutionGraph erg = outcome.erg();
        ResolutionStats stats = erg.getStats();

        ObjectNode root = objectMapper.createObjectNode();
        root.put("runId", outcome.runId());
        root.put("createdAt", erg.getCreatedAt().toString());

        ObjectNode statsNode = root.putObject("stats");
        statsNode.put("mentionCount", stats.mentionCount());
        statsNode.put("relationCount", stats.relationCount());
        statsNode.put("clusterCount", stats.clusterCount());
        statsNode.put("resolvedCount", stats.resolvedCount());
        statsNode.put("remappedCount", outcome.linkingResult().remappedCount());
        statsNode.put("literalObjectCount", outcome.linkingResult().literalObjectCount());
        statsNode.put("duplicatesDropped", outcome.duplicatesDropped());

        ObjectNode mapping = root.putObject("canonicalMapping");
        erg.getCanonicalMapping().forEach(mapping::put);

        ObjectNode mentions = root.putObject("mentions");
        for (Map.Entry<String, List<MentionRecord>> entry : erg.getMentionsByCanonical().entrySet()) {
            ArrayNode records = mentions.putArray(entry.getKey());
            for (MentionRecord record : entry.getValue()) {
                ObjectNode node = records.addObject();
                node.put("mentionId", record.mentionId());
                node.put("text", record.text());
                node.put("chunkIndex", record.chunkIndex());
                node.put("confidence", record.confidence());
                node.put("method", record.method().name());
            }
        }

        ArrayNode entities = root.putArray("entities");
        for (ResolvedEntity entity : erg.getResolvedEntities()) {
            ObjectNode node = entities.addObject();
            node.put("canonicalId", entity.canonicalId());
            node.put("mention", entity.mention());
            ArrayNode types = node.putArray("types");
            entity.types().forEach(types::add);
            node.set("attributes", objectMapper.valueToTree(entity.attributes()));
            node.put("memberCount", entity.memberCount());
            node.put("minSimilarity", entity.minSimilarity());
            ArrayNode methods = node.putArray("methods");
            entity.methods().stream().sorted().forEach(m -> methods.add(m.name()));
        }

        ArrayNode relations = root.putArray("relations");
        outcome.relations().forEach(relation -> relations.add(relationNode(relation)));

        log.debug("codec.report.written runId={} clusters={} relations={}",
                outcome.runId(), stats.clusterCount(), outcome.relations().size());
        return serialize(root, "resolution report");
    }

    private KnowledgeGraph toKnowledgeGraph(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Knowledge graph JSON must be an object");
        }

        List<EntityMention> entities = new ArrayList<>();
        JsonNode entityNodes = arrayField(root, "entities");
        for (int i = 0; i < entityNodes.size(); i++) {
            entities.add(toMention(entityNodes.get(i), i));
        }

        List<Relation> relations = new ArrayList<>();
        JsonNode relationNodes = arrayField(root, "relations");
        for (int i = 0; i < relationNodes.size(); i++) {
            relations.add(toRelation(relationNodes.get(i), i));
        }

        log.debug("codec.read entities={} relations={}", entities.size(), relations.size());
        return KnowledgeGraph.of(entities, relations);
    }

    private EntityMention toMention(JsonNode node, int index) {
        String path = "entities[" + index + "]";
        EntityMention.Builder builder = EntityMention.builder()
                .id(requiredText(node, "id", path))
                .mention(requiredText(node, "mention", path));

        Set<String> types = new LinkedHashSet<>();
        for (JsonNode type : node.path("types")) {
            types.add(type.asText());
        }
        builder.types(types);

        JsonNode attributes = node.get("attributes");
        if (attributes != null && attributes.isObject()) {
            builder.attributes(objectMapper.convertValue(attributes, ATTRIBUTES_TYPE));
        }

        JsonNode chunkIndex = node.get("chunkIndex");
        if (chunkIndex != null && !chunkIndex.isNull()) {
            if (!chunkIndex.canConvertToInt()) {
                throw new IllegalArgumentException(path + ".chunkIndex must be an integer, got " + chunkIndex);
            }
            builder.chunkIndex(chunkIndex.intValue());
        }
        return builder.build();
    }

    private Relation toRelation(JsonNode node, int index) {
        String path = "relations[" + index + "]";
        JsonNode object = node.get("object");
        if (object == null) {
            throw new IllegalArgumentException(path + ".object is required");
        }
        return new Relation(
                requiredText(node, "subjectId", path),
                requiredText(node, "predicate", path),
                toRelationObject(object, path));
    }

    private RelationObject toRelationObject(JsonNode object, String path) {
        if (object.isTextual()) {
            return RelationObject.reference(object.textValue());
        }
        if (object.isBoolean()) {
            return RelationObject.literal(object.booleanValue());
        }
        if (object.isNumber()) {
            return RelationObject.literal(object.numberValue());
        }
        throw new IllegalArgumentException(
                path + ".object must be a string, number or boolean, got " + object.getNodeType());
    }

    private ObjectNode relationNode(Relation relation) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("subjectId", relation.subjectId());
        node.put("predicate", relation.predicate());
        RelationObject object = relation.object();
        if (object.isReference()) {
            node.put("object", object.getReferenceId());
        } else {
            putLiteral(node, object.getValue());
        }
        return node;
    }

    private void putLiteral(ObjectNode node, Object value) {
        if (value instanceof Boolean b) {
            node.put("object", b);
        } else if (value instanceof Integer i) {
            node.put("object", i);
        } else if (value instanceof Long l) {
            node.put("object", l);
        } else if (value instanceof BigInteger bi) {
            node.put("object", bi);
        } else if (value instanceof BigDecimal bd) {
            node.put("object", bd);
        } else {
            node.put("object", ((Number) value).doubleValue());
        }
    }

    private static JsonNode arrayField(JsonNode root, String field) {
        JsonNode value = root.path(field);
        if (!value.isMissingNode() && !value.isNull() && !value.isArray()) {
            throw new IllegalArgumentException(field + " must be an array, got " + value.getNodeType());
        }
        return value;
    }

    private static String requiredText(JsonNode node, String field, String path) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException(path + "." + field + " must be a string");
        }
        return value.textValue();
    }

    private String serialize(JsonNode root, String what) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to write " + what, e);
        }
    }
}
