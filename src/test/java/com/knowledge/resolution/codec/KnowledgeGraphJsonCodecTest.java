package com.knowledge.resolution.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledge.resolution.api.EntityResolutionConfig;
import com.knowledge.resolution.api.KnowledgeGraphResolver;
import com.knowledge.resolution.api.ResolutionOutcome;
import com.knowledge.resolution.core.model.EntityMention;
import com.knowledge.resolution.core.model.KnowledgeGraph;
import com.knowledge.resolution.core.model.Relation;
import com.knowledge.resolution.core.model.RelationObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("KnowledgeGraphJsonCodec Tests")
class KnowledgeGraphJsonCodecTest {

    private static final String BATCH = """
            {
              "entities": [
                {"id": "arsenal_0", "mention": "Arsenal", "types": ["SportsTeam"], "attributes": {"city": "London"}, "chunkIndex": 0},
                {"id": "arsenal_fc_3", "mention": "Arsenal FC", "types": ["SportsTeam"], "attributes": {"founded": 1886}},
                {"id": "saka", "mention": "Bukayo Saka", "types": ["Person"]}
              ],
              "relations": [
                {"subjectId": "saka", "predicate": "memberOf", "object": "arsenal_fc_3"},
                {"subjectId": "saka", "predicate": "shirtNumber", "object": 7},
                {"subjectId": "saka", "predicate": "active", "object": true}
              ]
            }
            """;

    private final KnowledgeGraphJsonCodec codec = new KnowledgeGraphJsonCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Nested
    @DisplayName("read")
    class ReadTests {

        @Test
        @DisplayName("Should parse entities with types, attributes and chunk index")
        void parsesEntities() {
            KnowledgeGraph kg = codec.read(BATCH);

            assertEquals(3, kg.getEntities().size());
            EntityMention arsenal = kg.getEntities().get(0);
            assertEquals("arsenal_0", arsenal.getId());
            assertEquals(Set.of("SportsTeam"), arsenal.getTypes());
            assertEquals("London", arsenal.getAttributes().get("city"));
            assertEquals(Optional.of(0), arsenal.getChunkIndex());
            assertEquals(Optional.empty(), kg.getEntities().get(1).getChunkIndex());
            assertEquals(1886, kg.getEntities().get(1).getAttributes().get("founded"));
        }

        @Test
        @DisplayName("Strings are references; numbers and booleans are literals")
        void classifiesObjects() {
            KnowledgeGraph kg = codec.read(new ByteArrayInputStream(BATCH.getBytes(StandardCharsets.UTF_8)));

            assertEquals(Relation.of("saka", "memberOf", "arsenal_fc_3"), kg.getRelations().get(0));
            assertEquals(RelationObject.literal(7), kg.getRelations().get(1).object());
            assertEquals(RelationObject.literal(true), kg.getRelations().get(2).object());
        }

        @Test
        @DisplayName("Missing sections read as empty")
        void missingSections() {
            assertTrue(codec.read("{}").isEmpty());
        }

        @Test
        @DisplayName("Should reject malformed input")
        void rejectsMalformed() {
            assertThrows(UncheckedIOException.class, () -> codec.read("{not json"));
            assertThrows(IllegalArgumentException.class, () -> codec.read("[]"));
            assertThrows(IllegalArgumentException.class, () -> codec.read("{\"entities\": {}}"));
            assertThrows(IllegalArgumentException.class,
                    () -> codec.read("{\"entities\": [{\"mention\": \"Arsenal\"}]}"));
            assertThrows(IllegalArgumentException.class,
                    () -> codec.read("{\"relations\": [{\"subjectId\": \"a\", \"predicate\": \"p\", \"object\": [1]}]}"));
            assertThrows(IllegalArgumentException.class,
                    () -> codec.read("{\"relations\": [{\"subjectId\": \"a\", \"predicate\": \"p\", \"object\": null}]}"));
            assertThrows(IllegalArgumentException.class,
                    () -> codec.read("{\"entities\": [{\"id\": \"a\", \"mention\": \"A\", \"chunkIndex\": \"x\"}]}"));
        }
    }

    @Nested
    @DisplayName("write")
    class WriteTests {

        @Test
        @DisplayName("Written batch reads back to an equal graph")
        void writeThenRead() {
            KnowledgeGraph kg = codec.read(BATCH);

            assertEquals(kg, codec.read(codec.write(kg)));
        }

        @Test
        @DisplayName("Report carries stats, mapping, provenance and canonical relations")
        void report() throws Exception {
            ResolutionOutcome outcome = KnowledgeGraphResolver.builder()
                    .config(EntityResolutionConfig.lexicalOnly())
                    .build()
                    .resolve(codec.read(BATCH));

            JsonNode report = mapper.readTree(codec.writeReport(outcome));

            assertEquals(outcome.runId(), report.get("runId").asText());
            assertEquals(3, report.at("/stats/mentionCount").asInt());
            assertEquals(2, report.at("/stats/clusterCount").asInt());
            assertEquals(2, report.at("/stats/literalObjectCount").asInt());
            assertEquals("arsenal_0", report.at("/canonicalMapping/arsenal_fc_3").asText());
            assertEquals(2, report.at("/mentions/arsenal_0").size());
            assertEquals("CONTAINMENT", report.at("/mentions/arsenal_0/1/method").asText());
            assertEquals(1, report.at("/mentions/arsenal_0/1/chunkIndex").asInt());
            assertEquals("arsenal_0", report.at("/relations/0/object").asText());
            assertEquals(7, report.at("/relations/1/object").asInt());
            assertTrue(report.at("/relations/2/object").isBoolean());
            assertEquals(1886, report.at("/entities/0/attributes/founded").asInt());
        }
    }
}
