package com.knowledge.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Core model Tests")
class EntityMentionTest {

    @Nested
    @DisplayName("EntityMention")
    class MentionTests {

        @Test
        @DisplayName("of() should keep types in declaration order")
        void ofKeepsTypes() {
            EntityMention mention = EntityMention.of("arsenal_0", "Arsenal", "SportsTeam", "Organization");

            assertEquals("arsenal_0", mention.getId());
            assertEquals("Arsenal", mention.getMention());
            assertEquals(List.of("SportsTeam", "Organization"), List.copyOf(mention.getTypes()));
            assertTrue(mention.getAttributes().isEmpty());
            assertEquals(Optional.empty(), mention.getChunkIndex());
        }

        @Test
        @DisplayName("Builder should copy collections it is given")
        void builderCopiesInput() {
            Set<String> types = new LinkedHashSet<>(Set.of("Person"));
            Map<String, Object> attributes = new HashMap<>();
            attributes.put("position", "winger");

            EntityMention mention = EntityMention.builder()
                    .id("saka")
                    .mention("Bukayo Saka")
                    .types(types)
                    .attributes(attributes)
                    .chunkIndex(2)
                    .build();
            types.add("Athlete");
            attributes.put("number", 7);

            assertEquals(Set.of("Person"), mention.getTypes());
            assertEquals(Map.of("position", "winger"), mention.getAttributes());
            assertEquals(Optional.of(2), mention.getChunkIndex());
            assertThrows(UnsupportedOperationException.class, () -> mention.getTypes().add("x"));
        }

        @Test
        @DisplayName("Attributes may hold null values")
        void nullAttributeValue() {
            EntityMention mention = EntityMention.builder()
                    .id("m1").mention("Arsenal").attribute("founded", null).build();

            assertTrue(mention.getAttributes().containsKey("founded"));
            assertNull(mention.getAttributes().get("founded"));
        }

        @Test
        @DisplayName("Should reject blank id and negative chunk index")
        void rejectsInvalid() {
            assertThrows(IllegalArgumentException.class,
                    () -> EntityMention.builder().id(" ").mention("x").build());
            assertThrows(NullPointerException.class,
                    () -> EntityMention.builder().mention("x").build());
            assertThrows(NullPointerException.class,
                    () -> EntityMention.builder().id("a").build());
            assertThrows(IllegalArgumentException.class,
                    () -> EntityMention.builder().id("a").mention("x").chunkIndex(-1).build());
        }
    }

    @Nested
    @DisplayName("RelationObject")
    class RelationObjectTests {

        @Test
        @DisplayName("Strings classify as references, numbers and booleans as literals")
        void classify() {
            assertTrue(RelationObject.of("arsenal_0").isReference());
            assertTrue(RelationObject.of(7).isLiteral());
            assertTrue(RelationObject.of(1.5).isLiteral());
            assertTrue(RelationObject.of(true).isLiteral());
        }

        @Test
        @DisplayName("Literal must be a number or boolean")
        void literalTypeChecked() {
            assertThrows(IllegalArgumentException.class, () -> RelationObject.literal("text"));
            assertThrows(IllegalArgumentException.class, () -> RelationObject.of(List.of(1)));
            assertThrows(NullPointerException.class, () -> RelationObject.of(null));
        }

        @Test
        @DisplayName("Literal has no reference id")
        void literalReferenceId() {
            assertThrows(IllegalStateException.class, () -> RelationObject.literal(3).getReferenceId());
            assertEquals("saka", RelationObject.reference("saka").getReferenceId());
        }

        @Test
        @DisplayName("A reference and a literal with the same text are not equal")
        void referenceVersusLiteral() {
            RelationObject reference = RelationObject.reference("7");
            RelationObject literal = RelationObject.literal(7);

            assertNotEquals(reference, literal);
            assertEquals(reference.stringify(), literal.stringify());
        }
    }

    @Nested
    @DisplayName("KnowledgeGraph")
    class KnowledgeGraphTests {

        @Test
        @DisplayName("Should reject duplicate mention ids")
        void rejectsDuplicateIds() {
            List<EntityMention> entities = List.of(
                    EntityMention.of("a", "Arsenal"),
                    EntityMention.of("a", "Arsenal FC"));

            assertThrows(IllegalArgumentException.class, () -> KnowledgeGraph.of(entities, List.of()));
        }

        @Test
        @DisplayName("Relations may reference unknown mentions")
        void danglingRelationsAccepted() {
            KnowledgeGraph graph = KnowledgeGraph.of(
                    List.of(EntityMention.of("a", "Arsenal")),
                    List.of(Relation.of("a", "opponent", "nobody")));

            assertEquals(1, graph.getRelations().size());
            assertFalse(graph.isEmpty());
            assertTrue(KnowledgeGraph.empty().isEmpty());
        }
    }

    @Nested
    @DisplayName("Records")
    class RecordTests {

        @Test
        @DisplayName("ResolutionStats should enforce cluster consistency")
        void statsInvariants() {
            ResolutionStats stats = new ResolutionStats(7, 3, 5, 5);
            assertEquals(2, stats.mergedMentionCount());

            assertThrows(IllegalArgumentException.class, () -> new ResolutionStats(7, 3, 5, 4));
            assertThrows(IllegalArgumentException.class, () -> new ResolutionStats(2, 0, 3, 3));
            assertThrows(IllegalArgumentException.class, () -> new ResolutionStats(-1, 0, 0, 0));
        }

        @Test
        @DisplayName("MentionRecord should validate chunk index and confidence")
        void mentionRecordValidation() {
            assertDoesNotThrow(() -> new MentionRecord("a", "Arsenal", 0, 1.0, ResolutionMethod.CANONICAL));
            assertThrows(IllegalArgumentException.class,
                    () -> new MentionRecord("a", "Arsenal", -1, 1.0, ResolutionMethod.CANONICAL));
            assertThrows(IllegalArgumentException.class,
                    () -> new MentionRecord("a", "Arsenal", 0, 1.5, ResolutionMethod.EXACT));
        }
    }
}
