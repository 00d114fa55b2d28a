package br.edu.ifba.kgraph.storage.impl;

import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.Relationship;
import br.edu.ifba.kgraph.core.RelationshipType;
import br.edu.ifba.kgraph.storage.GraphStore;
import br.edu.ifba.kgraph.storage.GraphStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryGraphStoreTest {

    private InMemoryGraphStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryGraphStore();
        store.upsertEntity(entity("a", new float[]{1.0f, 0.0f}));
        store.upsertEntity(entity("b", new float[]{0.8f, 0.6f}));
        store.upsertEntity(entity("c", null));
    }

    private static Entity entity(String id, float[] embedding) {
        return Entity.builder().name(id.toUpperCase()).canonicalId(id).description(id).embedding(embedding).build();
    }

    private static Relationship edge(String source, String target, RelationshipType type, String chunkId) {
        return Relationship.builder()
            .sourceEntityId(source)
            .targetEntityId(target)
            .relationshipType(type)
            .confidence(0.9)
            .weight(type.getBaseWeight() * 9.0)
            .chunkId(chunkId)
            .build();
    }

    @Nested
    @DisplayName("Entities")
    class Entities {

        @Test
        @DisplayName("should find similar entities above the threshold, best first")
        void findSimilar() {
            List<GraphStore.EntityMatch> matches = store.findSimilarEntities(new float[]{1.0f, 0.0f}, 0.5, 10);

            assertEquals(2, matches.size());
            assertEquals("a", matches.get(0).entity().getCanonicalId());
            assertEquals(1.0, matches.get(0).similarity(), 1e-6);
            assertEquals(0.8, matches.get(1).similarity(), 1e-6);
        }

        @Test
        @DisplayName("should honor the limit and skip entities without embeddings")
        void limitAndMissingEmbeddings() {
            assertEquals(1, store.findSimilarEntities(new float[]{1.0f, 0.0f}, -1.0, 1).size());
            assertEquals(2, store.findSimilarEntities(new float[]{1.0f, 0.0f}, -1.0, 10).size());
            assertTrue(store.findSimilarEntities(new float[]{1.0f, 0.0f}, 0.5, 0).isEmpty());
        }

        @Test
        @DisplayName("should replace an entity on upsert")
        void upsertReplaces() {
            store.upsertEntity(Entity.builder().name("A").canonicalId("a").description("updated").build());

            assertEquals("updated", store.findByCanonicalId("a").orElseThrow().getDescription());
            assertEquals(3, store.listEntities().size());
        }

        @Test
        @DisplayName("should delete an entity together with its relationships")
        void deleteEntity() {
            store.upsertRelationship(edge("a", "b", RelationshipType.CAUSAL, "c1"));
            store.upsertRelationship(edge("c", "a", RelationshipType.REFERENCE, "c1"));
            store.upsertRelationship(edge("b", "c", RelationshipType.CAUSAL, "c2"));

            store.deleteEntity("a");
            store.deleteEntity("missing");

            assertTrue(store.findByCanonicalId("a").isEmpty());
            assertEquals(1, store.listRelationships().size());
            assertTrue(store.listRelationshipsByChunk("c1").isEmpty());
            assertEquals(0, store.countOutgoingEdges("c"));
        }
    }

    @Nested
    @DisplayName("Relationships")
    class Relationships {

        @Test
        @DisplayName("should index relationships by chunk, source and endpoint")
        void indexes() {
            Relationship ab = edge("a", "b", RelationshipType.CAUSAL, "c1");
            Relationship cb = edge("c", "b", RelationshipType.GENERIC, "c2");
            store.upsertRelationship(ab);
            store.upsertRelationship(cb);

            assertEquals(List.of(ab), store.listRelationshipsByChunk("c1"));
            assertEquals(1, store.countOutgoingEdges("a"));
            assertEquals(0, store.countOutgoingEdges("b"));
            assertEquals(2, store.listRelationshipsForEntity("b").size());
            assertTrue(store.findRelationship("a", "b", RelationshipType.CAUSAL).isPresent());
            assertTrue(store.findRelationship("b", "a", RelationshipType.CAUSAL).isEmpty());
            assertTrue(store.findRelationship("a", "b", RelationshipType.SYNONYM).isEmpty());
        }

        @Test
        @DisplayName("should reject relationships with a missing endpoint")
        void missingEndpoint() {
            assertThrows(GraphStoreException.class,
                () -> store.upsertRelationship(edge("a", "missing", RelationshipType.GENERIC, "c1")));
            assertTrue(store.listRelationships().isEmpty());
        }

        @Test
        @DisplayName("should remove deleted edges from every index")
        void deleteEdges() {
            Relationship ab = edge("a", "b", RelationshipType.CAUSAL, "c1");
            Relationship ac = edge("a", "c", RelationshipType.CAUSAL, "c1");
            store.upsertRelationship(ab);
            store.upsertRelationship(ac);

            int deleted = store.deleteEdges(Set.of(ab.getId(), "unknown"));

            assertEquals(1, deleted);
            assertEquals(List.of(ac), store.listRelationshipsByChunk("c1"));
            assertEquals(1, store.countOutgoingEdges("a"));
            assertTrue(store.listRelationshipsForEntity("b").isEmpty());
        }
    }

    @Test
    @DisplayName("should report stats and clear everything on reset")
    void statsAndReset() {
        store.upsertRelationship(edge("a", "b", RelationshipType.CAUSAL, "c1"));

        GraphStore.GraphStats stats = store.getStats();
        assertEquals(3, stats.entityCount());
        assertEquals(1, stats.relationshipCount());
        assertEquals(2.0 / 3.0, stats.averageDegree(), 1e-9);

        store.reset();

        assertEquals(0, store.getStats().entityCount());
        assertTrue(store.listRelationshipsByChunk("c1").isEmpty());
        assertEquals(0.0, store.getStats().averageDegree(), 1e-9);
    }
}
