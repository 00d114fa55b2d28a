package br.edu.ifba.kgraph.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class EntityTest {

    @Test
    @DisplayName("should keep the longer description and its embedding")
    void longerDescriptionWins() {
        Entity existing = base().description("Short").embedding(new float[]{1.0f, 0.0f}).build();
        Entity candidate = base().description("A much longer description").embedding(new float[]{0.0f, 1.0f})
            .addSourceChunkId("chunk-2").build();

        Entity merged = existing.mergeWith(candidate);

        assertEquals("A much longer description", merged.getDescription());
        assertArrayEquals(new float[]{0.0f, 1.0f}, merged.getEmbedding());
        assertEquals(Set.of("chunk-1", "chunk-2"), merged.getSourceChunkIds());
    }

    @Test
    @DisplayName("should keep the existing description on a tie")
    void tieKeepsExisting() {
        Entity existing = base().description("abcd").build();
        Entity candidate = base().description("wxyz").build();

        assertEquals("abcd", existing.mergeWith(candidate).getDescription());
    }

    @Test
    @DisplayName("should overwrite metadata conflicts with the candidate value")
    void candidateMetadataWins() {
        Entity existing = base().putMetadata("source", "a").putMetadata("kept", 1).build();
        Entity candidate = base().putMetadata("source", "b").build();

        Map<String, Object> metadata = existing.mergeWith(candidate).getMetadata();

        assertEquals("b", metadata.get("source"));
        assertEquals(1, metadata.get("kept"));
    }

    @Test
    @DisplayName("should keep the existing type unless it is blank")
    void entityTypeMerge() {
        Entity typed = base().entityType("drug").build();
        Entity untyped = base().entityType("").build();
        Entity other = base().entityType("concept").build();

        assertEquals("drug", typed.mergeWith(other).getEntityType());
        assertEquals("concept", untyped.mergeWith(other).getEntityType());
    }

    @Test
    @DisplayName("should be immutable")
    void immutability() {
        float[] vector = {1.0f, 2.0f};
        Entity entity = base().embedding(vector).build();
        vector[0] = 9.0f;

        assertEquals(1.0f, entity.getEmbedding()[0]);
        assertThrows(UnsupportedOperationException.class, () -> entity.getSourceChunkIds().add("x"));
        assertThrows(UnsupportedOperationException.class, () -> entity.getMetadata().put("k", "v"));
    }

    private static Entity.Builder base() {
        return Entity.builder()
            .name("Norepinephrine")
            .canonicalId("id-1")
            .addSourceChunkId("chunk-1");
    }
}
