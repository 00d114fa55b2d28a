package br.edu.ifba.kgraph.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddingUtilTest {

    @Test
    void cosineSimilarityOfParallelAndOrthogonalVectors() {
        assertEquals(1.0, EmbeddingUtil.cosineSimilarity(new float[]{1, 2, 3}, new float[]{2, 4, 6}), 1e-6);
        assertEquals(0.0, EmbeddingUtil.cosineSimilarity(new float[]{1, 0}, new float[]{0, 1}), 1e-9);
        assertEquals(-1.0, EmbeddingUtil.cosineSimilarity(new float[]{1, 0}, new float[]{-1, 0}), 1e-9);
    }

    @Test
    void zeroVectorHasZeroSimilarity() {
        assertEquals(0.0, EmbeddingUtil.cosineSimilarity(new float[]{0, 0}, new float[]{1, 1}));
    }

    @Test
    void dimensionMismatchIsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> EmbeddingUtil.cosineSimilarity(new float[]{1}, new float[]{1, 0}));
    }

    @Test
    void shortIdIsSixteenHexChars() {
        String id = HashUtil.shortId("tidb database::A distributed SQL database");
        assertEquals("00a05c771ff5c356", id);
        assertEquals(HashUtil.sha256Hex("x").substring(0, 16), HashUtil.shortId("x"));
    }
}
