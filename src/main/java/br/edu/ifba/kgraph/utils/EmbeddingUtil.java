package br.edu.ifba.kgraph.utils;

import org.jetbrains.annotations.NotNull;

/**
 * Vector math shared by entity merging and seed selection.
 */
public final class EmbeddingUtil {

    private EmbeddingUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Computes cosine similarity between two embeddings.
     * Returns a value between -1 (opposite) and 1 (identical), or 0 when either
     * vector has zero norm.
     *
     * @param a First embedding
     * @param b Second embedding
     * @return Cosine similarity score
     */
    public static double cosineSimilarity(@NotNull float[] a, @NotNull float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embeddings must have same dimensions: " + a.length + " vs " + b.length
            );
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
