package br.edu.ifba.kgraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Assigns traversal weights to relationships.
 *
 * <p>Weight is {@code confidence * baseWeight(type) * 10}, with confidence clamped to
 * [0, 1], so weights fall in [0, 10]. When typed relationships are disabled every
 * relationship is weighted as {@link RelationshipType#GENERIC}.</p>
 */
public class RelationshipTyper {

    public static final double WEIGHT_SCALE = 10.0;

    private final boolean typedEnabled;

    /**
     * Creates a typer honouring the typed-relationships feature toggle.
     */
    public RelationshipTyper(@NotNull KnowledgeGraphConfig config) {
        this(config.isFeatureEnabled(KnowledgeGraphConfig.Feature.TYPED_RELATIONSHIPS));
    }

    public RelationshipTyper(boolean typedEnabled) {
        this.typedEnabled = typedEnabled;
    }

    /**
     * Resolves the effective type for a raw extractor value.
     */
    @NotNull
    public RelationshipType resolveType(@Nullable String rawType) {
        if (!typedEnabled) {
            return RelationshipType.GENERIC;
        }
        return RelationshipType.fromString(rawType);
    }

    /**
     * Computes the weight for a relationship of the given type and confidence.
     * NaN confidence counts as zero.
     */
    public double weight(@NotNull RelationshipType type, double confidence) {
        return clamp(confidence) * type.getBaseWeight() * WEIGHT_SCALE;
    }

    public boolean isSymmetric(@NotNull RelationshipType type) {
        return type.isSymmetric();
    }

    public boolean isTypedEnabled() {
        return typedEnabled;
    }

    static double clamp(double confidence) {
        if (Double.isNaN(confidence)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
