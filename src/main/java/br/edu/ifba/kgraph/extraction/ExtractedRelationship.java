package br.edu.ifba.kgraph.extraction;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A relationship candidate as produced by the extractor. Endpoints are raw entity
 * names and the type is free text; both are resolved by the mutation gate.
 */
public record ExtractedRelationship(
        @Nullable String sourceEntity,
        @Nullable String targetEntity,
        @Nullable String description,
        @Nullable String relationshipType,
        double confidence,
        @NotNull Map<String, Object> metadata) {

    /**
     * Confidence used when the extractor omits one.
     */
    public static final double DEFAULT_CONFIDENCE = 0.8;

    public ExtractedRelationship {
        metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Map.of();
    }

    public ExtractedRelationship(@Nullable String sourceEntity, @Nullable String targetEntity,
                                 @Nullable String relationshipType, double confidence) {
        this(sourceEntity, targetEntity, null, relationshipType, confidence, Map.of());
    }
}
