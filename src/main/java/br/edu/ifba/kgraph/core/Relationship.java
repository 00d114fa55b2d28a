package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.utils.HashUtil;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A directed, typed edge between two entities, identified by canonical ids.
 *
 * <p>Relationships are never mutated after creation. The id is derived from
 * source, target, type and chunk, so re-applying the same chunk produces the same
 * id and the store overwrites instead of duplicating.</p>
 */
public final class Relationship {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("source_entity_id")
    @NotNull
    private final String sourceEntityId;

    @JsonProperty("target_entity_id")
    @NotNull
    private final String targetEntityId;

    @JsonProperty("description")
    @NotNull
    private final String description;

    @JsonProperty("relationship_type")
    @NotNull
    private final RelationshipType relationshipType;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("weight")
    private final double weight;

    @JsonProperty("chunk_id")
    @NotNull
    private final String chunkId;

    @JsonProperty("metadata")
    @NotNull
    private final Map<String, Object> metadata;

    public Relationship(
            @NotNull String sourceEntityId,
            @NotNull String targetEntityId,
            @Nullable String description,
            @NotNull RelationshipType relationshipType,
            double confidence,
            double weight,
            @NotNull String chunkId,
            @Nullable Map<String, Object> metadata) {
        this.sourceEntityId = Objects.requireNonNull(sourceEntityId, "sourceEntityId must not be null");
        this.targetEntityId = Objects.requireNonNull(targetEntityId, "targetEntityId must not be null");
        this.relationshipType = Objects.requireNonNull(relationshipType, "relationshipType must not be null");
        this.chunkId = Objects.requireNonNull(chunkId, "chunkId must not be null");
        this.description = description != null ? description : "";
        this.confidence = confidence;
        this.weight = weight;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
        this.id = computeId(sourceEntityId, targetEntityId, relationshipType, chunkId);
    }

    /**
     * Derives the deterministic relationship id.
     */
    @NotNull
    public static String computeId(
            @NotNull String sourceEntityId,
            @NotNull String targetEntityId,
            @NotNull RelationshipType type,
            @NotNull String chunkId) {
        return HashUtil.shortId(sourceEntityId + "::" + targetEntityId + "::" + type.name() + "::" + chunkId);
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getSourceEntityId() {
        return sourceEntityId;
    }

    @NotNull
    public String getTargetEntityId() {
        return targetEntityId;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @NotNull
    public RelationshipType getRelationshipType() {
        return relationshipType;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getWeight() {
        return weight;
    }

    @NotNull
    public String getChunkId() {
        return chunkId;
    }

    @NotNull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * Returns the other endpoint of this edge, or null if the entity is not an endpoint.
     */
    @Nullable
    public String otherEndpoint(@NotNull String entityId) {
        if (sourceEntityId.equals(entityId)) {
            return targetEntityId;
        }
        if (targetEntityId.equals(entityId)) {
            return sourceEntityId;
        }
        return null;
    }

    /**
     * Creates the inverse edge (target to source) with the same type, confidence,
     * weight and provenance.
     */
    public Relationship inverse(@NotNull Map<String, Object> extraMetadata) {
        Map<String, Object> mirrorMetadata = new LinkedHashMap<>(metadata);
        mirrorMetadata.putAll(extraMetadata);
        return new Relationship(targetEntityId, sourceEntityId, description, relationshipType,
            confidence, weight, chunkId, mirrorMetadata);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Relationship that = (Relationship) obj;
        return Double.compare(that.confidence, confidence) == 0 &&
               Double.compare(that.weight, weight) == 0 &&
               Objects.equals(id, that.id) &&
               Objects.equals(description, that.description) &&
               Objects.equals(metadata, that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, description, confidence, weight, metadata);
    }

    @Override
    public String toString() {
        return "Relationship{" +
                "id='" + id + '\'' +
                ", " + sourceEntityId + " -[" + relationshipType + "]-> " + targetEntityId +
                ", confidence=" + confidence +
                ", weight=" + weight +
                ", chunkId='" + chunkId + '\'' +
                '}';
    }

    /**
     * Builder for Relationship instances.
     */
    public static class Builder {
        private String sourceEntityId;
        private String targetEntityId;
        private String description;
        private RelationshipType relationshipType = RelationshipType.GENERIC;
        private double confidence;
        private double weight;
        private String chunkId;
        private Map<String, Object> metadata = new LinkedHashMap<>();

        public Builder sourceEntityId(@NotNull String sourceEntityId) {
            this.sourceEntityId = sourceEntityId;
            return this;
        }

        public Builder targetEntityId(@NotNull String targetEntityId) {
            this.targetEntityId = targetEntityId;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder relationshipType(@NotNull RelationshipType relationshipType) {
            this.relationshipType = relationshipType;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder weight(double weight) {
            this.weight = weight;
            return this;
        }

        public Builder chunkId(@NotNull String chunkId) {
            this.chunkId = chunkId;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            this.metadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
            return this;
        }

        public Builder putMetadata(@NotNull String key, @Nullable Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Relationship build() {
            return new Relationship(sourceEntityId, targetEntityId, description, relationshipType,
                confidence, weight, chunkId, metadata);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
