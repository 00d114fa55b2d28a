package br.edu.ifba.kgraph.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A concept node in the knowledge graph.
 *
 * <p>Entities are identified by their canonical id: two entities with the same
 * canonical id are the same concept and are stored once. Instances are immutable;
 * the graph changes them only through {@link #mergeWith(Entity)}.</p>
 */
public final class Entity {

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("canonical_id")
    @NotNull
    private final String canonicalId;

    @JsonProperty("description")
    @NotNull
    private final String description;

    @JsonProperty("entity_type")
    @Nullable
    private final String entityType;

    @JsonProperty("metadata")
    @NotNull
    private final Map<String, Object> metadata;

    @JsonProperty("source_chunk_ids")
    @NotNull
    private final Set<String> sourceChunkIds;

    @JsonIgnore
    @Nullable
    private final float[] embedding;

    public Entity(
            @NotNull String name,
            @NotNull String canonicalId,
            @Nullable String description,
            @Nullable String entityType,
            @Nullable Map<String, Object> metadata,
            @Nullable Collection<String> sourceChunkIds,
            @Nullable float[] embedding) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.canonicalId = Objects.requireNonNull(canonicalId, "canonicalId must not be null");
        this.description = description != null ? description : "";
        this.entityType = entityType;
        this.metadata = metadata != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
            : Collections.emptyMap();
        this.sourceChunkIds = sourceChunkIds != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(sourceChunkIds))
            : Collections.emptySet();
        this.embedding = embedding != null ? embedding.clone() : null;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public String getCanonicalId() {
        return canonicalId;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @Nullable
    public String getEntityType() {
        return entityType;
    }

    /**
     * @return unmodifiable metadata in insertion order
     */
    @NotNull
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /**
     * @return unmodifiable set of chunk ids in the order they were first seen
     */
    @NotNull
    public Set<String> getSourceChunkIds() {
        return sourceChunkIds;
    }

    @Nullable
    public float[] getEmbedding() {
        return embedding != null ? embedding.clone() : null;
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }

    public boolean hasSourceChunk(@NotNull String chunkId) {
        return sourceChunkIds.contains(chunkId);
    }

    /**
     * Creates a new Entity with the given embedding.
     */
    public Entity withEmbedding(@Nullable float[] newEmbedding) {
        return new Entity(name, canonicalId, description, entityType, metadata, sourceChunkIds, newEmbedding);
    }

    /**
     * Merges a newly extracted candidate into this stored entity.
     *
     * <p>The result keeps this entity's name and canonical id. Source chunks are
     * unioned. The longer description wins and a tie keeps this one; the embedding
     * follows the kept description. Metadata is merged with the candidate's values
     * overwriting on conflict. The entity type is kept unless this one has none.</p>
     *
     * @param candidate the entity to fold into this one
     * @return new Entity instance with merged data
     */
    public Entity mergeWith(@NotNull Entity candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");

        boolean candidateRicher = candidate.description.length() > this.description.length();
        String mergedDescription = candidateRicher ? candidate.description : this.description;
        float[] mergedEmbedding = candidateRicher && candidate.embedding != null
            ? candidate.embedding
            : (this.embedding != null ? this.embedding : candidate.embedding);

        Set<String> mergedChunkIds = new LinkedHashSet<>(this.sourceChunkIds);
        mergedChunkIds.addAll(candidate.sourceChunkIds);

        Map<String, Object> mergedMetadata = new LinkedHashMap<>(this.metadata);
        mergedMetadata.putAll(candidate.metadata);

        String mergedType = isBlank(this.entityType) ? candidate.entityType : this.entityType;

        return new Entity(name, canonicalId, mergedDescription, mergedType, mergedMetadata, mergedChunkIds, mergedEmbedding);
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Entity entity = (Entity) obj;
        return Objects.equals(name, entity.name) &&
               Objects.equals(canonicalId, entity.canonicalId) &&
               Objects.equals(description, entity.description) &&
               Objects.equals(entityType, entity.entityType) &&
               Objects.equals(metadata, entity.metadata) &&
               Objects.equals(sourceChunkIds, entity.sourceChunkIds) &&
               Arrays.equals(embedding, entity.embedding);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(name, canonicalId, description, entityType, metadata, sourceChunkIds);
        return 31 * result + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "name='" + name + '\'' +
                ", canonicalId='" + canonicalId + '\'' +
                ", entityType='" + entityType + '\'' +
                ", description='" + description + '\'' +
                ", sourceChunkIds=" + sourceChunkIds +
                '}';
    }

    /**
     * Builder for Entity instances.
     */
    public static class Builder {
        private String name;
        private String canonicalId;
        private String description;
        private String entityType;
        private Map<String, Object> metadata = new LinkedHashMap<>();
        private Set<String> sourceChunkIds = new LinkedHashSet<>();
        private float[] embedding;

        public Builder name(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder canonicalId(@NotNull String canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description;
            return this;
        }

        public Builder entityType(@Nullable String entityType) {
            this.entityType = entityType;
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

        public Builder sourceChunkIds(@Nullable Collection<String> sourceChunkIds) {
            this.sourceChunkIds = sourceChunkIds != null ? new LinkedHashSet<>(sourceChunkIds) : new LinkedHashSet<>();
            return this;
        }

        public Builder addSourceChunkId(@NotNull String chunkId) {
            Objects.requireNonNull(chunkId, "chunkId must not be null");
            this.sourceChunkIds.add(chunkId);
            return this;
        }

        public Builder embedding(@Nullable float[] embedding) {
            this.embedding = embedding;
            return this;
        }

        public Entity build() {
            return new Entity(name, canonicalId, description, entityType, metadata, sourceChunkIds, embedding);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
