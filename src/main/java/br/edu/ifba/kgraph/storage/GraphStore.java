package br.edu.ifba.kgraph.storage;

import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.Relationship;
import br.edu.ifba.kgraph.core.RelationshipType;
import br.edu.ifba.kgraph.utils.LockUtil;
import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Storage for the typed knowledge graph.
 *
 * <p>Entities are keyed by canonical id, relationships by their deterministic id.
 * Operations are synchronous: mutations run under thread-bound keyed locks taken by
 * {@link #executeAtomically(Collection, Supplier)}. Reads never lock.</p>
 *
 * <p>Implementations throw {@link GraphStoreException} on backend failures.</p>
 *
 * Implementations: InMemoryGraphStore
 */
public interface GraphStore {

    // ===== Entity Operations =====

    /**
     * Looks up an entity by canonical id.
     */
    @NotNull
    Optional<Entity> findByCanonicalId(@NotNull String canonicalId);

    /**
     * Finds entities whose embedding has cosine similarity at or above the threshold.
     * Entities without embeddings are skipped.
     *
     * @param vector query vector
     * @param threshold minimum cosine similarity
     * @param limit maximum number of matches
     * @return matches sorted by similarity descending, ties by canonical id
     */
    @NotNull
    List<EntityMatch> findSimilarEntities(@NotNull float[] vector, double threshold, int limit);

    /**
     * Inserts or replaces the entity with the same canonical id.
     */
    void upsertEntity(@NotNull Entity entity);

    @NotNull
    List<Entity> listEntities();

    /**
     * Deletes an entity and every relationship touching it. Unknown ids are ignored.
     */
    void deleteEntity(@NotNull String canonicalId);

    // ===== Relationship Operations =====

    /**
     * Inserts or replaces the relationship with the same id.
     * Both endpoints must already exist.
     *
     * @throws GraphStoreException if an endpoint is missing
     */
    void upsertRelationship(@NotNull Relationship relationship);

    /**
     * Lists relationships extracted from a chunk. A non-empty result marks the chunk
     * as already processed.
     */
    @NotNull
    List<Relationship> listRelationshipsByChunk(@NotNull String chunkId);

    int countOutgoingEdges(@NotNull String entityId);

    @NotNull
    List<Relationship> listOutgoingEdges(@NotNull String entityId);

    /**
     * Lists relationships where the entity is source or target.
     */
    @NotNull
    List<Relationship> listRelationshipsForEntity(@NotNull String entityId);

    /**
     * Finds any relationship with the given source, target and type, regardless of chunk.
     */
    @NotNull
    Optional<Relationship> findRelationship(@NotNull String sourceEntityId, @NotNull String targetEntityId,
                                            @NotNull RelationshipType type);

    /**
     * Deletes relationships by id. Unknown ids are ignored.
     *
     * @return number of relationships deleted
     */
    int deleteEdges(@NotNull Collection<String> relationshipIds);

    @NotNull
    List<Relationship> listRelationships();

    // ===== Lifecycle =====

    @NotNull
    GraphStats getStats();

    /**
     * Deletes all entities and relationships.
     */
    void reset();

    /**
     * Runs a unit of work while holding the keyed locks for every given key.
     * Locks are taken in sorted order and released on every exit path.
     *
     * @param lockKeys keys the work touches (chunk id, canonical ids)
     * @param work the mutation
     * @return the work's result
     */
    default <T> T executeAtomically(@NotNull Collection<String> lockKeys, @NotNull Supplier<T> work) {
        ReentrantLock[] locks = LockUtil.acquireLocksInOrder(lockKeys);
        try {
            return work.get();
        } finally {
            LockUtil.releaseLocks(locks);
        }
    }

    /**
     * An entity matched by embedding similarity.
     */
    record EntityMatch(
            @NotNull Entity entity,
            double similarity) {
    }

    /**
     * Represents statistics about the graph.
     */
    record GraphStats(
            long entityCount,
            long relationshipCount,
            double averageDegree) {
    }
}
