package br.edu.ifba.kgraph.core;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Outcome of applying one chunk's extracted fragment to the graph.
 *
 * @param status APPLIED or ALREADY_PROCESSED
 * @param chunkId the chunk the fragment came from
 * @param entities entities as stored after insert or merge, one per distinct concept
 * @param relationships relationships from this chunk still stored after degree capping, mirrors included
 * @param insertedEntities entities created
 * @param mergedEntities candidates folded into an existing entity
 * @param droppedMalformed candidates without a name
 * @param droppedUnresolved relationships whose endpoint is not an entity of this chunk
 * @param droppedSelfLoops relationships whose endpoints resolve to the same entity
 * @param droppedLowConfidence relationships below the minimum confidence
 * @param evictedEdges edges removed by the degree cap
 * @param mirroredEdges inverse edges created for symmetric types
 */
public record MutationResult(
    @NotNull Status status,
    @NotNull String chunkId,
    @NotNull List<Entity> entities,
    @NotNull List<Relationship> relationships,
    int insertedEntities,
    int mergedEntities,
    int droppedMalformed,
    int droppedUnresolved,
    int droppedSelfLoops,
    int droppedLowConfidence,
    int evictedEdges,
    int mirroredEdges
) {

    public enum Status {
        APPLIED,
        ALREADY_PROCESSED
    }

    public MutationResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (chunkId == null) {
            throw new IllegalArgumentException("chunkId cannot be null");
        }
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    /**
     * Result for a chunk whose relationships are already in the graph.
     */
    public static MutationResult alreadyProcessed(@NotNull String chunkId) {
        return new MutationResult(Status.ALREADY_PROCESSED, chunkId, List.of(), List.of(), 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public boolean isAlreadyProcessed() {
        return status == Status.ALREADY_PROCESSED;
    }

    /**
     * Total relationship candidates rejected before persistence.
     */
    public int droppedRelationships() {
        return droppedUnresolved + droppedSelfLoops + droppedLowConfidence;
    }

    /**
     * Returns a one-line summary for logging.
     */
    public String summary() {
        if (isAlreadyProcessed()) {
            return String.format("chunk %s already processed", chunkId);
        }
        return String.format(
            "chunk %s: %d entities (%d new, %d merged), %d relationships (%d mirrored), dropped %d, evicted %d",
            chunkId, entities.size(), insertedEntities, mergedEntities, relationships.size(), mirroredEdges,
            droppedRelationships() + droppedMalformed, evictedEdges
        );
    }
}
