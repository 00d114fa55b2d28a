package br.edu.ifba.kgraph.storage.impl;

import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.Relationship;
import br.edu.ifba.kgraph.core.RelationshipType;
import br.edu.ifba.kgraph.storage.GraphStore;
import br.edu.ifba.kgraph.storage.GraphStoreException;
import br.edu.ifba.kgraph.utils.EmbeddingUtil;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory graph store using adjacency lists.
 * Thread-safe with ConcurrentHashMap backing; list results are sorted by id so
 * callers see a deterministic order.
 */
public class InMemoryGraphStore implements GraphStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryGraphStore.class);

    private static final Comparator<Relationship> BY_ID = Comparator.comparing(Relationship::getId);

    // canonicalId -> Entity
    private final ConcurrentHashMap<String, Entity> entities = new ConcurrentHashMap<>();

    // relationshipId -> Relationship
    private final ConcurrentHashMap<String, Relationship> relationships = new ConcurrentHashMap<>();

    // srcId -> (relationshipId -> Relationship)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Relationship>> outgoingEdges = new ConcurrentHashMap<>();

    // tgtId -> (relationshipId -> Relationship)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Relationship>> incomingEdges = new ConcurrentHashMap<>();

    // chunkId -> (relationshipId -> Relationship)
    private final ConcurrentHashMap<String, ConcurrentHashMap<String, Relationship>> chunkEdges = new ConcurrentHashMap<>();

    @Override
    @NotNull
    public Optional<Entity> findByCanonicalId(@NotNull String canonicalId) {
        return Optional.ofNullable(entities.get(canonicalId));
    }

    @Override
    @NotNull
    public List<EntityMatch> findSimilarEntities(@NotNull float[] vector, double threshold, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<EntityMatch> matches = new ArrayList<>();
        for (Entity entity : entities.values()) {
            float[] embedding = entity.getEmbedding();
            if (embedding == null || embedding.length != vector.length) {
                continue;
            }
            double similarity = EmbeddingUtil.cosineSimilarity(vector, embedding);
            if (similarity >= threshold) {
                matches.add(new EntityMatch(entity, similarity));
            }
        }
        matches.sort(Comparator.comparingDouble(EntityMatch::similarity).reversed()
            .thenComparing(match -> match.entity().getCanonicalId()));
        return matches.size() > limit ? List.copyOf(matches.subList(0, limit)) : List.copyOf(matches);
    }

    @Override
    public void upsertEntity(@NotNull Entity entity) {
        entities.put(entity.getCanonicalId(), entity);
        logger.debug("Upserted entity: {} ({})", entity.getName(), entity.getCanonicalId());
    }

    @Override
    @NotNull
    public List<Entity> listEntities() {
        List<Entity> result = new ArrayList<>(entities.values());
        result.sort(Comparator.comparing(Entity::getCanonicalId));
        return result;
    }

    @Override
    public void deleteEntity(@NotNull String canonicalId) {
        Set<String> touching = new HashSet<>();
        ConcurrentHashMap<String, Relationship> outgoing = outgoingEdges.get(canonicalId);
        if (outgoing != null) {
            touching.addAll(outgoing.keySet());
        }
        ConcurrentHashMap<String, Relationship> incoming = incomingEdges.get(canonicalId);
        if (incoming != null) {
            touching.addAll(incoming.keySet());
        }
        deleteEdges(touching);
        if (entities.remove(canonicalId) != null) {
            logger.debug("Deleted entity {} and {} relationships", canonicalId, touching.size());
        }
    }

    @Override
    public void upsertRelationship(@NotNull Relationship relationship) {
        String srcId = relationship.getSourceEntityId();
        String tgtId = relationship.getTargetEntityId();
        if (!entities.containsKey(srcId) || !entities.containsKey(tgtId)) {
            throw new GraphStoreException(
                "Cannot store relationship " + relationship.getId() + ": endpoint missing (" + srcId + " -> " + tgtId + ")"
            );
        }

        String id = relationship.getId();
        relationships.put(id, relationship);
        outgoingEdges.computeIfAbsent(srcId, k -> new ConcurrentHashMap<>()).put(id, relationship);
        incomingEdges.computeIfAbsent(tgtId, k -> new ConcurrentHashMap<>()).put(id, relationship);
        chunkEdges.computeIfAbsent(relationship.getChunkId(), k -> new ConcurrentHashMap<>()).put(id, relationship);

        logger.debug("Upserted relationship: {} -[{}]-> {}", srcId, relationship.getRelationshipType(), tgtId);
    }

    @Override
    @NotNull
    public List<Relationship> listRelationshipsByChunk(@NotNull String chunkId) {
        return sorted(chunkEdges.get(chunkId));
    }

    @Override
    public int countOutgoingEdges(@NotNull String entityId) {
        ConcurrentHashMap<String, Relationship> outgoing = outgoingEdges.get(entityId);
        return outgoing != null ? outgoing.size() : 0;
    }

    @Override
    @NotNull
    public List<Relationship> listOutgoingEdges(@NotNull String entityId) {
        return sorted(outgoingEdges.get(entityId));
    }

    @Override
    @NotNull
    public List<Relationship> listRelationshipsForEntity(@NotNull String entityId) {
        Map<String, Relationship> result = new HashMap<>();
        ConcurrentHashMap<String, Relationship> outgoing = outgoingEdges.get(entityId);
        if (outgoing != null) {
            result.putAll(outgoing);
        }
        ConcurrentHashMap<String, Relationship> incoming = incomingEdges.get(entityId);
        if (incoming != null) {
            result.putAll(incoming);
        }
        return sorted(result);
    }

    @Override
    @NotNull
    public Optional<Relationship> findRelationship(@NotNull String sourceEntityId, @NotNull String targetEntityId,
                                                   @NotNull RelationshipType type) {
        ConcurrentHashMap<String, Relationship> outgoing = outgoingEdges.get(sourceEntityId);
        if (outgoing == null) {
            return Optional.empty();
        }
        return outgoing.values().stream()
            .filter(r -> r.getTargetEntityId().equals(targetEntityId) && r.getRelationshipType() == type)
            .min(BY_ID);
    }

    @Override
    public int deleteEdges(@NotNull Collection<String> relationshipIds) {
        int count = 0;
        for (String id : relationshipIds) {
            Relationship removed = relationships.remove(id);
            if (removed == null) {
                continue;
            }
            removeFromIndex(outgoingEdges, removed.getSourceEntityId(), id);
            removeFromIndex(incomingEdges, removed.getTargetEntityId(), id);
            removeFromIndex(chunkEdges, removed.getChunkId(), id);
            count++;
        }
        logger.debug("Deleted {} relationships", count);
        return count;
    }

    @Override
    @NotNull
    public List<Relationship> listRelationships() {
        return sorted(relationships);
    }

    @Override
    @NotNull
    public GraphStats getStats() {
        long entityCount = entities.size();
        long relationshipCount = relationships.size();
        double averageDegree = entityCount > 0 ? (2.0 * relationshipCount) / entityCount : 0.0;
        return new GraphStats(entityCount, relationshipCount, averageDegree);
    }

    @Override
    public void reset() {
        entities.clear();
        relationships.clear();
        outgoingEdges.clear();
        incomingEdges.clear();
        chunkEdges.clear();
        logger.info("InMemoryGraphStore reset");
    }

    private static void removeFromIndex(ConcurrentHashMap<String, ConcurrentHashMap<String, Relationship>> index,
                                        String key, String relationshipId) {
        ConcurrentHashMap<String, Relationship> edges = index.get(key);
        if (edges != null) {
            edges.remove(relationshipId);
        }
    }

    private static List<Relationship> sorted(Map<String, Relationship> edges) {
        if (edges == null || edges.isEmpty()) {
            return List.of();
        }
        List<Relationship> result = new ArrayList<>(edges.values());
        result.sort(BY_ID);
        return result;
    }
}
