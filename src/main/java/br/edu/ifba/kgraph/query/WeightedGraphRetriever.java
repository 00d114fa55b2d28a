package br.edu.ifba.kgraph.query;

import br.edu.ifba.kgraph.core.Entity;
import br.edu.ifba.kgraph.core.KnowledgeGraphConfig;
import br.edu.ifba.kgraph.core.Relationship;
import br.edu.ifba.kgraph.core.RelationshipTyper;
import br.edu.ifba.kgraph.embedding.EmbeddingFunction;
import br.edu.ifba.kgraph.storage.GraphStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Retrieves a ranked subgraph for a query.
 *
 * <h2>Retrieval Strategy:</h2>
 * <ol>
 *   <li>Embed the query</li>
 *   <li>Seed with the entities most similar to the query (cosine similarity at or
 *       above the seed threshold, best {@code maxSeeds}), restricted by metadata filters</li>
 *   <li>Traverse up to {@code depth} hops in both directions; a hop over edge {@code e}
 *       multiplies the score by {@code weight(e) / 10 * hopDecay}</li>
 *   <li>Keep the best score per entity and per relationship</li>
 * </ol>
 *
 * <p>Filters are exact: a value matches only when {@code equals} holds, so the string
 * {@code "1"} does not match the integer {@code 1}. Relationships whose metadata holds a
 * filtered key with a different value are not traversed. Read-only; takes no locks.</p>
 */
public class WeightedGraphRetriever {

    private static final Logger logger = LoggerFactory.getLogger(WeightedGraphRetriever.class);

    /**
     * Filter key also matched against the entity's type.
     */
    public static final String ENTITY_TYPE_KEY = "entity_type";

    private final GraphStore store;
    private final EmbeddingFunction embeddingFunction;
    private final double seedSimilarityThreshold;
    private final int maxSeeds;
    private final double hopDecay;

    public WeightedGraphRetriever(
            @NotNull KnowledgeGraphConfig config,
            @NotNull GraphStore store,
            @NotNull EmbeddingFunction embeddingFunction) {
        this(
            store,
            embeddingFunction,
            config.retrieval().seedSimilarityThreshold(),
            config.retrieval().maxSeeds(),
            config.retrieval().hopDecay()
        );
    }

    public WeightedGraphRetriever(
            @NotNull GraphStore store,
            @NotNull EmbeddingFunction embeddingFunction,
            double seedSimilarityThreshold,
            int maxSeeds,
            double hopDecay) {
        if (maxSeeds < 1) {
            throw new IllegalArgumentException("maxSeeds must be positive, got " + maxSeeds);
        }
        if (hopDecay <= 0.0 || hopDecay > 1.0) {
            throw new IllegalArgumentException("hopDecay must be in (0.0, 1.0], got " + hopDecay);
        }
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.embeddingFunction = Objects.requireNonNull(embeddingFunction, "embeddingFunction must not be null");
        this.seedSimilarityThreshold = seedSimilarityThreshold;
        this.maxSeeds = maxSeeds;
        this.hopDecay = hopDecay;
    }

    /**
     * Retrieves the subgraph relevant to a query.
     *
     * @param query natural language query
     * @param depth maximum hops from a seed; 0 or less returns seeds only
     * @param metadataFilters exact-match filters on entity and relationship metadata
     * @return ranked entities and relationships, empty when nothing matches the query
     */
    @NotNull
    public RetrievedGraph retrieve(@NotNull String query, int depth, @Nullable Map<String, Object> metadataFilters) {
        Objects.requireNonNull(query, "query must not be null");
        Map<String, Object> filters = metadataFilters != null ? metadataFilters : Map.of();
        if (query.isBlank()) {
            return RetrievedGraph.empty(query);
        }

        float[] queryVector = embeddingFunction.embedSingle(query).join();
        List<GraphStore.EntityMatch> seeds = selectSeeds(queryVector, filters);
        if (seeds.isEmpty()) {
            logger.debug("No seed entities for query '{}'", query);
            return RetrievedGraph.empty(query);
        }

        Map<String, Entity> entities = new HashMap<>();
        Map<String, Double> entityScores = new HashMap<>();
        Map<String, Integer> entityHops = new HashMap<>();
        Set<String> seedIds = new LinkedHashSet<>();
        for (GraphStore.EntityMatch seed : seeds) {
            String id = seed.entity().getCanonicalId();
            entities.put(id, seed.entity());
            entityScores.put(id, seed.similarity());
            entityHops.put(id, 0);
            seedIds.add(id);
        }

        Map<String, Relationship> relationships = new HashMap<>();
        Map<String, Double> relationshipScores = new HashMap<>();

        Set<String> frontier = new LinkedHashSet<>(seedIds);
        for (int hop = 1; hop <= depth && !frontier.isEmpty(); hop++) {
            // Snapshot so every path produced in this round has exactly `hop` edges
            Map<String, Double> parentScores = new HashMap<>();
            for (String id : frontier) {
                parentScores.put(id, entityScores.get(id));
            }

            Set<String> improved = new LinkedHashSet<>();
            for (String entityId : frontier) {
                double parentScore = parentScores.get(entityId);
                for (Relationship relationship : store.listRelationshipsForEntity(entityId)) {
                    if (!relationshipPasses(relationship, filters)) {
                        continue;
                    }
                    String neighborId = relationship.otherEndpoint(entityId);
                    if (neighborId == null) {
                        continue;
                    }
                    Entity neighbor = entities.get(neighborId);
                    if (neighbor == null) {
                        neighbor = store.findByCanonicalId(neighborId).orElse(null);
                        if (neighbor == null) {
                            continue;
                        }
                        entities.put(neighborId, neighbor);
                    }

                    double pathScore = parentScore * (relationship.getWeight() / RelationshipTyper.WEIGHT_SCALE) * hopDecay;

                    relationships.put(relationship.getId(), relationship);
                    relationshipScores.merge(relationship.getId(), pathScore, Math::max);

                    Double current = entityScores.get(neighborId);
                    if (current == null || pathScore > current) {
                        entityScores.put(neighborId, pathScore);
                        entityHops.put(neighborId, hop);
                        improved.add(neighborId);
                    }
                }
            }
            frontier = improved;
        }

        List<ScoredEntity> scoredEntities = new ArrayList<>(entityScores.size());
        for (Map.Entry<String, Double> entry : entityScores.entrySet()) {
            String id = entry.getKey();
            scoredEntities.add(new ScoredEntity(entities.get(id), entry.getValue(), entityHops.get(id), seedIds.contains(id)));
        }
        scoredEntities.sort(Comparator.comparingDouble(ScoredEntity::score).reversed()
            .thenComparing(scored -> scored.entity().getCanonicalId()));

        List<ScoredRelationship> scoredRelationships = new ArrayList<>(relationshipScores.size());
        for (Map.Entry<String, Double> entry : relationshipScores.entrySet()) {
            scoredRelationships.add(new ScoredRelationship(relationships.get(entry.getKey()), entry.getValue()));
        }
        scoredRelationships.sort(Comparator.comparingDouble(ScoredRelationship::score).reversed()
            .thenComparing(scored -> scored.relationship().getId()));

        logger.debug("Retrieved {} entities ({} seeds) and {} relationships for query '{}' at depth {}",
            scoredEntities.size(), seedIds.size(), scoredRelationships.size(), query, depth);
        return new RetrievedGraph(query, scoredEntities, scoredRelationships);
    }

    private List<GraphStore.EntityMatch> selectSeeds(float[] queryVector, Map<String, Object> filters) {
        if (filters.isEmpty()) {
            return store.findSimilarEntities(queryVector, seedSimilarityThreshold, maxSeeds);
        }
        List<GraphStore.EntityMatch> seeds = new ArrayList<>();
        for (GraphStore.EntityMatch match : store.findSimilarEntities(queryVector, seedSimilarityThreshold, Integer.MAX_VALUE)) {
            if (entityPasses(match.entity(), filters)) {
                seeds.add(match);
                if (seeds.size() == maxSeeds) {
                    break;
                }
            }
        }
        return seeds;
    }

    /**
     * Seeds must carry every filter key with an equal value.
     */
    static boolean entityPasses(Entity entity, Map<String, Object> filters) {
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object value = entity.getMetadata().get(filter.getKey());
            if (value == null && ENTITY_TYPE_KEY.equals(filter.getKey())) {
                value = entity.getEntityType();
            }
            if (!valueMatches(value, filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Relationships are excluded only when they carry a filter key with a different value.
     */
    static boolean relationshipPasses(Relationship relationship, Map<String, Object> filters) {
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Map<String, Object> metadata = relationship.getMetadata();
            if (metadata.containsKey(filter.getKey()) && !valueMatches(metadata.get(filter.getKey()), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    private static boolean valueMatches(@Nullable Object actual, @Nullable Object expected) {
        return Objects.equals(actual, expected);
    }
}
