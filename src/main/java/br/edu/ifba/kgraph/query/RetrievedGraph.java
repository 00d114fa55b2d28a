package br.edu.ifba.kgraph.query;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Ranked subgraph answering a query.
 * Entities and relationships are sorted by score descending, ties by id ascending.
 */
public record RetrievedGraph(
    @NotNull String query,
    @NotNull List<ScoredEntity> entities,
    @NotNull List<ScoredRelationship> relationships
) {

    public RetrievedGraph {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    public static RetrievedGraph empty(@NotNull String query) {
        return new RetrievedGraph(query, List.of(), List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    /**
     * Entities that matched the query directly.
     */
    public List<ScoredEntity> seeds() {
        return entities.stream().filter(ScoredEntity::seed).toList();
    }
}
