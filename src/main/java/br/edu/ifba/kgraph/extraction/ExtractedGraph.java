package br.edu.ifba.kgraph.extraction;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Entities and relationships extracted from one piece of text.
 */
public record ExtractedGraph(
        @NotNull List<ExtractedEntity> entities,
        @NotNull List<ExtractedRelationship> relationships) {

    public ExtractedGraph {
        entities = entities != null ? List.copyOf(entities) : List.of();
        relationships = relationships != null ? List.copyOf(relationships) : List.of();
    }

    public static ExtractedGraph empty() {
        return new ExtractedGraph(List.of(), List.of());
    }

    public boolean isEmpty() {
        return entities.isEmpty() && relationships.isEmpty();
    }
}
