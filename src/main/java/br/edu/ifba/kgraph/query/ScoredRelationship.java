package br.edu.ifba.kgraph.query;

import br.edu.ifba.kgraph.core.Relationship;
import org.jetbrains.annotations.NotNull;

/**
 * A relationship in a retrieval result, scored by the best path that traverses it.
 */
public record ScoredRelationship(
    @NotNull Relationship relationship,
    double score
) {
}
