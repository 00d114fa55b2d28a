package br.edu.ifba.kgraph.query;

import br.edu.ifba.kgraph.core.Entity;
import org.jetbrains.annotations.NotNull;

/**
 * An entity in a retrieval result.
 *
 * @param entity the stored entity
 * @param score relevance: best of seed similarity and decayed path scores
 * @param hops length of the best scoring path from a seed (0 when the seed score is best)
 * @param seed true if the entity matched the query directly
 */
public record ScoredEntity(
    @NotNull Entity entity,
    double score,
    int hops,
    boolean seed
) {
}
