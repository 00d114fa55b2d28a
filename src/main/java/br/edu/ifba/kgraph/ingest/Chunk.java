package br.edu.ifba.kgraph.ingest;

import org.jetbrains.annotations.NotNull;

/**
 * A text chunk to ingest. The id is the idempotency key: a chunk whose id already
 * has relationships in the graph is not extracted again.
 *
 * @param id unique chunk identifier
 * @param text chunk content
 */
public record Chunk(
    @NotNull String id,
    @NotNull String text
) {

    public Chunk {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
    }
}
