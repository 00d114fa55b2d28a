package br.edu.ifba.kgraph.extraction;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.CompletableFuture;

/**
 * Extracts a candidate graph from text.
 *
 * <p>Implementations are typically backed by an LLM and may be slow,
 * non-deterministic or fail. A failed future or a malformed result fails only the
 * chunk being processed.</p>
 */
@FunctionalInterface
public interface GraphExtractor {

    /**
     * @param text chunk text
     * @return future completing with the extracted graph
     */
    CompletableFuture<ExtractedGraph> extract(@NotNull String text);
}
