package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.embedding.EmbeddingFunction;
import br.edu.ifba.kgraph.extraction.GraphExtractor;
import br.edu.ifba.kgraph.extraction.LlmGraphExtractor;
import br.edu.ifba.kgraph.ingest.Chunk;
import br.edu.ifba.kgraph.ingest.ChunkResult;
import br.edu.ifba.kgraph.ingest.IngestionScheduler;
import br.edu.ifba.kgraph.llm.LLMFunction;
import br.edu.ifba.kgraph.query.RetrievedGraph;
import br.edu.ifba.kgraph.query.WeightedGraphRetriever;
import br.edu.ifba.kgraph.storage.GraphStore;
import br.edu.ifba.kgraph.storage.impl.InMemoryGraphStore;
import br.edu.ifba.kgraph.utils.HashUtil;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point for building and querying a typed knowledge graph.
 *
 * <p>Wires the canonicalizer, relationship typer, mutation gate, ingestion scheduler
 * and weighted retriever around one {@link GraphStore}.</p>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * KnowledgeGraphIndex index = KnowledgeGraphIndex.builder()
 *     .config(KnowledgeGraphConfigLoader.load())
 *     .llmFunction(llm)
 *     .embeddingFunction(embedder)
 *     .build();
 *
 * List<ChunkResult> results = index.addChunks(chunks);
 * RetrievedGraph graph = index.retrieve("What does norepinephrine treat?");
 * }</pre>
 */
public class KnowledgeGraphIndex {

    private static final Logger logger = LoggerFactory.getLogger(KnowledgeGraphIndex.class);

    public static final String TEXT_CHUNK_PREFIX = "text-";

    private final KnowledgeGraphConfig config;
    private final GraphStore store;
    private final IngestionScheduler scheduler;
    private final WeightedGraphRetriever retriever;

    private KnowledgeGraphIndex(
            @NotNull KnowledgeGraphConfig config,
            @NotNull GraphStore store,
            @NotNull GraphExtractor extractor,
            @NotNull EmbeddingFunction embeddingFunction) {
        this.config = config;
        this.store = store;
        GraphMutationGate gate = new GraphMutationGate(config, store, embeddingFunction);
        this.scheduler = new IngestionScheduler(config, extractor, gate, store);
        this.retriever = new WeightedGraphRetriever(config, store, embeddingFunction);

        logger.info("KnowledgeGraphIndex initialized (enhanced features: {}, store: {})",
            config.enabled(), store.getClass().getSimpleName());
    }

    /**
     * Ingests free text under a chunk id derived from its content.
     */
    @NotNull
    public ChunkResult addText(@NotNull String text) {
        Objects.requireNonNull(text, "text must not be null");
        return addChunk(new Chunk(TEXT_CHUNK_PREFIX + HashUtil.shortId(text), text));
    }

    /**
     * Ingests a single chunk; skipped if the chunk was already ingested.
     */
    @NotNull
    public ChunkResult addChunk(@NotNull Chunk chunk) {
        Objects.requireNonNull(chunk, "chunk must not be null");
        return scheduler.processChunk(chunk);
    }

    /**
     * Ingests chunks with the configured worker count.
     */
    @NotNull
    public List<ChunkResult> addChunks(@NotNull List<Chunk> chunks) {
        return scheduler.process(chunks);
    }

    /**
     * Ingests chunks with at most {@code maxParallelism} workers.
     */
    @NotNull
    public List<ChunkResult> addChunks(@NotNull List<Chunk> chunks, int maxParallelism) {
        return scheduler.process(chunks, maxParallelism);
    }

    /**
     * Retrieves with the configured default depth and no filters.
     */
    @NotNull
    public RetrievedGraph retrieve(@NotNull String query) {
        return retrieve(query, config.retrieval().defaultDepth(), null);
    }

    @NotNull
    public RetrievedGraph retrieve(@NotNull String query, int depth, @Nullable Map<String, Object> metadataFilters) {
        return retriever.retrieve(query, depth, metadataFilters);
    }

    @NotNull
    public GraphStore.GraphStats stats() {
        return store.getStats();
    }

    /**
     * Deletes the whole graph.
     */
    public void reset() {
        store.reset();
        logger.info("Knowledge graph reset");
    }

    @NotNull
    public GraphStore getStore() {
        return store;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for KnowledgeGraphIndex instances.
     */
    public static class Builder {
        private KnowledgeGraphConfig config;
        private GraphStore graphStore;
        private GraphExtractor graphExtractor;
        private LLMFunction llmFunction;
        private EmbeddingFunction embeddingFunction;

        public Builder config(@NotNull KnowledgeGraphConfig config) {
            this.config = config;
            return this;
        }

        public Builder graphStore(@NotNull GraphStore graphStore) {
            this.graphStore = graphStore;
            return this;
        }

        /**
         * Sets the extractor directly; takes precedence over {@link #llmFunction(LLMFunction)}.
         */
        public Builder graphExtractor(@NotNull GraphExtractor graphExtractor) {
            this.graphExtractor = graphExtractor;
            return this;
        }

        public Builder llmFunction(@NotNull LLMFunction llmFunction) {
            this.llmFunction = llmFunction;
            return this;
        }

        public Builder embeddingFunction(@NotNull EmbeddingFunction embeddingFunction) {
            this.embeddingFunction = embeddingFunction;
            return this;
        }

        public KnowledgeGraphIndex build() {
            if (graphExtractor == null && llmFunction == null) {
                throw new IllegalStateException("graphExtractor or llmFunction is required");
            }
            if (embeddingFunction == null) {
                throw new IllegalStateException("embeddingFunction is required");
            }

            KnowledgeGraphConfig effectiveConfig = config != null ? config : KnowledgeGraphConfigLoader.load();
            effectiveConfig.validate();
            GraphStore effectiveStore = graphStore != null ? graphStore : new InMemoryGraphStore();
            GraphExtractor effectiveExtractor = graphExtractor != null ? graphExtractor : new LlmGraphExtractor(llmFunction);

            return new KnowledgeGraphIndex(effectiveConfig, effectiveStore, effectiveExtractor, embeddingFunction);
        }
    }
}
