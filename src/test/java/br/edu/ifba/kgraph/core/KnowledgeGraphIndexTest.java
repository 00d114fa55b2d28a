package br.edu.ifba.kgraph.core;

import br.edu.ifba.kgraph.HashingEmbeddingFunction;
import br.edu.ifba.kgraph.extraction.ExtractedEntity;
import br.edu.ifba.kgraph.extraction.ExtractedGraph;
import br.edu.ifba.kgraph.extraction.ExtractedRelationship;
import br.edu.ifba.kgraph.extraction.GraphExtractor;
import br.edu.ifba.kgraph.ingest.Chunk;
import br.edu.ifba.kgraph.ingest.ChunkResult;
import br.edu.ifba.kgraph.llm.LLMFunction;
import br.edu.ifba.kgraph.query.RetrievedGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests: ingestion through the facade, then retrieval.
 */
class KnowledgeGraphIndexTest {

    private static final Map<String, ExtractedGraph> GRAPHS = Map.of(
        "Norepinephrine is the first-line vasopressor for septic shock.",
        new ExtractedGraph(
            List.of(
                new ExtractedEntity("Norepinephrine", "A vasopressor used in septic shock"),
                new ExtractedEntity("Septic Shock", "Circulatory failure caused by sepsis")
            ),
            List.of(new ExtractedRelationship("Norepinephrine", "Septic Shock", "dependency", 0.9))
        ),
        "Noradrenaline is another name for norepinephrine.",
        new ExtractedGraph(
            List.of(
                new ExtractedEntity("norepinephrine", "A vasopressor used in septic shock"),
                new ExtractedEntity("Noradrenaline", "British name of the catecholamine")
            ),
            List.of(new ExtractedRelationship("Noradrenaline", "norepinephrine", "synonym", 0.95))
        )
    );

    private final GraphExtractor extractor =
        text -> CompletableFuture.completedFuture(GRAPHS.getOrDefault(text, ExtractedGraph.empty()));

    private KnowledgeGraphIndex index;

    @BeforeEach
    void setUp() {
        index = KnowledgeGraphIndex.builder()
            .config(KnowledgeGraphConfigLoader.load(Map.of("kg.enabled", "true", "kg.parallel.max-workers", "4")))
            .graphExtractor(extractor)
            .embeddingFunction(new HashingEmbeddingFunction())
            .build();
    }

    private static List<Chunk> corpus() {
        return List.of(
            new Chunk("doc1-0", "Norepinephrine is the first-line vasopressor for septic shock."),
            new Chunk("doc1-1", "Noradrenaline is another name for norepinephrine.")
        );
    }

    @Test
    @DisplayName("should build a merged, typed graph from chunks")
    void buildsGraph() {
        List<ChunkResult> results = index.addChunks(corpus());

        assertTrue(results.stream().allMatch(r -> r.status() == ChunkResult.Status.PROCESSED));
        // norepinephrine appears in both chunks under one canonical id
        assertEquals(3, index.stats().entityCount());
        // dependency edge, synonym edge and its mirror
        assertEquals(3, index.stats().relationshipCount());
        assertEquals(1, results.get(1).mutation().mirroredEdges());
    }

    @Test
    @DisplayName("should skip chunks on a second ingestion")
    void rerunIsIdempotent() {
        index.addChunks(corpus());
        List<ChunkResult> second = index.addChunks(corpus(), 1);

        assertTrue(second.stream().allMatch(r -> r.status() == ChunkResult.Status.ALREADY_PROCESSED));
        assertEquals(3, index.stats().relationshipCount());
    }

    @Test
    @DisplayName("should retrieve seeds and their neighbors")
    void retrieves() {
        index.addChunks(corpus());

        RetrievedGraph graph = index.retrieve("norepinephrine vasopressor");

        assertFalse(graph.isEmpty());
        assertEquals("Norepinephrine", graph.entities().get(0).entity().getName());
        assertTrue(graph.entities().get(0).seed());
        assertTrue(graph.entities().stream().anyMatch(e -> e.entity().getName().equals("Septic Shock")));
        assertFalse(graph.relationships().isEmpty());
    }

    @Test
    @DisplayName("should ingest free text under a content-derived chunk id")
    void addText() {
        ChunkResult result = index.addText("Norepinephrine is the first-line vasopressor for septic shock.");

        assertEquals(ChunkResult.Status.PROCESSED, result.status());
        assertTrue(result.chunkId().startsWith(KnowledgeGraphIndex.TEXT_CHUNK_PREFIX));
        assertEquals(ChunkResult.Status.ALREADY_PROCESSED,
            index.addText("Norepinephrine is the first-line vasopressor for septic shock.").status());
    }

    @Test
    @DisplayName("should clear the graph on reset")
    void reset() {
        index.addChunks(corpus());
        index.reset();

        assertEquals(0, index.stats().entityCount());
        assertTrue(index.retrieve("norepinephrine").isEmpty());
    }

    @Test
    @DisplayName("should extract through an LLM function when no extractor is given")
    void llmBackedIndex() {
        LLMFunction llm = (prompt, systemPrompt, kwargs) -> CompletableFuture.completedFuture("""
            {"entities": [{"name": "Sepsis", "description": "Dysregulated response to infection"},
                          {"name": "Septic Shock", "description": "Circulatory failure caused by sepsis"}],
             "relationships": [{"source_entity": "Sepsis", "target_entity": "Septic Shock",
                                "relationship_type": "causal", "confidence": 0.9}]}
            """);
        KnowledgeGraphIndex llmIndex = KnowledgeGraphIndex.builder()
            .config(KnowledgeGraphConfigLoader.load(Map.of("kg.enabled", "true")))
            .llmFunction(llm)
            .embeddingFunction(new HashingEmbeddingFunction())
            .build();

        ChunkResult result = llmIndex.addChunk(new Chunk("c1", "Sepsis can progress to septic shock."));

        assertEquals(ChunkResult.Status.PROCESSED, result.status());
        Relationship stored = llmIndex.getStore().listRelationshipsByChunk("c1").get(0);
        assertEquals(RelationshipType.CAUSAL, stored.getRelationshipType());
        assertEquals(7.2, stored.getWeight(), 1e-9);
    }

    @Test
    @DisplayName("should require an extractor source and an embedding function")
    void builderValidation() {
        assertThrows(IllegalStateException.class,
            () -> KnowledgeGraphIndex.builder().embeddingFunction(new HashingEmbeddingFunction()).build());
        assertThrows(IllegalStateException.class,
            () -> KnowledgeGraphIndex.builder().graphExtractor(extractor).build());
    }
}
