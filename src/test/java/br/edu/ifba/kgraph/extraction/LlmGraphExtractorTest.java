package br.edu.ifba.kgraph.extraction;

import br.edu.ifba.kgraph.llm.LLMFunction;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LlmGraphExtractorTest {

    @Mock
    private LLMFunction llm;

    private LlmGraphExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new LlmGraphExtractor(llm, new ObjectMapper(), Map.of("temperature", 0.0));
    }

    private void llmReplies(String reply) {
        when(llm.apply(anyString(), anyString(), anyMap())).thenReturn(CompletableFuture.completedFuture(reply));
    }

    @Test
    @DisplayName("should parse a fenced JSON reply")
    void parsesFencedJson() {
        llmReplies("""
            Here is the graph:
            ```json
            {
              "entities": [
                {"name": "Norepinephrine", "description": "A vasopressor", "entity_type": "drug"},
                {"name": "Septic Shock", "description": "Circulatory failure from sepsis"}
              ],
              "relationships": [
                {"source_entity": "Norepinephrine", "target_entity": "Septic Shock",
                 "relationship_type": "dependency", "relationship_desc": "treats", "confidence": 0.9}
              ]
            }
            ```
            """);

        ExtractedGraph graph = extractor.extract("Norepinephrine treats septic shock.").join();

        assertEquals(2, graph.entities().size());
        assertEquals("drug", graph.entities().get(0).entityType());
        assertEquals(ExtractionPrompts.DEFAULT_ENTITY_TYPE, graph.entities().get(1).entityType());
        assertEquals(LlmGraphExtractor.EXTRACTION_METHOD, graph.entities().get(0).metadata().get("extraction_method"));

        ExtractedRelationship relationship = graph.relationships().get(0);
        assertEquals("Norepinephrine", relationship.sourceEntity());
        assertEquals("Septic Shock", relationship.targetEntity());
        assertEquals("dependency", relationship.relationshipType());
        assertEquals("treats", relationship.description());
        assertEquals(0.9, relationship.confidence(), 1e-9);
        assertEquals(Boolean.TRUE, relationship.metadata().get("typed_extraction"));
    }

    @Test
    @DisplayName("should default missing type and confidence")
    void defaultsMissingFields() {
        llmReplies("""
            {"entities": [{"name": "A"}, {"name": "B"}],
             "relationships": [{"source_entity": "A", "target_entity": "B", "confidence": "high"}]}
            """);

        ExtractedRelationship relationship = extractor.extract("text").join().relationships().get(0);

        assertEquals(ExtractionPrompts.DEFAULT_RELATIONSHIP_TYPE, relationship.relationshipType());
        assertEquals(ExtractedRelationship.DEFAULT_CONFIDENCE, relationship.confidence(), 1e-9);
    }

    @Test
    @DisplayName("should keep entity metadata from the reply")
    void keepsEntityMetadata() {
        llmReplies("{\"entities\": [{\"name\": \"A\", \"metadata\": {\"source\": \"guideline\"}}, 42]}");

        ExtractedGraph graph = extractor.extract("text").join();

        assertEquals(1, graph.entities().size());
        assertEquals("guideline", graph.entities().get(0).metadata().get("source"));
        assertTrue(graph.relationships().isEmpty());
    }

    @Test
    @DisplayName("should send the chunk text with the system prompt and kwargs")
    void buildsPrompt() {
        llmReplies("{}");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);

        ExtractedGraph graph = extractor.extract("Sepsis causes shock.").join();

        verify(llm).apply(prompt.capture(), eq(ExtractionPrompts.SYSTEM_PROMPT), eq(Map.of("temperature", 0.0)));
        assertTrue(prompt.getValue().contains("Sepsis causes shock."));
        assertTrue(graph.isEmpty());
    }

    @Test
    @DisplayName("should fail on a reply without JSON")
    void failsWithoutJson() {
        llmReplies("I could not find any entities.");

        CompletionException e = assertThrows(CompletionException.class, () -> extractor.extract("text").join());
        assertInstanceOf(GraphExtractionException.class, e.getCause());
    }

    @Test
    @DisplayName("should fail on malformed JSON")
    void failsOnMalformedJson() {
        llmReplies("{\"entities\": [ {\"name\": \"A\" ]}");

        CompletionException e = assertThrows(CompletionException.class, () -> extractor.extract("text").join());
        assertInstanceOf(GraphExtractionException.class, e.getCause());
    }

    @Test
    @DisplayName("should fail when entities is not an array")
    void failsOnWrongShape() {
        assertThrows(GraphExtractionException.class, () -> extractor.parseResponse("{\"entities\": \"none\"}"));
        assertThrows(GraphExtractionException.class, () -> extractor.parseResponse("   "));
    }
}
