package br.edu.ifba.kgraph.extraction;

import br.edu.ifba.kgraph.llm.LLMFunction;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * {@link GraphExtractor} backed by an LLM that answers in JSON.
 *
 * <p>The reply may be wrapped in a Markdown code fence or surrounded by prose; the
 * outermost JSON object is parsed. Missing entity types default to
 * {@value ExtractionPrompts#DEFAULT_ENTITY_TYPE} and missing confidences to
 * {@value ExtractedRelationship#DEFAULT_CONFIDENCE}. Every entity is tagged with
 * {@code extraction_method} and every relationship with {@code extraction_method} and
 * {@code typed_extraction}.</p>
 */
public class LlmGraphExtractor implements GraphExtractor {

    private static final Logger logger = LoggerFactory.getLogger(LlmGraphExtractor.class);

    public static final String EXTRACTION_METHOD = "typed_llm";

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final LLMFunction llmFunction;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> llmKwargs;

    public LlmGraphExtractor(@NotNull LLMFunction llmFunction) {
        this(llmFunction, new ObjectMapper(), Map.of());
    }

    public LlmGraphExtractor(@NotNull LLMFunction llmFunction, @NotNull ObjectMapper objectMapper,
                             @NotNull Map<String, Object> llmKwargs) {
        this.llmFunction = Objects.requireNonNull(llmFunction, "llmFunction must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.llmKwargs = Map.copyOf(llmKwargs);
    }

    @Override
    public CompletableFuture<ExtractedGraph> extract(@NotNull String text) {
        Objects.requireNonNull(text, "text must not be null");
        return llmFunction.apply(ExtractionPrompts.userPrompt(text), ExtractionPrompts.SYSTEM_PROMPT, llmKwargs)
            .thenApply(this::parseResponse);
    }

    /**
     * Parses an LLM reply into an extracted graph.
     *
     * @throws GraphExtractionException if the reply has no JSON object or cannot be parsed
     */
    @NotNull
    ExtractedGraph parseResponse(@Nullable String response) {
        if (response == null || response.isBlank()) {
            throw new GraphExtractionException("Empty extraction response");
        }

        String json = extractJsonObject(response);
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new GraphExtractionException("Malformed extraction response: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new GraphExtractionException("Extraction response is not a JSON object");
        }

        List<ExtractedEntity> entities = new ArrayList<>();
        for (JsonNode node : arrayOf(root, "entities")) {
            if (!node.isObject()) {
                logger.debug("Skipping non-object entity node: {}", node);
                continue;
            }
            Map<String, Object> metadata = metadataOf(node);
            metadata.put("extraction_method", EXTRACTION_METHOD);
            entities.add(new ExtractedEntity(
                textOf(node, "name"),
                textOf(node, "description"),
                textOrDefault(node, "entity_type", ExtractionPrompts.DEFAULT_ENTITY_TYPE),
                metadata
            ));
        }

        List<ExtractedRelationship> relationships = new ArrayList<>();
        for (JsonNode node : arrayOf(root, "relationships")) {
            if (!node.isObject()) {
                logger.debug("Skipping non-object relationship node: {}", node);
                continue;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("extraction_method", EXTRACTION_METHOD);
            metadata.put("typed_extraction", true);
            JsonNode confidence = node.get("confidence");
            relationships.add(new ExtractedRelationship(
                textOf(node, "source_entity"),
                textOf(node, "target_entity"),
                textOf(node, "relationship_desc"),
                textOrDefault(node, "relationship_type", ExtractionPrompts.DEFAULT_RELATIONSHIP_TYPE),
                confidence != null && confidence.isNumber() ? confidence.asDouble() : ExtractedRelationship.DEFAULT_CONFIDENCE,
                metadata
            ));
        }

        logger.debug("Parsed extraction response: {} entities, {} relationships", entities.size(), relationships.size());
        return new ExtractedGraph(entities, relationships);
    }

    /**
     * Returns the outermost {...} span, dropping code fences and surrounding prose.
     */
    private static String extractJsonObject(String response) {
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new GraphExtractionException("No JSON object in extraction response");
        }
        return response.substring(start, end + 1);
    }

    private static Iterable<JsonNode> arrayOf(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new GraphExtractionException("Field '" + field + "' must be an array");
        }
        return node;
    }

    private Map<String, Object> metadataOf(JsonNode node) {
        JsonNode metadata = node.get("metadata");
        if (metadata == null || !metadata.isObject()) {
            return new LinkedHashMap<>();
        }
        return new LinkedHashMap<>(objectMapper.convertValue(metadata, METADATA_TYPE));
    }

    @Nullable
    private static String textOf(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    @NotNull
    private static String textOrDefault(JsonNode node, String field, String defaultValue) {
        String value = textOf(node, field);
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
