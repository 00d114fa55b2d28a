package br.edu.ifba.kgraph.extraction;

import org.jetbrains.annotations.NotNull;

/**
 * Prompts for typed knowledge graph extraction.
 *
 * <p>The model is asked for a single JSON object with an {@code entities} array and a
 * {@code relationships} array. Relationship types are the lowercase names of
 * {@link br.edu.ifba.kgraph.core.RelationshipType}.</p>
 */
public final class ExtractionPrompts {

    public static final String DEFAULT_ENTITY_TYPE = "concept";

    public static final String DEFAULT_RELATIONSHIP_TYPE = "generic";

    public static final String SYSTEM_PROMPT = """
        You are a knowledge graph extraction system. Carefully analyze the provided text and identify
        every significant entity and every relationship between clearly related entities.

        1. Entities:
           - Use clear, specific names that carry meaning without extra context.
           - Give each entity a complete one-sentence description.
           - Set entity_type to a category such as drug, condition, procedure, technology, person, concept.
           - Put any other structured attributes in a metadata object.
           - Consolidate duplicates; each entity must be a distinct concept.

        2. Relationships:
           - source_entity and target_entity must be names from the entity list.
           - Describe the relationship in a complete sentence.
           - Set relationship_type to the most specific of:
             hypernym (is a kind of), hyponym (has subtype), meronym (part of), holonym (has part),
             synonym (same as), antonym (opposite of), causal (causes), temporal (before/after),
             dependency (requires), reference (mentions), generic (other).
           - Set confidence between 0.0 and 1.0: 0.9+ for explicit statements, 0.7-0.8 for clear
             implications, 0.5-0.6 for weak inferences.

        Only use facts stated in the text. Respond with JSON only.
        """;

    public static final String USER_PROMPT_TEMPLATE = """
        Extract the knowledge graph from the text below.

        Respond with a JSON object of this shape:
        {
          "entities": [
            {"name": "...", "description": "...", "entity_type": "...", "metadata": {}}
          ],
          "relationships": [
            {"source_entity": "...", "target_entity": "...", "relationship_desc": "...",
             "relationship_type": "...", "confidence": 0.8}
          ]
        }

        Text:
        %s
        """;

    private ExtractionPrompts() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Formats the user prompt for a chunk of text.
     */
    @NotNull
    public static String userPrompt(@NotNull String text) {
        return String.format(USER_PROMPT_TEMPLATE, text);
    }
}
