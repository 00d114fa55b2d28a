package br.edu.ifba.kgraph.llm;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for Large Language Model completion.
 * Implementations should handle API calls to LLM providers (OpenAI, Anthropic, etc.).
 */
@FunctionalInterface
public interface LLMFunction {

    /**
     * Generate a completion from the LLM.
     *
     * @param prompt The user prompt
     * @param systemPrompt Optional system prompt for context
     * @param kwargs Additional parameters (temperature, max_tokens, etc.)
     * @return CompletableFuture with the generated response text
     */
    CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt,
        @NotNull Map<String, Object> kwargs
    );

    /**
     * Convenience method for simple prompts without a system prompt.
     */
    default CompletableFuture<String> apply(@NotNull String prompt) {
        return apply(prompt, null, Map.of());
    }

    /**
     * Convenience method with system prompt and no extra parameters.
     */
    default CompletableFuture<String> apply(
        @NotNull String prompt,
        @Nullable String systemPrompt
    ) {
        return apply(prompt, systemPrompt, Map.of());
    }
}
