package org.example.quizgen.service.llm;

import java.util.List;

/**
 * Options for LLM generation requests.
 */
public record LlmOptions(
    double temperature,
    int maxTokens,
    List<String> stopSequences
) {
    /**
     * Stop sequences that cut generation before a fenced block or a reasoning block opens.
     */
    public static final List<String> DEFAULT_STOP_SEQUENCES = List.of("```", "<think>");

    public LlmOptions {
        stopSequences = stopSequences == null ? List.of() : List.copyOf(stopSequences);
    }

    /**
     * Create options with the default stop sequences.
     */
    public static LlmOptions of(double temperature, int maxTokens) {
        return new LlmOptions(temperature, maxTokens, DEFAULT_STOP_SEQUENCES);
    }
}
