package org.example.quizgen.service.llm;

/**
 * Successful dispatch: generated text, the model that produced it and the tokens charged.
 */
public record DispatchResult(String content, String model, int totalTokens) {
}
