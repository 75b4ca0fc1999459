package org.example.quizgen.model;

/**
 * What to generate: source text, per-type counts and difficulty.
 */
public record QuizRequest(
        String sourceText,
        TypeCounts counts,
        Difficulty difficulty
) {
    public QuizRequest {
        if (sourceText == null || sourceText.isBlank()) {
            throw new IllegalArgumentException("Source text is required");
        }
        if (counts == null || counts.isEmpty()) {
            throw new IllegalArgumentException("At least one question must be requested");
        }
        if (difficulty == null) {
            difficulty = Difficulty.INTERMEDIATE;
        }
    }
}
