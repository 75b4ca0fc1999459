package org.example.quizgen.model;

/**
 * Reference answer of a persisted question, as needed for grading.
 */
public record StoredReference(
        String questionId,
        QuestionType type,
        String question,
        String answer
) {
}
