package org.example.quizgen.model;

/**
 * Short answer, identification or essay question: free-text reference answer.
 */
public record TextAnswerItem(
        QuestionType type,
        String question,
        String answer
) implements QuizItem {

    public TextAnswerItem {
        if (type == QuestionType.MCQ || type == QuestionType.TRUE_FALSE) {
            throw new IllegalArgumentException("Not a free-text question type: " + type);
        }
    }
}
