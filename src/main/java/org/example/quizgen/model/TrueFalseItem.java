package org.example.quizgen.model;

/**
 * True/false question.
 *
 * @param answer strict boolean answer, null until the provider's value is known to be one
 * @param rawAnswer the provider's answer when it was written as text
 */
public record TrueFalseItem(
        String question,
        Boolean answer,
        String rawAnswer
) implements QuizItem {

    @Override
    public QuestionType type() {
        return QuestionType.TRUE_FALSE;
    }
}
