package org.example.quizgen.model;

import java.util.List;

public record McqItem(
        String question,
        List<String> choices,
        String answer
) implements QuizItem {

    public McqItem {
        choices = choices == null ? List.of() : List.copyOf(choices);
    }

    @Override
    public QuestionType type() {
        return QuestionType.MCQ;
    }

    public McqItem withChoices(List<String> newChoices) {
        return new McqItem(question, newChoices, answer);
    }

    public McqItem withAnswer(String newAnswer) {
        return new McqItem(question, choices, newAnswer);
    }
}
