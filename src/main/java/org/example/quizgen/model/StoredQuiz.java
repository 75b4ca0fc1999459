package org.example.quizgen.model;

import java.util.List;

public record StoredQuiz(String quizId, List<QuizQuestionView> questions) {
}
