package org.example.quizgen.model;

/**
 * One generated question. The variant is chosen from the provider's type tag at parse time.
 */
public sealed interface QuizItem permits McqItem, TrueFalseItem, TextAnswerItem {

    QuestionType type();

    String question();
}
