package org.example.quizgen.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Wire shape of one question: {@code {type, question, choices?, answer}}.
 * The answer is a boolean for true/false questions and a string otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QuizQuestionView(
        String id,
        String type,
        String question,
        List<String> choices,
        Object answer
) {
    public static QuizQuestionView of(String id, QuizItem item) {
        if (item instanceof McqItem mcq) {
            return new QuizQuestionView(id, mcq.type().tag(), mcq.question(), mcq.choices(), mcq.answer());
        }
        if (item instanceof TrueFalseItem tf) {
            return new QuizQuestionView(id, tf.type().tag(), tf.question(), null, tf.answer());
        }
        TextAnswerItem text = (TextAnswerItem) item;
        return new QuizQuestionView(id, text.type().tag(), text.question(), null, text.answer());
    }
}
