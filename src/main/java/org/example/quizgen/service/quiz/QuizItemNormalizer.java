package org.example.quizgen.service.quiz;

import org.example.quizgen.model.McqItem;
import org.example.quizgen.model.QuizItem;
import org.example.quizgen.model.TextAnswerItem;
import org.example.quizgen.model.TrueFalseItem;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Canonical text form: straight quotes, single spaces, trimmed. True/false answers written as text become booleans.
 */
@Component
public class QuizItemNormalizer {

    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");

    public QuizItem normalize(QuizItem item) {
        if (item instanceof McqItem mcq) {
            List<String> choices = mcq.choices().stream()
                    .filter(Objects::nonNull)
                    .map(QuizItemNormalizer::normalizeText)
                    .toList();
            return new McqItem(normalizeText(mcq.question()), choices, normalizeText(mcq.answer()));
        }
        if (item instanceof TrueFalseItem tf) {
            String raw = normalizeText(tf.rawAnswer());
            Boolean answer = tf.answer();
            if (answer == null && raw != null) {
                if ("true".equalsIgnoreCase(raw)) {
                    answer = Boolean.TRUE;
                } else if ("false".equalsIgnoreCase(raw)) {
                    answer = Boolean.FALSE;
                }
            }
            return new TrueFalseItem(normalizeText(tf.question()), answer, raw);
        }
        TextAnswerItem text = (TextAnswerItem) item;
        return new TextAnswerItem(text.type(), normalizeText(text.question()), normalizeText(text.answer()));
    }

    /**
     * Null-safe text normalization shared by repair, validation and grading.
     */
    public static String normalizeText(String value) {
        if (value == null) {
            return null;
        }
        String straightened = value
                .replace('\u2018', '\'')
                .replace('\u2019', '\'')
                .replace('\u201A', '\'')
                .replace('\u201B', '\'')
                .replace('\u201C', '"')
                .replace('\u201D', '"')
                .replace('\u201E', '"')
                .replace('\u201F', '"');
        return WHITESPACE_RUN.matcher(straightened).replaceAll(" ").trim();
    }
}
