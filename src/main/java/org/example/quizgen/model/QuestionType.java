package org.example.quizgen.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Question types in the fixed order used for output.
 */
public enum QuestionType {
    MCQ("mcq"),
    SHORT_ANSWER("short_answer"),
    TRUE_FALSE("true_false"),
    IDENTIFICATION("identification"),
    ESSAY("essay");

    private final String tag;

    QuestionType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Resolve a provider-written tag such as "mcq", "Short Answer" or "multiple_choice".
     */
    public static Optional<QuestionType> fromTag(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String folded = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        if ("multiple_choice".equals(folded)) {
            return Optional.of(MCQ);
        }
        for (QuestionType type : values()) {
            if (type.tag.equals(folded)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
