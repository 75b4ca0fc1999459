package org.example.quizgen.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Requested (or missing) number of questions per type.
 */
public record TypeCounts(
        int mcq,
        @JsonAlias("short_answer") int shortAnswer,
        @JsonAlias("true_false") int trueFalse,
        int identification,
        int essay
) {
    public static final TypeCounts NONE = new TypeCounts(0, 0, 0, 0, 0);

    public TypeCounts {
        if (mcq < 0 || shortAnswer < 0 || trueFalse < 0 || identification < 0 || essay < 0) {
            throw new IllegalArgumentException("Question counts must not be negative");
        }
        try {
            Math.addExact(Math.addExact(Math.addExact(Math.addExact(mcq, shortAnswer), trueFalse), identification), essay);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Total question count is too large", e);
        }
    }

    public static TypeCounts of(Map<QuestionType, Integer> counts) {
        return new TypeCounts(
                counts.getOrDefault(QuestionType.MCQ, 0),
                counts.getOrDefault(QuestionType.SHORT_ANSWER, 0),
                counts.getOrDefault(QuestionType.TRUE_FALSE, 0),
                counts.getOrDefault(QuestionType.IDENTIFICATION, 0),
                counts.getOrDefault(QuestionType.ESSAY, 0)
        );
    }

    public int get(QuestionType type) {
        return switch (type) {
            case MCQ -> mcq;
            case SHORT_ANSWER -> shortAnswer;
            case TRUE_FALSE -> trueFalse;
            case IDENTIFICATION -> identification;
            case ESSAY -> essay;
        };
    }

    @JsonIgnore
    public int total() {
        return mcq + shortAnswer + trueFalse + identification + essay;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return total() == 0;
    }

    /**
     * Per-type gap between these counts and what the buckets hold. Surpluses count as zero.
     */
    public TypeCounts shortfall(Map<QuestionType, ? extends List<?>> buckets) {
        Map<QuestionType, Integer> missing = new EnumMap<>(QuestionType.class);
        for (QuestionType type : QuestionType.values()) {
            List<?> bucket = buckets.get(type);
            int available = bucket == null ? 0 : bucket.size();
            missing.put(type, Math.max(0, get(type) - available));
        }
        return of(missing);
    }

    public Map<String, Integer> asTagMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (QuestionType type : QuestionType.values()) {
            map.put(type.tag(), get(type));
        }
        return map;
    }
}
