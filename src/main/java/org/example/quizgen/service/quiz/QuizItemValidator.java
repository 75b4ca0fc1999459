package org.example.quizgen.service.quiz;

import org.example.quizgen.model.McqItem;
import org.example.quizgen.model.QuestionType;
import org.example.quizgen.model.QuizItem;
import org.example.quizgen.model.TextAnswerItem;
import org.example.quizgen.model.TrueFalseItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-type schema checks, and bucketing of the survivors by type.
 */
@Component
public class QuizItemValidator {

    private static final Logger log = LoggerFactory.getLogger(QuizItemValidator.class);
    private static final int MIN_CHOICE_LENGTH = 3;

    public boolean isValid(QuizItem item) {
        if (item == null || isBlank(item.question())) {
            return false;
        }
        if (item instanceof McqItem mcq) {
            return isValidMcq(mcq);
        }
        if (item instanceof TrueFalseItem tf) {
            return tf.answer() != null;
        }
        String answer = QuizItemNormalizer.normalizeText(((TextAnswerItem) item).answer());
        return answer != null && !answer.isEmpty();
    }

    /**
     * Drop invalid items and group the rest by type, keeping their relative order.
     * Every type has a bucket, possibly empty.
     */
    public Map<QuestionType, List<QuizItem>> partition(List<QuizItem> items) {
        Map<QuestionType, List<QuizItem>> buckets = emptyBuckets();
        int dropped = 0;
        for (QuizItem item : items) {
            if (isValid(item)) {
                buckets.get(item.type()).add(item);
            } else {
                dropped++;
                log.debug("Dropping invalid {} item: {}", item == null ? "null" : item.type().tag(), item);
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} of {} generated items during validation", dropped, items.size());
        }
        return buckets;
    }

    public static Map<QuestionType, List<QuizItem>> emptyBuckets() {
        Map<QuestionType, List<QuizItem>> buckets = new EnumMap<>(QuestionType.class);
        for (QuestionType type : QuestionType.values()) {
            buckets.put(type, new ArrayList<>());
        }
        return buckets;
    }

    private boolean isValidMcq(McqItem mcq) {
        if (mcq.choices().size() != McqRepairer.CHOICE_COUNT || mcq.answer() == null) {
            return false;
        }
        for (String choice : mcq.choices()) {
            String normalized = QuizItemNormalizer.normalizeText(choice);
            if (normalized == null || normalized.length() < MIN_CHOICE_LENGTH) {
                return false;
            }
        }
        return mcq.choices().contains(mcq.answer());
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
