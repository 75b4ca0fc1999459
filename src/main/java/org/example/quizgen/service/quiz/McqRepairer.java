package org.example.quizgen.service.quiz;

import org.example.quizgen.model.McqItem;
import org.example.quizgen.model.QuizItem;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Fixes the two common multiple-choice defects: too many choices, and an answer that is a near
 * copy of one choice instead of the choice itself.
 */
@Component
public class McqRepairer {

    static final int CHOICE_COUNT = 4;

    private final double answerSimilarityThreshold;

    public McqRepairer(@Value("${quiz.repair.answer-similarity-threshold:0.6}") double answerSimilarityThreshold) {
        this.answerSimilarityThreshold = answerSimilarityThreshold;
    }

    public QuizItem repair(QuizItem item) {
        return item instanceof McqItem mcq ? repair(mcq) : item;
    }

    public McqItem repair(McqItem item) {
        String normalizedAnswer = QuizItemNormalizer.normalizeText(item.answer());
        List<String> choices = item.choices();

        if (choices.size() > CHOICE_COUNT) {
            choices = keepAnswerAndTruncate(choices, normalizedAnswer);
        }
        McqItem repaired = item.withChoices(choices);

        if (normalizedAnswer == null || choices.isEmpty() || choices.contains(item.answer())) {
            return repaired;
        }

        for (String choice : choices) {
            if (normalizedAnswer.equals(QuizItemNormalizer.normalizeText(choice))) {
                return repaired.withAnswer(choice);
            }
        }

        String closest = closestChoice(normalizedAnswer, choices);
        return closest == null ? repaired : repaired.withAnswer(closest);
    }

    private List<String> keepAnswerAndTruncate(List<String> choices, String normalizedAnswer) {
        int answerIndex = -1;
        if (normalizedAnswer != null) {
            for (int i = 0; i < choices.size(); i++) {
                if (normalizedAnswer.equals(QuizItemNormalizer.normalizeText(choices.get(i)))) {
                    answerIndex = i;
                    break;
                }
            }
        }

        List<String> kept = new ArrayList<>(CHOICE_COUNT);
        if (answerIndex >= 0) {
            kept.add(choices.get(answerIndex));
        }
        for (int i = 0; i < choices.size() && kept.size() < CHOICE_COUNT; i++) {
            if (i != answerIndex) {
                kept.add(choices.get(i));
            }
        }
        return kept;
    }

    private String closestChoice(String normalizedAnswer, List<String> choices) {
        String target = normalizedAnswer.toLowerCase(Locale.ROOT);
        String best = null;
        double bestRatio = -1.0;
        for (String choice : choices) {
            if (choice == null) {
                continue;
            }
            String candidate = Objects.requireNonNullElse(QuizItemNormalizer.normalizeText(choice), "")
                    .toLowerCase(Locale.ROOT);
            double ratio = TextSimilarity.ratio(target, candidate);
            if (ratio > bestRatio) {
                bestRatio = ratio;
                best = choice;
            }
        }
        return bestRatio >= answerSimilarityThreshold ? best : null;
    }
}
