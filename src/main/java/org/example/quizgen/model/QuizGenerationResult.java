package org.example.quizgen.model;

import java.util.List;

/**
 * Exactly the requested items, in type order.
 *
 * @param model model that answered the primary call
 * @param toppedUp whether a supplementary call was needed
 */
public record QuizGenerationResult(
        List<QuizItem> items,
        String model,
        boolean toppedUp
) {
    public QuizGenerationResult {
        items = List.copyOf(items);
    }
}
