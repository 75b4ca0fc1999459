package org.example.quizgen.service.quiz;

import org.example.quizgen.model.TypeCounts;

/**
 * Raised when even the top-up round left some type below its requested count.
 */
public class QuizShortfallException extends RuntimeException {

    private final TypeCounts shortfall;
    private final TypeCounts requested;

    public QuizShortfallException(TypeCounts shortfall, TypeCounts requested) {
        super("Generated quiz is short of " + shortfall.total() + " of " + requested.total()
                + " requested questions: " + shortfall.asTagMap());
        this.shortfall = shortfall;
        this.requested = requested;
    }

    public TypeCounts getShortfall() {
        return shortfall;
    }

    public TypeCounts getRequested() {
        return requested;
    }
}
