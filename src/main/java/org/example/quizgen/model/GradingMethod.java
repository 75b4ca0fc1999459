package org.example.quizgen.model;

public enum GradingMethod {
    EXACT_MATCH,
    MODEL,
    LEXICAL_FALLBACK
}
