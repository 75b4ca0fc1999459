package org.example.quizgen.model;

import java.util.Locale;

public enum Difficulty {
    EASY("Easy"),
    INTERMEDIATE("Intermediate"),
    DIFFICULT("Difficult");

    private final String label;

    Difficulty(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Difficulty fromLabel(String raw) {
        if (raw == null || raw.isBlank()) {
            return INTERMEDIATE;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Difficulty difficulty : values()) {
            if (difficulty.name().equals(normalized)) {
                return difficulty;
            }
        }
        throw new IllegalArgumentException("Unknown difficulty: " + raw);
    }
}
