package org.example.quizgen.model;

public record GradeResult(boolean correct, GradingMethod method) {
}
