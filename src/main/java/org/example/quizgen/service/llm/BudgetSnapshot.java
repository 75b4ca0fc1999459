package org.example.quizgen.service.llm;

public record BudgetSnapshot(
        int requestsThisMinute,
        int requestsToday,
        long tokensThisMinute,
        long tokensToday,
        int requestsPerMinute,
        int requestsPerDay,
        int tokensPerMinute,
        int tokensPerDay
) {
}
