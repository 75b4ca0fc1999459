package org.example.quizgen.controller;

import org.example.quizgen.service.QuizGenerationService;
import org.example.quizgen.service.QuizMetricsService;
import org.example.quizgen.service.llm.BudgetSnapshot;
import org.example.quizgen.service.llm.ModelCooldownRegistry;
import org.example.quizgen.service.llm.TokenBudgetTracker;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;

@RestController
public class HealthController {

    private final QuizGenerationService quizGenerationService;
    private final QuizMetricsService quizMetricsService;
    private final TokenBudgetTracker budgetTracker;
    private final ModelCooldownRegistry cooldownRegistry;

    public HealthController(
            QuizGenerationService quizGenerationService,
            QuizMetricsService quizMetricsService,
            TokenBudgetTracker budgetTracker,
            ModelCooldownRegistry cooldownRegistry) {
        this.quizGenerationService = quizGenerationService;
        this.quizMetricsService = quizMetricsService;
        this.budgetTracker = budgetTracker;
        this.cooldownRegistry = cooldownRegistry;
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok");
    }

    @GetMapping("/health/details")
    public HealthDetails healthDetails() {
        boolean providerAvailable = quizGenerationService.isProviderAvailable();
        return new HealthDetails(
                providerAvailable ? "ok" : "degraded",
                LocalDateTime.now(),
                new ProviderHealth(quizGenerationService.getProviderName(), providerAvailable),
                budgetTracker.snapshot(),
                cooldownRegistry.activeCooldowns(),
                quizMetricsService.snapshot()
        );
    }

    public record Health(String status) {}

    public record HealthDetails(
            String status,
            LocalDateTime asOf,
            ProviderHealth provider,
            BudgetSnapshot budget,
            Map<String, Instant> cooldowns,
            Map<String, Object> quizMetrics
    ) {
    }

    public record ProviderHealth(String name, boolean available) {
    }
}
