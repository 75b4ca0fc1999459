package org.example.quizgen.service;

import org.example.quizgen.model.GradingMethod;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

@Service
public class QuizMetricsService {

    private final LongAdder generationRequested = new LongAdder();
    private final LongAdder generationCompleted = new LongAdder();
    private final LongAdder generationToppedUp = new LongAdder();
    private final LongAdder generationBudgetExhausted = new LongAdder();
    private final LongAdder generationDispatchFailed = new LongAdder();
    private final LongAdder generationParseFailed = new LongAdder();
    private final LongAdder generationShortfall = new LongAdder();
    private final AtomicLong generationLatencyTotalMs = new AtomicLong(0);
    private final Map<GradingMethod, LongAdder> gradedByMethod = new EnumMap<>(GradingMethod.class);

    public QuizMetricsService() {
        for (GradingMethod method : GradingMethod.values()) {
            gradedByMethod.put(method, new LongAdder());
        }
    }

    public void recordGenerationRequested() {
        generationRequested.increment();
    }

    public void recordGenerationCompleted(boolean toppedUp, long durationMs) {
        generationCompleted.increment();
        if (toppedUp) {
            generationToppedUp.increment();
        }
        addLatency(durationMs);
    }

    public void recordBudgetExhausted(long durationMs) {
        generationBudgetExhausted.increment();
        addLatency(durationMs);
    }

    public void recordDispatchFailed(long durationMs) {
        generationDispatchFailed.increment();
        addLatency(durationMs);
    }

    public void recordParseFailed(long durationMs) {
        generationParseFailed.increment();
        addLatency(durationMs);
    }

    public void recordShortfall(long durationMs) {
        generationShortfall.increment();
        addLatency(durationMs);
    }

    public void recordGraded(GradingMethod method) {
        gradedByMethod.get(method).increment();
    }

    public Map<String, Object> snapshot() {
        long completed = generationCompleted.sum();
        long failed = generationBudgetExhausted.sum()
                + generationDispatchFailed.sum()
                + generationParseFailed.sum()
                + generationShortfall.sum();
        long measured = completed + failed;
        long avgLatencyMs = measured == 0 ? 0 : generationLatencyTotalMs.get() / measured;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("generationRequested", generationRequested.sum());
        metrics.put("generationCompleted", completed);
        metrics.put("generationToppedUp", generationToppedUp.sum());
        metrics.put("generationFailed", failed);
        metrics.put("generationBudgetExhausted", generationBudgetExhausted.sum());
        metrics.put("generationDispatchFailed", generationDispatchFailed.sum());
        metrics.put("generationParseFailed", generationParseFailed.sum());
        metrics.put("generationShortfall", generationShortfall.sum());
        metrics.put("generationAverageLatencyMs", avgLatencyMs);
        for (Map.Entry<GradingMethod, LongAdder> entry : gradedByMethod.entrySet()) {
            metrics.put("graded" + camel(entry.getKey()), entry.getValue().sum());
        }
        return metrics;
    }

    private void addLatency(long durationMs) {
        if (durationMs > 0) {
            generationLatencyTotalMs.addAndGet(durationMs);
        }
    }

    private static String camel(GradingMethod method) {
        StringBuilder name = new StringBuilder();
        for (String part : method.name().toLowerCase(Locale.ROOT).split("_")) {
            name.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return name.toString();
    }
}
