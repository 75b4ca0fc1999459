package org.example.quizgen.service.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Sends one prompt to the first model that can take it, failing over along the model preference list.
 * <p>
 * Every attempt reserves budget up front and settles it afterwards: with the reported usage on
 * success, with the prompt tokens alone on failure. Rate-limited models are quarantined in the
 * {@link ModelCooldownRegistry}; 5xx answers get a bounded retry on the same model.
 */
@Service
public class ModelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ModelDispatcher.class);

    private final LlmProvider provider;
    private final TokenBudgetTracker budgetTracker;
    private final ModelCooldownRegistry cooldownRegistry;
    private final List<String> modelPreference;
    private final List<Duration> retryBackoffs;
    private final long shortCooldownSeconds;
    private final long longCooldownSeconds;
    private final double defaultTemperature;
    private final Sleeper sleeper;
    private final Clock clock;

    @Autowired
    public ModelDispatcher(
            @Qualifier("quizLlmProvider") LlmProvider provider,
            TokenBudgetTracker budgetTracker,
            ModelCooldownRegistry cooldownRegistry,
            @Value("${quiz.llm.models:llama-3.3-70b-versatile,llama-3.1-8b-instant}") List<String> modelPreference,
            @Value("${quiz.llm.retry-backoffs-ms:300,600}") List<Long> retryBackoffsMs,
            @Value("${quiz.llm.cooldown.short-seconds:60}") long shortCooldownSeconds,
            @Value("${quiz.llm.cooldown.long-seconds:21600}") long longCooldownSeconds,
            @Value("${quiz.llm.temperature:0.3}") double defaultTemperature) {
        this(provider, budgetTracker, cooldownRegistry, modelPreference, retryBackoffsMs,
                shortCooldownSeconds, longCooldownSeconds, defaultTemperature, Sleeper.SYSTEM, Clock.systemUTC());
    }

    ModelDispatcher(
            LlmProvider provider,
            TokenBudgetTracker budgetTracker,
            ModelCooldownRegistry cooldownRegistry,
            List<String> modelPreference,
            List<Long> retryBackoffsMs,
            long shortCooldownSeconds,
            long longCooldownSeconds,
            double defaultTemperature,
            Sleeper sleeper,
            Clock clock) {
        this.provider = provider;
        this.budgetTracker = budgetTracker;
        this.cooldownRegistry = cooldownRegistry;
        this.modelPreference = dedupe(modelPreference);
        if (this.modelPreference.isEmpty()) {
            throw new IllegalStateException("At least one model must be configured in quiz.llm.models");
        }
        this.retryBackoffs = retryBackoffsMs == null
                ? List.of()
                : retryBackoffsMs.stream().filter(Objects::nonNull).map(Duration::ofMillis).toList();
        this.shortCooldownSeconds = shortCooldownSeconds;
        this.longCooldownSeconds = longCooldownSeconds;
        this.defaultTemperature = defaultTemperature;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public DispatchResult dispatch(String prompt, int outputTokenCap) {
        return dispatch(prompt, outputTokenCap, defaultTemperature);
    }

    /**
     * Run the prompt through the candidate models until one answers with 200.
     *
     * @throws BudgetExhaustedException if no model was eligible before any call was made
     * @throws DispatchFailedException if every candidate was skipped or failed
     */
    public DispatchResult dispatch(String prompt, int outputTokenCap, double temperature) {
        int reserved = budgetTracker.estimateTokens(prompt.length(), outputTokenCap);
        int promptTokens = TokenBudgetTracker.promptTokens(prompt.length());
        LlmOptions options = LlmOptions.of(temperature, outputTokenCap);

        List<String> candidates = selectCandidates(reserved);
        ProviderResponse last = null;

        for (String model : candidates) {
            DispatchState state = DispatchState.CALLING;
            int retries = 0;

            while (state == DispatchState.CALLING) {
                if (cooldownRegistry.isOnCooldown(model)) {
                    log.debug("Skipping model {}: cooling down until {}", model, cooldownRegistry.expiryOf(model));
                    state = DispatchState.NEXT_CANDIDATE;
                    continue;
                }
                TokenBudgetTracker.BudgetCheck check = budgetTracker.tryReserve(reserved);
                if (!check.ok()) {
                    log.debug("Skipping model {}: budget ceiling {} reached", model, check.reason());
                    state = DispatchState.NEXT_CANDIDATE;
                    continue;
                }

                ProviderResponse response = call(model, prompt, options);
                last = response;

                if (response.isSuccess()) {
                    int actual = response.totalTokens() != null ? response.totalTokens() : reserved;
                    budgetTracker.adjustAfterResponse(reserved, actual);
                    log.info("Model {} answered ({} tokens, reserved {})", model, actual, reserved);
                    return new DispatchResult(response.content(), model, actual);
                }

                budgetTracker.adjustAfterResponse(reserved, promptTokens);
                state = nextState(model, response, retries);

                if (state == DispatchState.COOLING_DOWN) {
                    coolDown(model, response);
                    state = DispatchState.NEXT_CANDIDATE;
                } else if (state == DispatchState.RETRYING) {
                    Duration backoff = retryBackoffs.get(retries++);
                    log.warn("Model {} returned {}; retry {}/{} in {} ms",
                            model, response.status(), retries, retryBackoffs.size(), backoff.toMillis());
                    pause(backoff, response);
                    state = DispatchState.CALLING;
                }
            }
        }

        log.error("All candidate models failed; last status {}", last == null ? 0 : last.status());
        if (last == null) {
            throw new DispatchFailedException(0, "no candidate model could be attempted");
        }
        throw new DispatchFailedException(last.status(), last.rawBody());
    }

    public List<String> getModelPreference() {
        return modelPreference;
    }

    private List<String> selectCandidates(int reserved) {
        TokenBudgetTracker.BudgetCheck check = budgetTracker.canAfford(reserved);
        if (!check.ok()) {
            log.warn("Budget exhausted ({}); no model call made", check.reason());
            throw new BudgetExhaustedException("budget ceiling " + check.reason() + " reached",
                    budgetTracker.secondsUntilReset(check.reason()));
        }

        String first = modelPreference.stream()
                .filter(model -> !cooldownRegistry.isOnCooldown(model))
                .findFirst()
                .orElse(null);
        if (first == null) {
            log.warn("All models cooling down; no model call made");
            throw new BudgetExhaustedException("all models cooling down", secondsUntilFirstCooldownEnds());
        }

        List<String> candidates = new ArrayList<>();
        candidates.add(first);
        for (String model : modelPreference) {
            if (!model.equals(first)) {
                candidates.add(model);
            }
        }
        return candidates;
    }

    private DispatchState nextState(String model, ProviderResponse response, int retries) {
        ProviderErrorKind kind = ProviderErrorClassifier.classify(response);
        return switch (kind) {
            case DECOMMISSIONED -> {
                log.warn("Model {} is decommissioned or unknown ({}); trying next model", model, response.status());
                yield DispatchState.NEXT_CANDIDATE;
            }
            case RATE_LIMITED -> DispatchState.COOLING_DOWN;
            case TRANSIENT -> {
                if (retries < retryBackoffs.size()) {
                    yield DispatchState.RETRYING;
                }
                log.warn("Model {} still failing with {} after {} retries; trying next model",
                        model, response.status(), retries);
                yield DispatchState.NEXT_CANDIDATE;
            }
            case UNKNOWN -> {
                log.warn("Model {} failed with status {}: {}; trying next model",
                        model, response.status(), response.errorMessage());
                yield DispatchState.NEXT_CANDIDATE;
            }
        };
    }

    private ProviderResponse call(String model, String prompt, LlmOptions options) {
        try {
            return provider.complete(model, prompt, options);
        } catch (LlmProviderException e) {
            return ProviderResponse.failure(0, "", e.getMessage(), "");
        }
    }

    private void coolDown(String model, ProviderResponse response) {
        boolean daily = ProviderErrorClassifier.isLongCooldown(response);
        long seconds = daily ? longCooldownSeconds : shortCooldownSeconds;
        cooldownRegistry.setCooldown(model, seconds);
        log.warn("Model {} rate limited ({}); cooling down for {}s: {}",
                model, response.status(), seconds, response.errorMessage());
    }

    private void pause(Duration backoff, ProviderResponse response) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchFailedException(response.status(), response.rawBody());
        }
    }

    private long secondsUntilFirstCooldownEnds() {
        Instant now = clock.instant();
        return modelPreference.stream()
                .map(cooldownRegistry::expiryOf)
                .filter(Objects::nonNull)
                .mapToLong(expiry -> Math.max(1L, Duration.between(now, expiry).toSeconds()))
                .min()
                .orElse(shortCooldownSeconds);
    }

    private static List<String> dedupe(List<String> models) {
        if (models == null) {
            return List.of();
        }
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String model : models) {
            if (model != null && !model.isBlank()) {
                unique.add(model.trim());
            }
        }
        return List.copyOf(unique);
    }
}
