package org.example.quizgen.service.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ModelDispatcherTest {

    private static final Instant START = Instant.parse("2026-02-14T12:00:10Z");
    private static final String PRIMARY = "llama-3.3-70b-versatile";
    private static final String FALLBACK = "llama-3.1-8b-instant";
    private static final String PROMPT = "x".repeat(400);

    @Mock
    private LlmProvider provider;

    private MutableClock clock;
    private TokenBudgetTracker budgetTracker;
    private ModelCooldownRegistry cooldownRegistry;
    private List<Duration> sleeps;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        budgetTracker = new TokenBudgetTracker(30, 1000, 12000, 100000, 0.5, clock);
        cooldownRegistry = new ModelCooldownRegistry(clock);
        sleeps = new ArrayList<>();
    }

    @Test
    void dispatch_success_settlesReservationWithReportedUsage() {
        when(provider.complete(eq(PRIMARY), eq(PROMPT), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 900, "{}"));

        DispatchResult result = dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        assertEquals(PRIMARY, result.model());
        assertEquals("[]", result.content());
        assertEquals(900, result.totalTokens());
        assertEquals(900L, budgetTracker.snapshot().tokensThisMinute());
        assertEquals(1, budgetTracker.snapshot().requestsThisMinute());
    }

    @Test
    void dispatch_sendsConfiguredOptions() {
        when(provider.complete(eq(PRIMARY), eq(PROMPT), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", null, "{}"));

        dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        ArgumentCaptor<LlmOptions> options = ArgumentCaptor.forClass(LlmOptions.class);
        verify(provider).complete(eq(PRIMARY), eq(PROMPT), options.capture());
        assertEquals(0.3, options.getValue().temperature());
        assertEquals(1000, options.getValue().maxTokens());
        assertEquals(List.of("```", "<think>"), options.getValue().stopSequences());
        // no usage reported: the reservation stands
        assertEquals(600L, budgetTracker.snapshot().tokensThisMinute());
    }

    @Test
    void dispatch_decommissionedModel_movesOnWithoutRetryOrCooldown() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(400, "model_decommissioned", "decommissioned", "{}"));
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        DispatchResult result = dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        assertEquals(FALLBACK, result.model());
        verify(provider, times(1)).complete(eq(PRIMARY), anyString(), any(LlmOptions.class));
        assertTrue(sleeps.isEmpty());
        assertFalse(cooldownRegistry.isOnCooldown(PRIMARY));
    }

    @Test
    void dispatch_minuteRateLimit_coolsDownShortAndFailsOver() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(429, "rate_limit_exceeded",
                        "Rate limit reached on tokens per minute (TPM)", "{}"));
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        ModelDispatcher dispatcher = dispatcher(budgetTracker);
        assertEquals(FALLBACK, dispatcher.dispatch(PROMPT, 1000).model());
        assertEquals(START.plusSeconds(60), cooldownRegistry.expiryOf(PRIMARY));

        // the cooled-down primary is not tried again
        assertEquals(FALLBACK, dispatcher.dispatch(PROMPT, 1000).model());
        verify(provider, times(1)).complete(eq(PRIMARY), anyString(), any(LlmOptions.class));
    }

    @Test
    void dispatch_dailyQuota_coolsDownLong() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(429, "rate_limit_exceeded",
                        "Rate limit reached on tokens per day (TPD)", "{}"));
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        assertEquals(START.plusSeconds(21600), cooldownRegistry.expiryOf(PRIMARY));
    }

    @Test
    void dispatch_rateLimitWithoutWindowWording_coolsDownShort() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(429, "rate_limit_exceeded",
                        "Rate limit reached for model. Please try again in 2s.", "{}"));
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        assertEquals(START.plusSeconds(60), cooldownRegistry.expiryOf(PRIMARY));
    }

    @Test
    void dispatch_transientError_retriesSameModelAfterBackoff() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(503, "", "Service Unavailable", "unavailable"))
                .thenReturn(ProviderResponse.success("[]", 650, "{}"));

        DispatchResult result = dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        assertEquals(PRIMARY, result.model());
        assertEquals(List.of(Duration.ofMillis(300)), sleeps);
        assertEquals(2, budgetTracker.snapshot().requestsThisMinute());
        // failed attempt settles at prompt tokens (100), the success at reported usage
        assertEquals(750L, budgetTracker.snapshot().tokensThisMinute());
    }

    @Test
    void dispatch_transientErrorPersists_exhaustsRetriesThenFailsOver() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(500, "", "Internal Server Error", "boom"));
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        DispatchResult result = dispatcher(budgetTracker).dispatch(PROMPT, 1000);

        assertEquals(FALLBACK, result.model());
        verify(provider, times(3)).complete(eq(PRIMARY), anyString(), any(LlmOptions.class));
        assertEquals(List.of(Duration.ofMillis(300), Duration.ofMillis(600)), sleeps);
    }

    @Test
    void dispatch_transportFailure_movesToNextModel() {
        when(provider.complete(eq(PRIMARY), anyString(), any(LlmOptions.class)))
                .thenThrow(new LlmProviderException("Failed to reach Groq"));
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        assertEquals(FALLBACK, dispatcher(budgetTracker).dispatch(PROMPT, 1000).model());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void dispatch_everyModelFails_reportsLastStatusAndSettlesAtPromptTokens() {
        when(provider.complete(anyString(), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.failure(401, "invalid_api_key", "Invalid API Key", "{\"error\":{}}"));

        DispatchFailedException ex = assertThrows(DispatchFailedException.class,
                () -> dispatcher(budgetTracker).dispatch(PROMPT, 1000));

        assertEquals(401, ex.getLastStatus());
        assertEquals("{\"error\":{}}", ex.getLastBody());
        assertEquals(2, budgetTracker.snapshot().requestsThisMinute());
        assertEquals(200L, budgetTracker.snapshot().tokensThisMinute());
    }

    @Test
    void dispatch_budgetExhausted_makesNoCall() {
        TokenBudgetTracker tight = new TokenBudgetTracker(1, 1000, 12000, 100000, 0.5, clock);
        tight.reserve(10);

        BudgetExhaustedException ex = assertThrows(BudgetExhaustedException.class,
                () -> dispatcher(tight).dispatch(PROMPT, 1000));

        assertEquals("rpm", ex.getReason());
        assertEquals(50L, ex.getRetryAfterSeconds());
        verifyNoInteractions(provider);
    }

    @Test
    void dispatch_allModelsCoolingDown_makesNoCall() {
        cooldownRegistry.setCooldown(PRIMARY, 60);
        cooldownRegistry.setCooldown(FALLBACK, 120);

        BudgetExhaustedException ex = assertThrows(BudgetExhaustedException.class,
                () -> dispatcher(budgetTracker).dispatch(PROMPT, 1000));

        assertEquals(60L, ex.getRetryAfterSeconds());
        verifyNoInteractions(provider);
    }

    @Test
    void dispatch_primaryCoolingDown_startsWithFallback() {
        cooldownRegistry.setCooldown(PRIMARY, 60);
        when(provider.complete(eq(FALLBACK), anyString(), any(LlmOptions.class)))
                .thenReturn(ProviderResponse.success("[]", 700, "{}"));

        assertEquals(FALLBACK, dispatcher(budgetTracker).dispatch(PROMPT, 1000).model());
        verify(provider, never()).complete(eq(PRIMARY), anyString(), any(LlmOptions.class));
    }

    @Test
    void constructor_deduplicatesModelPreference() {
        ModelDispatcher dispatcher = new ModelDispatcher(provider, budgetTracker, cooldownRegistry,
                List.of(PRIMARY, FALLBACK, PRIMARY), List.of(300L), 60, 21600, 0.3, sleeps::add, clock);

        assertEquals(List.of(PRIMARY, FALLBACK), dispatcher.getModelPreference());
    }

    private ModelDispatcher dispatcher(TokenBudgetTracker tracker) {
        return new ModelDispatcher(
                provider,
                tracker,
                cooldownRegistry,
                List.of(PRIMARY, FALLBACK),
                List.of(300L, 600L),
                60,
                21600,
                0.3,
                sleeps::add,
                clock
        );
    }
}
