package org.example.quizgen.service.llm;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Soft per-minute/per-day request and token budget for the provider account.
 * <p>
 * Windows are fixed calendar windows (UTC minute, UTC day) rolled over lazily on every call.
 * All operations are synchronized on the instance so a check followed by a reservation
 * cannot interleave with another caller's.
 */
@Component
public class TokenBudgetTracker {

    private static final long MINUTE_MILLIS = 60_000L;
    private static final long DAY_MILLIS = 86_400_000L;

    private final int requestsPerMinute;
    private final int requestsPerDay;
    private final int tokensPerMinute;
    private final int tokensPerDay;
    private final double outputReservationRatio;
    private final Clock clock;

    private long minuteEpoch;
    private long dayEpoch;
    private int requestsThisMinute;
    private int requestsToday;
    private long tokensThisMinute;
    private long tokensToday;

    @Autowired
    public TokenBudgetTracker(
            @Value("${quiz.budget.rpm:30}") int requestsPerMinute,
            @Value("${quiz.budget.rpd:1000}") int requestsPerDay,
            @Value("${quiz.budget.tpm:12000}") int tokensPerMinute,
            @Value("${quiz.budget.tpd:100000}") int tokensPerDay,
            @Value("${quiz.budget.output-reservation-ratio:0.5}") double outputReservationRatio) {
        this(requestsPerMinute, requestsPerDay, tokensPerMinute, tokensPerDay, outputReservationRatio, Clock.systemUTC());
    }

    TokenBudgetTracker(
            int requestsPerMinute,
            int requestsPerDay,
            int tokensPerMinute,
            int tokensPerDay,
            double outputReservationRatio,
            Clock clock) {
        this.requestsPerMinute = requestsPerMinute;
        this.requestsPerDay = requestsPerDay;
        this.tokensPerMinute = tokensPerMinute;
        this.tokensPerDay = tokensPerDay;
        this.outputReservationRatio = Math.max(0.0, outputReservationRatio);
        this.clock = clock;
        long now = clock.millis();
        this.minuteEpoch = Math.floorDiv(now, MINUTE_MILLIS);
        this.dayEpoch = Math.floorDiv(now, DAY_MILLIS);
    }

    /**
     * Pessimistic token estimate for one call: prompt tokens plus a share of the output cap.
     */
    public int estimateTokens(int promptLength, int outputCap) {
        return promptTokens(promptLength) + (int) Math.ceil(Math.max(0, outputCap) * outputReservationRatio);
    }

    /**
     * Rough prompt token count at four characters per token.
     */
    public static int promptTokens(int promptLength) {
        return (int) Math.ceil(Math.max(0, promptLength) / 4.0);
    }

    public synchronized BudgetCheck canAfford(int tokenEstimate) {
        rollover();
        if (requestsPerMinute > 0 && requestsThisMinute + 1 > requestsPerMinute) {
            return BudgetCheck.denied("rpm");
        }
        if (requestsPerDay > 0 && requestsToday + 1 > requestsPerDay) {
            return BudgetCheck.denied("rpd");
        }
        if (tokensPerMinute > 0 && tokensThisMinute + tokenEstimate > tokensPerMinute) {
            return BudgetCheck.denied("tpm");
        }
        if (tokensPerDay > 0 && tokensToday + tokenEstimate > tokensPerDay) {
            return BudgetCheck.denied("tpd");
        }
        return BudgetCheck.OK;
    }

    public synchronized void reserve(int tokenEstimate) {
        rollover();
        int tokens = Math.max(0, tokenEstimate);
        requestsThisMinute++;
        requestsToday++;
        tokensThisMinute += tokens;
        tokensToday += tokens;
    }

    /**
     * Check and reserve as one step.
     *
     * @return the check result; counters are only touched when it is ok
     */
    public synchronized BudgetCheck tryReserve(int tokenEstimate) {
        BudgetCheck check = canAfford(tokenEstimate);
        if (check.ok()) {
            reserve(tokenEstimate);
        }
        return check;
    }

    /**
     * Replace a reservation with the real usage. Token counters never drop below zero.
     */
    public synchronized void adjustAfterResponse(int reserved, int actual) {
        rollover();
        long delta = (long) actual - reserved;
        tokensThisMinute = Math.max(0L, tokensThisMinute + delta);
        tokensToday = Math.max(0L, tokensToday + delta);
    }

    public synchronized BudgetSnapshot snapshot() {
        rollover();
        return new BudgetSnapshot(
                requestsThisMinute,
                requestsToday,
                tokensThisMinute,
                tokensToday,
                requestsPerMinute,
                requestsPerDay,
                tokensPerMinute,
                tokensPerDay
        );
    }

    /**
     * Seconds until the window named by a denial reason ("rpm", "tpm", "rpd", "tpd") resets.
     */
    public long secondsUntilReset(String reason) {
        long now = clock.millis();
        boolean daily = "rpd".equals(reason) || "tpd".equals(reason);
        long windowMillis = daily ? DAY_MILLIS : MINUTE_MILLIS;
        long remaining = windowMillis - Math.floorMod(now, windowMillis);
        return (long) Math.ceil(remaining / 1000.0);
    }

    private void rollover() {
        long now = clock.millis();
        long currentMinute = Math.floorDiv(now, MINUTE_MILLIS);
        long currentDay = Math.floorDiv(now, DAY_MILLIS);
        if (currentMinute != minuteEpoch) {
            minuteEpoch = currentMinute;
            requestsThisMinute = 0;
            tokensThisMinute = 0;
        }
        if (currentDay != dayEpoch) {
            dayEpoch = currentDay;
            requestsToday = 0;
            tokensToday = 0;
        }
    }

    public record BudgetCheck(boolean ok, String reason) {
        static final BudgetCheck OK = new BudgetCheck(true, null);

        static BudgetCheck denied(String reason) {
            return new BudgetCheck(false, reason);
        }
    }
}
