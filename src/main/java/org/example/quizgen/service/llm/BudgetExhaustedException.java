package org.example.quizgen.service.llm;

/**
 * No model was eligible under the current budget and cooldowns; nothing was sent.
 */
public class BudgetExhaustedException extends LlmProviderException {

    private final String reason;
    private final long retryAfterSeconds;

    public BudgetExhaustedException(String reason, long retryAfterSeconds) {
        super("No eligible model: " + reason);
        this.reason = reason;
        this.retryAfterSeconds = Math.max(1L, retryAfterSeconds);
    }

    public String getReason() {
        return reason;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
