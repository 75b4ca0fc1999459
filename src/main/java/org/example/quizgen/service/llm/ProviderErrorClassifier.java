package org.example.quizgen.service.llm;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Maps failed provider responses onto {@link ProviderErrorKind} and cooldown lengths.
 */
public final class ProviderErrorClassifier {

    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(500, 502, 503);

    private static final List<String> DECOMMISSIONED_MARKERS = List.of(
            "model_decommissioned", "model_not_found", "decommissioned", "does not exist", "not found"
    );

    private static final List<String> RATE_OR_QUOTA_MARKERS = List.of(
            "rate limit", "rate_limit", "ratelimit", "too many requests", "quota", "insufficient",
            "tokens per minute", "requests per minute", "tokens per day", "requests per day",
            "(tpm)", "(rpm)", "(tpd)", "(rpd)"
    );

    private static final List<String> MINUTE_MARKERS = List.of(
            "per minute", "tpm", "rpm"
    );

    private static final List<String> DAILY_MARKERS = List.of(
            "per day", "daily", "rpd", "tpd", "quota", "insufficient", "exceeded"
    );

    private ProviderErrorClassifier() {
    }

    public static ProviderErrorKind classify(ProviderResponse response) {
        int status = response.status();
        if (status == 0) {
            return ProviderErrorKind.UNKNOWN;
        }
        String text = errorText(response);
        if ((status == 400 || status == 404) && containsAny(text, DECOMMISSIONED_MARKERS)) {
            return ProviderErrorKind.DECOMMISSIONED;
        }
        if (status == 429 || status == 403 || containsAny(text, RATE_OR_QUOTA_MARKERS)) {
            return ProviderErrorKind.RATE_LIMITED;
        }
        if (TRANSIENT_STATUSES.contains(status)) {
            return ProviderErrorKind.TRANSIENT;
        }
        return ProviderErrorKind.UNKNOWN;
    }

    /**
     * Whether a rate-limited response points at a daily or account-level limit.
     * Minute-scoped wording wins over daily wording. Only the message is read: the error code
     * ({@code rate_limit_exceeded} for every Groq 429) says nothing about the window.
     */
    public static boolean isLongCooldown(ProviderResponse response) {
        String text = response.errorMessage().toLowerCase(Locale.ROOT);
        if (containsAny(text, MINUTE_MARKERS)) {
            return false;
        }
        return containsAny(text, DAILY_MARKERS);
    }

    private static String errorText(ProviderResponse response) {
        return (response.errorCode() + " " + response.errorMessage()).toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> markers) {
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
