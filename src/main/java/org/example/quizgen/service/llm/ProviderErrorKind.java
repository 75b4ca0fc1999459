package org.example.quizgen.service.llm;

/**
 * How the dispatcher reacts to a failed provider call.
 */
public enum ProviderErrorKind {
    /** Model retired or unknown: skip it for this call, no retry. */
    DECOMMISSIONED,
    /** Rate or quota limit: quarantine the model, then skip it. */
    RATE_LIMITED,
    /** Server-side hiccup: bounded retry on the same model. */
    TRANSIENT,
    /** Anything else, including transport failures: skip. */
    UNKNOWN
}
