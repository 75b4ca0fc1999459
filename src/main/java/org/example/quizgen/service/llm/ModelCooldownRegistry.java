package org.example.quizgen.service.llm;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory quarantine of models that recently hit a rate or quota limit.
 */
@Component
public class ModelCooldownRegistry {

    private final Map<String, Instant> expiries = new HashMap<>();
    private final Clock clock;

    @Autowired
    public ModelCooldownRegistry() {
        this(Clock.systemUTC());
    }

    ModelCooldownRegistry(Clock clock) {
        this.clock = clock;
    }

    public synchronized boolean isOnCooldown(String model) {
        Instant expiry = expiries.get(model);
        return expiry != null && clock.instant().isBefore(expiry);
    }

    /**
     * Quarantine a model. An existing later expiry is kept.
     */
    public synchronized void setCooldown(String model, long durationSeconds) {
        Instant candidate = clock.instant().plusSeconds(Math.max(0L, durationSeconds));
        expiries.merge(model, candidate, (current, proposed) -> proposed.isAfter(current) ? proposed : current);
    }

    public synchronized Instant expiryOf(String model) {
        return expiries.get(model);
    }

    /**
     * Models still quarantined, with their expiry.
     */
    public synchronized Map<String, Instant> activeCooldowns() {
        Instant now = clock.instant();
        Map<String, Instant> active = new LinkedHashMap<>();
        expiries.forEach((model, expiry) -> {
            if (now.isBefore(expiry)) {
                active.put(model, expiry);
            }
        });
        return active;
    }
}
