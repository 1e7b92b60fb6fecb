package com.phillippitts.blast.service.recovery;

import java.time.Duration;
import java.util.Objects;

/**
 * Recovery registration for one category, fixed at engine construction.
 *
 * @param category handled category
 * @param maxAttempts retry budget, also the failure count from which escalation starts
 * @param cooldown how long the circuit stays open once tripped
 * @param strategy recovery behavior
 * @param escalation escalation hook (nullable)
 * @param backoff delay shape between retries
 */
public record RecoveryAction(ErrorCategory category,
                             int maxAttempts,
                             Duration cooldown,
                             RecoveryStrategy strategy,
                             EscalationHook escalation,
                             BackoffPolicy backoff) {

    public RecoveryAction {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(cooldown, "cooldown");
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(backoff, "backoff");
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0 for " + category);
        }
        if (cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive for " + category);
        }
    }

    public boolean hasEscalation() {
        return escalation != null;
    }
}
