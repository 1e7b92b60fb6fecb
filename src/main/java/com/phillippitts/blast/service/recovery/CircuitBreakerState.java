package com.phillippitts.blast.service.recovery;

import java.time.Instant;
import java.util.Optional;

/**
 * Snapshot of one category's circuit.
 *
 * @param openUntil end of the current cooldown, or null while closed
 */
public record CircuitBreakerState(ErrorCategory category, int consecutiveFailures, Instant openUntil) {

    public boolean isOpen() {
        return openUntil != null;
    }

    public Optional<Instant> openUntilTime() {
        return Optional.ofNullable(openUntil);
    }
}
