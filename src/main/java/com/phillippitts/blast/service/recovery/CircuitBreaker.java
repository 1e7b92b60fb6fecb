package com.phillippitts.blast.service.recovery;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-category circuit: CLOSED, then OPEN until a deadline once failures reach the
 * threshold, then CLOSED again on the first check after the deadline.
 *
 * <p>The failure count survives the cooldown, so a failure right after it reopens the
 * circuit. Any success resets everything.
 */
final class CircuitBreaker {

    private static final Logger LOG = LogManager.getLogger(CircuitBreaker.class);

    private final ErrorCategory category;
    private int consecutiveFailures;
    private Instant openUntil;

    CircuitBreaker(ErrorCategory category) {
        this.category = category;
    }

    /**
     * @return true while the cooldown is running; closes the circuit once it has elapsed
     */
    synchronized boolean isOpen(Instant now) {
        if (openUntil == null) {
            return false;
        }
        if (now.isBefore(openUntil)) {
            return true;
        }
        LOG.info("Circuit for {} closed after cooldown; next recovery will be attempted", category);
        openUntil = null;
        return false;
    }

    /**
     * @return true if this failure opened the circuit
     */
    synchronized boolean recordFailure(Instant now, int threshold, Duration cooldown) {
        consecutiveFailures++;
        if (consecutiveFailures >= threshold && openUntil == null) {
            openUntil = now.plus(cooldown);
            return true;
        }
        return false;
    }

    synchronized void recordSuccess() {
        consecutiveFailures = 0;
        openUntil = null;
    }

    synchronized CircuitBreakerState snapshot(Instant now) {
        Instant until = openUntil != null && now.isBefore(openUntil) ? openUntil : null;
        return new CircuitBreakerState(category, consecutiveFailures, until);
    }
}
