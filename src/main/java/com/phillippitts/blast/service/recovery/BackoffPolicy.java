package com.phillippitts.blast.service.recovery;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff shape: {@code min(initialDelay * base^attempt, maxDelay)}, scaled by a
 * jitter factor in {@code [0.5, 1.5)} when jitter is enabled.
 */
public record BackoffPolicy(Duration initialDelay, Duration maxDelay, double base, boolean jitter) {

    public BackoffPolicy {
        Objects.requireNonNull(initialDelay, "initialDelay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Backoff delays must not be negative");
        }
        if (base < 1.0) {
            throw new IllegalArgumentException("Backoff base must be >= 1.0, got " + base);
        }
    }

    /**
     * Delay before the retry that follows the given failed attempt.
     *
     * @param attempt zero-based index of the attempt that just failed
     * @param random uniform sample in {@code [0, 1)}, used only when jitter is enabled
     */
    public Duration delayFor(int attempt, double random) {
        double baseNanos = initialDelay.toNanos() * Math.pow(base, attempt);
        double capped = Math.min(baseNanos, maxDelay.toNanos());
        double factor = jitter ? 0.5 + random : 1.0;
        return Duration.ofNanos(Math.round(capped * factor));
    }
}
