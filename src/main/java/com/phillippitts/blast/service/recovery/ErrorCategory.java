package com.phillippitts.blast.service.recovery;

import java.util.Locale;

/**
 * Closed taxonomy of transient operational errors, with the default retry budget of each.
 */
public enum ErrorCategory {
    CONNECTION_LOSS(3, 1000),
    TIMEOUT(5, 500),
    PARSE_FAILURE(3, 100),
    FILE_WRITE(3, 100),
    NETWORK(5, 500),
    RESOURCE_EXHAUSTION(2, 2000),
    GENERIC(3, 500);

    private final int defaultMaxAttempts;
    private final long defaultInitialDelayMs;

    ErrorCategory(int defaultMaxAttempts, long defaultInitialDelayMs) {
        this.defaultMaxAttempts = defaultMaxAttempts;
        this.defaultInitialDelayMs = defaultInitialDelayMs;
    }

    public int defaultMaxAttempts() {
        return defaultMaxAttempts;
    }

    public long defaultInitialDelayMs() {
        return defaultInitialDelayMs;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
