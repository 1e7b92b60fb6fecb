package com.phillippitts.blast.service.recovery;

/**
 * Recovery counters for one category.
 */
public record CategoryStats(ErrorCategory category,
                            long attempts,
                            long successes,
                            long failures,
                            long escalations,
                            long shortCircuits,
                            CircuitBreakerState circuit) {
}
