package com.phillippitts.blast.service.recovery;

import java.util.Map;

/**
 * Aggregated recovery statistics across categories.
 *
 * @param successRate successes divided by attempts, 1.0 when nothing was attempted
 */
public record RecoveryStats(long totalAttempts,
                            long successful,
                            long failed,
                            long escalations,
                            long shortCircuits,
                            double successRate,
                            Map<ErrorCategory, CategoryStats> categories) {

    public long openCircuits() {
        return categories.values().stream().filter(c -> c.circuit().isOpen()).count();
    }
}
