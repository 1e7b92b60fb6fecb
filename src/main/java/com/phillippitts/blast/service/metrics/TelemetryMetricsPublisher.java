package com.phillippitts.blast.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe facade over {@link TelemetryMetrics} used by every telemetry component.
 *
 * <p>Components are constructed with this publisher rather than the metrics class directly
 * so they can run without a {@code MeterRegistry} (unit tests, standalone construction).
 *
 * @see TelemetryMetrics
 */
public final class TelemetryMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(TelemetryMetricsPublisher.class);

    /**
     * Shared no-op instance. Never throws and reports as disabled via {@link #isEnabled()}.
     */
    public static final TelemetryMetricsPublisher NOOP = new TelemetryMetricsPublisher(null);

    private final TelemetryMetrics metrics;

    /**
     * @param metrics metrics service (nullable for metrics-less construction)
     */
    public TelemetryMetricsPublisher(TelemetryMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("TelemetryMetricsPublisher created without metrics");
        }
    }

    public void recordOperation(String operation, long durationNanos) {
        if (metrics != null) {
            metrics.recordOperation(operation, durationNanos);
        }
    }

    public void recordFreeze(String component) {
        if (metrics != null) {
            metrics.incrementFreeze(component);
        }
    }

    public void recordFreezeRecovery(String component) {
        if (metrics != null) {
            metrics.incrementFreezeRecovery(component);
        }
    }

    public void recordRecovery(String category, String outcome) {
        if (metrics != null) {
            metrics.incrementRecovery(category, outcome);
        }
    }

    public void recordEscalation(String category) {
        if (metrics != null) {
            metrics.incrementEscalation(category);
        }
    }

    public void recordCircuitOpen(String category) {
        if (metrics != null) {
            metrics.incrementCircuitOpen(category);
        }
    }

    public void recordLogRejected(String category) {
        if (metrics != null) {
            metrics.incrementLogRejected(category);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
