package com.phillippitts.blast.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the telemetry subsystem.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Operation timings measured by the performance monitor</li>
 *   <li>Freeze and recovery transitions per watched component</li>
 *   <li>Error recovery outcomes, escalations and circuit openings per category</li>
 *   <li>Log queue rejections per category</li>
 * </ul>
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
public class TelemetryMetrics {

    static final String METRIC_PREFIX = "blast.telemetry";

    private final MeterRegistry registry;

    public TelemetryMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records the duration of a measured operation.
     *
     * @param operation operation name passed to {@code measure}
     * @param durationNanos duration in nanoseconds
     */
    public void recordOperation(String operation, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".operation")
                .description("Duration of measured operations")
                .tag("operation", operation)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementFreeze(String component) {
        Counter.builder(METRIC_PREFIX + ".freeze")
                .description("Number of detected freeze episodes")
                .tag("component", component)
                .register(registry)
                .increment();
    }

    public void incrementFreezeRecovery(String component) {
        Counter.builder(METRIC_PREFIX + ".freeze.recovered")
                .description("Number of components recovered from a freeze")
                .tag("component", component)
                .register(registry)
                .increment();
    }

    /**
     * Increments the recovery outcome counter for a category.
     *
     * @param category error category label
     * @param outcome success, failure or short_circuit
     */
    public void incrementRecovery(String category, String outcome) {
        Counter.builder(METRIC_PREFIX + ".recovery")
                .description("Error recovery attempts by outcome")
                .tag("category", category)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementEscalation(String category) {
        Counter.builder(METRIC_PREFIX + ".recovery.escalation")
                .description("Recoveries escalated for external intervention")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void incrementCircuitOpen(String category) {
        Counter.builder(METRIC_PREFIX + ".circuit.opened")
                .description("Circuit breaker openings")
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void incrementLogRejected(String category) {
        Counter.builder(METRIC_PREFIX + ".log.rejected")
                .description("Records rejected because the log queue was full")
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
