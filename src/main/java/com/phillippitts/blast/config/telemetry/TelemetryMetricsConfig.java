package com.phillippitts.blast.config.telemetry;

import com.phillippitts.blast.service.health.TelemetryStatus;
import com.phillippitts.blast.service.health.TelemetryStatusService;
import com.phillippitts.blast.service.router.LogRouter;
import com.phillippitts.blast.service.recovery.ErrorRecoveryEngine;
import com.phillippitts.blast.service.watchdog.FreezeDetector;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Gauges over the telemetry components, exposed via Micrometer.
 *
 * <ul>
 *   <li>blast.telemetry.log.queue.depth - records waiting for the writer</li>
 *   <li>blast.telemetry.watchdog.frozen - watchdogs currently frozen</li>
 *   <li>blast.telemetry.circuit.open - recovery categories with an open circuit</li>
 * </ul>
 *
 * <p>Also logs a status summary every 5 minutes.
 */
@Configuration
public class TelemetryMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(TelemetryMetricsConfig.class);

    private final TelemetryStatusService statusService;

    public TelemetryMetricsConfig(TelemetryStatusService statusService) {
        this.statusService = statusService;
    }

    @Bean
    public MeterBinder telemetryGauges(LogRouter router, FreezeDetector freezeDetector,
                                       ErrorRecoveryEngine recovery) {
        return registry -> {
            Gauge.builder("blast.telemetry.log.queue.depth", router, LogRouter::queueDepth)
                    .description("Log records waiting to be written")
                    .register(registry);

            Gauge.builder("blast.telemetry.watchdog.frozen", freezeDetector,
                            d -> d.getStatistics().frozenCount())
                    .description("Watchdogs currently in the frozen state")
                    .register(registry);

            Gauge.builder("blast.telemetry.circuit.open", recovery,
                            r -> r.getStatistics().openCircuits())
                    .description("Error categories with an open circuit breaker")
                    .register(registry);

            LOG.info("Telemetry gauges registered: blast.telemetry.* available via /actuator/metrics");
        };
    }

    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logTelemetryStatus() {
        TelemetryStatus status = statusService.currentStatus();
        LOG.info("Telemetry status: run={}, queued={}/{}, rejected={}, events={}, frozen={}, openCircuits={}, "
                        + "recoverySuccessRate={}",
                status.router().runId(),
                status.router().queueDepth(),
                status.router().queueCapacity(),
                status.router().rejected(),
                status.events().totalEvents(),
                status.watchdog().frozenCount(),
                status.recovery().openCircuits(),
                status.recovery().successRate());
    }
}
