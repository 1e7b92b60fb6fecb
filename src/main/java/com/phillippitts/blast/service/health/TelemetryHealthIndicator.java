package com.phillippitts.blast.service.health;

import com.phillippitts.blast.service.watchdog.WatchdogState;
import com.phillippitts.blast.service.watchdog.WatchdogStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for the telemetry subsystem.
 *
 * <ul>
 *   <li>UP: logs are being persisted and every component is healthy</li>
 *   <li>DEGRADED: a watchdog is frozen, a circuit is open, resource usage is high or
 *       recoveries keep failing</li>
 *   <li>DOWN: the log router is not running</li>
 * </ul>
 */
@Component
public class TelemetryHealthIndicator implements HealthIndicator {

    private final TelemetryStatusService statusService;

    public TelemetryHealthIndicator(TelemetryStatusService statusService) {
        this.statusService = statusService;
    }

    @Override
    public Health health() {
        TelemetryStatus status = statusService.currentStatus();
        Health.Builder builder = new Health.Builder();

        if (!status.router().running()) {
            builder.down().withDetail("status", "Log router not running");
        } else if (status.isDegraded()) {
            builder.status("DEGRADED").withDetail("status", "Telemetry degraded");
        } else {
            builder.up().withDetail("status", "Telemetry operational");
        }

        return builder
                .withDetail("run", String.valueOf(status.router().runId()))
                .withDetail("logQueueDepth", status.router().queueDepth())
                .withDetail("logRejected", status.router().rejected())
                .withDetail("frozenComponents", frozenComponents(status.watchdog().watchdogs()))
                .withDetail("freezesDetected", status.watchdog().freezesDetected())
                .withDetail("openCircuits", status.recovery().openCircuits())
                .withDetail("recoverySuccessRate", status.recovery().successRate())
                .withDetail("escalations", status.recovery().escalations())
                .withDetail("performanceIssues", status.performance().issues())
                .withDetail("dataLagMs", status.performance().averageDataLagMs())
                .withDetail("readingsRecorded", status.data().recorded())
                .withDetail("readingsDropped", status.data().dropped())
                .withDetail("serialErrorRate", status.serial().errorRate())
                .build();
    }

    private static List<String> frozenComponents(List<WatchdogStatus> watchdogs) {
        return watchdogs.stream()
                .filter(w -> w.state() == WatchdogState.FROZEN)
                .map(WatchdogStatus::component)
                .toList();
    }
}
