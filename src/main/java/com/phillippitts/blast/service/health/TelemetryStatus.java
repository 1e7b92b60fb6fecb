package com.phillippitts.blast.service.health;

import com.phillippitts.blast.service.data.DataRecorderStats;
import com.phillippitts.blast.service.events.EventSummary;
import com.phillippitts.blast.service.performance.MetricSnapshot;
import com.phillippitts.blast.service.performance.PerformanceHealth;
import com.phillippitts.blast.service.recovery.RecoveryStats;
import com.phillippitts.blast.service.router.LogRouterStats;
import com.phillippitts.blast.service.serial.CommunicationStatistics;
import com.phillippitts.blast.service.watchdog.FreezeDetectorStats;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only snapshot of every telemetry component, taken at {@code generatedAt}.
 */
public record TelemetryStatus(Instant generatedAt,
                              LogRouterStats router,
                              EventSummary events,
                              Map<String, MetricSnapshot> metrics,
                              PerformanceHealth performance,
                              CommunicationStatistics serial,
                              DataRecorderStats data,
                              FreezeDetectorStats watchdog,
                              RecoveryStats recovery,
                              boolean recoveryHealthy) {

    public boolean isDegraded() {
        return watchdog.frozenCount() > 0
                || recovery.openCircuits() > 0
                || !performance.healthy()
                || !recoveryHealthy;
    }
}
