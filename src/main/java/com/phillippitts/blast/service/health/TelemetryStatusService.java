package com.phillippitts.blast.service.health;

import com.phillippitts.blast.service.data.DataRecorder;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.performance.PerformanceMonitor;
import com.phillippitts.blast.service.recovery.ErrorRecoveryEngine;
import com.phillippitts.blast.service.router.LogRouter;
import com.phillippitts.blast.service.serial.CommunicationLogger;
import com.phillippitts.blast.service.watchdog.FreezeDetector;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Query surface for the supervisory layer: aggregates component statistics into one
 * {@link TelemetryStatus} without mutating anything.
 */
@Service
public class TelemetryStatusService {

    private final LogRouter router;
    private final EventRecorder events;
    private final PerformanceMonitor performance;
    private final CommunicationLogger serial;
    private final DataRecorder data;
    private final FreezeDetector freezeDetector;
    private final ErrorRecoveryEngine recovery;
    private final Clock clock;

    public TelemetryStatusService(LogRouter router,
                                  EventRecorder events,
                                  PerformanceMonitor performance,
                                  CommunicationLogger serial,
                                  DataRecorder data,
                                  FreezeDetector freezeDetector,
                                  ErrorRecoveryEngine recovery,
                                  Clock clock) {
        this.router = router;
        this.events = events;
        this.performance = performance;
        this.serial = serial;
        this.data = data;
        this.freezeDetector = freezeDetector;
        this.recovery = recovery;
        this.clock = clock;
    }

    public TelemetryStatus currentStatus() {
        return new TelemetryStatus(clock.instant(),
                router.getStats(),
                events.getEventSummary(),
                performance.getStatistics(),
                performance.checkHealth(),
                serial.getStatistics(),
                data.getStatistics(),
                freezeDetector.getStatistics(),
                recovery.getStatistics(),
                recovery.isHealthy());
    }

    public boolean isRouterRunning() {
        return router.isRunning();
    }
}
