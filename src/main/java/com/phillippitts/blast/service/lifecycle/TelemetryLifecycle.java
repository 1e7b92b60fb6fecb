package com.phillippitts.blast.service.lifecycle;

import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.performance.PerformanceMonitor;
import com.phillippitts.blast.service.router.LogRouter;
import com.phillippitts.blast.service.router.Run;
import com.phillippitts.blast.service.watchdog.FreezeDetector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Starts the background workers in dependency order and stops them in reverse.
 *
 * <p>The log router starts first; a failure to create the run directory propagates and
 * aborts application startup. Stopping joins each worker with its own bounded timeout so
 * a stuck worker is logged but never blocks exit.
 */
@Component
public class TelemetryLifecycle implements SmartLifecycle {

    private static final Logger LOG = LogManager.getLogger(TelemetryLifecycle.class);

    private final LogRouter router;
    private final EventRecorder events;
    private final PerformanceMonitor performance;
    private final FreezeDetector freezeDetector;

    private volatile boolean running;

    public TelemetryLifecycle(LogRouter router,
                              EventRecorder events,
                              PerformanceMonitor performance,
                              FreezeDetector freezeDetector) {
        this.router = router;
        this.events = events;
        this.performance = performance;
        this.freezeDetector = freezeDetector;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        Run run = router.start();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("run_id", run.id());
        details.put("run_directory", run.directory().toAbsolutePath().toString());
        details.put("pid", ProcessHandle.current().pid());
        details.put("java_version", System.getProperty("java.version"));
        events.recordStartup(details);
        performance.start();
        freezeDetector.start();
        running = true;
        LOG.info("Telemetry subsystem started (run={})", run.id());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        freezeDetector.stop();
        performance.stop();
        try {
            events.recordShutdown("application stopping");
        } catch (RuntimeException e) {
            LOG.warn("Could not record shutdown event: {}", e.toString());
        }
        router.shutdown();
        running = false;
        LOG.info("Telemetry subsystem stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
