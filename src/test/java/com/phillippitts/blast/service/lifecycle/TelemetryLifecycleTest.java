package com.phillippitts.blast.service.lifecycle;

import com.phillippitts.blast.config.properties.LogRouterProperties;
import com.phillippitts.blast.config.properties.PerformanceProperties;
import com.phillippitts.blast.config.properties.WatchdogProperties;
import com.phillippitts.blast.exception.LogDirectoryException;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import com.phillippitts.blast.service.performance.NoopResourceProbe;
import com.phillippitts.blast.service.performance.PerformanceMonitor;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRouter;
import com.phillippitts.blast.service.router.Run;
import com.phillippitts.blast.service.watchdog.FreezeDetector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TelemetryLifecycleTest {

    @TempDir
    Path baseDir;

    private final Clock clock = Clock.systemUTC();
    private LogRouter router;
    private PerformanceMonitor performance;
    private FreezeDetector freezeDetector;
    private TelemetryLifecycle lifecycle;

    @AfterEach
    void tearDown() {
        if (lifecycle != null) {
            lifecycle.stop();
        }
        if (router != null) {
            router.shutdown();
        }
    }

    private void build(String base) {
        LogRouterProperties routerProps = new LogRouterProperties();
        routerProps.setBaseDir(base);
        router = new LogRouter(routerProps, clock, TelemetryMetricsPublisher.NOOP);
        EventRecorder events = new EventRecorder(router, clock);
        performance = new PerformanceMonitor(new PerformanceProperties(), router, NoopResourceProbe.INSTANCE,
                TelemetryMetricsPublisher.NOOP, clock);
        WatchdogProperties watchdogProps = new WatchdogProperties();
        watchdogProps.setPollIntervalMs(50);
        freezeDetector = new FreezeDetector(watchdogProps, router, events, NoopResourceProbe.INSTANCE,
                event -> { }, TelemetryMetricsPublisher.NOOP, clock);
        lifecycle = new TelemetryLifecycle(router, events, performance, freezeDetector);
    }

    @Test
    void startsWorkersAndRecordsStartupAndShutdown() throws IOException {
        build(baseDir.toString());

        lifecycle.start();

        assertThat(lifecycle.isRunning()).isTrue();
        assertThat(router.isRunning()).isTrue();
        assertThat(freezeDetector.isRunning()).isTrue();
        Run run = router.currentRun().orElseThrow();

        lifecycle.stop();

        assertThat(lifecycle.isRunning()).isFalse();
        assertThat(router.isRunning()).isFalse();
        assertThat(freezeDetector.isRunning()).isFalse();
        assertThat(performance.isRunning()).isFalse();
        List<String> lines = Files.readAllLines(LogCategory.EVENTS.resolve(run.directory()));
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0)).contains("\"event_type\":\"startup\"").contains(run.id());
        assertThat(lines.get(1)).contains("\"event_type\":\"shutdown\"").contains("application stopping");
    }

    @Test
    void startAndStopAreIdempotent() {
        build(baseDir.toString());

        lifecycle.start();
        Run first = router.currentRun().orElseThrow();
        lifecycle.start();

        assertThat(router.currentRun()).contains(first);

        lifecycle.stop();
        lifecycle.stop();
        assertThat(lifecycle.isRunning()).isFalse();
    }

    @Test
    void unusableLogDirectoryAbortsStartup() throws IOException {
        Path file = Files.createFile(baseDir.resolve("not-a-directory"));
        build(file.toString());

        assertThatThrownBy(() -> lifecycle.start()).isInstanceOf(LogDirectoryException.class);
        assertThat(lifecycle.isRunning()).isFalse();
        lifecycle = null;
    }
}
