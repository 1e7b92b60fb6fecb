package com.phillippitts.blast.service.watchdog;

import com.phillippitts.blast.config.properties.WatchdogProperties;
import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.events.EventKind;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import com.phillippitts.blast.service.performance.NoopResourceProbe;
import com.phillippitts.blast.service.performance.ResourceProbe;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.RecordSink;
import com.phillippitts.blast.service.router.Severity;
import com.phillippitts.blast.util.BoundedHistory;
import com.phillippitts.blast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Detects unresponsive components through heartbeat timeouts.
 *
 * <p>Each registered component moves through {@code NORMAL -> FROZEN -> NORMAL}. The poll
 * loop moves an entry to FROZEN at most once per episode, so exactly one alert is raised
 * per continuous freeze no matter how many ticks it spans. The next heartbeat ends the
 * episode and records one recovery event.
 *
 * <p>On a freeze the detector:
 * <ol>
 *   <li>logs a critical record to the errors stream and a FREEZE_DETECTED event,</li>
 *   <li>invokes the component's callback and every global freeze callback,</li>
 *   <li>publishes a {@link ComponentFrozenEvent},</li>
 *   <li>queues a diagnostic dump (thread stacks, resources, recent operations) into the run.</li>
 * </ol>
 *
 * <p>Detection is observational only; it never blocks or interrupts the watched component.
 */
public class FreezeDetector {

    private static final Logger LOG = LogManager.getLogger(FreezeDetector.class);

    static final String POLL_THREAD_NAME = "freeze-watchdog";
    private static final DateTimeFormatter DUMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final WatchdogProperties properties;
    private final RecordSink sink;
    private final EventRecorder events;
    private final ResourceProbe probe;
    private final ApplicationEventPublisher publisher;
    private final TelemetryMetricsPublisher metrics;
    private final Clock clock;
    private final FreezeDiagnostics diagnostics;

    private final Map<String, WatchdogEntry> watchdogs = new ConcurrentHashMap<>();
    private final List<FreezeCallback> globalCallbacks = new CopyOnWriteArrayList<>();
    private final BoundedHistory<OperationRecord> operations;

    private final AtomicLong totalHeartbeats = new AtomicLong();
    private final AtomicLong freezesDetected = new AtomicLong();
    private final AtomicLong recoveries = new AtomicLong();
    private final AtomicLong dumpSequence = new AtomicLong();
    private volatile ScheduledExecutorService poller;

    public FreezeDetector(WatchdogProperties properties,
                          RecordSink sink,
                          EventRecorder events,
                          ResourceProbe probe,
                          ApplicationEventPublisher publisher,
                          TelemetryMetricsPublisher metrics,
                          Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.events = Objects.requireNonNull(events, "events");
        this.probe = probe == null ? NoopResourceProbe.INSTANCE : probe;
        this.publisher = publisher == null ? event -> { } : publisher;
        this.metrics = metrics == null ? TelemetryMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        if (properties.getPollIntervalMs() <= 0) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        if (!(properties.getMinHeartbeatIntervalSeconds() > 0)) {
            throw new IllegalArgumentException("minHeartbeatIntervalSeconds must be > 0");
        }
        this.operations = new BoundedHistory<>(properties.getOperationHistorySize());
        this.diagnostics = new FreezeDiagnostics(properties.getMaxStackDepth());
    }

    /**
     * Registers (or replaces) a watchdog. The heartbeat clock starts now.
     *
     * @param timeoutSeconds must be strictly greater than the configured minimum heartbeat interval
     * @param callback component-specific remediation hook (nullable)
     * @throws IllegalArgumentException if the timeout is too short
     */
    public void register(String component, double timeoutSeconds, FreezeCallback callback) {
        Objects.requireNonNull(component, "component");
        double minInterval = properties.getMinHeartbeatIntervalSeconds();
        if (!(timeoutSeconds > minInterval)) {
            throw new IllegalArgumentException("Watchdog timeout for '" + component + "' (" + timeoutSeconds
                    + "s) must exceed the heartbeat interval (" + minInterval + "s)");
        }
        WatchdogEntry previous = watchdogs.put(component, new WatchdogEntry(component,
                TimeUtils.secondsToDuration(timeoutSeconds), callback, clock.instant()));
        if (previous != null) {
            LOG.info("Replaced watchdog for {} (timeout={}s)", component, timeoutSeconds);
        } else {
            LOG.info("Registered watchdog for {} (timeout={}s)", component, timeoutSeconds);
        }
    }

    public void register(String component, double timeoutSeconds) {
        register(component, timeoutSeconds, null);
    }

    public boolean unregister(String component) {
        return watchdogs.remove(component) != null;
    }

    /**
     * Pauses or resumes a watchdog. Resuming restarts its heartbeat clock.
     *
     * @return false if the component is not registered
     */
    public boolean setActive(String component, boolean active) {
        WatchdogEntry entry = watchdogs.get(component);
        if (entry == null) {
            return false;
        }
        entry.setActive(active, clock.instant());
        return true;
    }

    public void registerFreezeCallback(FreezeCallback callback) {
        globalCallbacks.add(Objects.requireNonNull(callback, "callback"));
    }

    /**
     * Signals that a component is alive. Ends a freeze episode if one is in progress.
     * Heartbeats for unknown components are ignored.
     */
    public void heartbeat(String component) {
        WatchdogEntry entry = watchdogs.get(component);
        if (entry == null) {
            LOG.trace("Heartbeat for unregistered component {}", component);
            return;
        }
        totalHeartbeats.incrementAndGet();
        Instant now = clock.instant();
        Duration frozenFor = entry.beat(now);
        if (frozenFor != null) {
            onRecovered(entry, now, frozenFor);
        }
    }

    /**
     * Appends to the bounded operation history used for freeze dumps.
     */
    public void logOperation(String operation, Map<String, ?> details) {
        Map<String, Object> copy = details == null ? Map.of() : new LinkedHashMap<>(details);
        operations.add(new OperationRecord(clock.instant(), operation, copy, Thread.currentThread().getName()));
    }

    public List<OperationRecord> getRecentOperations(int count) {
        return operations.last(count);
    }

    /**
     * Checks every active watchdog once. The poll loop calls this every poll interval.
     */
    void checkWatchdogs() {
        Instant now = clock.instant();
        for (WatchdogEntry entry : watchdogs.values()) {
            Instant lastHeartbeat = entry.tryFreeze(now);
            if (lastHeartbeat != null) {
                onFrozen(entry, now, lastHeartbeat);
            }
        }
    }

    private void onFrozen(WatchdogEntry entry, Instant now, Instant lastHeartbeat) {
        long count = freezesDetected.incrementAndGet();
        metrics.recordFreeze(entry.component());
        ComponentFrozenEvent event = new ComponentFrozenEvent(entry.component(), now, lastHeartbeat,
                Duration.between(lastHeartbeat, now), entry.timeout(), count);
        LOG.fatal("FREEZE DETECTED: {} unresponsive for {} ms (timeout {} ms)",
                entry.component(), event.frozenFor().toMillis(), entry.timeout().toMillis());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("component", entry.component());
        details.put("frozen_for_ms", event.frozenFor().toMillis());
        details.put("timeout_ms", entry.timeout().toMillis());
        details.put("freeze_count", count);
        try {
            sink.enqueue(new LogRecord(LogCategory.ERRORS, now, Severity.CRITICAL,
                    "Component frozen: " + entry.component(), details));
            events.record(EventKind.FREEZE_DETECTED, details, Severity.CRITICAL);
        } catch (LogRecordRejectedException e) {
            LOG.error("Could not log freeze of {}: {}", entry.component(), e.getMessage());
        }

        if (entry.callback() != null) {
            invoke(entry.callback(), event);
        }
        for (FreezeCallback callback : globalCallbacks) {
            invoke(callback, event);
        }
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.error("Freeze event listener failed for {}: {}", entry.component(), e.toString(), e);
        }
        dumpDiagnostics(event);
    }

    private void invoke(FreezeCallback callback, ComponentFrozenEvent event) {
        try {
            callback.onFreeze(event);
        } catch (RuntimeException e) {
            LOG.error("Freeze callback failed for {}: {}", event.component(), e.toString(), e);
        }
    }

    private void dumpDiagnostics(ComponentFrozenEvent event) {
        String fileName = "freeze_dump_" + safeName(event.component()) + "_"
                + DUMP_FORMAT.format(event.detectedAt().atZone(ZoneId.systemDefault()))
                + "_" + dumpSequence.incrementAndGet() + ".json";
        try {
            String content = diagnostics.capture(event, probe.sample(),
                    operations.last(properties.getDiagnosticOperationCount()));
            sink.enqueueArtifact(fileName, content);
        } catch (LogRecordRejectedException e) {
            LOG.error("Could not queue freeze dump {}: {}", fileName, e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Failed to capture freeze diagnostics for {}: {}", event.component(), e.toString(), e);
        }
    }

    private void onRecovered(WatchdogEntry entry, Instant now, Duration frozenFor) {
        recoveries.incrementAndGet();
        metrics.recordFreezeRecovery(entry.component());
        LOG.info("Component {} recovered after {} ms", entry.component(), frozenFor.toMillis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("component", entry.component());
        details.put("frozen_for_ms", frozenFor.toMillis());
        try {
            events.record(EventKind.FREEZE_RECOVERED, details, Severity.INFO);
        } catch (LogRecordRejectedException e) {
            LOG.warn("Could not log recovery of {}: {}", entry.component(), e.getMessage());
        }
        try {
            publisher.publishEvent(new ComponentRecoveredEvent(entry.component(), now, frozenFor));
        } catch (RuntimeException e) {
            LOG.error("Recovery event listener failed for {}: {}", entry.component(), e.toString(), e);
        }
    }

    private static String safeName(String component) {
        return component.replaceAll("[^A-Za-z0-9_-]", "_");
    }

    /**
     * Starts the poll loop. No-op if already running.
     */
    public synchronized void start() {
        if (poller != null) {
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, POLL_THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        long period = properties.getPollIntervalMs();
        executor.scheduleWithFixedDelay(this::checkSafely, period, period, TimeUnit.MILLISECONDS);
        poller = executor;
        LOG.info("Freeze detector started (poll={}ms, watchdogs={})", period, watchdogs.keySet());
    }

    /**
     * Stops the poll loop with a bounded wait.
     */
    public synchronized void stop() {
        ScheduledExecutorService executor = poller;
        poller = null;
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(properties.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                LOG.error("Freeze detector poll loop did not stop within {} ms", properties.getStopTimeoutMs());
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        LOG.info("Freeze detector stopped ({} freeze(s) detected)", freezesDetected.get());
    }

    private void checkSafely() {
        try {
            checkWatchdogs();
        } catch (RuntimeException e) {
            LOG.error("Watchdog check failed: {}", e.toString(), e);
        }
    }

    public boolean isRunning() {
        return poller != null;
    }

    public boolean isFrozen(String component) {
        WatchdogEntry entry = watchdogs.get(component);
        return entry != null && entry.isFrozen();
    }

    public Optional<WatchdogStatus> getStatus(String component) {
        WatchdogEntry entry = watchdogs.get(component);
        return entry == null ? Optional.empty() : Optional.of(entry.status(clock.instant()));
    }

    public FreezeDetectorStats getStatistics() {
        Instant now = clock.instant();
        List<WatchdogStatus> statuses = new ArrayList<>();
        for (WatchdogEntry entry : watchdogs.values()) {
            statuses.add(entry.status(now));
        }
        statuses.sort(Comparator.comparing(WatchdogStatus::component));
        return new FreezeDetectorStats(isRunning(), totalHeartbeats.get(), freezesDetected.get(),
                recoveries.get(), List.copyOf(statuses));
    }

    /** Healthy when no active watchdog is frozen. */
    public boolean isHealthy() {
        for (WatchdogEntry entry : watchdogs.values()) {
            if (entry.isFrozen()) {
                return false;
            }
        }
        return true;
    }
}
