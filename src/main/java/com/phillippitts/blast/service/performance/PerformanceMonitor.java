package com.phillippitts.blast.service.performance;

import com.phillippitts.blast.config.properties.PerformanceProperties;
import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.RecordSink;
import com.phillippitts.blast.service.router.Severity;
import com.phillippitts.blast.util.BoundedHistory;
import com.phillippitts.blast.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Timing instrumentation, metric aggregation and resource sampling.
 *
 * <p>Metrics are aggregated into windows of {@code logIntervalSeconds}. When a window
 * elapses the next {@link #recordMetric} call flushes a snapshot of every metric to the
 * {@link LogCategory#PERFORMANCE} stream and drops the non-system metrics so the next window
 * starts fresh. System metrics ({@code memory_*}, {@code cpu_*}, {@code thread_*}) are kept
 * and updated continuously.
 *
 * <p>A background sampler feeds memory, CPU and thread usage from the {@link ResourceProbe}
 * every {@code sampleIntervalSeconds}.
 *
 * <p>Acquisition lag reported through {@link #recordDataLag} is kept as the {@code data_lag_ms}
 * metric and in a short history; the average of the last {@value #RECENT_LAG_SAMPLES} samples
 * feeds {@link #checkHealth()}.
 */
public class PerformanceMonitor {

    private static final Logger LOG = LogManager.getLogger(PerformanceMonitor.class);

    public static final String MEMORY_METRIC = "memory_mb";
    public static final String CPU_METRIC = "cpu_percent";
    public static final String THREAD_METRIC = "thread_count";
    public static final String DATA_LAG_METRIC = "data_lag_ms";
    static final int RECENT_LAG_SAMPLES = 10;
    private static final int LAG_HISTORY_SIZE = 100;
    static final String SAMPLER_THREAD_NAME = "perf-sampler";
    private static final List<String> SYSTEM_PREFIXES = List.of("memory_", "cpu_", "thread_");

    private final PerformanceProperties properties;
    private final RecordSink sink;
    private final ResourceProbe probe;
    private final TelemetryMetricsPublisher metrics;
    private final Clock clock;
    private final Duration sampleInterval;
    private final Duration logInterval;

    private final Lock lock = new ReentrantLock();
    private final Map<String, MetricStat> stats = new HashMap<>();
    private final Map<String, String> units = new HashMap<>();
    private Instant windowStart;

    private final AtomicInteger activeOperations = new AtomicInteger();
    private final AtomicLong slowOperations = new AtomicLong();
    private final AtomicLong lagAlerts = new AtomicLong();
    private final BoundedHistory<Double> dataLag = new BoundedHistory<>(LAG_HISTORY_SIZE);
    private volatile ResourceSnapshot lastSample = ResourceSnapshot.UNAVAILABLE;
    private volatile ScheduledExecutorService sampler;

    public PerformanceMonitor(PerformanceProperties properties, RecordSink sink, ResourceProbe probe,
                              TelemetryMetricsPublisher metrics, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.probe = probe == null ? NoopResourceProbe.INSTANCE : probe;
        this.metrics = metrics == null ? TelemetryMetricsPublisher.NOOP : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        if (!(properties.getSampleIntervalSeconds() > 0)) {
            throw new IllegalArgumentException("sampleIntervalSeconds must be > 0, got "
                    + properties.getSampleIntervalSeconds());
        }
        if (!(properties.getLogIntervalSeconds() > 0)) {
            throw new IllegalArgumentException("logIntervalSeconds must be > 0, got "
                    + properties.getLogIntervalSeconds());
        }
        if (properties.getDataLagCriticalMs() < properties.getDataLagWarningMs()) {
            throw new IllegalArgumentException("dataLagCriticalMs must be >= dataLagWarningMs, got "
                    + properties.getDataLagCriticalMs() + " < " + properties.getDataLagWarningMs());
        }
        this.sampleInterval = TimeUtils.secondsToDuration(properties.getSampleIntervalSeconds());
        this.logInterval = TimeUtils.secondsToDuration(properties.getLogIntervalSeconds());
        this.windowStart = clock.instant();
    }

    /**
     * Starts timing an operation. Close the returned timer to record {@code <operation>_time}
     * in milliseconds.
     */
    public OperationTimer measure(String operation) {
        Objects.requireNonNull(operation, "operation");
        activeOperations.incrementAndGet();
        return new OperationTimer(this, operation, System.nanoTime());
    }

    public <T> T measure(String operation, Supplier<T> work) {
        try (OperationTimer ignored = measure(operation)) {
            return work.get();
        }
    }

    public void measureRun(String operation, Runnable work) {
        try (OperationTimer ignored = measure(operation)) {
            work.run();
        }
    }

    void complete(String operation, long elapsedNanos) {
        activeOperations.decrementAndGet();
        double elapsedMs = TimeUtils.nanosToMillis(elapsedNanos);
        recordMetric(operation + "_time", elapsedMs, "ms");
        metrics.recordOperation(operation, elapsedNanos);
        if (elapsedMs > properties.getSlowOperationThresholdMs()) {
            slowOperations.incrementAndGet();
            LOG.warn("Slow operation: {} took {} ms", operation, String.format("%.1f", elapsedMs));
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("operation", operation);
            fields.put("duration_ms", TimeUtils.round3(elapsedMs));
            fields.put("threshold_ms", properties.getSlowOperationThresholdMs());
            tryEnqueue(Severity.WARNING, "Slow operation", fields);
        }
    }

    /**
     * Adds a sample to the named metric and flushes a snapshot if the aggregation window
     * has elapsed.
     */
    public void recordMetric(String name, double value, String unit) {
        Objects.requireNonNull(name, "name");
        Map<String, MetricSnapshot> due = null;
        lock.lock();
        try {
            stats.computeIfAbsent(name, MetricStat::new).add(value);
            if (unit != null) {
                units.put(name, unit);
            }
            Instant now = clock.instant();
            if (Duration.between(windowStart, now).compareTo(logInterval) >= 0) {
                due = closeWindowLocked(now);
            }
        } finally {
            lock.unlock();
        }
        if (due != null) {
            publish(due);
        }
    }

    public void recordMetric(String name, double value) {
        recordMetric(name, value, null);
    }

    /**
     * Records how far acquisition is running behind, in milliseconds. Lag at or above the
     * critical threshold is logged as CRITICAL, lag at or above the warning threshold as WARNING.
     *
     * @throws IllegalArgumentException if {@code lagMs} is negative or not finite
     */
    public void recordDataLag(double lagMs) {
        if (!Double.isFinite(lagMs) || lagMs < 0) {
            throw new IllegalArgumentException("lagMs must be a finite value >= 0, got " + lagMs);
        }
        dataLag.add(lagMs);
        recordMetric(DATA_LAG_METRIC, lagMs, "ms");
        Severity severity;
        double threshold;
        if (lagMs >= properties.getDataLagCriticalMs()) {
            severity = Severity.CRITICAL;
            threshold = properties.getDataLagCriticalMs();
            LOG.error("Critical data lag: {} ms", String.format("%.1f", lagMs));
        } else if (lagMs >= properties.getDataLagWarningMs()) {
            severity = Severity.WARNING;
            threshold = properties.getDataLagWarningMs();
            LOG.warn("High data lag: {} ms", String.format("%.1f", lagMs));
        } else {
            return;
        }
        lagAlerts.incrementAndGet();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("lag_ms", TimeUtils.round3(lagMs));
        fields.put("threshold_ms", threshold);
        tryEnqueue(severity, severity == Severity.CRITICAL ? "Critical data lag" : "High data lag", fields);
    }

    /** Average of the most recent lag samples, or 0 when none were recorded. */
    public double getRecentDataLagMs() {
        List<Double> recent = dataLag.last(RECENT_LAG_SAMPLES);
        if (recent.isEmpty()) {
            return 0.0;
        }
        double sum = 0;
        for (double lag : recent) {
            sum += lag;
        }
        return sum / recent.size();
    }

    /** Lag samples that crossed the warning or critical threshold. */
    public long getDataLagAlerts() {
        return lagAlerts.get();
    }

    /** Flushes the current window immediately. */
    public void flushMetrics() {
        Map<String, MetricSnapshot> due;
        lock.lock();
        try {
            due = closeWindowLocked(clock.instant());
        } finally {
            lock.unlock();
        }
        publish(due);
    }

    private Map<String, MetricSnapshot> closeWindowLocked(Instant now) {
        Map<String, MetricSnapshot> snapshot = snapshotLocked();
        stats.keySet().removeIf(name -> !isSystemMetric(name));
        units.keySet().retainAll(stats.keySet());
        windowStart = now;
        return snapshot;
    }

    private Map<String, MetricSnapshot> snapshotLocked() {
        Map<String, MetricSnapshot> snapshot = new TreeMap<>();
        stats.forEach((name, stat) -> snapshot.put(name, stat.snapshot(units.get(name))));
        return snapshot;
    }

    private void publish(Map<String, MetricSnapshot> snapshot) {
        if (snapshot.isEmpty()) {
            return;
        }
        Map<String, Object> metricFields = new LinkedHashMap<>();
        snapshot.forEach((name, s) -> metricFields.put(name, s.toFields()));
        tryEnqueue(Severity.INFO, "Performance metrics", Map.of("metrics", metricFields));
        LOG.debug("Flushed {} metric(s)", snapshot.size());
    }

    static boolean isSystemMetric(String name) {
        for (String prefix : SYSTEM_PREFIXES) {
            if (name.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Starts the background resource sampler. No-op when the probe is unavailable or the
     * sampler is already running.
     */
    public synchronized void start() {
        if (sampler != null) {
            return;
        }
        if (!probe.isAvailable()) {
            LOG.info("Resource probe unavailable; performance sampler not started");
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, SAMPLER_THREAD_NAME);
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::sampleSafely, 0, sampleInterval.toNanos(), TimeUnit.NANOSECONDS);
        sampler = executor;
        LOG.info("Performance sampler started (interval={}s, window={}s)",
                properties.getSampleIntervalSeconds(), properties.getLogIntervalSeconds());
    }

    /**
     * Stops the sampler with a bounded wait and flushes the final window.
     */
    public synchronized void stop() {
        ScheduledExecutorService executor = sampler;
        sampler = null;
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(properties.getStopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                    LOG.error("Performance sampler did not stop within {} ms", properties.getStopTimeoutMs());
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                executor.shutdownNow();
            }
        }
        flushMetrics();
    }

    public boolean isRunning() {
        return sampler != null;
    }

    private void sampleSafely() {
        try {
            sampleResources();
        } catch (RuntimeException e) {
            LOG.error("Resource sampling failed: {}", e.toString(), e);
        }
    }

    /** Takes one resource sample; the sampler thread calls this every interval. */
    void sampleResources() {
        ResourceSnapshot sample = probe.sample();
        lastSample = sample;
        recordMetric(MEMORY_METRIC, sample.memoryMb(), "MB");
        if (sample.cpuPercent() > 0) {
            recordMetric(CPU_METRIC, sample.cpuPercent(), "%");
        }
        recordMetric(THREAD_METRIC, sample.threadCount(), "count");
        if (sample.memoryMb() > properties.getMemoryCeilingMb()) {
            LOG.warn("High memory usage: {} MB (ceiling {} MB)",
                    String.format("%.1f", sample.memoryMb()), properties.getMemoryCeilingMb());
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("memory_mb", TimeUtils.round3(sample.memoryMb()));
            fields.put("ceiling_mb", properties.getMemoryCeilingMb());
            tryEnqueue(Severity.WARNING, "High memory usage", fields);
        }
    }

    private void tryEnqueue(Severity severity, String message, Map<String, Object> fields) {
        try {
            sink.enqueue(new LogRecord(LogCategory.PERFORMANCE, clock.instant(), severity, message, fields));
        } catch (LogRecordRejectedException e) {
            LOG.debug("Dropped performance record '{}': {}", message, e.getMessage());
        }
    }

    public Map<String, MetricSnapshot> getStatistics() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(snapshotLocked());
        } finally {
            lock.unlock();
        }
    }

    public Optional<MetricSnapshot> getMetric(String name) {
        lock.lock();
        try {
            MetricStat stat = stats.get(name);
            return stat == null ? Optional.empty() : Optional.of(stat.snapshot(units.get(name)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Checks the latest resource sample against the memory ceiling and thread limit.
     */
    public PerformanceHealth checkHealth() {
        ResourceSnapshot sample = lastSample;
        if (sample == ResourceSnapshot.UNAVAILABLE && probe.isAvailable()) {
            sample = probe.sample();
        }
        List<String> issues = new ArrayList<>();
        if (sample.memoryMb() > properties.getMemoryCeilingMb()) {
            issues.add(String.format("High memory usage: %.1f MB", sample.memoryMb()));
        }
        if (sample.threadCount() > properties.getMaxThreadCount()) {
            issues.add("High thread count: " + sample.threadCount());
        }
        double recentLag = getRecentDataLagMs();
        if (recentLag > properties.getDataLagWarningMs()) {
            issues.add(String.format(Locale.ROOT, "High data lag: %.1f ms", recentLag));
        }
        int tracked;
        lock.lock();
        try {
            tracked = stats.size();
        } finally {
            lock.unlock();
        }
        return new PerformanceHealth(issues.isEmpty(), sample.memoryMb(), sample.cpuPercent(),
                sample.threadCount(), activeOperations.get(), tracked, slowOperations.get(), recentLag,
                List.copyOf(issues));
    }
}
