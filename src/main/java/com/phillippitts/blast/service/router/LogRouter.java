package com.phillippitts.blast.service.router;

import com.phillippitts.blast.config.properties.LogRouterProperties;
import com.phillippitts.blast.exception.LogDirectoryException;
import com.phillippitts.blast.exception.LogQueueOverloadedException;
import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.exception.LogRouterClosedException;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Durable, ordered persistence of telemetry records.
 *
 * <p>Producers call {@link #enqueue(LogRecord)} which only offers the record to a bounded
 * FIFO queue and returns. A single writer thread drains the queue and appends each record to
 * its category file, so records from one producer land in that producer's call order. When
 * the queue is full the call fails with {@link LogQueueOverloadedException} instead of
 * blocking or dropping silently; after {@link #shutdown()} it fails with
 * {@link LogRouterClosedException}.
 *
 * <p>All disk writes of the subsystem happen on the writer thread. Other components only
 * hold this router by reference (usually through {@link RecordSink}).
 *
 * <p><b>Lifecycle:</b> {@link #start()} creates the run, starts the writer and removes runs
 * older than {@code retentionDays};
 * {@link #shutdown()} sends a stop marker through the queue and joins the writer with a
 * bounded timeout. A writer that does not stop in time is logged, never waited on forever.
 */
public class LogRouter implements RecordSink {

    private static final Logger LOG = LogManager.getLogger(LogRouter.class);

    static final String WRITER_THREAD_NAME = "log-router-writer";
    private static final long REJECTION_LOG_EVERY = 1000;
    private static final Envelope STOP = new Envelope(null, null, null);

    private final LogRouterProperties properties;
    private final Clock clock;
    private final RunDirectoryFactory runFactory;
    private final TelemetryMetricsPublisher metrics;
    private final BlockingQueue<Envelope> queue;

    // Touched only by the writer thread once started
    private final Map<LogCategory, RollingCategoryWriter> writers = new EnumMap<>(LogCategory.class);

    private final Map<LogCategory, AtomicLong> written = new EnumMap<>(LogCategory.class);
    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();
    private final AtomicLong artifactsWritten = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    // Read side guards offer(); write side guards the stop hand-off so nothing is accepted after STOP
    private final ReadWriteLock stateLock = new ReentrantReadWriteLock();
    private volatile Run run;
    private volatile Thread writer;
    private volatile boolean stopped;

    public LogRouter(LogRouterProperties properties, Clock clock, TelemetryMetricsPublisher metrics) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.metrics = metrics == null ? TelemetryMetricsPublisher.NOOP : metrics;
        if (properties.getQueueCapacity() <= 0) {
            throw new IllegalArgumentException("queueCapacity must be > 0");
        }
        if (properties.getShutdownTimeoutMs() <= 0) {
            throw new IllegalArgumentException("shutdownTimeoutMs must be > 0");
        }
        this.clock = Objects.requireNonNull(clock, "clock");
        this.runFactory = new RunDirectoryFactory(Path.of(properties.getBaseDir()), clock);
        this.queue = new ArrayBlockingQueue<>(properties.getQueueCapacity());
        for (LogCategory category : LogCategory.values()) {
            written.put(category, new AtomicLong());
        }
    }

    /**
     * Creates the run directory with its category files and starts the writer thread.
     *
     * @return the active run
     * @throws LogDirectoryException if the run or any category file cannot be created
     * @throws IllegalStateException if already started
     */
    public synchronized Run start() {
        if (run != null) {
            throw new IllegalStateException("Log router already started with run " + run.id());
        }
        Run created = runFactory.createRun();
        for (LogCategory category : LogCategory.values()) {
            Path file = created.fileFor(category);
            try {
                writers.put(category, new RollingCategoryWriter(file,
                        properties.getMaxFileSizeBytes(), properties.getBackupCount()));
            } catch (IOException e) {
                closeWriters();
                throw new LogDirectoryException(file.toString(), e);
            }
        }
        this.run = created;
        Thread t = new Thread(this::drain, WRITER_THREAD_NAME);
        t.setDaemon(true);
        this.writer = t;
        t.start();
        if (properties.getRetentionDays() > 0) {
            try {
                cleanupOldRuns(properties.getRetentionDays());
            } catch (LogDirectoryException e) {
                LOG.warn("Log retention cleanup skipped: {}", e.getMessage());
            }
        }
        return created;
    }

    /**
     * Removes run directories under the base directory whose files are all older than the
     * given number of days. The active run is always kept.
     *
     * @return number of runs removed
     * @throws LogDirectoryException if the base directory cannot be listed
     */
    public int cleanupOldRuns(int days) {
        if (days < 0) {
            throw new IllegalArgumentException("days must be >= 0, got " + days);
        }
        Run active = run;
        int removed = runFactory.cleanupOldRuns(Duration.ofDays(days), active == null ? null : active.directory());
        if (removed > 0 && !stopped) {
            try {
                enqueue(LogRecord.of(LogCategory.SYSTEM, clock.instant(), Severity.INFO,
                        "Log cleanup completed, removed " + removed + " run(s) older than " + days + " day(s)"));
            } catch (LogRecordRejectedException e) {
                LOG.debug("Dropped cleanup record: {}", e.getMessage());
            }
        }
        return removed;
    }

    @Override
    public void enqueue(LogRecord record) {
        Objects.requireNonNull(record, "record");
        offer(new Envelope(record, null, null), record.category());
    }

    @Override
    public void enqueueArtifact(String fileName, String content) {
        Objects.requireNonNull(fileName, "fileName");
        offer(new Envelope(null, fileName, content == null ? "" : content), LogCategory.SYSTEM);
    }

    private void offer(Envelope envelope, LogCategory category) {
        stateLock.readLock().lock();
        try {
            if (stopped) {
                throw new LogRouterClosedException(category);
            }
            if (!queue.offer(envelope)) {
                long count = rejected.incrementAndGet();
                metrics.recordLogRejected(category.label());
                if (count == 1 || count % REJECTION_LOG_EVERY == 0) {
                    LOG.warn("Log queue full (capacity={}); {} record(s) rejected so far",
                            properties.getQueueCapacity(), count);
                }
                throw new LogQueueOverloadedException(category, properties.getQueueCapacity());
            }
            accepted.incrementAndGet();
        } finally {
            stateLock.readLock().unlock();
        }
    }

    private void drain() {
        ThreadContext.put("run", run.id());
        try {
            while (true) {
                Envelope envelope = queue.take();
                if (envelope == STOP) {
                    break;
                }
                write(envelope);
                if (queue.isEmpty()) {
                    flushWriters();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Log router writer interrupted with {} record(s) pending", queue.size());
        } finally {
            flushWriters();
            closeWriters();
            ThreadContext.remove("run");
        }
    }

    private void write(Envelope envelope) {
        if (envelope.record() != null) {
            LogRecord record = envelope.record();
            try {
                writers.get(record.category()).append(record.toLine());
                written.get(record.category()).incrementAndGet();
            } catch (IOException | RuntimeException e) {
                writeFailures.incrementAndGet();
                LOG.error("Failed to append {} record: {}", record.category().label(), e.toString());
            }
            return;
        }
        // Only the bare file name is honored so artifacts stay inside the run directory
        Path target = run.directory().resolve(Path.of(envelope.artifactName()).getFileName());
        try {
            Files.writeString(target, envelope.artifactContent(), StandardCharsets.UTF_8);
            artifactsWritten.incrementAndGet();
            LOG.info("Wrote diagnostic artifact {}", target);
        } catch (IOException e) {
            writeFailures.incrementAndGet();
            LOG.error("Failed to write artifact {}: {}", target, e.toString());
        }
    }

    private void flushWriters() {
        for (RollingCategoryWriter w : writers.values()) {
            try {
                w.flush();
            } catch (IOException e) {
                writeFailures.incrementAndGet();
                LOG.error("Failed to flush {}: {}", w.file(), e.toString());
            }
        }
    }

    private void closeWriters() {
        for (RollingCategoryWriter w : writers.values()) {
            try {
                w.close();
            } catch (IOException e) {
                LOG.warn("Failed to close {}: {}", w.file(), e.toString());
            }
        }
        writers.clear();
    }

    /**
     * Stops accepting records, lets the writer drain everything queued before the stop marker
     * and joins it for at most the configured timeout. Idempotent.
     */
    public void shutdown() {
        long timeoutMs = properties.getShutdownTimeoutMs();
        Thread t;
        boolean handedOff;
        stateLock.writeLock().lock();
        try {
            if (stopped) {
                return;
            }
            stopped = true;
            t = writer;
            handedOff = t != null && queue.offer(STOP);
        } finally {
            stateLock.writeLock().unlock();
        }
        if (t == null) {
            LOG.debug("Log router shut down before start");
            return;
        }
        if (!handedOff) {
            // Queue is full; nothing new can be accepted so STOP goes in once the writer makes room
            offerStopLater(t, timeoutMs);
        }
        try {
            t.join(timeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (t.isAlive()) {
            LOG.error("Log router writer did not stop cleanly within {} ms ({} record(s) pending)",
                    timeoutMs, queue.size());
        } else {
            LOG.info("Log router stopped; {} record(s) accepted, {} rejected", accepted.get(), rejected.get());
        }
    }

    private void offerStopLater(Thread t, long timeoutMs) {
        try {
            if (!queue.offer(STOP, timeoutMs, TimeUnit.MILLISECONDS)) {
                LOG.error("Could not hand stop signal to log router writer; interrupting it");
                t.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            t.interrupt();
        }
    }

    public Optional<Run> currentRun() {
        return Optional.ofNullable(run);
    }

    public boolean isRunning() {
        Thread t = writer;
        return t != null && t.isAlive() && !stopped;
    }

    public int queueDepth() {
        return queue.size();
    }

    public LogRouterStats getStats() {
        Map<LogCategory, Long> perCategory = new EnumMap<>(LogCategory.class);
        written.forEach((k, v) -> perCategory.put(k, v.get()));
        Run r = run;
        return new LogRouterStats(isRunning(), r == null ? null : r.id(), accepted.get(), rejected.get(),
                Map.copyOf(perCategory), artifactsWritten.get(), writeFailures.get(),
                queue.size(), properties.getQueueCapacity());
    }

    /** Visible for tests */
    Thread writerThread() {
        return writer;
    }

    private record Envelope(LogRecord record, String artifactName, String artifactContent) {
    }
}
