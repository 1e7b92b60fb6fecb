package com.phillippitts.blast.service.data;

import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.RecordSink;
import com.phillippitts.blast.service.router.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Writes acquired sensor readings to the {@link LogCategory#DATA} stream, one line per
 * reading with the raw values, the offset-adjusted values and the offsets applied.
 *
 * <p>{@code ts} is the acquisition time and {@code logged_at} the time the reading reached
 * the recorder, both as epoch seconds. A reading the router refuses is counted as dropped
 * and the acquisition loop carries on.
 */
public class DataRecorder {

    private static final Logger LOG = LogManager.getLogger(DataRecorder.class);
    private static final long DROP_LOG_EVERY = 1000;

    private final RecordSink sink;
    private final Clock clock;
    private final AtomicLong recorded = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    public DataRecorder(RecordSink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records one reading.
     *
     * @param acquiredAt when the sample was taken
     * @param raw sensor values as read (nullable)
     * @param adjusted sensor values after offsets (nullable)
     * @param offsets offsets applied per sensor (nullable)
     * @return true if the router accepted the reading
     */
    public boolean recordReading(Instant acquiredAt, Map<String, ?> raw, Map<String, ?> adjusted,
                                 Map<String, ?> offsets) {
        Objects.requireNonNull(acquiredAt, "acquiredAt");
        Instant now = clock.instant();
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("ts", epochSeconds(acquiredAt));
        fields.put("raw", copyOf(raw));
        fields.put("adjusted", copyOf(adjusted));
        fields.put("offsets", copyOf(offsets));
        fields.put("logged_at", epochSeconds(now));
        try {
            sink.enqueue(new LogRecord(LogCategory.DATA, now, Severity.INFO, "reading", fields));
            recorded.incrementAndGet();
            return true;
        } catch (LogRecordRejectedException e) {
            long count = dropped.incrementAndGet();
            if (count == 1 || count % DROP_LOG_EVERY == 0) {
                LOG.warn("Dropped sensor reading ({} so far): {}", count, e.getMessage());
            }
            return false;
        }
    }

    public DataRecorderStats getStatistics() {
        return new DataRecorderStats(recorded.get(), dropped.get());
    }

    static double epochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    private static Map<String, Object> copyOf(Map<String, ?> values) {
        return values == null ? Map.of() : new LinkedHashMap<>(values);
    }
}
