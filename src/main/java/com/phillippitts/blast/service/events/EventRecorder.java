package com.phillippitts.blast.service.events;

import com.phillippitts.blast.exception.LogRecordRejectedException;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.RecordSink;
import com.phillippitts.blast.service.router.Severity;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Records typed domain events into the {@link LogCategory#EVENTS} stream.
 *
 * <p>Every event carries the session id and a sequence number that is monotonic per
 * {@link EventKind}. Threshold events are deduplicated on zone changes: a sensor that stays
 * in the same zone is not re-recorded, except that {@link ThresholdZone#DANGER} and
 * {@link ThresholdZone#CRITICAL} samples are always recorded. Connection, mode and valve
 * events represent discrete actions and are always recorded.
 *
 * <p>Recording never blocks; a full or closed router surfaces as {@link LogRecordRejectedException}.
 * A rejected event leaves no trace: its sequence number is reused by the next event of the kind,
 * and the sensor zone or valve state it would have reported is not committed.
 */
public class EventRecorder {

    private static final Logger LOG = LogManager.getLogger(EventRecorder.class);

    private final RecordSink sink;
    private final Clock clock;
    private final long sessionId;
    private final Map<EventKind, AtomicLong> sequences = new EnumMap<>(EventKind.class);
    private final Lock sequenceLock = new ReentrantLock();

    private final Lock stateLock = new ReentrantLock();
    private final Map<String, ThresholdZone> sensorZones = new HashMap<>();
    private final Map<String, Boolean> valveStates = new HashMap<>();

    public EventRecorder(RecordSink sink, Clock clock) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sessionId = clock.instant().getEpochSecond();
        for (EventKind kind : EventKind.values()) {
            sequences.put(kind, new AtomicLong());
        }
    }

    /**
     * Records one event.
     *
     * @param kind event kind
     * @param details event-specific payload (nullable)
     * @param severity record level
     * @return the sequence number assigned within {@code kind}
     * @throws LogRecordRejectedException if the router refuses the record
     */
    public long record(EventKind kind, Map<String, ?> details, Severity severity) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        AtomicLong counter = sequences.get(kind);
        long sequence;
        // held across the non-blocking enqueue so queue order matches sequence order
        sequenceLock.lock();
        try {
            sequence = counter.get() + 1;
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("event_type", kind.label());
            fields.put("severity", severity.name());
            fields.put("sequence", sequence);
            fields.put("session_id", sessionId);
            fields.put("details", details == null ? Map.of() : new LinkedHashMap<>(details));
            sink.enqueue(new LogRecord(LogCategory.EVENTS, clock.instant(), severity, kind.label(), fields));
            counter.set(sequence);
        } finally {
            sequenceLock.unlock();
        }
        if (severity.isAtLeast(Severity.WARNING)) {
            LOG.log(severity.toLog4jLevel(), "Event {} #{}: {}", kind, sequence, details);
        } else {
            LOG.debug("Event {} #{}: {}", kind, sequence, details);
        }
        return sequence;
    }

    /**
     * Evaluates a sample against the sensor's limits and records the resulting zone.
     *
     * @return the zone the sample falls into
     */
    public ThresholdZone checkThreshold(SensorLimits limits, double value) {
        ThresholdZone zone = limits.zoneOf(value);
        recordThreshold(limits, value, zone);
        return zone;
    }

    /**
     * Records a threshold zone for a sensor if the zone changed, or unconditionally for
     * danger and critical zones. The sensor's zone only moves once the event is accepted.
     *
     * @return true if an event was recorded
     * @throws LogRecordRejectedException if the router refuses the event
     */
    public boolean recordThreshold(SensorLimits limits, double value, ThresholdZone zone) {
        Objects.requireNonNull(limits, "limits");
        Objects.requireNonNull(zone, "zone");
        stateLock.lock();
        try {
            ThresholdZone previous = sensorZones.getOrDefault(limits.sensorId(), ThresholdZone.NORMAL);
            if (zone == previous && !zone.isAlwaysRecorded()) {
                return false;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sensor_id", limits.sensorId());
            details.put("sensor_name", limits.name());
            details.put("value", value);
            details.put("unit", limits.unit());
            details.put("zone", zone.name().toLowerCase(Locale.ROOT));
            details.put("previous_zone", previous.name().toLowerCase(Locale.ROOT));
            if (zone != ThresholdZone.NORMAL) {
                details.put("threshold", limits.limitFor(zone));
            }
            record(zone.eventKind(), details, zone.severity());
            sensorZones.put(limits.sensorId(), zone);
            return true;
        } finally {
            stateLock.unlock();
        }
    }

    public long recordConnection(ConnectionState state, Map<String, ?> details) {
        Objects.requireNonNull(state, "state");
        return record(state.eventKind(), details, state.severity());
    }

    public long recordModeChange(String from, String to, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from_mode", from);
        details.put("to_mode", to);
        details.put("reason", reason == null ? "" : reason);
        return record(EventKind.MODE_CHANGE, details, Severity.INFO);
    }

    /**
     * Records a valve command outcome. The tracked valve state only changes on success,
     * and only once the event is accepted.
     *
     * @param error failure description when {@code success} is false (nullable)
     */
    public long recordValveOperation(String valveId, String valveName, boolean open, String source,
                                     boolean success, String error) {
        Objects.requireNonNull(valveId, "valveId");
        stateLock.lock();
        try {
            Boolean previous = valveStates.get(valveId);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("valve_id", valveId);
            details.put("valve_name", valveName == null ? valveId : valveName);
            details.put("action", open ? "open" : "close");
            details.put("source", source == null ? "unknown" : source);
            details.put("success", success);
            details.put("previous_state", previous == null ? "unknown" : (previous ? "open" : "closed"));
            if (!success) {
                details.put("error", error == null ? "" : error);
                return record(EventKind.VALVE_ERROR, details, Severity.ERROR);
            }
            long sequence = record(open ? EventKind.VALVE_OPEN : EventKind.VALVE_CLOSE, details, Severity.INFO);
            valveStates.put(valveId, open);
            return sequence;
        } finally {
            stateLock.unlock();
        }
    }

    public long recordStartup(Map<String, ?> details) {
        return record(EventKind.STARTUP, details, Severity.INFO);
    }

    public long recordShutdown(String reason) {
        EventSummary summary = getEventSummary();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason == null ? "normal" : reason);
        details.put("total_events", summary.totalEvents());
        return record(EventKind.SHUTDOWN, details, Severity.INFO);
    }

    public ThresholdZone currentZone(String sensorId) {
        stateLock.lock();
        try {
            return sensorZones.getOrDefault(sensorId, ThresholdZone.NORMAL);
        } finally {
            stateLock.unlock();
        }
    }

    public EventSummary getEventSummary() {
        Map<EventKind, Long> counts = new EnumMap<>(EventKind.class);
        long total = 0;
        for (Map.Entry<EventKind, AtomicLong> e : sequences.entrySet()) {
            long count = e.getValue().get();
            if (count > 0) {
                counts.put(e.getKey(), count);
                total += count;
            }
        }
        return new EventSummary(sessionId, total, Map.copyOf(counts));
    }

    public long getSessionId() {
        return sessionId;
    }
}
