package com.phillippitts.blast.service.events;

import com.phillippitts.blast.exception.LogQueueOverloadedException;
import com.phillippitts.blast.exception.LogRouterClosedException;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.Severity;
import com.phillippitts.blast.testutil.CapturingRecordSink;
import com.phillippitts.blast.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventRecorderTest {

    private static final SensorLimits CHAMBER = new SensorLimits("PT-CH", "Chamber pressure",
            500, 800, 1000, "psi");

    private final MutableClock clock = MutableClock.startingAt("2025-02-01T08:00:00Z");
    private CapturingRecordSink sink;
    private EventRecorder recorder;

    @BeforeEach
    void setUp() {
        sink = new CapturingRecordSink();
        recorder = new EventRecorder(sink, clock);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> details(LogRecord record) {
        return (Map<String, Object>) record.fields().get("details");
    }

    @Test
    void recordsEnvelopeFields() {
        long seq = recorder.record(EventKind.CONFIG_RELOAD, Map.of("file", "stand.yaml"), Severity.INFO);

        LogRecord record = sink.records().get(0);
        assertThat(seq).isEqualTo(1);
        assertThat(record.category()).isEqualTo(LogCategory.EVENTS);
        assertThat(record.fields())
                .containsEntry("event_type", "config_reload")
                .containsEntry("severity", "INFO")
                .containsEntry("sequence", 1L)
                .containsEntry("session_id", clock.instant().getEpochSecond());
        assertThat(details(record)).containsEntry("file", "stand.yaml");
    }

    @Test
    void sequencesAreMonotonicPerKind() {
        assertThat(recorder.record(EventKind.VALVE_COMMAND, null, Severity.INFO)).isEqualTo(1);
        assertThat(recorder.record(EventKind.VALVE_COMMAND, null, Severity.INFO)).isEqualTo(2);
        assertThat(recorder.record(EventKind.MODE_CHANGE, null, Severity.INFO)).isEqualTo(1);
        assertThat(recorder.record(EventKind.VALVE_COMMAND, null, Severity.INFO)).isEqualTo(3);
    }

    @Test
    void thresholdEventsAreDeduplicatedExceptDangerAndCritical() {
        recorder.checkThreshold(CHAMBER, 100);   // normal, no change
        recorder.checkThreshold(CHAMBER, 600);   // warning
        recorder.checkThreshold(CHAMBER, 650);   // still warning
        recorder.checkThreshold(CHAMBER, 850);   // danger
        recorder.checkThreshold(CHAMBER, 900);   // danger again, always recorded

        List<LogRecord> events = sink.records(LogCategory.EVENTS);
        assertThat(events).extracting(r -> r.fields().get("event_type"))
                .containsExactly("threshold_warning", "threshold_danger", "threshold_danger");
        assertThat(details(events.get(1)))
                .containsEntry("previous_zone", "warning")
                .containsEntry("threshold", 800.0)
                .containsEntry("value", 850.0);
        assertThat(recorder.currentZone("PT-CH")).isEqualTo(ThresholdZone.DANGER);
    }

    @Test
    void returnToNormalIsRecordedOnce() {
        recorder.checkThreshold(CHAMBER, 600);
        recorder.checkThreshold(CHAMBER, 100);
        recorder.checkThreshold(CHAMBER, 90);

        assertThat(sink.events("sensor_normal")).hasSize(1);
        assertThat(sink.records()).hasSize(2);
    }

    @Test
    void zonesUseInclusiveLimits() {
        assertThat(CHAMBER.zoneOf(499.99)).isEqualTo(ThresholdZone.NORMAL);
        assertThat(CHAMBER.zoneOf(500)).isEqualTo(ThresholdZone.WARNING);
        assertThat(CHAMBER.zoneOf(800)).isEqualTo(ThresholdZone.DANGER);
        assertThat(CHAMBER.zoneOf(1000)).isEqualTo(ThresholdZone.CRITICAL);
        SensorLimits noCritical = new SensorLimits("TC-1", "Nozzle temp", 300, 450, "C");
        assertThat(noCritical.zoneOf(1e9)).isEqualTo(ThresholdZone.DANGER);
    }

    @Test
    void rejectsInconsistentLimits() {
        assertThatThrownBy(() -> new SensorLimits("X", "x", 10, 5, "u"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sensorsAreTrackedIndependently() {
        SensorLimits other = new SensorLimits("PT-FUEL", "Fuel pressure", 100, 200, "psi");

        recorder.checkThreshold(CHAMBER, 600);
        recorder.checkThreshold(other, 150);
        recorder.checkThreshold(CHAMBER, 610);

        assertThat(sink.events("threshold_warning")).hasSize(2);
    }

    @Test
    void valveOperationsTrackPreviousState() {
        recorder.recordValveOperation("V1", "Main oxidizer", true, "operator", true, null);
        recorder.recordValveOperation("V1", "Main oxidizer", false, "sequence", false, "actuator stalled");
        recorder.recordValveOperation("V1", "Main oxidizer", false, "sequence", true, null);

        assertThat(sink.records()).extracting(r -> r.fields().get("event_type"))
                .containsExactly("valve_open", "valve_error", "valve_close");
        assertThat(details(sink.records().get(0))).containsEntry("previous_state", "unknown");
        assertThat(details(sink.records().get(1)))
                .containsEntry("previous_state", "open")
                .containsEntry("error", "actuator stalled");
        assertThat(sink.records().get(1).severity()).isEqualTo(Severity.ERROR);
        assertThat(details(sink.records().get(2))).containsEntry("previous_state", "open");
    }

    @Test
    void connectionAndModeEventsAreAlwaysRecorded() {
        recorder.recordConnection(ConnectionState.DISCONNECT, Map.of("port", "/dev/ttyUSB0"));
        recorder.recordConnection(ConnectionState.DISCONNECT, Map.of("port", "/dev/ttyUSB0"));
        recorder.recordModeChange("normal", "safe", "operator abort");

        assertThat(sink.events("serial_disconnect")).hasSize(2)
                .allSatisfy(r -> assertThat(r.severity()).isEqualTo(Severity.WARNING));
        assertThat(details(sink.events("mode_change").get(0)))
                .containsEntry("from_mode", "normal")
                .containsEntry("to_mode", "safe");
    }

    @Test
    void summaryCountsEventsByKind() {
        recorder.recordStartup(Map.of("version", "1.0"));
        recorder.checkThreshold(CHAMBER, 900);
        recorder.recordShutdown("test");

        EventSummary summary = recorder.getEventSummary();
        assertThat(summary.sessionId()).isEqualTo(recorder.getSessionId());
        assertThat(summary.totalEvents()).isEqualTo(3);
        assertThat(summary.countsByKind())
                .containsEntry(EventKind.STARTUP, 1L)
                .containsEntry(EventKind.THRESHOLD_DANGER, 1L)
                .containsEntry(EventKind.SHUTDOWN, 1L);
        assertThat(details(sink.events("shutdown").get(0))).containsEntry("total_events", 2L);
    }

    @Test
    void overloadPropagatesToCaller() {
        sink.setOverloaded(true);

        assertThatThrownBy(() -> recorder.recordModeChange("a", "b", null))
                .isInstanceOf(LogQueueOverloadedException.class);
    }

    @Test
    void rejectedThresholdEventLeavesZoneAndSequenceUntouched() {
        SensorLimits pt1 = new SensorLimits("PT-1", "Feed pressure", 10, 20, "psi");
        sink.setOverloaded(true);

        assertThatThrownBy(() -> recorder.checkThreshold(pt1, 15))
                .isInstanceOf(LogQueueOverloadedException.class);
        assertThat(recorder.currentZone("PT-1")).isEqualTo(ThresholdZone.NORMAL);

        sink.setOverloaded(false);
        recorder.checkThreshold(pt1, 15);
        recorder.checkThreshold(pt1, 15);

        assertThat(sink.events("threshold_warning")).singleElement()
                .satisfies(r -> assertThat(r.fields()).containsEntry("sequence", 1L));
        assertThat(recorder.currentZone("PT-1")).isEqualTo(ThresholdZone.WARNING);
        assertThat(recorder.getEventSummary().totalEvents()).isEqualTo(1);
    }

    @Test
    void rejectedValveEventDoesNotMoveValveState() {
        recorder.recordValveOperation("V1", "Main oxidizer", true, "operator", true, null);
        sink.setOverloaded(true);

        assertThatThrownBy(() -> recorder.recordValveOperation("V1", "Main oxidizer", false, "operator", true, null))
                .isInstanceOf(LogQueueOverloadedException.class);

        sink.setOverloaded(false);
        recorder.recordValveOperation("V1", "Main oxidizer", false, "sequence", true, null);

        assertThat(sink.records()).hasSize(2);
        assertThat(details(sink.events("valve_close").get(0))).containsEntry("previous_state", "open");
        assertThat(sink.events("valve_close").get(0).fields()).containsEntry("sequence", 1L);
    }

    @Test
    void closedRouterRejectsEvents() {
        sink.close();

        assertThatThrownBy(() -> recorder.recordStartup(Map.of()))
                .isInstanceOf(LogRouterClosedException.class);
        assertThat(recorder.getEventSummary().totalEvents()).isZero();
    }
}
