package com.phillippitts.blast.service.data;

import com.phillippitts.blast.config.properties.LogRouterProperties;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.LogRecord;
import com.phillippitts.blast.service.router.LogRouter;
import com.phillippitts.blast.service.router.Run;
import com.phillippitts.blast.testutil.CapturingRecordSink;
import com.phillippitts.blast.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DataRecorderTest {

    private final MutableClock clock = MutableClock.startingAt("2025-09-01T10:00:00.250Z");
    private CapturingRecordSink sink;
    private DataRecorder recorder;

    @BeforeEach
    void setUp() {
        sink = new CapturingRecordSink();
        recorder = new DataRecorder(sink, clock);
    }

    @Test
    void routesReadingToDataStream() {
        Instant acquired = clock.instant().minusMillis(50);

        boolean accepted = recorder.recordReading(acquired,
                Map.of("PT-CH", 512.0), Map.of("PT-CH", 510.5), Map.of("PT-CH", -1.5));

        assertThat(accepted).isTrue();
        assertThat(sink.records(LogCategory.DATA)).singleElement().satisfies(r -> {
            assertThat(r.fields()).containsKeys("ts", "raw", "adjusted", "offsets", "logged_at");
            assertThat((double) r.fields().get("ts")).isCloseTo(1756720800.2, within(1e-6));
            assertThat((double) r.fields().get("logged_at")).isCloseTo(1756720800.25, within(1e-6));
            assertThat(r.fields().get("adjusted")).isEqualTo(Map.of("PT-CH", 510.5));
        });
        assertThat(sink.records()).hasSize(1);
        assertThat(recorder.getStatistics()).isEqualTo(new DataRecorderStats(1, 0));
    }

    @Test
    void missingMapsAreWrittenEmpty() {
        recorder.recordReading(clock.instant(), Map.of("TC-1", 20.0), null, null);

        LogRecord record = sink.records(LogCategory.DATA).get(0);
        assertThat(record.fields().get("adjusted")).isEqualTo(Map.of());
        assertThat(record.fields().get("offsets")).isEqualTo(Map.of());
    }

    @Test
    void rejectedReadingIsCountedNotThrown() {
        sink.setOverloaded(true);
        assertThat(recorder.recordReading(clock.instant(), Map.of(), Map.of(), Map.of())).isFalse();

        sink.setOverloaded(false);
        sink.close();
        assertThat(recorder.recordReading(clock.instant(), Map.of(), Map.of(), Map.of())).isFalse();

        assertThat(recorder.getStatistics()).isEqualTo(new DataRecorderStats(0, 2));
    }

    @Test
    void requiresAcquisitionTime() {
        assertThatThrownBy(() -> recorder.recordReading(null, Map.of(), Map.of(), Map.of()))
                .isInstanceOf(NullPointerException.class);
    }

    @Test
    void oneReadingBecomesOneDataLine(@TempDir Path baseDir) throws IOException {
        LogRouterProperties props = new LogRouterProperties();
        props.setBaseDir(baseDir.toString());
        LogRouter router = new LogRouter(props, clock, TelemetryMetricsPublisher.NOOP);
        Run run = router.start();
        DataRecorder routed = new DataRecorder(router, clock);

        routed.recordReading(clock.instant(), Map.of("PT-CH", 512.0), Map.of("PT-CH", 510.5),
                Map.of("PT-CH", -1.5));
        router.shutdown();

        List<String> lines = Files.readAllLines(run.fileFor(LogCategory.DATA));
        assertThat(lines).hasSize(1);
        JSONObject line = new JSONObject(lines.get(0));
        assertThat(line.getJSONObject("raw").getDouble("PT-CH")).isEqualTo(512.0);
        assertThat(line.getJSONObject("adjusted").getDouble("PT-CH")).isEqualTo(510.5);
        assertThat(line.getJSONObject("offsets").getDouble("PT-CH")).isEqualTo(-1.5);
        assertThat(line.getDouble("ts")).isCloseTo(1756720800.25, within(1e-6));
        assertThat(line.has("logged_at")).isTrue();
        assertThat(run.directory().resolve("data").resolve("data.jsonl")).isEqualTo(run.fileFor(LogCategory.DATA));
    }
}
