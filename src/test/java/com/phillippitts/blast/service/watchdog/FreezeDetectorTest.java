package com.phillippitts.blast.service.watchdog;

import com.phillippitts.blast.config.properties.WatchdogProperties;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.performance.NoopResourceProbe;
import com.phillippitts.blast.service.router.LogCategory;
import com.phillippitts.blast.service.router.Severity;
import com.phillippitts.blast.testutil.CapturingRecordSink;
import com.phillippitts.blast.testutil.MutableClock;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class FreezeDetectorTest {

    private final MutableClock clock = MutableClock.startingAt("2025-07-04T12:00:00Z");
    private final List<Object> published = new CopyOnWriteArrayList<>();
    private CapturingRecordSink sink;
    private WatchdogProperties props;
    private FreezeDetector detector;

    @BeforeEach
    void setUp() {
        sink = new CapturingRecordSink();
        props = new WatchdogProperties();
        detector = newDetector(clock);
    }

    @AfterEach
    void tearDown() {
        detector.stop();
    }

    private FreezeDetector newDetector(Clock c) {
        ApplicationEventPublisher publisher = published::add;
        return new FreezeDetector(props, sink, new EventRecorder(sink, c), NoopResourceProbe.INSTANCE,
                publisher, null, c);
    }

    @Test
    void rejectsTimeoutNotAboveHeartbeatInterval() {
        assertThatThrownBy(() -> detector.register("daq", 0.5))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("daq");
        assertThatThrownBy(() -> detector.register("daq", 0.2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void acceptsOneSecondTimeoutWithDefaultSettings() {
        detector.register("acq", 1.0);

        assertThat(detector.getStatus("acq")).get()
                .extracting(WatchdogStatus::timeoutSeconds).isEqualTo(1.0);
    }

    @Test
    void detectsFreezeOncePerEpisode() {
        detector.register("daq", 2.0);

        clock.advanceSeconds(2.0);
        detector.checkWatchdogs();
        assertThat(detector.isFrozen("daq")).isFalse();

        clock.advanceMillis(1);
        detector.checkWatchdogs();
        detector.checkWatchdogs();
        clock.advanceSeconds(10);
        detector.checkWatchdogs();

        assertThat(detector.isFrozen("daq")).isTrue();
        assertThat(detector.isHealthy()).isFalse();
        assertThat(detector.getStatistics().freezesDetected()).isEqualTo(1);
        assertThat(sink.records(LogCategory.ERRORS)).singleElement()
                .satisfies(r -> assertThat(r.severity()).isEqualTo(Severity.CRITICAL));
        assertThat(sink.events("freeze_detected")).hasSize(1);
        assertThat(published).filteredOn(ComponentFrozenEvent.class::isInstance).hasSize(1);
        assertThat(sink.artifacts()).hasSize(1);
        assertThat(sink.artifacts().keySet()).allMatch(name -> name.startsWith("freeze_dump_daq_"));
    }

    @Test
    void frozenEventDescribesTheEpisode() {
        detector.register("serial link", 2.0);
        clock.advanceSeconds(3);
        detector.checkWatchdogs();

        ComponentFrozenEvent event = (ComponentFrozenEvent) published.get(0);
        assertThat(event.component()).isEqualTo("serial link");
        assertThat(event.frozenFor()).isEqualTo(Duration.ofSeconds(3));
        assertThat(event.timeout()).isEqualTo(Duration.ofSeconds(2));
        assertThat(event.freezeCount()).isEqualTo(1);
        assertThat(sink.artifacts().keySet()).singleElement().asString().startsWith("freeze_dump_serial_link_");
    }

    @Test
    void heartbeatEndsFreezeExactlyOnce() {
        detector.register("daq", 2.0);
        clock.advanceSeconds(5);
        detector.checkWatchdogs();

        detector.heartbeat("daq");
        detector.heartbeat("daq");

        assertThat(detector.isFrozen("daq")).isFalse();
        assertThat(detector.isHealthy()).isTrue();
        assertThat(sink.events("freeze_recovered")).hasSize(1);
        assertThat(published).filteredOn(ComponentRecoveredEvent.class::isInstance).singleElement()
                .satisfies(e -> assertThat(((ComponentRecoveredEvent) e).frozenFor()).isEqualTo(Duration.ofSeconds(5)));
        assertThat(detector.getStatistics().recoveries()).isEqualTo(1);
        assertThat(detector.getStatistics().totalHeartbeats()).isEqualTo(2);
    }

    @Test
    void secondEpisodeIsDetectedAfterRecovery() {
        detector.register("daq", 2.0);
        clock.advanceSeconds(3);
        detector.checkWatchdogs();
        detector.heartbeat("daq");
        clock.advanceSeconds(3);
        detector.checkWatchdogs();

        assertThat(detector.getStatistics().freezesDetected()).isEqualTo(2);
        assertThat(detector.getStatus("daq")).get()
                .extracting(WatchdogStatus::freezeEpisodes).isEqualTo(2L);
    }

    @Test
    void regularHeartbeatsPreventFreeze() {
        detector.register("daq", 2.0);
        for (int i = 0; i < 10; i++) {
            clock.advanceSeconds(1.5);
            detector.heartbeat("daq");
            detector.checkWatchdogs();
        }

        assertThat(detector.getStatistics().freezesDetected()).isZero();
        assertThat(published).isEmpty();
    }

    @Test
    void invokesComponentAndGlobalCallbacksEvenIfOneFails() {
        AtomicInteger componentCalls = new AtomicInteger();
        AtomicInteger globalCalls = new AtomicInteger();
        detector.register("daq", 2.0, e -> {
            componentCalls.incrementAndGet();
            throw new IllegalStateException("restart failed");
        });
        detector.registerFreezeCallback(e -> globalCalls.incrementAndGet());

        clock.advanceSeconds(3);
        detector.checkWatchdogs();

        assertThat(componentCalls).hasValue(1);
        assertThat(globalCalls).hasValue(1);
        assertThat(sink.artifacts()).hasSize(1);
    }

    @Test
    void inactiveWatchdogIsNotChecked() {
        detector.register("daq", 2.0);
        assertThat(detector.setActive("daq", false)).isTrue();

        clock.advanceSeconds(60);
        detector.checkWatchdogs();
        assertThat(detector.isFrozen("daq")).isFalse();

        detector.setActive("daq", true);
        clock.advanceSeconds(1);
        detector.checkWatchdogs();
        assertThat(detector.isFrozen("daq")).isFalse();
        assertThat(detector.setActive("unknown", true)).isFalse();
    }

    @Test
    void unregisteredComponentsAreIgnored() {
        detector.register("daq", 2.0);
        assertThat(detector.unregister("daq")).isTrue();

        clock.advanceSeconds(10);
        detector.checkWatchdogs();
        detector.heartbeat("daq");

        assertThat(published).isEmpty();
        assertThat(detector.getStatistics().totalHeartbeats()).isZero();
        assertThat(detector.getStatus("daq")).isEmpty();
    }

    @Test
    void dumpIncludesRecentOperations() {
        props.setDiagnosticOperationCount(2);
        FreezeDetector limited = newDetector(clock);
        limited.register("daq", 2.0);
        for (int i = 0; i < 5; i++) {
            limited.logOperation("read_frame", Map.of("n", i));
        }

        clock.advanceSeconds(3);
        limited.checkWatchdogs();

        JSONObject dump = new JSONObject(sink.artifacts().values().iterator().next());
        assertThat(dump.getString("component")).isEqualTo("daq");
        assertThat(dump.getLong("frozen_for_ms")).isEqualTo(3000);
        assertThat(dump.getJSONArray("recent_operations").length()).isEqualTo(2);
        assertThat(dump.getJSONArray("recent_operations").getJSONObject(1)
                .getJSONObject("details").getInt("n")).isEqualTo(4);
        assertThat(dump.getJSONArray("threads").length()).isPositive();
    }

    @Test
    void operationHistoryIsBounded() {
        props.setOperationHistorySize(3);
        FreezeDetector small = newDetector(clock);
        for (int i = 0; i < 10; i++) {
            small.logOperation("op" + i, null);
        }

        assertThat(small.getRecentOperations(100)).extracting(OperationRecord::operation)
                .containsExactly("op7", "op8", "op9");
    }

    @Test
    void overloadedSinkStillRunsCallbacks() {
        AtomicInteger calls = new AtomicInteger();
        detector.register("daq", 2.0, e -> calls.incrementAndGet());
        sink.setOverloaded(true);

        clock.advanceSeconds(3);
        detector.checkWatchdogs();

        assertThat(calls).hasValue(1);
        assertThat(detector.isFrozen("daq")).isTrue();
    }

    @Test
    void pollLoopDetectsFreezeInRealTime() {
        props.setMinHeartbeatIntervalSeconds(0.05);
        props.setPollIntervalMs(20);
        FreezeDetector live = newDetector(Clock.systemUTC());
        live.register("daq", 0.2);
        try {
            live.start();
            assertThat(live.isRunning()).isTrue();

            await().atMost(Duration.ofSeconds(5)).until(() -> live.isFrozen("daq"));
        } finally {
            live.stop();
        }
        assertThat(live.isRunning()).isFalse();
        assertThat(live.getStatistics().freezesDetected()).isEqualTo(1);
    }

    @Test
    void silentComponentRaisesSingleAlertAcrossManyPollsThenRecoversOnce() throws InterruptedException {
        props.setPollIntervalMs(100);
        FreezeDetector live = newDetector(Clock.systemUTC());
        live.register("acq", 1.0);
        live.heartbeat("acq");
        try {
            live.start();

            await().atMost(Duration.ofSeconds(5)).until(() -> live.isFrozen("acq"));
            // Stay frozen for many more poll ticks
            Thread.sleep(1000);

            assertThat(live.getStatistics().freezesDetected()).isEqualTo(1);
            assertThat(sink.events("freeze_detected")).hasSize(1);
            assertThat(published).filteredOn(ComponentFrozenEvent.class::isInstance).hasSize(1);

            live.heartbeat("acq");
            Thread.sleep(300);
        } finally {
            live.stop();
        }
        assertThat(live.isFrozen("acq")).isFalse();
        assertThat(sink.events("freeze_recovered")).hasSize(1);
        assertThat(live.getStatistics().recoveries()).isEqualTo(1);
        assertThat(live.getStatistics().freezesDetected()).isEqualTo(1);
    }

    @Test
    void closedRouterDoesNotStopFreezeHandling() {
        AtomicInteger calls = new AtomicInteger();
        detector.register("daq", 2.0, e -> calls.incrementAndGet());
        sink.close();

        clock.advanceSeconds(3);
        detector.checkWatchdogs();
        detector.heartbeat("daq");

        assertThat(calls).hasValue(1);
        assertThat(detector.getStatistics().freezesDetected()).isEqualTo(1);
        assertThat(detector.getStatistics().recoveries()).isEqualTo(1);
        assertThat(detector.isFrozen("daq")).isFalse();
    }
}
