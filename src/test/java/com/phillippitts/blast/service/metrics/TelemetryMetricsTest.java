package com.phillippitts.blast.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class TelemetryMetricsTest {

    private MeterRegistry registry;
    private TelemetryMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TelemetryMetrics(registry);
    }

    @Test
    void shouldRecordOperationTimingsPerOperation() {
        metrics.recordOperation("parse_frame", TimeUnit.MILLISECONDS.toNanos(2));
        metrics.recordOperation("parse_frame", TimeUnit.MILLISECONDS.toNanos(4));
        metrics.recordOperation("write_csv", TimeUnit.MILLISECONDS.toNanos(10));

        Timer parse = registry.find("blast.telemetry.operation").tag("operation", "parse_frame").timer();
        Timer write = registry.find("blast.telemetry.operation").tag("operation", "write_csv").timer();

        assertThat(parse).isNotNull();
        assertThat(parse.count()).isEqualTo(2);
        assertThat(parse.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(6);
        assertThat(write).isNotNull();
        assertThat(write.count()).isEqualTo(1);
    }

    @Test
    void shouldCountFreezeTransitionsPerComponent() {
        metrics.incrementFreeze("data_acquisition");
        metrics.incrementFreeze("data_acquisition");
        metrics.incrementFreezeRecovery("data_acquisition");

        assertThat(registry.find("blast.telemetry.freeze").tag("component", "data_acquisition").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find("blast.telemetry.freeze.recovered").tag("component", "data_acquisition")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    void shouldTagRecoveryOutcomes() {
        metrics.incrementRecovery("timeout", "success");
        metrics.incrementRecovery("timeout", "failure");
        metrics.incrementRecovery("timeout", "failure");

        Counter failures = registry.find("blast.telemetry.recovery")
                .tag("category", "timeout")
                .tag("outcome", "failure")
                .counter();

        assertThat(failures).isNotNull();
        assertThat(failures.count()).isEqualTo(2.0);
        assertThat(registry.find("blast.telemetry.recovery").tag("outcome", "short_circuit").counter()).isNull();
    }

    @Test
    void shouldCountEscalationsCircuitsAndRejections() {
        metrics.incrementEscalation("connection_loss");
        metrics.incrementCircuitOpen("generic");
        metrics.incrementLogRejected("events");
        metrics.incrementLogRejected("events");

        assertThat(registry.find("blast.telemetry.recovery.escalation").tag("category", "connection_loss")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("blast.telemetry.circuit.opened").tag("category", "generic")
                .counter().count()).isEqualTo(1.0);
        assertThat(registry.find("blast.telemetry.log.rejected").tag("category", "events")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    void publisherForwardsToMetrics() {
        TelemetryMetricsPublisher publisher = new TelemetryMetricsPublisher(metrics);

        publisher.recordRecovery("network", "success");
        publisher.recordFreeze("serial_communication");

        assertThat(publisher.isEnabled()).isTrue();
        assertThat(registry.find("blast.telemetry.recovery").tag("category", "network").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("blast.telemetry.freeze").counter().count()).isEqualTo(1.0);
    }

    @Test
    void noopPublisherIsDisabledAndSilent() {
        TelemetryMetricsPublisher noop = TelemetryMetricsPublisher.NOOP;

        noop.recordOperation("x", 1);
        noop.recordFreeze("x");
        noop.recordFreezeRecovery("x");
        noop.recordRecovery("x", "success");
        noop.recordEscalation("x");
        noop.recordCircuitOpen("x");
        noop.recordLogRejected("x");

        assertThat(noop.isEnabled()).isFalse();
        assertThat(new TelemetryMetricsPublisher(null).isEnabled()).isFalse();
    }
}
