package com.phillippitts.blast.config.telemetry;

import com.phillippitts.blast.config.properties.LogRouterProperties;
import com.phillippitts.blast.config.properties.PerformanceProperties;
import com.phillippitts.blast.config.properties.RecoveryProperties;
import com.phillippitts.blast.config.properties.SerialLoggerProperties;
import com.phillippitts.blast.config.properties.WatchdogProperties;
import com.phillippitts.blast.service.data.DataRecorder;
import com.phillippitts.blast.service.events.EventRecorder;
import com.phillippitts.blast.service.metrics.TelemetryMetrics;
import com.phillippitts.blast.service.metrics.TelemetryMetricsPublisher;
import com.phillippitts.blast.service.performance.PerformanceMonitor;
import com.phillippitts.blast.service.performance.ResourceProbe;
import com.phillippitts.blast.service.recovery.EscalationHook;
import com.phillippitts.blast.service.recovery.ErrorRecoveryEngine;
import com.phillippitts.blast.service.recovery.RecoveryEscalatedEvent;
import com.phillippitts.blast.service.recovery.Sleeper;
import com.phillippitts.blast.service.recovery.strategy.RecoveryActions;
import com.phillippitts.blast.service.router.LogRouter;
import com.phillippitts.blast.service.serial.CommunicationLogger;
import com.phillippitts.blast.service.watchdog.FreezeDetector;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Map;

/**
 * Wires the telemetry components explicitly so every one of them shares the same log
 * router, clock and metrics publisher.
 */
@Configuration
public class TelemetryConfig {

    private static final Logger LOG = LogManager.getLogger(TelemetryConfig.class);

    private final ApplicationEventPublisher publisher;

    public TelemetryConfig(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock telemetryClock() {
        return Clock.systemUTC();
    }

    /**
     * Metrics publisher; falls back to the no-op publisher when no registry is present.
     */
    @Bean
    public TelemetryMetricsPublisher telemetryMetricsPublisher(ObjectProvider<MeterRegistry> registry) {
        MeterRegistry meterRegistry = registry.getIfAvailable();
        if (meterRegistry == null) {
            LOG.info("No MeterRegistry available; telemetry metrics disabled");
            return TelemetryMetricsPublisher.NOOP;
        }
        return new TelemetryMetricsPublisher(new TelemetryMetrics(meterRegistry));
    }

    @Bean
    public ResourceProbe resourceProbe(PerformanceProperties properties) {
        return ResourceProbe.select(properties.isResourceSamplingEnabled());
    }

    // TelemetryLifecycle starts it; shutdown() is also the inferred destroy method.
    @Bean
    public LogRouter logRouter(LogRouterProperties properties, Clock clock,
                               TelemetryMetricsPublisher metrics) {
        return new LogRouter(properties, clock, metrics);
    }

    @Bean
    public EventRecorder eventRecorder(LogRouter router, Clock clock) {
        return new EventRecorder(router, clock);
    }

    @Bean
    public DataRecorder dataRecorder(LogRouter router, Clock clock) {
        return new DataRecorder(router, clock);
    }

    @Bean
    public PerformanceMonitor performanceMonitor(PerformanceProperties properties, LogRouter router,
                                                 ResourceProbe probe, TelemetryMetricsPublisher metrics,
                                                 Clock clock) {
        return new PerformanceMonitor(properties, router, probe, metrics, clock);
    }

    @Bean
    public CommunicationLogger communicationLogger(SerialLoggerProperties properties, LogRouter router,
                                                   Clock clock) {
        return new CommunicationLogger(properties, router, clock);
    }

    /**
     * Freeze detector with the watchdogs declared under {@code telemetry.watchdog.components}.
     */
    @Bean
    public FreezeDetector freezeDetector(WatchdogProperties properties, LogRouter router,
                                         EventRecorder events, ResourceProbe probe,
                                         TelemetryMetricsPublisher metrics, Clock clock) {
        FreezeDetector detector = new FreezeDetector(properties, router, events, probe,
                publisher, metrics, clock);
        for (Map.Entry<String, Double> component : properties.getComponents().entrySet()) {
            detector.register(component.getKey(), component.getValue());
        }
        return detector;
    }

    /**
     * Recovery engine with one action per error category. Escalations are published as
     * {@link RecoveryEscalatedEvent} for whichever operator-facing listener is present.
     */
    @Bean
    public ErrorRecoveryEngine errorRecoveryEngine(RecoveryProperties properties, LogRouter router,
                                                   EventRecorder events, TelemetryMetricsPublisher metrics,
                                                   Clock clock) {
        EscalationHook escalation = (category, message) ->
                publisher.publishEvent(new RecoveryEscalatedEvent(category, message, clock.instant()));
        return new ErrorRecoveryEngine(properties,
                RecoveryActions.defaults(properties, events, escalation),
                router, events, metrics, Sleeper.SYSTEM, null, clock);
    }
}
