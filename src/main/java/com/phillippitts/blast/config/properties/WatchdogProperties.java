package com.phillippitts.blast.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the freeze detector (heartbeat watchdogs).
 */
@ConfigurationProperties(prefix = "telemetry.watchdog")
@Validated
public class WatchdogProperties {

    /** Poll loop period. */
    @Positive(message = "Poll interval must be positive")
    private long pollIntervalMs = 500;

    /** Expected heartbeat interval; every watchdog timeout must exceed it. */
    @Positive(message = "Minimum heartbeat interval must be positive")
    private double minHeartbeatIntervalSeconds = 0.5;

    /** Operations kept for freeze diagnostics. */
    @Positive(message = "Operation history size must be positive")
    private int operationHistorySize = 100;

    /** Most recent operations written into a freeze dump. */
    @Positive(message = "Diagnostic operation count must be positive")
    private int diagnosticOperationCount = 50;

    /** Stack frames captured per thread in a freeze dump. */
    @Positive(message = "Max stack depth must be positive")
    private int maxStackDepth = 8;

    /** Bounded wait for the poll loop to stop. */
    @Positive(message = "Stop timeout must be positive")
    private long stopTimeoutMs = 2000;

    /** Watchdogs registered at startup: component name to timeout in seconds. */
    @NotNull
    private Map<String, Double> components = defaultComponents();

    private static Map<String, Double> defaultComponents() {
        Map<String, Double> defaults = new LinkedHashMap<>();
        defaults.put("data_acquisition", 10.0);
        defaults.put("serial_communication", 15.0);
        return defaults;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public void setPollIntervalMs(long pollIntervalMs) {
        this.pollIntervalMs = pollIntervalMs;
    }

    public double getMinHeartbeatIntervalSeconds() {
        return minHeartbeatIntervalSeconds;
    }

    public void setMinHeartbeatIntervalSeconds(double minHeartbeatIntervalSeconds) {
        this.minHeartbeatIntervalSeconds = minHeartbeatIntervalSeconds;
    }

    public int getOperationHistorySize() {
        return operationHistorySize;
    }

    public void setOperationHistorySize(int operationHistorySize) {
        this.operationHistorySize = operationHistorySize;
    }

    public int getDiagnosticOperationCount() {
        return diagnosticOperationCount;
    }

    public void setDiagnosticOperationCount(int diagnosticOperationCount) {
        this.diagnosticOperationCount = diagnosticOperationCount;
    }

    public int getMaxStackDepth() {
        return maxStackDepth;
    }

    public void setMaxStackDepth(int maxStackDepth) {
        this.maxStackDepth = maxStackDepth;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }

    public Map<String, Double> getComponents() {
        return components;
    }

    public void setComponents(Map<String, Double> components) {
        this.components = components;
    }
}
