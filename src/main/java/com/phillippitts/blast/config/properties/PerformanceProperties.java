package com.phillippitts.blast.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the performance monitor and its resource sampler.
 */
@ConfigurationProperties(prefix = "telemetry.performance")
@Validated
public class PerformanceProperties {

    /** Resource sampling period. */
    @Positive(message = "Sample interval must be positive")
    private double sampleIntervalSeconds = 1.0;

    /** Aggregation window; a metrics snapshot is flushed once per window. */
    @Positive(message = "Log interval must be positive")
    private double logIntervalSeconds = 60.0;

    /** Operations slower than this are logged as warnings. */
    @Positive(message = "Slow operation threshold must be positive")
    private long slowOperationThresholdMs = 500;

    /** Memory usage above this ceiling is logged as a warning and reported unhealthy. */
    @Positive(message = "Memory ceiling must be positive")
    private double memoryCeilingMb = 500;

    /** Live thread count above this is reported unhealthy. */
    @Positive(message = "Max thread count must be positive")
    private int maxThreadCount = 200;

    /** Acquisition lag at or above this is logged as a warning; the recent average above it is unhealthy. */
    @Positive(message = "Data lag warning threshold must be positive")
    private double dataLagWarningMs = 1000.0;

    /** Acquisition lag at or above this is logged as critical. */
    @Positive(message = "Data lag critical threshold must be positive")
    private double dataLagCriticalMs = 5000.0;

    /** When false the no-op resource probe is used and no sampler thread is started. */
    private boolean resourceSamplingEnabled = true;

    /** Bounded wait for the sampler to stop. */
    @Positive(message = "Stop timeout must be positive")
    private long stopTimeoutMs = 2000;

    public double getSampleIntervalSeconds() {
        return sampleIntervalSeconds;
    }

    public void setSampleIntervalSeconds(double sampleIntervalSeconds) {
        this.sampleIntervalSeconds = sampleIntervalSeconds;
    }

    public double getLogIntervalSeconds() {
        return logIntervalSeconds;
    }

    public void setLogIntervalSeconds(double logIntervalSeconds) {
        this.logIntervalSeconds = logIntervalSeconds;
    }

    public long getSlowOperationThresholdMs() {
        return slowOperationThresholdMs;
    }

    public void setSlowOperationThresholdMs(long slowOperationThresholdMs) {
        this.slowOperationThresholdMs = slowOperationThresholdMs;
    }

    public double getMemoryCeilingMb() {
        return memoryCeilingMb;
    }

    public void setMemoryCeilingMb(double memoryCeilingMb) {
        this.memoryCeilingMb = memoryCeilingMb;
    }

    public int getMaxThreadCount() {
        return maxThreadCount;
    }

    public void setMaxThreadCount(int maxThreadCount) {
        this.maxThreadCount = maxThreadCount;
    }

    public double getDataLagWarningMs() {
        return dataLagWarningMs;
    }

    public void setDataLagWarningMs(double dataLagWarningMs) {
        this.dataLagWarningMs = dataLagWarningMs;
    }

    public double getDataLagCriticalMs() {
        return dataLagCriticalMs;
    }

    public void setDataLagCriticalMs(double dataLagCriticalMs) {
        this.dataLagCriticalMs = dataLagCriticalMs;
    }

    public boolean isResourceSamplingEnabled() {
        return resourceSamplingEnabled;
    }

    public void setResourceSamplingEnabled(boolean resourceSamplingEnabled) {
        this.resourceSamplingEnabled = resourceSamplingEnabled;
    }

    public long getStopTimeoutMs() {
        return stopTimeoutMs;
    }

    public void setStopTimeoutMs(long stopTimeoutMs) {
        this.stopTimeoutMs = stopTimeoutMs;
    }
}
