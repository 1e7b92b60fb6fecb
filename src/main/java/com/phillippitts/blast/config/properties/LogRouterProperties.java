package com.phillippitts.blast.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the log router and its per-run category streams.
 */
@ConfigurationProperties(prefix = "telemetry.router")
@Validated
public class LogRouterProperties {

    /** Base directory under which one run directory is created per process start. */
    @NotBlank(message = "Log base directory must not be blank")
    private String baseDir = "logs";

    /** Bounded queue capacity between producers and the writer thread. */
    @Positive(message = "Queue capacity must be positive")
    private int queueCapacity = 10_000;

    /** Bounded join timeout for the writer thread at shutdown. */
    @Positive(message = "Shutdown timeout must be positive")
    private long shutdownTimeoutMs = 2000;

    /** Rotation size per category file. */
    @Positive(message = "Max file size must be positive")
    private long maxFileSizeBytes = 100L * 1024 * 1024;

    /** Rotated backups kept per category file. */
    @Min(value = 0, message = "Backup count must be >= 0")
    private int backupCount = 7;

    /** Runs whose newest file is older than this many days are removed at start; 0 keeps every run. */
    @Min(value = 0, message = "Retention days must be >= 0")
    private int retentionDays = 30;

    public String getBaseDir() {
        return baseDir;
    }

    public void setBaseDir(String baseDir) {
        this.baseDir = baseDir;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public int getBackupCount() {
        return backupCount;
    }

    public void setBackupCount(int backupCount) {
        this.backupCount = backupCount;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }
}
