package com.phillippitts.blast.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for protocol-level serial communication logging.
 */
@ConfigurationProperties(prefix = "telemetry.serial")
@Validated
public class SerialLoggerProperties {

    /** Entries kept per direction for statistics and dumps. */
    @Positive(message = "Buffer size must be positive")
    private int bufferSize = 1000;

    /** Hex characters kept in each summary line. */
    @Positive(message = "Summary hex limit must be positive")
    private int summaryHexLimit = 100;

    /** Printable characters kept in each summary line. */
    @Positive(message = "Summary ASCII limit must be positive")
    private int summaryAsciiLimit = 50;

    public int getBufferSize() {
        return bufferSize;
    }

    public void setBufferSize(int bufferSize) {
        this.bufferSize = bufferSize;
    }

    public int getSummaryHexLimit() {
        return summaryHexLimit;
    }

    public void setSummaryHexLimit(int summaryHexLimit) {
        this.summaryHexLimit = summaryHexLimit;
    }

    public int getSummaryAsciiLimit() {
        return summaryAsciiLimit;
    }

    public void setSummaryAsciiLimit(int summaryAsciiLimit) {
        this.summaryAsciiLimit = summaryAsciiLimit;
    }
}
