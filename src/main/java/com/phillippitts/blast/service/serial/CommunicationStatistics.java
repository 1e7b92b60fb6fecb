package com.phillippitts.blast.service.serial;

/**
 * Serial link counters and derived rates.
 *
 * <p>{@code errorRate} is protocol errors (JSON parse, malformed, checksum) divided by
 * received messages, 0 when nothing was received. Round-trip figures cover the buffered
 * RX window and are 0 when no sample exists.
 */
public record CommunicationStatistics(long totalSent,
                                      long totalReceived,
                                      long timeouts,
                                      long jsonParseErrors,
                                      long malformedMessages,
                                      long checksumErrors,
                                      long reconnectAttempts,
                                      long reconnectSuccesses,
                                      double errorRate,
                                      int roundTripSamples,
                                      double minRoundTripMs,
                                      double avgRoundTripMs,
                                      double maxRoundTripMs) {

    public long errorCount() {
        return jsonParseErrors + malformedMessages + checksumErrors;
    }
}
