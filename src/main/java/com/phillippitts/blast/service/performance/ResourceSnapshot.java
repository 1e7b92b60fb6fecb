package com.phillippitts.blast.service.performance;

/**
 * Process resource usage at one instant.
 *
 * @param memoryMb used JVM memory (heap and non-heap) in megabytes
 * @param cpuPercent process CPU load in percent, negative when unknown
 * @param threadCount live thread count
 */
public record ResourceSnapshot(double memoryMb, double cpuPercent, int threadCount) {

    public static final ResourceSnapshot UNAVAILABLE = new ResourceSnapshot(0, -1, 0);
}
