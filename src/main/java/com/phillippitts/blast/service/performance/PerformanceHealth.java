package com.phillippitts.blast.service.performance;

import java.util.List;

/**
 * Result of {@link PerformanceMonitor#checkHealth()}.
 */
public record PerformanceHealth(boolean healthy,
                                double memoryMb,
                                double cpuPercent,
                                int threadCount,
                                int activeOperations,
                                int metricsTracked,
                                long slowOperations,
                                double averageDataLagMs,
                                List<String> issues) {
}
