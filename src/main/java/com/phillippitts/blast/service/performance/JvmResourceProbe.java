package com.phillippitts.blast.service.performance;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;
import java.lang.management.ThreadMXBean;

/**
 * Reads memory, CPU and thread usage from the platform MXBeans.
 * CPU load is only available on JVMs exposing {@code com.sun.management.OperatingSystemMXBean}.
 */
final class JvmResourceProbe implements ResourceProbe {

    private static final double BYTES_PER_MB = 1024d * 1024d;

    private final MemoryMXBean memory;
    private final ThreadMXBean threads;
    private final OperatingSystemMXBean os;

    JvmResourceProbe() {
        this.memory = ManagementFactory.getMemoryMXBean();
        this.threads = ManagementFactory.getThreadMXBean();
        this.os = ManagementFactory.getOperatingSystemMXBean();
    }

    @Override
    public ResourceSnapshot sample() {
        long usedBytes = memory.getHeapMemoryUsage().getUsed() + memory.getNonHeapMemoryUsage().getUsed();
        return new ResourceSnapshot(usedBytes / BYTES_PER_MB, cpuPercent(), threads.getThreadCount());
    }

    private double cpuPercent() {
        if (os instanceof com.sun.management.OperatingSystemMXBean sunOs) {
            double load = sunOs.getProcessCpuLoad();
            return load < 0 ? -1 : load * 100d;
        }
        return -1;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
