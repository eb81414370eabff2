package com.jobrunner.runtime;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.OperatingSystemMXBean;

/**
 * Reads load average and heap usage from the platform MXBeans.
 */
public class JvmHealthProbe implements HealthProbe {

    private final OperatingSystemMXBean os = ManagementFactory.getOperatingSystemMXBean();
    private final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();

    @Override
    public double cpuLoad() {
        double loadAverage = os.getSystemLoadAverage();
        if (loadAverage < 0) {
            return 0.0;
        }
        return loadAverage / Math.max(1, os.getAvailableProcessors());
    }

    @Override
    public long heapUsedBytes() {
        return memory.getHeapMemoryUsage().getUsed();
    }
}
