package com.jobrunner.runtime;

/**
 * One health measurement.
 *
 * @param timestampMs   When it was taken
 * @param cpuLoad       One-minute load average divided by available processors
 * @param memoryPercent Heap in use as a fraction of the runtime memory limit
 * @param heapUsedMb    Heap in use
 * @param runningJobs   In-flight jobs at sampling time
 */
public record HealthSample(
        long timestampMs,
        double cpuLoad,
        double memoryPercent,
        double heapUsedMb,
        int runningJobs
) {}
