package com.jobrunner.runtime;

/**
 * Source of host health readings.
 */
public interface HealthProbe {

    /**
     * Normalized CPU load; 1.0 means every core busy. Zero when unavailable.
     */
    double cpuLoad();

    /**
     * Heap currently in use, in bytes.
     */
    long heapUsedBytes();
}
