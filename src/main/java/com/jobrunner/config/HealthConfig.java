package com.jobrunner.config;

import com.jobrunner.exception.ConfigurationException;

/**
 * Health monitoring and adaptive concurrency configuration.
 *
 * @param memoryLimitMb            Runtime heap ceiling; exceeding it triggers graceful shutdown
 * @param memoryCheckIntervalMs    Memory watchdog period
 * @param healthCheckIntervalMs    Load/memory sampling period for the concurrency ceiling
 * @param maxCpuLoad               Normalized load average above which the system is stressed
 * @param maxMemoryPercent         Heap fraction above which the system is stressed
 * @param initialConcurrency       Starting ceiling
 * @param minConcurrency           Ceiling never shrinks below this
 * @param maxConcurrency           Ceiling never grows above this
 * @param shrinkFactor             Multiplier applied when stressed
 * @param growStep                 Increment applied when healthy and busy
 * @param adaptive                 Whether health samples move the ceiling at all
 */
public record HealthConfig(
        int memoryLimitMb,
        long memoryCheckIntervalMs,
        long healthCheckIntervalMs,
        double maxCpuLoad,
        double maxMemoryPercent,
        int initialConcurrency,
        int minConcurrency,
        int maxConcurrency,
        double shrinkFactor,
        int growStep,
        boolean adaptive
) {
    public static HealthConfig defaults() {
        return new HealthConfig(512, 5_000, 30_000, 0.7, 0.75, 10, 3, 20, 0.7, 1, true);
    }

    public void validate() {
        if (memoryLimitMb <= 0) {
            throw new ConfigurationException("memory-limit-mb must be positive");
        }
        if (memoryCheckIntervalMs <= 0 || healthCheckIntervalMs <= 0) {
            throw new ConfigurationException("Health check intervals must be positive");
        }
        if (minConcurrency < 1 || minConcurrency > maxConcurrency) {
            throw new ConfigurationException("Concurrency bounds invalid: min=" + minConcurrency
                    + ", max=" + maxConcurrency);
        }
        if (initialConcurrency < minConcurrency || initialConcurrency > maxConcurrency) {
            throw new ConfigurationException("initial-concurrency " + initialConcurrency
                    + " outside [" + minConcurrency + ", " + maxConcurrency + "]");
        }
        if (shrinkFactor <= 0 || shrinkFactor >= 1) {
            throw new ConfigurationException("shrink-factor must be in (0, 1)");
        }
        if (growStep < 1) {
            throw new ConfigurationException("grow-step must be at least 1");
        }
    }
}
