package com.jobrunner.config;

/**
 * Graceful shutdown configuration.
 *
 * @param drainTimeoutMs       Longest wait for in-flight jobs before forcing the loop down
 * @param drainCheckIntervalMs How often outstanding jobs are re-checked while draining
 */
public record ShutdownConfig(long drainTimeoutMs, long drainCheckIntervalMs) {

    public static ShutdownConfig defaults() {
        return new ShutdownConfig(30_000, 1_000);
    }
}
