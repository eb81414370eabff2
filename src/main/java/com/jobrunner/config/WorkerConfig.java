package com.jobrunner.config;

/**
 * Queue worker configuration.
 *
 * @param pollIntervalMs   Delay before polling again when the source was empty
 * @param rejectBackoffMs  Delay before polling again after admission control refused a job
 * @param maxJobs          Stop after this many processed jobs (0 = unlimited)
 * @param maxTimeSeconds   Stop after running this long (0 = unlimited)
 */
public record WorkerConfig(long pollIntervalMs, long rejectBackoffMs, int maxJobs, long maxTimeSeconds) {

    public static WorkerConfig defaults() {
        return new WorkerConfig(100, 1_000, 0, 0);
    }
}
