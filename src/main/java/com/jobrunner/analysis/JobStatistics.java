package com.jobrunner.analysis;

/**
 * Accumulated execution history of one job type.
 * Counts and cumulative duration only grow until the entry is cleared or expires.
 *
 * @param executions           Number of recorded executions
 * @param totalDurationSeconds Sum of wall-clock durations
 * @param failures             Executions that failed
 * @param lastUpdatedEpochMs   When the entry was last written
 */
public record JobStatistics(
        long executions,
        double totalDurationSeconds,
        long failures,
        long lastUpdatedEpochMs
) {
    public static JobStatistics empty() {
        return new JobStatistics(0, 0.0, 0, System.currentTimeMillis());
    }

    /**
     * Copy with one more execution folded in.
     */
    public JobStatistics record(double durationSeconds, boolean success) {
        return new JobStatistics(
                executions + 1,
                totalDurationSeconds + Math.max(0.0, durationSeconds),
                success ? failures : failures + 1,
                System.currentTimeMillis());
    }

    public double averageDurationSeconds() {
        return executions == 0 ? 0.0 : totalDurationSeconds / executions;
    }

    public double failureRate() {
        return executions == 0 ? 0.0 : (double) failures / executions;
    }
}
