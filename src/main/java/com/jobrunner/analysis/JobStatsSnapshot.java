package com.jobrunner.analysis;

import com.jobrunner.core.ExecutionTier;

/**
 * Read-only view of a job type's statistics.
 *
 * @param type                   Job type
 * @param executions             Recorded executions
 * @param averageDurationSeconds Mean wall-clock duration
 * @param failureRate            Failed executions / executions
 * @param recommendedTier        Tier history suggests, POOLED while history is too thin
 */
public record JobStatsSnapshot(
        String type,
        long executions,
        double averageDurationSeconds,
        double failureRate,
        ExecutionTier recommendedTier
) {}
