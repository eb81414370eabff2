package com.jobrunner.runtime;

import com.jobrunner.core.ExecutionTier;

import java.util.Map;

/**
 * Point-in-time runtime statistics.
 *
 * @param processedJobs      Jobs that completed successfully
 * @param failedJobs         Jobs that failed or timed out
 * @param rejectedJobs       Jobs refused by validation or admission
 * @param runningJobs        Jobs in flight
 * @param concurrencyCeiling Current adaptive ceiling
 * @param heapUsedMb         Heap in use
 * @param selections         Strategy selections per tier
 * @param lastHealth         Most recent health sample, null before the first one
 * @param shuttingDown       Whether shutdown has begun
 */
public record RuntimeStats(
        long processedJobs,
        long failedJobs,
        long rejectedJobs,
        int runningJobs,
        int concurrencyCeiling,
        double heapUsedMb,
        Map<ExecutionTier, Long> selections,
        HealthSample lastHealth,
        boolean shuttingDown
) {
    public RuntimeStats {
        selections = Map.copyOf(selections);
    }
}
