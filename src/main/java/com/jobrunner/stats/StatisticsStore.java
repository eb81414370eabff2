package com.jobrunner.stats;

import com.jobrunner.analysis.JobStatistics;

import java.time.Duration;
import java.util.Optional;

/**
 * Key to statistics mapping with per-entry expiry.
 * Updates are get-then-put; implementations need not offer atomic increments.
 */
public interface StatisticsStore {

    /**
     * Live entry for the key, empty when absent or expired.
     */
    Optional<JobStatistics> get(String key);

    /**
     * Store an entry that expires after the given time to live.
     */
    void put(String key, JobStatistics value, Duration ttl);

    /**
     * Remove an entry. Unknown keys are ignored.
     */
    void forget(String key);
}
