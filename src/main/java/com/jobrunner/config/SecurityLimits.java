package com.jobrunner.config;

import com.jobrunner.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Server-side limits. Jobs cannot exceed these regardless of what they request.
 * Immutable: changing them requires a restart.
 *
 * @param maxTimeoutSeconds  Maximum job timeout in seconds
 * @param maxMemoryMb        Maximum job memory in MB
 * @param maxConcurrentJobs  Absolute upper bound on in-flight jobs
 * @param maxJobsPerMinute   Dispatches allowed in any trailing 60 second window
 * @param allowedJobPaths    Directories job code must live under for isolated execution (empty = allow all)
 * @param isolatedByDefault  Isolated strategy also accepts jobs without an isolation hint
 * @param strictMode         Require a non-empty allow-list
 */
public record SecurityLimits(
        int maxTimeoutSeconds,
        int maxMemoryMb,
        int maxConcurrentJobs,
        int maxJobsPerMinute,
        List<String> allowedJobPaths,
        boolean isolatedByDefault,
        boolean strictMode
) {
    public static final int MIN_PRIORITY = -100;
    public static final int MAX_PRIORITY = 100;

    public SecurityLimits {
        allowedJobPaths = allowedJobPaths == null ? List.of() : List.copyOf(allowedJobPaths);
    }

    public static SecurityLimits defaults() {
        return new SecurityLimits(300, 512, 100, 1000, List.of(), true, false);
    }

    /**
     * Production preset. Callers still need to supply allowed job paths.
     */
    public static SecurityLimits production(List<String> allowedJobPaths) {
        return new SecurityLimits(300, 256, 50, 500, allowedJobPaths, true, true);
    }

    /**
     * Permissive preset for local development.
     */
    public static SecurityLimits development() {
        return new SecurityLimits(600, 1024, 200, 5000, List.of(), true, false);
    }

    public SecurityLimits withAllowedJobPaths(List<String> paths) {
        return new SecurityLimits(maxTimeoutSeconds, maxMemoryMb, maxConcurrentJobs,
                maxJobsPerMinute, paths, isolatedByDefault, strictMode);
    }

    /**
     * Fail fast on nonsensical limits.
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (maxTimeoutSeconds <= 0) {
            errors.add("max-timeout-seconds must be positive");
        }
        if (maxMemoryMb <= 0) {
            errors.add("max-memory-mb must be positive");
        }
        if (maxConcurrentJobs <= 0) {
            errors.add("max-concurrent-jobs must be positive");
        }
        if (maxJobsPerMinute <= 0) {
            errors.add("max-jobs-per-minute must be positive");
        }
        if (strictMode && allowedJobPaths.isEmpty()) {
            errors.add("strict mode requires allowed-job-paths to be configured");
        }
        if (!errors.isEmpty()) {
            throw new ConfigurationException("Invalid security limits: " + String.join(", ", errors));
        }
    }
}
