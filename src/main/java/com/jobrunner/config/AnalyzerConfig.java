package com.jobrunner.config;

import com.jobrunner.exception.ConfigurationException;

import java.util.List;

/**
 * Job analyzer configuration.
 *
 * @param inlineThresholdSeconds Durations up to this run inline
 * @param pooledThresholdSeconds Durations up to this run pooled; longer ones isolated
 * @param minExecutions          Recorded executions needed before history is trusted
 * @param statsTtlSeconds        Expiry of per-type statistics
 * @param sourceRoots            Directories searched for job source files
 * @param extraPatterns          Patterns added to the built-in blocking catalogue
 */
public record AnalyzerConfig(
        double inlineThresholdSeconds,
        double pooledThresholdSeconds,
        int minExecutions,
        long statsTtlSeconds,
        List<String> sourceRoots,
        List<PatternConfig> extraPatterns
) {
    public AnalyzerConfig {
        sourceRoots = sourceRoots == null ? List.of() : List.copyOf(sourceRoots);
        extraPatterns = extraPatterns == null ? List.of() : List.copyOf(extraPatterns);
    }

    public static AnalyzerConfig defaults() {
        return new AnalyzerConfig(1.0, 30.0, 3, 86_400, List.of(), List.of());
    }

    public void validate() {
        if (inlineThresholdSeconds < 0 || pooledThresholdSeconds < 0) {
            throw new ConfigurationException("Analyzer thresholds must not be negative");
        }
        if (inlineThresholdSeconds > pooledThresholdSeconds) {
            throw new ConfigurationException("inline-threshold (" + inlineThresholdSeconds
                    + ") must not exceed pooled-threshold (" + pooledThresholdSeconds + ")");
        }
        if (minExecutions < 1) {
            throw new ConfigurationException("min-executions must be at least 1");
        }
        if (statsTtlSeconds <= 0) {
            throw new ConfigurationException("stats-ttl-seconds must be positive");
        }
    }
}
