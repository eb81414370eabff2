package com.jobrunner.analysis;

import com.jobrunner.config.AnalyzerConfig;
import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.IsolationHint;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.stats.StatisticsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides the execution tier of a job.
 *
 * <p>Sources are consulted in order and the first one with an answer wins:
 * <ol>
 *   <li>the job's explicit isolation hint, then its estimated duration</li>
 *   <li>recorded execution history, once enough executions are known</li>
 *   <li>blocking patterns found in the job's code</li>
 *   <li>the job's type name</li>
 *   <li>POOLED</li>
 * </ol>
 */
public class JobAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(JobAnalyzer.class);

    public static final String STATS_KEY_PREFIX = "jobrunner_job_stats:";

    /**
     * Highest blocking score still considered POOLED; anything above is ISOLATED.
     */
    static final int POOLED_SCORE_LIMIT = 5;

    private final AnalyzerConfig config;
    private final StatisticsStore store;
    private final SourceLocator sourceLocator;
    private final BlockingPatternScanner scanner;
    private final Duration statsTtl;

    public JobAnalyzer(AnalyzerConfig config, StatisticsStore store) {
        this(config, store, SourceLocator.standard(config.sourceRoots()));
    }

    public JobAnalyzer(AnalyzerConfig config, StatisticsStore store, SourceLocator sourceLocator) {
        if (config == null || store == null || sourceLocator == null) {
            throw new NullPointerException("Config, store and source locator cannot be null");
        }
        config.validate();
        this.config = config;
        this.store = store;
        this.sourceLocator = sourceLocator;
        this.scanner = BlockingPatternScanner.withExtras(config.extraPatterns());
        this.statsTtl = Duration.ofSeconds(config.statsTtlSeconds());
    }

    /**
     * Choose the tier for a job.
     */
    public ExecutionTier analyze(JobDescriptor job) {
        String type = job.getType();

        Optional<ExecutionTier> tier = explicitTier(job);
        if (tier.isPresent()) {
            log.debug("Job {} using explicit mode: {}", type, tier.get().key());
            return tier.get();
        }

        tier = historicalTier(type);
        if (tier.isPresent()) {
            log.debug("Job {} using historical mode: {}", type, tier.get().key());
            return tier.get();
        }

        tier = staticTier(job.getClass());
        if (tier.isPresent()) {
            log.debug("Job {} using static analysis mode: {}", type, tier.get().key());
            return tier.get();
        }

        tier = NameHeuristics.classify(type);
        if (tier.isPresent()) {
            log.debug("Job {} using name heuristic mode: {}", type, tier.get().key());
            return tier.get();
        }

        log.debug("Job {} using default mode: pooled", type);
        return ExecutionTier.POOLED;
    }

    /**
     * Fold one execution into the statistics of a job type.
     */
    public void recordExecution(String type, double durationSeconds, boolean success) {
        String key = STATS_KEY_PREFIX + type;
        JobStatistics updated = store.get(key)
                .orElseGet(JobStatistics::empty)
                .record(durationSeconds, success);
        store.put(key, updated, statsTtl);
    }

    /**
     * Statistics of a job type, empty when nothing has been recorded.
     */
    public Optional<JobStatsSnapshot> getStats(String type) {
        return store.get(STATS_KEY_PREFIX + type)
                .filter(stats -> stats.executions() > 0)
                .map(stats -> new JobStatsSnapshot(
                        type,
                        stats.executions(),
                        stats.averageDurationSeconds(),
                        stats.failureRate(),
                        tierFromHistory(stats).orElse(ExecutionTier.POOLED)));
    }

    public void clearStats(String type) {
        store.forget(STATS_KEY_PREFIX + type);
        log.debug("Cleared statistics for {}", type);
    }

    public Thresholds getThresholds() {
        return new Thresholds(config.inlineThresholdSeconds(), config.pooledThresholdSeconds());
    }

    private Optional<ExecutionTier> explicitTier(JobDescriptor job) {
        IsolationHint hint = job.getIsolation();
        if (hint == IsolationHint.ISOLATED) {
            return Optional.of(ExecutionTier.ISOLATED);
        }
        if (hint == IsolationHint.INLINE) {
            return Optional.of(ExecutionTier.INLINE);
        }
        return job.getEstimatedDurationSeconds().map(this::tierForDuration);
    }

    private Optional<ExecutionTier> historicalTier(String type) {
        Optional<JobStatistics> stats;
        try {
            stats = store.get(STATS_KEY_PREFIX + type);
        } catch (RuntimeException e) {
            log.warn("Statistics unavailable for {}: {}", type, e.getMessage());
            return Optional.empty();
        }
        return stats.flatMap(this::tierFromHistory);
    }

    private Optional<ExecutionTier> tierFromHistory(JobStatistics stats) {
        if (stats.executions() < config.minExecutions()) {
            return Optional.empty();
        }
        return Optional.of(tierForDuration(stats.averageDurationSeconds()));
    }

    private Optional<ExecutionTier> staticTier(Class<?> jobClass) {
        Optional<String> code;
        try {
            code = sourceLocator.locate(jobClass);
        } catch (RuntimeException e) {
            log.debug("Static analysis unavailable for {}: {}", jobClass.getName(), e.getMessage());
            return Optional.empty();
        }
        if (code.isEmpty()) {
            return Optional.empty();
        }

        BlockingPatternScanner.ScanResult result = scanner.scan(code.get());
        if (!result.matched().isEmpty()) {
            log.debug("Detected blocking patterns in {}: {} (score {})",
                    jobClass.getName(), result.matched(), result.score());
        }
        if (result.score() == 0) {
            return Optional.of(ExecutionTier.INLINE);
        }
        if (result.score() <= POOLED_SCORE_LIMIT) {
            return Optional.of(ExecutionTier.POOLED);
        }
        return Optional.of(ExecutionTier.ISOLATED);
    }

    private ExecutionTier tierForDuration(double seconds) {
        if (seconds <= config.inlineThresholdSeconds()) {
            return ExecutionTier.INLINE;
        }
        if (seconds <= config.pooledThresholdSeconds()) {
            return ExecutionTier.POOLED;
        }
        return ExecutionTier.ISOLATED;
    }

    /**
     * Duration thresholds in seconds.
     */
    public record Thresholds(double inlineSeconds, double pooledSeconds) {}
}
