package com.jobrunner.strategy;

import com.jobrunner.analysis.JobAnalyzer;
import com.jobrunner.core.ErrorSanitizer;
import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.exception.JobRunnerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Selects through the {@link JobAnalyzer}: the analyzer picks a tier and each tier is
 * bound to a strategy.
 */
public class AnalyzingStrategySelector implements StrategySelector {

    private static final Logger log = LoggerFactory.getLogger(AnalyzingStrategySelector.class);

    private final JobAnalyzer analyzer;
    private final Map<ExecutionTier, ExecutionStrategy> strategies = new ConcurrentHashMap<>();
    private final Map<ExecutionTier, AtomicLong> counts = new EnumMap<>(ExecutionTier.class);

    public AnalyzingStrategySelector(JobAnalyzer analyzer) {
        if (analyzer == null) {
            throw new NullPointerException("Analyzer cannot be null");
        }
        this.analyzer = analyzer;
        for (ExecutionTier tier : ExecutionTier.values()) {
            counts.put(tier, new AtomicLong());
        }
    }

    /**
     * Default binding: INLINE to the inline strategy, POOLED and ISOLATED to the isolated one.
     */
    public static AnalyzingStrategySelector standard(JobAnalyzer analyzer,
                                                     InlineStrategy inline,
                                                     IsolatedStrategy isolated) {
        AnalyzingStrategySelector selector = new AnalyzingStrategySelector(analyzer);
        selector.registerStrategy(ExecutionTier.INLINE, inline);
        selector.registerStrategy(ExecutionTier.POOLED, isolated);
        selector.registerStrategy(ExecutionTier.ISOLATED, isolated);
        return selector;
    }

    /**
     * Bind a tier to a strategy, replacing any previous binding.
     */
    public AnalyzingStrategySelector registerStrategy(ExecutionTier tier, ExecutionStrategy strategy) {
        if (tier == null || strategy == null) {
            throw new NullPointerException("Tier and strategy cannot be null");
        }
        strategies.put(tier, strategy);
        return this;
    }

    @Override
    public Selection select(JobDescriptor job) {
        ExecutionTier tier = analyzer.analyze(job);
        ExecutionStrategy strategy = strategies.get(tier);
        if (strategy == null) {
            throw new JobRunnerException("No strategy registered for tier " + tier.key());
        }
        counts.get(tier).incrementAndGet();
        log.debug("Job {} ({}) routed to {} as {}",
                ErrorSanitizer.sanitizeJobId(job.getId()), job.getType(), strategy.getName(), tier.key());
        return new Selection(strategy, tier);
    }

    @Override
    public Map<ExecutionTier, Long> getSelectionCounts() {
        Map<ExecutionTier, Long> snapshot = new EnumMap<>(ExecutionTier.class);
        counts.forEach((tier, count) -> snapshot.put(tier, count.get()));
        return snapshot;
    }

    @Override
    public Collection<ExecutionStrategy> getStrategies() {
        return new LinkedHashSet<>(strategies.values());
    }

    public JobAnalyzer getAnalyzer() {
        return analyzer;
    }
}
