package com.jobrunner.strategy;

import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.JobDescriptor;
import com.jobrunner.exception.JobRunnerException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Manual selection: the first registered strategy whose {@code canHandle} accepts the job wins.
 */
public class FirstMatchStrategySelector implements StrategySelector {

    private final List<Selection> candidates = new CopyOnWriteArrayList<>();
    private final Map<ExecutionTier, AtomicLong> counts = new EnumMap<>(ExecutionTier.class);

    public FirstMatchStrategySelector() {
        for (ExecutionTier tier : ExecutionTier.values()) {
            counts.put(tier, new AtomicLong());
        }
    }

    /**
     * Append a strategy; the tier is what selections through it are counted as.
     */
    public FirstMatchStrategySelector addStrategy(ExecutionStrategy strategy, ExecutionTier tier) {
        if (strategy == null || tier == null) {
            throw new NullPointerException("Strategy and tier cannot be null");
        }
        candidates.add(new Selection(strategy, tier));
        return this;
    }

    @Override
    public Selection select(JobDescriptor job) {
        for (Selection candidate : candidates) {
            if (candidate.strategy().canHandle(job)) {
                counts.get(candidate.tier()).incrementAndGet();
                return candidate;
            }
        }
        throw new JobRunnerException("No strategy can handle job type " + job.getType());
    }

    @Override
    public Map<ExecutionTier, Long> getSelectionCounts() {
        Map<ExecutionTier, Long> snapshot = new EnumMap<>(ExecutionTier.class);
        counts.forEach((tier, count) -> snapshot.put(tier, count.get()));
        return snapshot;
    }

    @Override
    public Collection<ExecutionStrategy> getStrategies() {
        List<ExecutionStrategy> strategies = new ArrayList<>();
        candidates.forEach(c -> strategies.add(c.strategy()));
        return new LinkedHashSet<>(strategies);
    }
}
