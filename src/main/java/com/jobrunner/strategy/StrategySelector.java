package com.jobrunner.strategy;

import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.JobDescriptor;

import java.util.Collection;
import java.util.Map;

/**
 * Binds a job to the strategy that will run it.
 */
public interface StrategySelector {

    /**
     * Pick the strategy for a job.
     *
     * @throws com.jobrunner.exception.JobRunnerException if no strategy fits
     */
    Selection select(JobDescriptor job);

    /**
     * Selections made so far, per tier.
     */
    Map<ExecutionTier, Long> getSelectionCounts();

    /**
     * Every distinct strategy this selector can return.
     */
    Collection<ExecutionStrategy> getStrategies();

    /**
     * A selection outcome.
     */
    record Selection(ExecutionStrategy strategy, ExecutionTier tier) {}
}
