package com.jobrunner.runtime;

import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.JobDescriptor;

import java.time.Duration;

/**
 * Observer of runtime events. All callbacks run on the event loop and must not block.
 */
public interface RuntimeListener {

    default void onDispatched(JobDescriptor job, String strategy, ExecutionTier tier) {
    }

    default void onCompleted(JobDescriptor job, Duration duration) {
    }

    default void onFailed(JobDescriptor job, String reason) {
    }

    default void onTimedOut(JobDescriptor job) {
    }

    default void onConcurrencyChanged(int oldCeiling, int newCeiling) {
    }

    default void onShutdownInitiated(int runningJobs) {
    }
}
