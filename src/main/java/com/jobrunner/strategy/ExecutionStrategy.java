package com.jobrunner.strategy;

import com.jobrunner.core.JobDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * A way of running jobs.
 */
public interface ExecutionStrategy {

    /**
     * Strategy name, used in logs and statistics.
     */
    String getName();

    /**
     * Whether this strategy accepts the job on its own terms.
     */
    boolean canHandle(JobDescriptor job);

    /**
     * Start the job.
     *
     * <p>Validation and security problems are thrown before anything is started.
     * Once started, the outcome arrives through the returned future: normal completion
     * on success, otherwise a {@link com.jobrunner.exception.JobExecutionException} or
     * {@link com.jobrunner.exception.JobTimeoutException}.
     */
    CompletableFuture<Void> execute(JobDescriptor job);

    /**
     * Release resources and terminate anything still running.
     */
    default void close() {
    }
}
