package com.jobrunner.worker;

import com.jobrunner.core.JobDescriptor;

import java.util.Optional;

/**
 * Where a {@link QueueWorker} gets its jobs. Durable storage and retry bookkeeping
 * belong to the implementation. Every method is called on the runtime's event loop
 * and must not block for long.
 */
public interface JobSource {

    /**
     * Next job, or empty when none is available right now.
     */
    Optional<JobDescriptor> poll();

    /**
     * Take back a job that admission control refused, so it can be offered again later.
     */
    void reject(JobDescriptor job, String reason);

    /**
     * The job completed successfully.
     */
    default void onCompleted(JobDescriptor job) {
    }

    /**
     * The job failed, timed out, or could not be dispatched.
     */
    default void onFailed(JobDescriptor job, String reason) {
    }
}
