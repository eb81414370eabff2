package com.jobrunner.exception;

/**
 * Exception thrown when a job cannot be accepted by the runtime.
 * Typically due to an admission limit or the runtime shutting down.
 * Nothing is queued: the caller decides whether and when to retry.
 */
public class JobRejectedException extends JobRunnerException {

    public JobRejectedException(String message) {
        super(message);
    }

    public JobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
