package com.jobrunner.exception;

/**
 * Thrown when the number of in-flight jobs has reached the current concurrency ceiling.
 */
public class ConcurrencyLimitExceededException extends JobRejectedException {

    private final int ceiling;

    public ConcurrencyLimitExceededException(int ceiling) {
        super("Maximum concurrent jobs limit reached (" + ceiling + ")");
        this.ceiling = ceiling;
    }

    public int getCeiling() {
        return ceiling;
    }
}
