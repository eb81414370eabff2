package com.jobrunner.exception;

/**
 * Thrown when more jobs were dispatched in the trailing minute than the configured rate allows.
 */
public class RateLimitExceededException extends JobRejectedException {

    private final int maxJobsPerMinute;

    public RateLimitExceededException(int maxJobsPerMinute) {
        super("Rate limit exceeded: maximum " + maxJobsPerMinute + " jobs per minute");
        this.maxJobsPerMinute = maxJobsPerMinute;
    }

    public int getMaxJobsPerMinute() {
        return maxJobsPerMinute;
    }
}
