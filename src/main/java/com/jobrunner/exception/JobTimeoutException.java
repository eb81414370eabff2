package com.jobrunner.exception;

/**
 * A job exceeded its timeout and its process was forcibly terminated.
 * Not a {@link JobExecutionException}: callers can tell a kill from a failure.
 */
public class JobTimeoutException extends JobRunnerException {

    private final int timeoutSeconds;

    public JobTimeoutException(String jobId, int timeoutSeconds) {
        super("Job " + jobId + " timed out after " + timeoutSeconds + "s and was terminated");
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }
}
