package com.jobrunner.exception;

/**
 * A job ran and failed. The message is already sanitized.
 */
public class JobExecutionException extends JobRunnerException {

    public JobExecutionException(String message) {
        super(message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
