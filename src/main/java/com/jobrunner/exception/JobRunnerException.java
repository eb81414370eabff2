package com.jobrunner.exception;

/**
 * Base exception for the job runner.
 */
public class JobRunnerException extends RuntimeException {

    public JobRunnerException(String message) {
        super(message);
    }

    public JobRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
