package com.jobrunner.exception;

/**
 * Thrown when a job's code source lies outside the directories allowed for isolated execution.
 * Raised before any process is spawned.
 */
public class SecurityViolationException extends JobRunnerException {

    public SecurityViolationException(String message) {
        super(message);
    }
}
