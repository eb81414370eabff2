package com.jobrunner.core;

import com.jobrunner.config.SecurityLimits;
import com.jobrunner.exception.JobValidationException;
import com.jobrunner.exception.JobValidationException.Violation;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks job attributes against server limits. Every violation of a job is reported at once.
 */
public final class JobValidator {

    private JobValidator() {
    }

    /**
     * Timeout, memory and priority.
     *
     * @throws JobValidationException if any attribute is out of range
     */
    public static void validate(JobDescriptor job, SecurityLimits limits) {
        List<Violation> violations = resourceViolations(job, limits);
        int priority = job.getPriority();
        if (priority < SecurityLimits.MIN_PRIORITY || priority > SecurityLimits.MAX_PRIORITY) {
            violations.add(new Violation("priority", priority,
                    SecurityLimits.MIN_PRIORITY, SecurityLimits.MAX_PRIORITY));
        }
        throwIfAny(violations);
    }

    /**
     * Timeout and memory only.
     *
     * @throws JobValidationException if either is out of range
     */
    public static void validateResources(JobDescriptor job, SecurityLimits limits) {
        throwIfAny(resourceViolations(job, limits));
    }

    private static List<Violation> resourceViolations(JobDescriptor job, SecurityLimits limits) {
        List<Violation> violations = new ArrayList<>();
        int timeout = job.getTimeoutSeconds();
        if (timeout < 1 || timeout > limits.maxTimeoutSeconds()) {
            violations.add(new Violation("timeout", timeout, 1, limits.maxTimeoutSeconds()));
        }
        int memory = job.getMaxMemoryMb();
        if (memory < 1 || memory > limits.maxMemoryMb()) {
            violations.add(new Violation("maxMemory", memory, 1, limits.maxMemoryMb()));
        }
        return violations;
    }

    private static void throwIfAny(List<Violation> violations) {
        if (!violations.isEmpty()) {
            throw new JobValidationException(violations);
        }
    }
}
