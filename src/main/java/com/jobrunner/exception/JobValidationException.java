package com.jobrunner.exception;

import java.util.List;

/**
 * Thrown when job properties fall outside server-side limits. The job is never dispatched.
 */
public class JobValidationException extends JobRunnerException {

    private final List<Violation> violations;

    public JobValidationException(List<Violation> violations) {
        super(buildMessage(violations));
        this.violations = List.copyOf(violations);
    }

    public List<Violation> getViolations() {
        return violations;
    }

    private static String buildMessage(List<Violation> violations) {
        StringBuilder sb = new StringBuilder("Job validation failed: ");
        for (int i = 0; i < violations.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(violations.get(i).describe());
        }
        return sb.toString();
    }

    /**
     * One offending field.
     *
     * @param field     Field name (timeout, maxMemory, priority)
     * @param requested Value the job asked for
     * @param min       Smallest allowed value
     * @param max       Largest allowed value
     */
    public record Violation(String field, long requested, long min, long max) {

        public String describe() {
            return "Invalid " + field + ": " + requested + " (allowed: " + min + " to " + max + ")";
        }
    }
}
