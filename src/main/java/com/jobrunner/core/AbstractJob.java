package com.jobrunner.core;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Base class for jobs.
 * Holds the execution attributes with the usual defaults; subclasses implement
 * {@link #execute()} and, when they carry state, {@link #exportFields()} and
 * {@link #restoreFields(Map)}.
 */
public abstract class AbstractJob implements JobDescriptor {

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_MEMORY_MB = 64;

    private final String id;
    private int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    private int maxMemoryMb = DEFAULT_MAX_MEMORY_MB;
    private IsolationHint isolation = IsolationHint.UNSET;
    private int priority;
    private Double estimatedDurationSeconds;

    protected AbstractJob() {
        this.id = "job_" + UUID.randomUUID().toString().replace("-", "");
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(int timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public int getMaxMemoryMb() {
        return maxMemoryMb;
    }

    public void setMaxMemoryMb(int maxMemoryMb) {
        this.maxMemoryMb = maxMemoryMb;
    }

    @Override
    public IsolationHint getIsolation() {
        return isolation;
    }

    public void setIsolation(IsolationHint isolation) {
        this.isolation = isolation == null ? IsolationHint.UNSET : isolation;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    @Override
    public Optional<Double> getEstimatedDurationSeconds() {
        return Optional.ofNullable(estimatedDurationSeconds);
    }

    public void setEstimatedDurationSeconds(Double estimatedDurationSeconds) {
        this.estimatedDurationSeconds = estimatedDurationSeconds;
    }

    @Override
    public Map<String, Object> exportFields() {
        return Collections.emptyMap();
    }

    @Override
    public void restoreFields(Map<String, Object> fields) {
        // stateless by default
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "id='" + id + '\'' +
                ", timeout=" + timeoutSeconds +
                ", maxMemoryMb=" + maxMemoryMb +
                ", isolation=" + isolation +
                ", priority=" + priority +
                '}';
    }
}
