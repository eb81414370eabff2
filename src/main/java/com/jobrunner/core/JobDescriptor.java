package com.jobrunner.core;

import java.util.Map;
import java.util.Optional;

/**
 * Contract every job satisfies.
 *
 * <p>A job is owned by the runtime for exactly one execution attempt and is never
 * executed concurrently with itself. Implementations that may run isolated need a
 * public no-arg constructor: the child process rebuilds a fresh instance and
 * assigns the transmitted fields through {@link #restoreFields(Map)}.
 */
public interface JobDescriptor {

    /**
     * Unique, immutable job identifier.
     */
    String getId();

    /**
     * Requested timeout in seconds. Validated against the server maximum before dispatch.
     */
    int getTimeoutSeconds();

    /**
     * Requested memory ceiling in megabytes. Validated against the server maximum before dispatch.
     */
    int getMaxMemoryMb();

    /**
     * Isolation preference; {@link IsolationHint#UNSET} lets the analyzer decide.
     */
    IsolationHint getIsolation();

    /**
     * Priority in [-100, 100], higher is more important.
     */
    int getPriority();

    /**
     * Optional duration hint in seconds used for routing.
     */
    Optional<Double> getEstimatedDurationSeconds();

    /**
     * Logical job type, the key under which execution statistics are kept.
     */
    default String getType() {
        return getClass().getName();
    }

    /**
     * Plain-data state of the job: String, Number, Boolean, null, and Lists or Maps of those.
     * Identity and behaviour are never part of it.
     */
    Map<String, Object> exportFields();

    /**
     * Assign previously exported fields onto a freshly constructed instance.
     */
    void restoreFields(Map<String, Object> fields);

    /**
     * Run the job. Failure is signalled by throwing.
     */
    void execute() throws Exception;
}
