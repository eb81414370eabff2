package com.jobrunner.runtime;

import com.jobrunner.core.ExecutionTier;
import com.jobrunner.core.JobDescriptor;

import java.time.Instant;

/**
 * An in-flight job as tracked by the runtime.
 */
public record ExecutionRecord(
        JobDescriptor job,
        Instant startedAt,
        String strategy,
        ExecutionTier tier
) {}
