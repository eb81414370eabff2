package com.jobrunner.strategy.isolated;

import java.util.Map;

/**
 * What travels from the runtime to an isolated child process.
 *
 * @param jobClass       Fully-qualified class the child instantiates
 * @param type           Logical job type
 * @param id             Job id
 * @param timeoutSeconds Effective timeout
 * @param maxMemoryMb    Effective memory ceiling
 * @param fields         Plain-data job state
 */
public record JobEnvelope(
        String jobClass,
        String type,
        String id,
        int timeoutSeconds,
        int maxMemoryMb,
        Map<String, Object> fields
) {
    public JobEnvelope {
        fields = fields == null ? Map.of() : fields;
    }
}
