package com.jobrunner.config;

import java.util.List;

/**
 * Child process settings for isolated execution.
 *
 * @param javaCommand    Java executable (null = the running JVM's)
 * @param classpath      Child classpath (null = this JVM's java.class.path)
 * @param jvmOptions     Extra JVM options placed before the main class
 * @param stderrLimit    Maximum characters of child stderr kept for diagnostics
 * @param tempDirectory  Where job payload files are written (null = java.io.tmpdir)
 */
public record IsolationConfig(
        String javaCommand,
        String classpath,
        List<String> jvmOptions,
        int stderrLimit,
        String tempDirectory
) {
    public IsolationConfig {
        jvmOptions = jvmOptions == null ? List.of() : List.copyOf(jvmOptions);
    }

    public static IsolationConfig defaults() {
        return new IsolationConfig(null, null,
                List.of("-XX:+UseSerialGC", "-XX:TieredStopAtLevel=1"), 4096, null);
    }
}
