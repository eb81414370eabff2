package com.jobrunner.adapter.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the job runner.
 */
@ConfigurationProperties(prefix = "jobrunner")
public class JobRunnerProperties {

    /**
     * Whether the job runner is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the runner configuration file.
     * Supports classpath: prefix for classpath resources.
     */
    private String configPath = "classpath:jobrunner.yaml";

    /**
     * File for learned job statistics. Statistics stay in memory when unset.
     */
    private String statsFile;

    /**
     * Register a JVM shutdown hook that drains running jobs.
     */
    private boolean shutdownHook = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getConfigPath() {
        return configPath;
    }

    public void setConfigPath(String configPath) {
        this.configPath = configPath;
    }

    public String getStatsFile() {
        return statsFile;
    }

    public void setStatsFile(String statsFile) {
        this.statsFile = statsFile;
    }

    public boolean isShutdownHook() {
        return shutdownHook;
    }

    public void setShutdownHook(boolean shutdownHook) {
        this.shutdownHook = shutdownHook;
    }
}
