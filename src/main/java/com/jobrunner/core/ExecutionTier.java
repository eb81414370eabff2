package com.jobrunner.core;

/**
 * Execution tier chosen by the analyzer.
 */
public enum ExecutionTier {

    /**
     * Run synchronously on the event loop (expected well under a second).
     */
    INLINE,

    /**
     * Middle tier: neither blocks the loop nor warrants a dedicated process.
     * Default wiring maps it onto the isolated strategy.
     */
    POOLED,

    /**
     * Run in a dedicated child process.
     */
    ISOLATED;

    /**
     * Lower-case name used in configuration and logs.
     */
    public String key() {
        return name().toLowerCase();
    }
}
