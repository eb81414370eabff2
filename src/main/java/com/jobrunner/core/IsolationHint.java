package com.jobrunner.core;

/**
 * Tri-state isolation preference declared by a job.
 */
public enum IsolationHint {

    /**
     * Job must run in its own process.
     */
    ISOLATED,

    /**
     * Job explicitly opts out of isolation and runs inline on the event loop.
     */
    INLINE,

    /**
     * No preference; the analyzer decides.
     */
    UNSET
}
