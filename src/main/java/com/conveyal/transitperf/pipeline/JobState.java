package com.conveyal.transitperf.pipeline;

/**
 * Lifecycle of a route/day job. A job moves through the states in order and stops at PERSISTED or FAILED.
 * SKIPPED marks units that were never run because their metrics already exist.
 */
public enum JobState {
    PENDING, MATCHING, CLASSIFYING, AGGREGATING, PERSISTED, FAILED, SKIPPED;

    public boolean isFinal () {
        return this == PERSISTED || this == FAILED || this == SKIPPED;
    }
}
