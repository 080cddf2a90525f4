package com.conveyal.transitperf.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;

/**
 * The report line for one route/day unit of a run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class JobResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public String route_id;
    /** ISO date of the service day. */
    public String day;
    public JobState status = JobState.PENDING;
    /** Error code when the job failed, otherwise null. */
    public String reason;
    /** Human readable detail accompanying the reason. */
    public String detail;

    public int samples_seen;
    public int duplicates_removed;
    public int samples_matched;
    public int samples_unmatched;
    public int events_produced;
    public int headway_observations;
    public int speed_samples;
    /** Schedule entities and samples skipped as inconsistent. */
    public int integrity_errors;
    public long elapsed_millis;

    public JobResult () { }

    public JobResult (String route_id, String day) {
        this.route_id = route_id;
        this.day = day;
    }

    @Override
    public String toString () {
        if (status == JobState.FAILED) return String.format("%s %s: FAILED (%s)", route_id, day, reason);
        return String.format("%s %s: %s (%d samples, %d matched, %d events)", route_id, day, status, samples_seen,
                samples_matched, events_produced);
    }

}
