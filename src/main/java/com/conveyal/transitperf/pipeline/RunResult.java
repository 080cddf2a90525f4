package com.conveyal.transitperf.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Summary of a whole run: one entry per route/day unit plus totals. Written out as JSON when requested on the
 * command line, for the scheduler that invoked the run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RunResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public String firstDay;
    public String lastDay;
    public String routeFilter;
    public boolean recalculate;

    public int persisted;
    public int failed;
    public int skipped;
    public long totalSamples;
    public long totalMatched;
    public long runTimeMillis;

    /** Ordered by route, then day. */
    public List<JobResult> jobs = new ArrayList<>();

    public void add (JobResult job) {
        jobs.add(job);
        switch (job.status) {
            case PERSISTED: persisted++; break;
            case SKIPPED: skipped++; break;
            default: failed++;
        }
        totalSamples += job.samples_seen;
        totalMatched += job.samples_matched;
    }

    /**
     * Some failed route/days do not make a run fail: it succeeds if anything was written, or if everything asked for
     * was already there.
     */
    @JsonIgnore
    public boolean isSuccess () {
        return persisted > 0 || failed == 0;
    }

}
