package com.conveyal.transitperf.pipeline;

import com.conveyal.transitperf.stats.HeadwayStatistics;
import com.conveyal.transitperf.stats.model.RollingSummary;
import com.conveyal.transitperf.util.Util;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Tunable parameters of a metrics run. The defaults are what the production runs use. A JSON file with any subset of
 * these fields can be supplied on the command line to override them.
 *
 * The schedule adherence thresholds and the match confidence weights are not here: they define what the published
 * figures mean and are fixed in code.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AggregationConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Time zone of the agency. Service days and schedule times are local to this zone. */
    public String timeZone = "America/New_York";

    /** How far outside its first and last scheduled times a trip is still considered as a match candidate. */
    public int candidateToleranceSeconds = 15 * 60;

    public int windowDays = RollingSummary.DEFAULT_WINDOW_DAYS;

    public double maxHeadwayMinutes = HeadwayStatistics.DEFAULT_MAX_HEADWAY_MINUTES;

    /** Size of the worker pool. Each route is handled by a single worker. */
    public int workerThreads = 4;

    /** Wall-clock budget of one route/day job. */
    public int jobTimeoutSeconds = 600;

    public int persistAttempts = 3;

    /** Delay before the second write attempt. It doubles on each further attempt. */
    public long persistBackoffMillis = 500;

    public String positionTable = "vehicle_positions";

    /** Table holding the vendor's self-reported deviations, or null if there is no such feed. */
    public String vendorTable = null;

    /** Route/days with fewer distinct samples than this fail with no_samples. */
    public int minSamples = 1;

    @JsonIgnore
    public ZoneId getZoneId () {
        return ZoneId.of(timeZone);
    }

    /**
     * @throws IllegalArgumentException naming the first field with an unusable value.
     */
    public void validate () {
        try {
            getZoneId();
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("Unknown time zone: " + timeZone, e);
        }
        if (candidateToleranceSeconds < 0) throw new IllegalArgumentException("candidateToleranceSeconds must not be negative");
        if (windowDays < 1) throw new IllegalArgumentException("windowDays must be at least 1");
        if (!(maxHeadwayMinutes > 0)) throw new IllegalArgumentException("maxHeadwayMinutes must be positive");
        if (workerThreads < 1) throw new IllegalArgumentException("workerThreads must be at least 1");
        if (jobTimeoutSeconds < 1) throw new IllegalArgumentException("jobTimeoutSeconds must be at least 1");
        if (persistAttempts < 1) throw new IllegalArgumentException("persistAttempts must be at least 1");
        if (persistBackoffMillis < 0) throw new IllegalArgumentException("persistBackoffMillis must not be negative");
        if (minSamples < 1) throw new IllegalArgumentException("minSamples must be at least 1");
        Util.ensureValidTableName(positionTable);
        if (vendorTable != null) Util.ensureValidTableName(vendorTable);
    }

    public static AggregationConfig fromFile (File file) throws IOException {
        AggregationConfig config = new ObjectMapper().readValue(file, AggregationConfig.class);
        config.validate();
        return config;
    }

}
