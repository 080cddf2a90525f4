package com.conveyal.transitperf.error;

/**
 * Every problem the pipeline can report. The code is what appears as the failure reason in run reports, so existing
 * codes must not be renamed.
 */
public enum MetricsErrorType {
    // Input absence: the route/day is skipped and reported.
    NO_SCHEDULE("no_schedule", "The schedule reference has no entry for this route."),
    NO_STOPS("no_stops", "No trip of this route visits any stop, so there is nothing to match samples against."),
    NO_SAMPLES("no_samples", "There are not enough position samples for this route on this day."),

    // Data integrity: the offending record is skipped and counted.
    MALFORMED_SAMPLE("malformed_sample", "A position sample has no timestamp or an impossible coordinate."),
    STOP_TIMES_OUT_OF_SEQUENCE("stop_times_out_of_sequence", "The scheduled times of a trip decrease along the stop sequence."),
    TRIP_TOO_FEW_STOP_TIMES("trip_too_few_stop_times", "A trip needs at least two timed stop times to be located in time."),
    MISSING_STOP("missing_stop", "A stop time references a stop that is not in the schedule reference."),

    // Job-level failures.
    TIMEOUT("timeout", "The job exceeded its wall-clock budget and was abandoned before writing anything."),
    PERSISTENCE_FAILED("persistence_failed", "The metrics could not be written after repeated attempts."),

    // Unknown errors.
    OTHER("unexpected_error", "Other errors.");

    public final String code;
    public final String englishMessage;

    MetricsErrorType (String code, String englishMessage) {
        this.code = code;
        this.englishMessage = englishMessage;
    }

}
