package com.conveyal.transitperf.error;

/**
 * Thrown from deep inside a route/day job when it cannot go on, for example because the route has no schedule.
 * The job boundary catches it and turns it into a failed unit in the run report. It never escapes a job.
 */
public class MetricsException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public final MetricsErrorType errorType;

    /** The route, trip or other value that caused the problem. */
    public final String badValue;

    public MetricsException (MetricsErrorType errorType, String badValue) {
        super(String.format("%s (%s)", errorType.englishMessage, badValue));
        this.errorType = errorType;
        this.badValue = badValue;
    }

}
