package com.conveyal.transitperf.storage;

import com.conveyal.transitperf.error.MetricsErrorType;

/**
 * Some errors are detected way down the call stack, while reading positions or writing metrics, where there is no way
 * to report them to the job. We throw this exception to signal the caller that something went wrong.
 * It also serves as a catch-all wrapper for unexpected database problems.
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** For expected, recognized errors that have a defined enum value. */
    public MetricsErrorType errorType = MetricsErrorType.OTHER;

    /** This is the string that will make it out to the run report, explaining what went wrong. */
    public String badValue = null;

    /** This is the constructor for expected errors that have a defined enum value. */
    public StorageException (MetricsErrorType errorType, String badValue) {
        super(errorType.englishMessage);
        this.errorType = errorType;
        this.badValue = badValue;
    }

    /** This is the constructor for wrapping unexpected and unhandled exceptions. */
    public StorageException (Exception ex) {
        super(ex);
        // Expose the exception type and message to the outside world.
        badValue = ex.toString();
    }

}
