package com.conveyal.transitperf.stats;

/**
 * Schedule adherence classes. The thresholds are a fixed policy: published grades depend on the definition staying
 * the same from one day to the next, so they are deliberately not configurable.
 */
public enum Classification {
    EARLY, ON_TIME, LATE;

    /** More than one minute early is early. */
    public static final int EARLY_THRESHOLD_SECONDS = -60;
    /** More than five minutes late is late. */
    public static final int LATE_THRESHOLD_SECONDS = 300;

    /** Both thresholds are themselves on time. */
    public static Classification of (double deviationSeconds) {
        if (deviationSeconds < EARLY_THRESHOLD_SECONDS) return EARLY;
        if (deviationSeconds > LATE_THRESHOLD_SECONDS) return LATE;
        return ON_TIME;
    }

}
