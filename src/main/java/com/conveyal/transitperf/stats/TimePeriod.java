package com.conveyal.transitperf.stats;

/**
 * Fixed time-of-day buckets for on-time performance. Events are bucketed by their scheduled time, so that a late
 * bus does not drift into the next bucket.
 */
public enum TimePeriod {
    NIGHT("Night", 0, 6),
    AM_PEAK("AM Peak", 6, 9),
    MIDDAY("Midday", 9, 15),
    PM_PEAK("PM Peak", 15, 19),
    EVENING("Evening", 19, 24);

    public final String label;
    /** Inclusive. */
    public final int startHour;
    /** Exclusive. */
    public final int endHour;

    TimePeriod (String label, int startHour, int endHour) {
        this.label = label;
        this.startHour = startHour;
        this.endHour = endHour;
    }

    /**
     * @param secondsOfDay a GTFS time of the service day. Times past 24:00:00 wrap around, so 25:30 is
     *                     Night.
     */
    public static TimePeriod forSecondsOfDay (int secondsOfDay) {
        int hour = Math.floorMod(secondsOfDay, 24 * 3600) / 3600;
        for (TimePeriod period : values()) {
            if (hour >= period.startHour && hour < period.endHour) return period;
        }
        throw new IllegalStateException("No time period for hour " + hour);
    }

}
