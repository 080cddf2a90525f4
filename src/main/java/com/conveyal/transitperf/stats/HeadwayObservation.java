package com.conveyal.transitperf.stats;

import java.time.LocalDate;

/**
 * The time between two successive vehicles passing the same stop.
 */
public class HeadwayObservation {

    public final String route_id;
    public final String stop_id;
    public final String vehicle_a;
    public final String vehicle_b;
    public final long gap_seconds;
    public final LocalDate day;

    public HeadwayObservation (String route_id, String stop_id, String vehicle_a, String vehicle_b, long gap_seconds,
                               LocalDate day) {
        this.route_id = route_id;
        this.stop_id = stop_id;
        this.vehicle_a = vehicle_a;
        this.vehicle_b = vehicle_b;
        this.gap_seconds = gap_seconds;
        this.day = day;
    }

    public double getGapMinutes () {
        return gap_seconds / 60.0;
    }

}
