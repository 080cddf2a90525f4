package com.conveyal.transitperf.stats;

import java.time.Instant;

/**
 * Speed of a vehicle between two consecutive positions on the same trip, measured along the trip's path.
 */
public class SpeedSample {

    public final String vehicle_id;
    public final String trip_id;
    public final Instant from_time;
    public final Instant to_time;
    public final double distance_meters;
    public final double elapsed_seconds;
    public final double speed_mph;

    public SpeedSample (String vehicle_id, String trip_id, Instant from_time, Instant to_time,
                        double distance_meters, double elapsed_seconds, double speed_mph) {
        this.vehicle_id = vehicle_id;
        this.trip_id = trip_id;
        this.from_time = from_time;
        this.to_time = to_time;
        this.distance_meters = distance_meters;
        this.elapsed_seconds = elapsed_seconds;
        this.speed_mph = speed_mph;
    }

}
