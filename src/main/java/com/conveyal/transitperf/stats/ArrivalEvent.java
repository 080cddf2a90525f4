package com.conveyal.transitperf.stats;

import java.time.Instant;

/**
 * A vehicle observed at a stop it is scheduled to serve, with its deviation from the schedule.
 */
public class ArrivalEvent {

    public final String route_id;
    public final String stop_id;
    public final String trip_id;
    public final String vehicle_id;
    public final Instant scheduled_time;
    /** The scheduled GTFS time, as written in the schedule. Used for time-of-day bucketing. */
    public final int scheduled_seconds_of_day;
    /** Polling only tells us the vehicle was near the stop at this time. */
    public final Instant observed_time_estimate;
    public final int deviation_seconds;
    public final double distance_to_stop_meters;
    public final Classification classification;

    public ArrivalEvent (String route_id, String stop_id, String trip_id, String vehicle_id, Instant scheduled_time,
                         int scheduled_seconds_of_day, Instant observed_time_estimate, int deviation_seconds,
                         double distance_to_stop_meters) {
        this.route_id = route_id;
        this.stop_id = stop_id;
        this.trip_id = trip_id;
        this.vehicle_id = vehicle_id;
        this.scheduled_time = scheduled_time;
        this.scheduled_seconds_of_day = scheduled_seconds_of_day;
        this.observed_time_estimate = observed_time_estimate;
        this.deviation_seconds = deviation_seconds;
        this.distance_to_stop_meters = distance_to_stop_meters;
        this.classification = Classification.of(deviation_seconds);
    }

    public TimePeriod getTimePeriod () {
        return TimePeriod.forSecondsOfDay(scheduled_seconds_of_day);
    }

}
