package com.conveyal.transitperf.model;

/**
 * Represents a GTFS StopTime. Times are seconds after noon minus 12 hours of the service day and may go past 24:00:00.
 */
public class StopTime extends Entity {

    private static final long serialVersionUID = -8883780047901081832L;
    public String trip_id;
    public int    arrival_time = INT_MISSING;
    public int    departure_time = INT_MISSING;
    public String stop_id;
    public int    stop_sequence;

    public StopTime () { }

    public StopTime (String trip_id, String stop_id, int stop_sequence, int arrival_time, int departure_time) {
        this.trip_id = trip_id;
        this.stop_id = stop_id;
        this.stop_sequence = stop_sequence;
        this.arrival_time = arrival_time;
        this.departure_time = departure_time;
    }

    @Override
    public String getId () {
        return trip_id; // Needs sequence number to be unique
    }

    /**
     * The time used for schedule adherence: the arrival time, or the departure time when only that is given.
     * @return the scheduled offset, or INT_MISSING if the stop time is not timed.
     */
    public int getScheduledTime () {
        return arrival_time != INT_MISSING ? arrival_time : departure_time;
    }

    public boolean isTimed () {
        return getScheduledTime() != INT_MISSING;
    }

}
