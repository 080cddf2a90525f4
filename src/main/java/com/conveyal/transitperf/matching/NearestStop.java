package com.conveyal.transitperf.matching;

/**
 * The answer to a stop index lookup.
 */
public class NearestStop {

    public final String stop_id;
    public final double distance_meters;

    public NearestStop (String stop_id, double distance_meters) {
        this.stop_id = stop_id;
        this.distance_meters = distance_meters;
    }

    public boolean isAtStop () {
        return StopIndex.isAtStop(distance_meters);
    }

}
