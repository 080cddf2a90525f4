package com.conveyal.transitperf.stats;

import java.util.List;

/**
 * What the event classifier derives from one route/day of match results.
 */
public class ClassifiedEvents {

    /** One arrival per stop visit: the last observation of a vehicle on a trip at a scheduled stop time. */
    public final List<ArrivalEvent> arrivals;
    /** Every matched sample taken at a stop, several per visit when a vehicle is seen while dwelling. */
    public final List<ArrivalEvent> stopObservations;
    public final List<SpeedSample> speeds;
    /** Consecutive position pairs dropped for zero or negative elapsed time or an impossible speed. */
    public final int discardedSpeedSamples;

    public ClassifiedEvents (List<ArrivalEvent> arrivals, List<ArrivalEvent> stopObservations, List<SpeedSample> speeds,
                             int discardedSpeedSamples) {
        this.arrivals = arrivals;
        this.stopObservations = stopObservations;
        this.speeds = speeds;
        this.discardedSpeedSamples = discardedSpeedSamples;
    }

}
