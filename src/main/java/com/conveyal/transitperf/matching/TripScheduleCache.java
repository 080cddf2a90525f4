package com.conveyal.transitperf.matching;

import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.Trip;

import java.util.HashMap;
import java.util.Map;

/**
 * Lays out each trip along its path at most once per job. Owned by a single route/day job, so it is not
 * thread-safe.
 */
public class TripScheduleCache {

    private final ScheduleReference schedule;
    private final Map<String, TripSchedule> tripSchedules = new HashMap<>();

    public TripScheduleCache (ScheduleReference schedule) {
        this.schedule = schedule;
    }

    public TripSchedule get (Trip trip) {
        return tripSchedules.computeIfAbsent(trip.trip_id, id -> new TripSchedule(trip, schedule));
    }

    /** @return the laid out trip, or null if the schedule has no such trip. */
    public TripSchedule get (String tripId) {
        Trip trip = schedule.getTrip(tripId);
        return trip == null ? null : get(trip);
    }

    public ScheduleReference getSchedule () {
        return schedule;
    }

}
