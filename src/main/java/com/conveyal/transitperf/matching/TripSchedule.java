package com.conveyal.transitperf.matching;

import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.ShapePoint;
import com.conveyal.transitperf.model.Stop;
import com.conveyal.transitperf.model.StopTime;
import com.conveyal.transitperf.model.Trip;
import com.conveyal.transitperf.util.Util;

import java.util.ArrayList;
import java.util.List;

/**
 * A trip laid out along its path: where each stop falls along the path geometry and when the vehicle is due there.
 * This is what lets the matcher tell where a trip's vehicle should be at a given time, and when it should have been
 * at a given place.
 *
 * Expected positions are interpolated linearly in time between consecutive timed stops, and mapped onto the
 * distances of those stops along the path. The inverse lookup (scheduled time at a distance along the path) uses the
 * same pairs, so the two are consistent with one another.
 */
public class TripSchedule {

    public final Trip trip;
    public final PathGeometry path;

    /** All stop times of the trip in sequence order, with the distance of their stop along the path. */
    private final List<StopTime> stopTimes;
    private final double[] stopDistances;
    private final double[] stopLats;
    private final double[] stopLons;

    /** Timed stop times only: the knots of the time / distance interpolation. */
    private final int[] knotTimes;
    private final double[] knotDistances;

    public TripSchedule (Trip trip, ScheduleReference schedule) {
        this.trip = trip;
        this.stopTimes = trip.stop_times;
        List<Stop> stops = new ArrayList<>(stopTimes.size());
        for (StopTime stopTime : stopTimes) {
            stops.add(schedule.getStop(stopTime.stop_id));
        }
        List<ShapePoint> shapePoints = schedule.getShapePoints(trip.shape_id);
        this.path = shapePoints.size() >= 2 ? PathGeometry.fromShapePoints(shapePoints) : PathGeometry.fromStops(stops);

        int n = stopTimes.size();
        stopDistances = new double[n];
        stopLats = new double[n];
        stopLons = new double[n];
        int timed = 0;
        double previous = 0;
        for (int i = 0; i < n; i++) {
            Stop stop = stops.get(i);
            stopLats[i] = stop.stop_lat;
            stopLons[i] = stop.stop_lon;
            // Stops must not go backwards along the path, even where the path passes by a stop twice.
            previous = path.projectAfter(stop.stop_lat, stop.stop_lon, previous);
            stopDistances[i] = previous;
            if (stopTimes.get(i).isTimed()) timed++;
        }
        knotTimes = new int[timed];
        knotDistances = new double[timed];
        int k = 0;
        for (int i = 0; i < n; i++) {
            StopTime stopTime = stopTimes.get(i);
            if (!stopTime.isTimed()) continue;
            knotTimes[k] = stopTime.getScheduledTime();
            knotDistances[k] = stopDistances[i];
            k++;
        }
    }

    public int firstScheduledTime () {
        return knotTimes[0];
    }

    public int lastScheduledTime () {
        return knotTimes[knotTimes.length - 1];
    }

    /**
     * @param secondsOfDay observed time as a GTFS time of the service day
     * @return whether the trip is scheduled to be running at that time, give or take the tolerance.
     */
    public boolean isInService (int secondsOfDay, int toleranceSeconds) {
        return secondsOfDay >= firstScheduledTime() - toleranceSeconds
                && secondsOfDay <= lastScheduledTime() + toleranceSeconds;
    }

    /**
     * @return how far along the path the vehicle is due at the given time. Before the first stop's time this is the
     * first stop, after the last stop's time the last stop.
     */
    public double expectedDistanceAt (int secondsOfDay) {
        int n = knotTimes.length;
        if (secondsOfDay <= knotTimes[0]) return knotDistances[0];
        if (secondsOfDay >= knotTimes[n - 1]) return knotDistances[n - 1];
        for (int i = 0; i < n - 1; i++) {
            int t0 = knotTimes[i];
            int t1 = knotTimes[i + 1];
            if (secondsOfDay >= t0 && secondsOfDay < t1) {
                double fraction = (secondsOfDay - t0) / (double) (t1 - t0);
                return knotDistances[i] + fraction * (knotDistances[i + 1] - knotDistances[i]);
            }
        }
        return knotDistances[n - 1];
    }

    /**
     * The inverse of {@link #expectedDistanceAt(int)}: when the vehicle is due at the given distance along the path.
     * Where the vehicle dwells (several knots at the same distance) the earliest time is used.
     */
    public double scheduledTimeAtDistance (double distanceAlong) {
        int n = knotTimes.length;
        if (distanceAlong <= knotDistances[0]) return knotTimes[0];
        if (distanceAlong >= knotDistances[n - 1]) return knotTimes[n - 1];
        for (int i = 0; i < n - 1; i++) {
            double d0 = knotDistances[i];
            double d1 = knotDistances[i + 1];
            if (d1 > d0 && distanceAlong >= d0 && distanceAlong <= d1) {
                double fraction = (distanceAlong - d0) / (d1 - d0);
                return knotTimes[i] + fraction * (knotTimes[i + 1] - knotTimes[i]);
            }
        }
        return knotTimes[n - 1];
    }

    /**
     * @return the great-circle distance from the position to the first stop lying beyond the given distance along
     * the path, or to the last stop if the vehicle is past all of them.
     */
    public double distanceToNextStop (double lat, double lon, double distanceAlong) {
        int n = stopDistances.length;
        int next = n - 1;
        for (int i = 0; i < n; i++) {
            if (stopDistances[i] > distanceAlong) {
                next = i;
                break;
            }
        }
        return Util.haversineDistance(lat, lon, stopLats[next], stopLons[next]);
    }

    /**
     * @return the scheduled time at the stop that is closest to the observed time, or null if the trip does not serve
     * the stop at a timed stop time. A trip may visit the same stop twice (loops), hence the closest one.
     */
    public Integer scheduledTimeAtStop (String stopId, int observedSecondsOfDay) {
        Integer best = null;
        for (StopTime stopTime : stopTimes) {
            if (!stopTime.isTimed() || !stopTime.stop_id.equals(stopId)) continue;
            int time = stopTime.getScheduledTime();
            if (best == null || Math.abs(observedSecondsOfDay - time) < Math.abs(observedSecondsOfDay - best)) {
                best = time;
            }
        }
        return best;
    }

}
