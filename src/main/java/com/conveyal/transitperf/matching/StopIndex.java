package com.conveyal.transitperf.matching;

import com.conveyal.transitperf.error.MetricsException;
import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.Stop;
import com.conveyal.transitperf.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static com.conveyal.transitperf.error.MetricsErrorType.NO_STOPS;

/**
 * Answers "which stop of this route is nearest to this position" for one route. Only the stops visited by the
 * route's own trips are held, not every stop in the feed, which keeps each lookup to a few dozen distance
 * computations.
 *
 * An index is built once per route/day job and belongs to that job alone. It is never modified after construction.
 */
public class StopIndex {

    private static final Logger LOG = LoggerFactory.getLogger(StopIndex.class);

    /** A vehicle within this distance of a stop is considered to be at the stop. */
    public static final double AT_STOP_RADIUS_METERS = 50.0;

    public final String routeId;
    private final String[] stopIds;
    private final double[] lats;
    private final double[] lons;

    private StopIndex (String routeId, List<Stop> stops) {
        this.routeId = routeId;
        int n = stops.size();
        stopIds = new String[n];
        lats = new double[n];
        lons = new double[n];
        for (int i = 0; i < n; i++) {
            Stop stop = stops.get(i);
            stopIds[i] = stop.stop_id;
            lats[i] = stop.stop_lat;
            lons[i] = stop.stop_lon;
        }
    }

    /**
     * @throws MetricsException if no trip of the route visits any stop. Nothing can be matched for such a route.
     */
    public static StopIndex forRoute (ScheduleReference schedule, String routeId) {
        List<Stop> stops = schedule.stopsForRoute(routeId);
        if (stops.isEmpty()) {
            throw new MetricsException(NO_STOPS, routeId);
        }
        LOG.debug("Indexed {} stops for route {}", stops.size(), routeId);
        return new StopIndex(routeId, stops);
    }

    /**
     * @return the nearest stop of the route, or null if the index is for another route. When two stops are exactly
     * as close, the one with the smaller stop_id wins (stops are held in stop_id order).
     */
    public NearestStop nearest (String routeId, double lat, double lon) {
        if (!this.routeId.equals(routeId)) return null;
        int best = -1;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < stopIds.length; i++) {
            double distance = Util.haversineDistance(lat, lon, lats[i], lons[i]);
            if (distance < bestDistance) {
                best = i;
                bestDistance = distance;
            }
        }
        if (best < 0) return null;
        return new NearestStop(stopIds[best], bestDistance);
    }

    public static boolean isAtStop (double distanceMeters) {
        return distanceMeters <= AT_STOP_RADIUS_METERS;
    }

    public int size () {
        return stopIds.length;
    }

}
