package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.StopTime;
import com.conveyal.transitperf.model.Trip;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Estimates the gaps between successive vehicles at reference stops.
 *
 * Polling rarely catches a vehicle at the exact moment it reaches a stop. Each vehicle's pass of a stop is therefore
 * timed by its closest approach: of all the at-stop samples for one vehicle on one trip at one stop, the one nearest
 * to the stop gives the pass time.
 */
public class HeadwayEstimator {

    private static final Logger LOG = LoggerFactory.getLogger(HeadwayEstimator.class);

    /** A stop counts as served by most trips when at least this share of the busiest stop's trips visit it. */
    public static final double COMMON_STOP_SHARE = 0.8;

    /**
     * Pick the stop at which to measure headways: a stop served by nearly every trip of the route, as near the
     * middle of the route as possible so that both short-turn and full-length trips pass it.
     *
     * @return the stop ID, or null if the route has no trips.
     */
    public static String selectReferenceStop (ScheduleReference schedule, String routeId, LocalDate day) {
        List<Trip> trips = schedule.activeTrips(routeId, day);
        if (trips.isEmpty()) trips = schedule.tripsForRoute(routeId);
        Map<String, Integer> tripCount = new TreeMap<>();
        Map<String, Long> sequenceSum = new HashMap<>();
        Map<String, Integer> visitCount = new HashMap<>();
        for (Trip trip : trips) {
            Set<String> stopsOfTrip = new HashSet<>();
            for (StopTime stopTime : trip.stop_times) {
                if (stopsOfTrip.add(stopTime.stop_id)) tripCount.merge(stopTime.stop_id, 1, Integer::sum);
                sequenceSum.merge(stopTime.stop_id, (long) stopTime.stop_sequence, Long::sum);
                visitCount.merge(stopTime.stop_id, 1, Integer::sum);
            }
        }
        if (tripCount.isEmpty()) return null;
        int maxTrips = tripCount.values().stream().mapToInt(Integer::intValue).max().getAsInt();
        List<String> common = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : tripCount.entrySet()) {
            if (entry.getValue() >= COMMON_STOP_SHARE * maxTrips) common.add(entry.getKey());
        }
        // Stop IDs are already in order, and the sort is stable, so equal average sequences stay in stop ID order.
        common.sort(Comparator.comparingDouble(stopId -> sequenceSum.get(stopId) / (double) visitCount.get(stopId)));
        String referenceStop = common.get(common.size() / 2);
        LOG.debug("Reference stop for route {} is {} ({} common stops)", routeId, referenceStop, common.size());
        return referenceStop;
    }

    /**
     * @param arrivalsAtReferenceStops arrival events, which may include several events per vehicle pass.
     * @return one observation per pair of successive passes at each stop, ordered by stop then time.
     */
    public List<HeadwayObservation> estimate (String routeId, LocalDate day, List<ArrivalEvent> arrivalsAtReferenceStops) {
        ListMultimap<String, ArrivalEvent> eventsForStop = MultimapBuilder.treeKeys().arrayListValues().build();
        for (ArrivalEvent event : arrivalsAtReferenceStops) {
            eventsForStop.put(event.stop_id, event);
        }
        List<HeadwayObservation> observations = new ArrayList<>();
        for (String stopId : eventsForStop.keySet()) {
            List<ArrivalEvent> passes = closestApproaches(eventsForStop.get(stopId));
            passes.sort(Comparator.comparing((ArrivalEvent e) -> e.observed_time_estimate)
                    .thenComparing(e -> e.vehicle_id, Comparator.nullsFirst(Comparator.naturalOrder())));
            for (int i = 1; i < passes.size(); i++) {
                ArrivalEvent previous = passes.get(i - 1);
                ArrivalEvent next = passes.get(i);
                long gap = Duration.between(previous.observed_time_estimate, next.observed_time_estimate).getSeconds();
                observations.add(new HeadwayObservation(routeId, stopId, previous.vehicle_id, next.vehicle_id, gap, day));
            }
        }
        return observations;
    }

    /**
     * Reduce the events at one stop to one per vehicle pass, keeping the one closest to the stop. Among equally close
     * events the earliest is kept.
     */
    private static List<ArrivalEvent> closestApproaches (List<ArrivalEvent> events) {
        Map<List<String>, ArrivalEvent> closestForVisit = new LinkedHashMap<>();
        for (ArrivalEvent event : events) {
            List<String> visit = Arrays.asList(event.vehicle_id, event.trip_id);
            ArrivalEvent closest = closestForVisit.get(visit);
            if (closest == null
                    || event.distance_to_stop_meters < closest.distance_to_stop_meters
                    || (event.distance_to_stop_meters == closest.distance_to_stop_meters
                        && event.observed_time_estimate.isBefore(closest.observed_time_estimate))) {
                closestForVisit.put(visit, event);
            }
        }
        return new ArrayList<>(closestForVisit.values());
    }

}
