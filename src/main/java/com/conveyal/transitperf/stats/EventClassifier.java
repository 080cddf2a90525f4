package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.matching.MatchResult;
import com.conveyal.transitperf.matching.TripSchedule;
import com.conveyal.transitperf.matching.TripScheduleCache;
import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.util.Util;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the match results of one route/day into arrival events at stops and speed samples between positions.
 */
public class EventClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(EventClassifier.class);

    /** Implied speeds above this are GPS noise, not buses. */
    public static final double MAX_SPEED_MPH = 70;

    private final TripScheduleCache tripSchedules;
    private final ZoneId zone;

    public EventClassifier (TripScheduleCache tripSchedules, ZoneId zone) {
        this.tripSchedules = tripSchedules;
        this.zone = zone;
    }

    public ClassifiedEvents classify (String routeId, LocalDate day, List<MatchResult> matches) {
        List<ArrivalEvent> stopObservations = new ArrayList<>();
        for (MatchResult match : matches) {
            ArrivalEvent event = toArrivalEvent(routeId, day, match);
            if (event != null) stopObservations.add(event);
        }
        List<ArrivalEvent> arrivals = lastObservationPerVisit(stopObservations);

        ListMultimap<String, MatchResult> matchesForVehicle = MultimapBuilder.treeKeys().arrayListValues().build();
        for (MatchResult match : matches) {
            if (match.sample.vehicle_id != null && match.sample.observed_at != null) {
                matchesForVehicle.put(match.sample.vehicle_id, match);
            }
        }
        List<SpeedSample> speeds = new ArrayList<>();
        int discarded = 0;
        for (String vehicleId : matchesForVehicle.keySet()) {
            List<MatchResult> vehicleMatches = new ArrayList<>(matchesForVehicle.get(vehicleId));
            vehicleMatches.sort(Comparator.comparing(m -> m.sample, PositionSample.OBSERVATION_ORDER));
            for (int i = 1; i < vehicleMatches.size(); i++) {
                MatchResult from = vehicleMatches.get(i - 1);
                MatchResult to = vehicleMatches.get(i);
                if (!from.isMatched() || !to.isMatched() || !from.trip_id.equals(to.trip_id)) continue;
                SpeedSample speed = toSpeedSample(from, to);
                if (speed == null) discarded++;
                else speeds.add(speed);
            }
        }
        LOG.debug("Route {} on {}: {} arrival events from {} samples at stops, {} speed samples ({} discarded)",
                routeId, day, arrivals.size(), stopObservations.size(), speeds.size(), discarded);
        return new ClassifiedEvents(arrivals, stopObservations, speeds, discarded);
    }

    /**
     * A vehicle seen more than once at a stop while serving one stop time of its trip has made one arrival. The last
     * observation stands for it, in the position of the first.
     */
    static List<ArrivalEvent> lastObservationPerVisit (List<ArrivalEvent> observations) {
        Map<List<Object>, ArrivalEvent> lastForVisit = new LinkedHashMap<>();
        for (ArrivalEvent event : observations) {
            List<Object> visit = Arrays.asList(event.vehicle_id, event.trip_id, event.stop_id,
                    event.scheduled_seconds_of_day);
            ArrivalEvent last = lastForVisit.get(visit);
            if (last == null || !event.observed_time_estimate.isBefore(last.observed_time_estimate)) {
                lastForVisit.put(visit, event);
            }
        }
        return new ArrayList<>(lastForVisit.values());
    }

    /**
     * @return an arrival event if the vehicle was at a stop that its trip is scheduled to serve, otherwise null.
     */
    private ArrivalEvent toArrivalEvent (String routeId, LocalDate day, MatchResult match) {
        if (!match.isAtStop() || match.schedule_deviation_seconds == null) return null;
        int deviation = match.schedule_deviation_seconds;
        Instant observed = match.sample.observed_at;
        Instant scheduled = observed.minusSeconds(deviation);
        int scheduledSecondsOfDay = Util.secondsOfServiceDay(scheduled, day, zone);
        return new ArrivalEvent(routeId, match.stop_id, match.trip_id, match.sample.vehicle_id, scheduled,
                scheduledSecondsOfDay, observed, deviation, match.distance_to_stop_meters);
    }

    /**
     * @return the speed between two positions along the trip's path, or null if it is not usable.
     */
    private SpeedSample toSpeedSample (MatchResult from, MatchResult to) {
        PositionSample a = from.sample;
        PositionSample b = to.sample;
        double elapsedSeconds = Duration.between(a.observed_at, b.observed_at).toMillis() / 1000.0;
        if (elapsedSeconds <= 0) return null;
        TripSchedule tripSchedule = tripSchedules.get(from.trip_id);
        if (tripSchedule == null) return null;
        double distance = Math.abs(tripSchedule.path.project(b.latitude, b.longitude)
                - tripSchedule.path.project(a.latitude, a.longitude));
        double mph = Util.metersPerSecondToMph(distance / elapsedSeconds);
        if (mph > MAX_SPEED_MPH) return null;
        return new SpeedSample(a.vehicle_id, from.trip_id, a.observed_at, b.observed_at, distance, elapsedSeconds, mph);
    }

}
