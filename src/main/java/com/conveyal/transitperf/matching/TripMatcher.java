package com.conveyal.transitperf.matching;

import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.Trip;
import com.conveyal.transitperf.util.Util;
import com.google.common.base.Strings;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

/**
 * Assigns position samples of one route on one service day to scheduled trips.
 *
 * A sample whose trip ID names a trip of the same route is taken at its word, with confidence 1. Anything else is
 * compared against every trip of the route scheduled to be running around the time of the sample: where the trip
 * should be at that time versus where the vehicle is, and when the trip is due where the vehicle is versus when the
 * sample was taken. The best scoring candidate wins if it scores above {@link ConfidenceScore#MATCH_THRESHOLD}.
 *
 * One matcher serves one route/day job and must not be shared between threads.
 */
public class TripMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(TripMatcher.class);

    /** Scores closer than this are treated as a tie. */
    private static final double SCORE_EPSILON = 1e-9;

    private final ScheduleReference schedule;
    private final StopIndex stopIndex;
    private final TripScheduleCache tripSchedules;
    private final String routeId;
    private final LocalDate day;
    private final ZoneId zone;
    private final int candidateToleranceSeconds;
    private final MatchScorer scorer;
    private final List<Trip> candidateTrips;
    private final MatchCounts counts = new MatchCounts();

    public TripMatcher (TripScheduleCache tripSchedules, StopIndex stopIndex, LocalDate day, ZoneId zone,
                        int candidateToleranceSeconds, MatchScorer scorer) {
        this.schedule = tripSchedules.getSchedule();
        this.tripSchedules = tripSchedules;
        this.stopIndex = stopIndex;
        this.routeId = stopIndex.routeId;
        this.day = day;
        this.zone = zone;
        this.candidateToleranceSeconds = candidateToleranceSeconds;
        this.scorer = scorer;
        this.candidateTrips = schedule.activeTrips(routeId, day);
        LOG.debug("{} of {} trips on route {} are active on {}", candidateTrips.size(),
                schedule.tripsForRoute(routeId).size(), routeId, day);
    }

    public MatchResult match (PositionSample sample) {
        MatchResult result = doMatch(sample);
        counts.add(result);
        if (LOG.isDebugEnabled()) LOG.debug(result.toString());
        return result;
    }

    private MatchResult doMatch (PositionSample sample) {
        if (sample.observed_at == null || Strings.isNullOrEmpty(sample.vehicle_id)
                || !Util.isValidCoordinate(sample.latitude, sample.longitude)) {
            return MatchResult.unmatched(sample, UnmatchedReason.MALFORMED_SAMPLE, 0);
        }
        int secondsOfDay = Util.secondsOfServiceDay(sample.observed_at, day, zone);
        Trip hinted = schedule.getTrip(sample.trip_id_hint);
        if (hinted != null && hinted.route_id.equals(sample.route_id) && hinted.route_id.equals(routeId)) {
            return matchToTrip(sample, tripSchedules.get(hinted), secondsOfDay, MatchResult.Path.FAST, 1.0);
        }
        return matchByPosition(sample, secondsOfDay);
    }

    private MatchResult matchByPosition (PositionSample sample, int secondsOfDay) {
        TripSchedule best = null;
        double bestScore = -1;
        double bestNextStopDistance = Double.POSITIVE_INFINITY;
        for (Trip trip : candidateTrips) {
            TripSchedule candidate = tripSchedules.get(trip);
            if (!candidate.isInService(secondsOfDay, candidateToleranceSeconds)) continue;

            double observedAlong = candidate.path.project(sample.latitude, sample.longitude);
            Coordinate expected = candidate.path.pointAt(candidate.expectedDistanceAt(secondsOfDay));
            double distanceToExpected = Util.haversineDistance(sample.latitude, sample.longitude, expected.y, expected.x);
            double timeDelta = secondsOfDay - candidate.scheduledTimeAtDistance(observedAlong);
            double score = scorer.score(ConfidenceScore.distanceTerm(distanceToExpected), ConfidenceScore.timeTerm(timeDelta));

            double nextStopDistance = candidate.distanceToNextStop(sample.latitude, sample.longitude, observedAlong);
            boolean better = score > bestScore + SCORE_EPSILON
                    || (Math.abs(score - bestScore) <= SCORE_EPSILON && nextStopDistance < bestNextStopDistance);
            if (better) {
                best = candidate;
                bestScore = score;
                bestNextStopDistance = nextStopDistance;
            }
        }
        if (best == null) {
            return MatchResult.unmatched(sample, UnmatchedReason.NO_CANDIDATE_TRIPS, 0);
        }
        if (!ConfidenceScore.isAccepted(bestScore)) {
            return MatchResult.unmatched(sample, UnmatchedReason.LOW_CONFIDENCE, bestScore);
        }
        return matchToTrip(sample, best, secondsOfDay, MatchResult.Path.FALLBACK, bestScore);
    }

    private MatchResult matchToTrip (PositionSample sample, TripSchedule tripSchedule, int secondsOfDay,
                                     MatchResult.Path path, double confidence) {
        NearestStop stop = stopIndex.nearest(routeId, sample.latitude, sample.longitude);
        Integer deviation = null;
        if (stop != null) {
            Integer scheduled = tripSchedule.scheduledTimeAtStop(stop.stop_id, secondsOfDay);
            if (scheduled != null) deviation = secondsOfDay - scheduled;
        }
        return MatchResult.matched(sample, path, tripSchedule.trip.trip_id, stop, confidence, deviation);
    }

    public MatchCounts getCounts () {
        return counts;
    }

}
