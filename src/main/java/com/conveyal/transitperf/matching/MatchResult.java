package com.conveyal.transitperf.matching;

import com.conveyal.transitperf.model.PositionSample;

/**
 * The outcome of matching one position sample to the schedule. Match results are recomputed on every run and are
 * never stored.
 */
public class MatchResult {

    public enum Path {
        /** The sample's own trip ID was trusted. */
        FAST,
        /** The trip was inferred from position and time. */
        FALLBACK
    }

    public final PositionSample sample;
    public final Path path;
    public final String trip_id;
    public final String stop_id;
    /** 1.0 on the fast path. On an unmatched sample, the best fallback score seen, or 0 if there was no candidate. */
    public final double confidence;
    /** Observed minus scheduled time at the matched stop, null when the matched trip does not serve the stop. */
    public final Integer schedule_deviation_seconds;
    public final Double distance_to_stop_meters;
    public final UnmatchedReason reason;

    private MatchResult (PositionSample sample, Path path, String tripId, String stopId, double confidence,
                         Integer scheduleDeviationSeconds, Double distanceToStopMeters, UnmatchedReason reason) {
        this.sample = sample;
        this.path = path;
        this.trip_id = tripId;
        this.stop_id = stopId;
        this.confidence = confidence;
        this.schedule_deviation_seconds = scheduleDeviationSeconds;
        this.distance_to_stop_meters = distanceToStopMeters;
        this.reason = reason;
    }

    public static MatchResult matched (PositionSample sample, Path path, String tripId, NearestStop stop,
                                       double confidence, Integer scheduleDeviationSeconds) {
        return new MatchResult(sample, path, tripId, stop == null ? null : stop.stop_id, confidence,
                scheduleDeviationSeconds, stop == null ? null : stop.distance_meters, null);
    }

    public static MatchResult unmatched (PositionSample sample, UnmatchedReason reason, double bestScore) {
        return new MatchResult(sample, null, null, null, bestScore, null, null, reason);
    }

    public boolean isMatched () {
        return reason == null;
    }

    /** @return whether the vehicle was close enough to its nearest stop to count as being at it. */
    public boolean isAtStop () {
        return isMatched() && distance_to_stop_meters != null && StopIndex.isAtStop(distance_to_stop_meters);
    }

    @Override
    public String toString () {
        if (isMatched()) {
            return String.format("%s matched to trip %s (%s, confidence %.2f)", sample, trip_id, path, confidence);
        }
        return String.format("%s unmatched (%s)", sample, reason.code);
    }

}
