package com.conveyal.transitperf.matching;

/**
 * The scoring used to rank candidate trips for a position that carries no usable trip ID. Each term is in [0, 1],
 * 1 being a perfect fit:
 *
 * <ul>
 *   <li>distance term: 1 at the trip's expected position, falling linearly to 0 at {@link #MAX_DISTANCE_METERS};</li>
 *   <li>time term: 1 when the position is exactly on schedule, falling linearly to 0 at
 *   {@link #MAX_TIME_DELTA_SECONDS} either way, plus {@link #REALISM_ADJUSTMENT} when the implied delay is one buses
 *   commonly run (up to two minutes early, up to ten minutes late) and minus it when the bus would be running more
 *   than two minutes early, which is much rarer than running late.</li>
 * </ul>
 *
 * The score is the weighted sum {@link #DISTANCE_WEIGHT} * distance + {@link #TIME_WEIGHT} * time, clamped to [0, 1].
 * A candidate must score strictly above {@link #MATCH_THRESHOLD} to be accepted.
 */
public abstract class ConfidenceScore {

    public static final double DISTANCE_WEIGHT = 0.5;
    public static final double TIME_WEIGHT = 0.5;

    public static final double MAX_DISTANCE_METERS = 1000;
    public static final int MAX_TIME_DELTA_SECONDS = 15 * 60;

    public static final int PLAUSIBLE_EARLY_SECONDS = -2 * 60;
    public static final int PLAUSIBLE_LATE_SECONDS = 10 * 60;
    public static final double REALISM_ADJUSTMENT = 0.2;

    public static final double MATCH_THRESHOLD = 0.3;

    /** The default scorer, for use where a {@link MatchScorer} is expected. */
    public static final MatchScorer WEIGHTED = ConfidenceScore::score;

    public static double score (double distanceTerm, double timeTerm) {
        return clamp(DISTANCE_WEIGHT * distanceTerm + TIME_WEIGHT * timeTerm);
    }

    public static double distanceTerm (double distanceMeters) {
        return 1 - Math.min(Math.abs(distanceMeters), MAX_DISTANCE_METERS) / MAX_DISTANCE_METERS;
    }

    /**
     * @param timeDeltaSeconds observed time minus the time the trip is due at the observed place, so positive when
     *                         running late.
     */
    public static double timeTerm (double timeDeltaSeconds) {
        double term = 1 - Math.min(Math.abs(timeDeltaSeconds), MAX_TIME_DELTA_SECONDS) / MAX_TIME_DELTA_SECONDS;
        if (timeDeltaSeconds >= PLAUSIBLE_EARLY_SECONDS && timeDeltaSeconds <= PLAUSIBLE_LATE_SECONDS) {
            term += REALISM_ADJUSTMENT;
        } else if (timeDeltaSeconds < PLAUSIBLE_EARLY_SECONDS) {
            term -= REALISM_ADJUSTMENT;
        }
        return clamp(term);
    }

    /** Scores exactly at the threshold are rejected. */
    public static boolean isAccepted (double score) {
        return score > MATCH_THRESHOLD;
    }

    private static double clamp (double value) {
        return Math.max(0, Math.min(1, value));
    }

}
