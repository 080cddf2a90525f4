package com.conveyal.transitperf.matching;

/**
 * Combines the distance and time plausibility of a candidate trip into one confidence value in [0, 1].
 */
@FunctionalInterface
public interface MatchScorer {

    double score (double distanceTerm, double timeTerm);

}
