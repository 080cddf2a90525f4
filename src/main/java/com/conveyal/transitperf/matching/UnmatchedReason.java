package com.conveyal.transitperf.matching;

public enum UnmatchedReason {
    /** The best candidate trip scored at or below the confidence threshold. */
    LOW_CONFIDENCE("low_confidence"),
    /** No trip of the route is scheduled to run around the time of the sample. */
    NO_CANDIDATE_TRIPS("no_candidate_trips"),
    /** The sample has no timestamp or an impossible position. */
    MALFORMED_SAMPLE("malformed_sample");

    public final String code;

    UnmatchedReason (String code) {
        this.code = code;
    }

}
