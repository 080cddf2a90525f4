package com.conveyal.transitperf.matching;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tallies match outcomes for one route/day job, so that match rates can be reported alongside the metrics.
 */
public class MatchCounts {

    private int fastPath = 0;
    private int fallbackMatched = 0;
    private final Map<UnmatchedReason, Integer> unmatched = new EnumMap<>(UnmatchedReason.class);

    public void add (MatchResult result) {
        if (result.isMatched()) {
            if (result.path == MatchResult.Path.FAST) fastPath++;
            else fallbackMatched++;
        } else {
            unmatched.merge(result.reason, 1, Integer::sum);
        }
    }

    public int getFastPath () {
        return fastPath;
    }

    public int getFallbackMatched () {
        return fallbackMatched;
    }

    public int getMatched () {
        return fastPath + fallbackMatched;
    }

    public int getUnmatched (UnmatchedReason reason) {
        return unmatched.getOrDefault(reason, 0);
    }

    public int getUnmatched () {
        return unmatched.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getTotal () {
        return getMatched() + getUnmatched();
    }

    @Override
    public String toString () {
        return String.format("%d fast path, %d fallback, %d unmatched %s", fastPath, fallbackMatched, getUnmatched(), unmatched);
    }

}
