package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.util.Util;

/**
 * On-time performance over a set of arrival events. Every event counts once. Percentages are null rather than zero
 * when there are no events.
 */
public class OtpSummary {

    public int early_count;
    public int on_time_count;
    public int late_count;
    public Double avg_deviation_seconds;

    public static OtpSummary of (Iterable<ArrivalEvent> events) {
        OtpSummary summary = new OtpSummary();
        long deviationSum = 0;
        for (ArrivalEvent event : events) {
            switch (event.classification) {
                case EARLY: summary.early_count++; break;
                case ON_TIME: summary.on_time_count++; break;
                case LATE: summary.late_count++; break;
            }
            deviationSum += event.deviation_seconds;
        }
        int total = summary.getTotal();
        if (total > 0) summary.avg_deviation_seconds = Util.round((double) deviationSum / total, 1);
        return summary;
    }

    public int getTotal () {
        return early_count + on_time_count + late_count;
    }

    public Double getOnTimePercentage () {
        return percentage(on_time_count);
    }

    public Double getEarlyPercentage () {
        return percentage(early_count);
    }

    public Double getLatePercentage () {
        return percentage(late_count);
    }

    private Double percentage (int count) {
        int total = getTotal();
        if (total == 0) return null;
        return Util.round(count * 100.0 / total, 2);
    }

}
