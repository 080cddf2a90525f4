package com.conveyal.transitperf.stats.model;

import com.conveyal.transitperf.util.Util;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * The metrics of one route over a trailing window of days. A summary is derived only from daily metrics, never from
 * raw positions, so it can be rebuilt at any time from the daily_metrics table.
 */
public class RollingSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_WINDOW_DAYS = 7;

    public String route_id;
    public LocalDate window_start;
    public LocalDate window_end;
    public int window_days;
    public int days_with_data;

    public Double avg_otp_percentage;
    public Double avg_early_percentage;
    public Double avg_late_percentage;
    public Double avg_headway_minutes;
    public Double avg_headway_cv;
    public Double avg_speed_mph;

    public long total_arrivals;
    public long total_samples;
    public long total_matched_samples;
    /** Sum over the days of each day's unique vehicle count. */
    public long vehicle_days;
    public Instant last_sample_at;

    /**
     * The window ends on the latest day among the daily metrics and reaches windowDays - 1 days back from it. Daily
     * metrics outside the window are ignored. Averages are taken over the days where the value is known, and are null
     * if it is known on no day.
     *
     * @return the summary, or null if there are no daily metrics at all.
     */
    public static RollingSummary fromDailyMetrics (String routeId, int windowDays, List<DailyMetric> dailyMetrics) {
        LocalDate latest = null;
        for (DailyMetric metric : dailyMetrics) {
            if (!metric.route_id.equals(routeId)) continue;
            if (latest == null || metric.service_date.isAfter(latest)) latest = metric.service_date;
        }
        if (latest == null) return null;
        RollingSummary summary = new RollingSummary();
        summary.route_id = routeId;
        summary.window_days = windowDays;
        summary.window_end = latest;
        summary.window_start = latest.minusDays(windowDays - 1);
        List<DailyMetric> inWindow = new ArrayList<>();
        for (DailyMetric metric : dailyMetrics) {
            if (!metric.route_id.equals(routeId)) continue;
            if (metric.service_date.isBefore(summary.window_start) || metric.service_date.isAfter(latest)) continue;
            inWindow.add(metric);
        }
        // Sum in date order so the floating point result does not depend on the order rows were read in.
        inWindow.sort(Comparator.comparing(m -> m.service_date));
        summary.days_with_data = inWindow.size();
        summary.avg_otp_percentage = average(inWindow, m -> m.otp_percentage, 2);
        summary.avg_early_percentage = average(inWindow, m -> m.early_percentage, 2);
        summary.avg_late_percentage = average(inWindow, m -> m.late_percentage, 2);
        summary.avg_headway_minutes = average(inWindow, m -> m.avg_headway_minutes, 2);
        summary.avg_headway_cv = average(inWindow, m -> m.headway_cv, 3);
        summary.avg_speed_mph = average(inWindow, m -> m.avg_speed_mph, 2);
        for (DailyMetric metric : inWindow) {
            summary.total_arrivals += metric.total_arrivals;
            summary.total_samples += metric.total_samples;
            summary.total_matched_samples += metric.matched_samples;
            summary.vehicle_days += metric.unique_vehicles;
            if (metric.last_sample_at != null
                    && (summary.last_sample_at == null || metric.last_sample_at.isAfter(summary.last_sample_at))) {
                summary.last_sample_at = metric.last_sample_at;
            }
        }
        return summary;
    }

    private static Double average (List<DailyMetric> metrics, Function<DailyMetric, Double> field, int places) {
        double sum = 0;
        int n = 0;
        for (DailyMetric metric : metrics) {
            Double value = field.apply(metric);
            if (value == null) continue;
            sum += value;
            n++;
        }
        if (n == 0) return null;
        return Util.round(sum / n, places);
    }

}
