package com.conveyal.transitperf.stats.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

public class RollingSummaryTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 3, 11);

    private static DailyMetric metric(String routeId, LocalDate day, Double otp, Double headway, int arrivals) {
        DailyMetric metric = new DailyMetric(routeId, day);
        metric.otp_percentage = otp;
        metric.avg_headway_minutes = headway;
        metric.total_arrivals = arrivals;
        metric.total_samples = 100;
        metric.matched_samples = 90;
        metric.unique_vehicles = 3;
        metric.last_sample_at = day.atStartOfDay().toInstant(ZoneOffset.UTC);
        return metric;
    }

    @Test
    public void windowEndsOnLatestDay() {
        List<DailyMetric> metrics = Arrays.asList(
            metric("C51", MONDAY, 80.0, 10.0, 10),
            metric("C51", MONDAY.plusDays(2), 90.0, null, 30),
            // Outside a 7 day window ending on Wednesday.
            metric("C51", MONDAY.minusDays(7), 10.0, 60.0, 1000),
            metric("X2", MONDAY.plusDays(3), 0.0, 99.0, 5)
        );
        RollingSummary summary = RollingSummary.fromDailyMetrics("C51", 7, metrics);
        assertThat(summary.window_end, equalTo(MONDAY.plusDays(2)));
        assertThat(summary.window_start, equalTo(MONDAY.minusDays(4)));
        assertThat(summary.window_days, equalTo(7));
        assertThat(summary.days_with_data, equalTo(2));
        assertThat(summary.avg_otp_percentage, equalTo(85.0));
        // Only known on one day.
        assertThat(summary.avg_headway_minutes, equalTo(10.0));
        assertThat(summary.avg_speed_mph, nullValue());
        assertThat(summary.total_arrivals, equalTo(40L));
        assertThat(summary.total_samples, equalTo(200L));
        assertThat(summary.total_matched_samples, equalTo(180L));
        assertThat(summary.vehicle_days, equalTo(6L));
        assertThat(summary.last_sample_at, equalTo(Instant.parse("2024-03-13T00:00:00Z")));
    }

    @Test
    public void singleDayWindow() {
        RollingSummary summary = RollingSummary.fromDailyMetrics("C51", 1, Arrays.asList(
            metric("C51", MONDAY, 80.0, 10.0, 10),
            metric("C51", MONDAY.plusDays(1), 70.0, 12.0, 10)
        ));
        assertThat(summary.window_start, equalTo(MONDAY.plusDays(1)));
        assertThat(summary.days_with_data, equalTo(1));
        assertThat(summary.avg_otp_percentage, equalTo(70.0));
    }

    @Test
    public void resultDoesNotDependOnRowOrder() {
        List<DailyMetric> metrics = new ArrayList<>();
        for (int i = 0; i < 7; i++) metrics.add(metric("C51", MONDAY.plusDays(i), 70.0 + i * 3.3, 10.0 + i / 3.0, i));
        RollingSummary inOrder = RollingSummary.fromDailyMetrics("C51", 7, metrics);
        Collections.reverse(metrics);
        RollingSummary reversed = RollingSummary.fromDailyMetrics("C51", 7, metrics);
        assertThat(reversed.avg_otp_percentage, equalTo(inOrder.avg_otp_percentage));
        assertThat(reversed.avg_headway_minutes, equalTo(inOrder.avg_headway_minutes));
        assertThat(reversed.window_end, equalTo(inOrder.window_end));
    }

    @Test
    public void noMetricsNoSummary() {
        assertThat(RollingSummary.fromDailyMetrics("C51", 7, Collections.emptyList()), nullValue());
        assertThat(RollingSummary.fromDailyMetrics("C51", 7,
                Collections.singletonList(metric("X2", MONDAY, 1.0, 1.0, 1))), nullValue());
    }

}
