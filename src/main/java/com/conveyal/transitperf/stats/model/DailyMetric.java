package com.conveyal.transitperf.stats.model;

import com.conveyal.transitperf.stats.HeadwayStatistics;
import com.conveyal.transitperf.stats.OtpBreakdown;
import com.conveyal.transitperf.stats.OtpSummary;
import com.conveyal.transitperf.stats.SpeedStatistics;
import com.conveyal.transitperf.stats.TimePeriod;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * The metrics of one route on one service day, as stored in the daily_metrics table (one row per route and day)
 * and read by the serving layer. Any statistic that could not be computed is null. A null never stands for zero.
 */
public class DailyMetric implements Serializable {

    private static final long serialVersionUID = 1L;

    public String route_id;
    public LocalDate service_date;

    // On-time performance over all arrival events
    public Double otp_percentage;
    public Double early_percentage;
    public Double late_percentage;
    public int total_arrivals;
    public Double avg_deviation_seconds;

    // Headways at the reference stop
    public String reference_stop_id;
    public int headway_count;
    public Double avg_headway_minutes;
    public Double median_headway_minutes;
    public Double min_headway_minutes;
    public Double max_headway_minutes;
    public Double headway_std_dev_minutes;
    public Double headway_cv;
    public int headway_data_gaps;

    // Speed along the route's paths
    public Double avg_speed_mph;
    public Double median_speed_mph;
    public int speed_sample_count;

    // Coverage
    public int matched_samples;
    public int total_samples;
    public int unique_vehicles;
    public int unique_trips;
    public Instant last_sample_at;

    /** Stored in daily_stop_otp. Not filled in when read back from the database. */
    public transient SortedMap<String, OtpSummary> stop_otp = Collections.emptySortedMap();
    /** Stored in daily_period_otp. Not filled in when read back from the database. */
    public transient Map<TimePeriod, OtpSummary> period_otp = Collections.emptyMap();

    public DailyMetric () { }

    public DailyMetric (String route_id, LocalDate service_date) {
        this.route_id = route_id;
        this.service_date = service_date;
    }

    public void setOtp (OtpBreakdown otp) {
        otp_percentage = otp.line.getOnTimePercentage();
        early_percentage = otp.line.getEarlyPercentage();
        late_percentage = otp.line.getLatePercentage();
        total_arrivals = otp.line.getTotal();
        avg_deviation_seconds = otp.line.avg_deviation_seconds;
        stop_otp = otp.byStop;
        period_otp = otp.byPeriod;
    }

    public void setHeadways (String referenceStopId, HeadwayStatistics headways) {
        reference_stop_id = referenceStopId;
        headway_count = headways.count;
        avg_headway_minutes = headways.mean_minutes;
        median_headway_minutes = headways.median_minutes;
        min_headway_minutes = headways.min_minutes;
        max_headway_minutes = headways.max_minutes;
        headway_std_dev_minutes = headways.std_dev_minutes;
        headway_cv = headways.cv;
        headway_data_gaps = headways.data_gaps;
    }

    public void setSpeeds (SpeedStatistics speeds) {
        avg_speed_mph = speeds.avg_speed_mph;
        median_speed_mph = speeds.median_speed_mph;
        speed_sample_count = speeds.count;
    }

}
