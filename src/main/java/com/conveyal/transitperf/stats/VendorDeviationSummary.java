package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.model.VendorDeviationSample;
import com.conveyal.transitperf.util.Util;

import java.util.List;

/**
 * On-time performance according to the vendor's own deviation field, using the same thresholds as arrival events.
 * This is kept apart from the arrival-based figures and only serves to cross-check them.
 */
public class VendorDeviationSummary {

    public int observations;
    public int early_count;
    public int on_time_count;
    public int late_count;
    public Double avg_deviation_minutes;

    public static VendorDeviationSummary of (List<VendorDeviationSample> samples) {
        VendorDeviationSummary summary = new VendorDeviationSummary();
        double sum = 0;
        for (VendorDeviationSample sample : samples) {
            if (sample.deviation_minutes == null || !Double.isFinite(sample.deviation_minutes)) continue;
            switch (Classification.of(sample.deviation_minutes * 60)) {
                case EARLY: summary.early_count++; break;
                case ON_TIME: summary.on_time_count++; break;
                case LATE: summary.late_count++; break;
            }
            sum += sample.deviation_minutes;
            summary.observations++;
        }
        if (summary.observations > 0) summary.avg_deviation_minutes = Util.round(sum / summary.observations, 2);
        return summary;
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
        if (observations == 0) return null;
        return Util.round(count * 100.0 / observations, 2);
    }

}
