package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.util.Util;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Summary of a day's headways in minutes. The standard deviation and the coefficient of variation describe how
 * regular the service is (bunching shows up as a high CV); they need at least two gaps and are null otherwise.
 */
public class HeadwayStatistics {

    public static final double DEFAULT_MAX_HEADWAY_MINUTES = 120;

    /** Gaps used in the statistics. */
    public int count;
    /** Gaps longer than the maximum, taken to be holes in the data rather than real headways. */
    public int data_gaps;
    public Double mean_minutes;
    public Double median_minutes;
    public Double min_minutes;
    public Double max_minutes;
    public Double std_dev_minutes;
    public Double cv;

    public static HeadwayStatistics of (List<HeadwayObservation> observations, double maxHeadwayMinutes) {
        HeadwayStatistics statistics = new HeadwayStatistics();
        DescriptiveStatistics gaps = new DescriptiveStatistics();
        for (HeadwayObservation observation : observations) {
            if (observation.getGapMinutes() > maxHeadwayMinutes) {
                statistics.data_gaps++;
            } else {
                gaps.addValue(observation.getGapMinutes());
            }
        }
        statistics.count = (int) gaps.getN();
        if (statistics.count >= 1) {
            statistics.mean_minutes = Util.round(gaps.getMean(), 2);
            statistics.median_minutes = Util.round(gaps.getPercentile(50), 2);
            statistics.min_minutes = Util.round(gaps.getMin(), 2);
            statistics.max_minutes = Util.round(gaps.getMax(), 2);
        }
        if (statistics.count >= 2) {
            double mean = gaps.getMean();
            double stdDev = gaps.getStandardDeviation();
            statistics.std_dev_minutes = Util.round(stdDev, 2);
            if (mean > 0) statistics.cv = Util.round(stdDev / mean, 3);
        }
        return statistics;
    }

}
