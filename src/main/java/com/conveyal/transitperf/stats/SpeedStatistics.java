package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.util.Util;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;

import java.util.List;

/**
 * Average speed is total distance over total time, so long intervals weigh more than short ones. The median is
 * over the individual samples.
 */
public class SpeedStatistics {

    public int count;
    public Double avg_speed_mph;
    public Double median_speed_mph;

    public static SpeedStatistics of (List<SpeedSample> samples) {
        SpeedStatistics statistics = new SpeedStatistics();
        DescriptiveStatistics speeds = new DescriptiveStatistics();
        double totalDistance = 0;
        double totalSeconds = 0;
        for (SpeedSample sample : samples) {
            speeds.addValue(sample.speed_mph);
            totalDistance += sample.distance_meters;
            totalSeconds += sample.elapsed_seconds;
        }
        statistics.count = samples.size();
        if (statistics.count > 0 && totalSeconds > 0) {
            statistics.avg_speed_mph = Util.round(Util.metersPerSecondToMph(totalDistance / totalSeconds), 2);
            statistics.median_speed_mph = Util.round(speeds.getPercentile(50), 2);
        }
        return statistics;
    }

}
