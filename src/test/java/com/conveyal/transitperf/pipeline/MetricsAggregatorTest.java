package com.conveyal.transitperf.pipeline;

import com.conveyal.transitperf.TestUtils;
import com.conveyal.transitperf.loader.JdbcPositionReader;
import com.conveyal.transitperf.loader.JdbcScheduleReader;
import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.stats.model.DailyMetric;
import com.conveyal.transitperf.stats.model.RollingSummary;
import com.conveyal.transitperf.storage.MetricsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.util.Arrays;
import java.util.List;

import static com.conveyal.transitperf.TestUtils.DAY;
import static com.conveyal.transitperf.TestUtils.STOP_LON;
import static com.conveyal.transitperf.TestUtils.assertThatSqlCountQueryYieldsExpectedCount;
import static com.conveyal.transitperf.TestUtils.at;
import static com.conveyal.transitperf.TestUtils.north;
import static com.conveyal.transitperf.TestUtils.sample;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;

/**
 * Runs the whole pipeline against an in-memory database holding the C51 feed, a day of positions and the metrics
 * tables.
 *
 * Two buses pass the middle stop S1 on schedule, each seen once just before and once just after it:
 * vehicle V on trip T1 around 08:04 and vehicle W on trip T2 around 08:22. Route X51 has positions but no schedule.
 */
public class MetricsAggregatorTest {

    private static final String FEED = "feed_2024";

    private DataSource dataSource;
    private MetricsAggregator aggregator;
    private MetricsStore store;

    @BeforeEach
    public void setUp() {
        dataSource = TestUtils.createTestDataSource();
        TestUtils.loadC51Feed(dataSource, FEED, true);
        TestUtils.createPositionTables(dataSource);
        double s1 = 38.91;
        List<PositionSample> c51 = Arrays.asList(
            sample(1, "V", "T1", north(s1, -12), STOP_LON, "08:03:30"),
            // The same report served again by the feed.
            sample(2, "V", "T1", north(s1, -12), STOP_LON, "08:03:30"),
            sample(3, "V", "T1", north(s1, 8), STOP_LON, "08:04:30"),
            sample(4, "W", "T2", north(s1, -30), STOP_LON, "08:21:30"),
            sample(5, "W", "T2", north(s1, 6), STOP_LON, "08:22:30"),
            // The evening before belongs to the previous service day.
            sample(6, "V", "T1", north(s1, 0), STOP_LON, "00:00:00")
        );
        c51.get(5).observed_at = at("00:00:00").minusSeconds(1);
        TestUtils.insertPositions(dataSource, "C51", c51);
        TestUtils.insertPositions(dataSource, "X51", Arrays.asList(
            sample(7, "Q", null, 39.0, -77.0, "09:00:00")
        ));
        TestUtils.execute(dataSource,
            "insert into vendor_deviations values ('V', 'C51', 0.5, timestamp with time zone '2024-03-12 12:04:00+00')");

        AggregationConfig config = new AggregationConfig();
        config.vendorTable = "vendor_deviations";
        config.workerThreads = 2;
        store = new MetricsStore(dataSource, null);
        aggregator = new MetricsAggregator(new JdbcScheduleReader(dataSource, FEED),
                new JdbcPositionReader(dataSource, config.positionTable, config.vendorTable), store, config);
    }

    @Test
    public void computesDailyMetricsForEveryRouteWithSamples() {
        RunResult result = aggregator.run(RunParameters.singleDay(DAY, null, false));
        assertThat(result.jobs, hasSize(2));
        assertThat(result.persisted, equalTo(1));
        assertThat(result.failed, equalTo(1));
        assertThat(result.isSuccess(), equalTo(true));

        JobResult c51 = result.jobs.get(0);
        assertThat(c51.route_id, equalTo("C51"));
        assertThat(c51.status, equalTo(JobState.PERSISTED));
        assertThat(c51.samples_seen, equalTo(5));
        assertThat(c51.duplicates_removed, equalTo(1));
        assertThat(c51.samples_matched, equalTo(4));
        assertThat(c51.events_produced, equalTo(2));
        assertThat(c51.headway_observations, equalTo(1));

        JobResult x51 = result.jobs.get(1);
        assertThat(x51.route_id, equalTo("X51"));
        assertThat(x51.status, equalTo(JobState.FAILED));
        assertThat(x51.reason, equalTo("no_schedule"));

        DailyMetric metric = store.readDailyMetric("C51", DAY);
        assertThat(metric.otp_percentage, equalTo(100.0));
        // One arrival per bus, each taken from its last sample at S1.
        assertThat(metric.total_arrivals, equalTo(2));
        assertThat(metric.avg_deviation_seconds, equalTo(30.0));
        assertThat(metric.reference_stop_id, equalTo("S1"));
        assertThat(metric.headway_count, equalTo(1));
        assertThat(metric.avg_headway_minutes, equalTo(18.0));
        assertThat(metric.headway_std_dev_minutes, nullValue());
        assertThat(metric.speed_sample_count, equalTo(2));
        assertThat(metric.matched_samples, equalTo(4));
        assertThat(metric.total_samples, equalTo(4));
        assertThat(metric.unique_vehicles, equalTo(2));
        assertThat(metric.unique_trips, equalTo(2));
        assertThat(metric.last_sample_at, equalTo(at("08:22:30")));
        assertThat(store.readDailyMetric("X51", DAY), nullValue());

        assertThatSqlCountQueryYieldsExpectedCount(dataSource,
                "select count(*) from daily_stop_otp where route_id = 'C51' and stop_id = 'S1' and on_time_count = 2", 1);
        assertThatSqlCountQueryYieldsExpectedCount(dataSource,
                "select count(*) from daily_period_otp where route_id = 'C51' and time_period = 'AM_PEAK'", 1);
        assertThatSqlCountQueryYieldsExpectedCount(dataSource,
                "select count(*) from vendor_deviation_daily where route_id = 'C51' and observations = 1", 1);

        RollingSummary summary = store.readRollingSummary("C51");
        assertThat(summary.days_with_data, equalTo(1));
        assertThat(summary.window_end, equalTo(DAY));
        assertThat(summary.avg_headway_minutes, equalTo(18.0));
    }

    @Test
    public void recalculatingGivesTheSameRows() {
        aggregator.run(RunParameters.singleDay(DAY, "C51", true));
        List<List<Object>> metrics = TestUtils.readRows(dataSource, "select * from daily_metrics order by route_id");
        List<List<Object>> stops = TestUtils.readRows(dataSource, "select * from daily_stop_otp order by stop_id");
        List<List<Object>> summaries = TestUtils.readRows(dataSource, "select * from rolling_summaries");

        RunResult again = aggregator.run(RunParameters.singleDay(DAY, "C51", true));
        assertThat(again.persisted, equalTo(1));
        assertThat(TestUtils.readRows(dataSource, "select * from daily_metrics order by route_id"), equalTo(metrics));
        assertThat(TestUtils.readRows(dataSource, "select * from daily_stop_otp order by stop_id"), equalTo(stops));
        assertThat(TestUtils.readRows(dataSource, "select * from rolling_summaries"), equalTo(summaries));
    }

    @Test
    public void existingDaysAreSkippedUnlessRecalculating() {
        aggregator.run(RunParameters.singleDay(DAY, "C51", false));
        RunResult second = aggregator.run(new RunParameters(DAY, DAY.plusDays(1), "C51", false));
        assertThat(second.jobs, hasSize(2));
        assertThat(second.jobs.get(0).status, equalTo(JobState.SKIPPED));
        // Wednesday 2024-03-13 has no positions.
        assertThat(second.jobs.get(1).status, equalTo(JobState.FAILED));
        assertThat(second.jobs.get(1).reason, equalTo("no_samples"));
        assertThat(second.skipped, equalTo(1));
        assertThat(second.isSuccess(), equalTo(false));
    }

    @Test
    public void routeFilterLimitsTheRun() {
        RunResult result = aggregator.run(RunParameters.singleDay(DAY, "X51", false));
        assertThat(result.jobs, hasSize(1));
        assertThat(result.isSuccess(), equalTo(false));
        assertThatSqlCountQueryYieldsExpectedCount(dataSource, "select count(*) from daily_metrics", 0);
    }

}
