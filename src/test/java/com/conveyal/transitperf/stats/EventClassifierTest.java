package com.conveyal.transitperf.stats;

import com.conveyal.transitperf.TestUtils;
import com.conveyal.transitperf.matching.ConfidenceScore;
import com.conveyal.transitperf.matching.MatchResult;
import com.conveyal.transitperf.matching.StopIndex;
import com.conveyal.transitperf.matching.TripMatcher;
import com.conveyal.transitperf.matching.TripScheduleCache;
import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.model.ScheduleReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.transitperf.TestUtils.DAY;
import static com.conveyal.transitperf.TestUtils.STOP_LON;
import static com.conveyal.transitperf.TestUtils.ZONE;
import static com.conveyal.transitperf.TestUtils.at;
import static com.conveyal.transitperf.TestUtils.north;
import static com.conveyal.transitperf.TestUtils.sample;
import static com.conveyal.transitperf.TestUtils.seconds;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;

public class EventClassifierTest {

    private TripScheduleCache tripSchedules;
    private TripMatcher matcher;
    private EventClassifier classifier;

    @BeforeEach
    public void setUp() {
        ScheduleReference schedule = TestUtils.c51Schedule();
        tripSchedules = new TripScheduleCache(schedule);
        matcher = new TripMatcher(tripSchedules, StopIndex.forRoute(schedule, "C51"), DAY, ZONE, 900,
                ConfidenceScore.WEIGHTED);
        classifier = new EventClassifier(tripSchedules, ZONE);
    }

    private ClassifiedEvents classify(PositionSample... samples) {
        List<MatchResult> matches = new ArrayList<>();
        for (PositionSample sample : samples) matches.add(matcher.match(sample));
        return classifier.classify("C51", DAY, matches);
    }

    @Test
    public void arrivalEventsOnlyAtStops() {
        ClassifiedEvents events = classify(
            sample(1, "V", "T1", 38.90, STOP_LON, "07:59:00"),
            sample(2, "V", "T1", 38.905, STOP_LON, "08:02:00"),
            sample(3, "V", "T1", north(38.91, 40), STOP_LON, "08:10:00")
        );
        assertThat(events.arrivals, hasSize(2));
        ArrivalEvent early = events.arrivals.get(0);
        assertThat(early.stop_id, equalTo("S0"));
        assertThat(early.deviation_seconds, equalTo(-60));
        assertThat(early.classification, equalTo(Classification.ON_TIME));
        assertThat(early.scheduled_time, equalTo(at("08:00:00")));
        assertThat(early.scheduled_seconds_of_day, equalTo(seconds("08:00:00")));
        assertThat(early.getTimePeriod(), equalTo(TimePeriod.AM_PEAK));
        ArrivalEvent late = events.arrivals.get(1);
        assertThat(late.stop_id, equalTo("S1"));
        assertThat(late.deviation_seconds, equalTo(360));
        assertThat(late.classification, equalTo(Classification.LATE));
        assertThat(late.observed_time_estimate, equalTo(at("08:10:00")));
    }

    @Test
    public void vehicleSeenTwiceAtAStopArrivesOnce() {
        ClassifiedEvents events = classify(
            sample(1, "V", "T1", north(38.91, -10), STOP_LON, "08:02:50"),
            sample(2, "V", "T1", north(38.91, 5), STOP_LON, "08:04:10"),
            sample(3, "W", "T2", north(38.91, 0), STOP_LON, "08:22:00")
        );
        assertThat(events.stopObservations, hasSize(3));
        assertThat(events.arrivals, hasSize(2));
        ArrivalEvent dwell = events.arrivals.get(0);
        assertThat(dwell.vehicle_id, equalTo("V"));
        assertThat(dwell.deviation_seconds, equalTo(10));
        assertThat(dwell.observed_time_estimate, equalTo(at("08:04:10")));

        OtpBreakdown otp = OtpBreakdown.of(events.arrivals);
        assertThat(otp.line.getTotal(), equalTo(2));
        assertThat(otp.line.getOnTimePercentage(), equalTo(100.0));
        assertThat(otp.line.early_count, equalTo(0));
    }

    @Test
    public void unmatchedSamplesProduceNothing() {
        ClassifiedEvents events = classify(sample(1, "V", null, 38.91, STOP_LON, "03:00:00"));
        assertThat(events.arrivals, hasSize(0));
        assertThat(events.speeds, hasSize(0));
    }

    @Test
    public void speedIsMeasuredAlongThePath() {
        ClassifiedEvents events = classify(
            sample(1, "V", "T1", 38.90, STOP_LON, "08:00:00"),
            sample(2, "V", "T1", 38.91, STOP_LON, "08:02:00")
        );
        assertThat(events.speeds, hasSize(1));
        SpeedSample speed = events.speeds.get(0);
        assertThat(speed.distance_meters, closeTo(1111.11, 0.01));
        assertThat(speed.elapsed_seconds, equalTo(120.0));
        // 9.26 m/s
        assertThat(speed.speed_mph, closeTo(20.71, 0.01));
        assertThat(events.discardedSpeedSamples, equalTo(0));
    }

    @Test
    public void impossibleSpeedsAndZeroElapsedTimeAreDiscarded() {
        ClassifiedEvents events = classify(
            sample(1, "V", "T1", 38.90, STOP_LON, "08:00:00"),
            // Same instant, different place.
            sample(2, "V", "T1", 38.901, STOP_LON, "08:00:00"),
            // 2.1 km in a minute is about 78 mph.
            sample(3, "V", "T1", 38.92, STOP_LON, "08:01:00")
        );
        assertThat(events.speeds, hasSize(0));
        assertThat(events.discardedSpeedSamples, equalTo(2));
    }

    @Test
    public void speedPairsNeverSpanTwoTrips() {
        ClassifiedEvents events = classify(
            sample(1, "V", "T1", 38.91, STOP_LON, "08:04:00"),
            sample(2, "V", "T2", 38.90, STOP_LON, "08:18:00"),
            sample(3, "W", "T2", 38.90, STOP_LON, "08:18:00"),
            sample(4, "W", "T2", 38.91, STOP_LON, "08:22:00")
        );
        assertThat(events.speeds, hasSize(1));
        assertThat(events.speeds.get(0).vehicle_id, equalTo("W"));
    }

    @Test
    public void otpCountsEveryEventOnce() {
        ClassifiedEvents events = classify(
            sample(1, "V", "T1", 38.90, STOP_LON, "07:58:00"),
            sample(2, "V", "T1", 38.91, STOP_LON, "08:04:30"),
            sample(3, "V", "T1", 38.92, STOP_LON, "08:14:00"),
            sample(4, "W", "T2", 38.91, STOP_LON, "08:22:00")
        );
        OtpBreakdown otp = OtpBreakdown.of(events.arrivals);
        assertThat(otp.line.getTotal(), equalTo(4));
        assertThat(otp.line.early_count, equalTo(1));
        assertThat(otp.line.on_time_count, equalTo(2));
        assertThat(otp.line.late_count, equalTo(1));
        assertThat(otp.line.getOnTimePercentage(), equalTo(50.0));
        // (-120 + 30 + 360 + 0) / 4
        assertThat(otp.line.avg_deviation_seconds, equalTo(67.5));
        assertThat(otp.byStop.keySet(), contains("S0", "S1", "S2"));
        assertThat(otp.byStop.get("S1").getTotal(), equalTo(2));
        assertThat(otp.byStop.get("S1").getOnTimePercentage(), equalTo(100.0));
        assertThat(otp.byPeriod.keySet(), contains(TimePeriod.AM_PEAK));
    }

    @Test
    public void noEventsMeansUnknownPercentages() {
        OtpSummary summary = OtpSummary.of(new ArrayList<>());
        assertThat(summary.getTotal(), equalTo(0));
        assertThat(summary.getOnTimePercentage(), nullValue());
        assertThat(summary.avg_deviation_seconds, nullValue());
    }

}
