package com.conveyal.transitperf.model;

import com.conveyal.transitperf.TestUtils;
import com.conveyal.transitperf.error.DataIntegrityError;
import com.conveyal.transitperf.error.MetricsErrorType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.conveyal.transitperf.TestUtils.DAY;
import static com.conveyal.transitperf.TestUtils.seconds;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.hamcrest.Matchers.nullValue;

/**
 * Checks how schedule rows are assembled into a reference and which trips are left out.
 */
public class ScheduleReferenceTest {

    private static void addTrip(ScheduleReference.Builder builder, String tripId, String... stopsAndTimes) {
        builder.addTrip(new Trip(tripId, "C51", "WK"));
        for (int i = 0; i < stopsAndTimes.length; i += 2) {
            String time = stopsAndTimes[i + 1];
            int seconds = time == null ? Entity.INT_MISSING : seconds(time);
            builder.addStopTime(new StopTime(tripId, stopsAndTimes[i], i / 2 + 1, seconds, seconds));
        }
    }

    @Test
    public void tripsComeOutInIdOrderWithOrderedStopTimes() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        // Rows may arrive in any order.
        builder.addTrip(new Trip("A0", "C51", "WK"));
        builder.addStopTime(new StopTime("A0", "S2", 3, seconds("09:08:00"), seconds("09:08:00")));
        builder.addStopTime(new StopTime("A0", "S0", 1, seconds("09:00:00"), seconds("09:00:00")));
        builder.addStopTime(new StopTime("A0", "S1", 2, seconds("09:04:00"), seconds("09:04:00")));
        ScheduleReference schedule = builder.build();
        assertThat(schedule.tripsForRoute("C51"), hasSize(3));
        assertThat(schedule.tripsForRoute("C51").get(0).trip_id, equalTo("A0"));
        assertThat(schedule.getTrip("A0").stop_times.get(0).stop_id, equalTo("S0"));
        assertThat(schedule.getTrip("A0").stop_times.get(2).stop_id, equalTo("S2"));
        assertThat(schedule.integrityErrors, hasSize(0));
    }

    @Test
    public void tripWithDecreasingTimesIsSkippedAndRecorded() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        addTrip(builder, "BAD", "S0", "09:00:00", "S1", "08:59:00", "S2", "09:10:00");
        ScheduleReference schedule = builder.build();
        assertThat(schedule.getTrip("BAD"), nullValue());
        assertThat(schedule.integrityErrors, hasSize(1));
        DataIntegrityError error = schedule.integrityErrors.get(0);
        assertThat(error.errorType, equalTo(MetricsErrorType.STOP_TIMES_OUT_OF_SEQUENCE));
        assertThat(error.entityId, equalTo("BAD"));
    }

    @Test
    public void equalConsecutiveTimesAreAllowed() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        addTrip(builder, "SAME", "S0", "09:00:00", "S1", "09:00:00", "S2", "09:05:00");
        ScheduleReference schedule = builder.build();
        assertThat(schedule.getTrip("SAME"), notNullValue());
        assertThat(schedule.integrityErrors, hasSize(0));
    }

    @Test
    public void tripNeedsTwoTimedStops() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        addTrip(builder, "ONE", "S0", "09:00:00", "S1", null, "S2", null);
        ScheduleReference schedule = builder.build();
        assertThat(schedule.getTrip("ONE"), nullValue());
        assertThat(schedule.integrityErrors.get(0).errorType, equalTo(MetricsErrorType.TRIP_TOO_FEW_STOP_TIMES));
    }

    @Test
    public void tripThroughUnknownStopIsSkipped() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        addTrip(builder, "LOST", "S0", "09:00:00", "NOWHERE", "09:05:00");
        ScheduleReference schedule = builder.build();
        assertThat(schedule.getTrip("LOST"), nullValue());
        assertThat(schedule.integrityErrors.get(0).errorType, equalTo(MetricsErrorType.MISSING_STOP));
        assertThat(schedule.integrityErrors.get(0).badValue, equalTo("NOWHERE"));
    }

    @Test
    public void activeTripsFollowServiceCalendar() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        builder.addCalendarDate(new CalendarDate("WK", DAY, CalendarDate.SERVICE_REMOVED));
        ScheduleReference schedule = builder.build();
        assertThat(schedule.hasServiceCalendars, equalTo(true));
        assertThat(schedule.activeTrips("C51", DAY), hasSize(0));
        assertThat(schedule.activeTrips("C51", DAY.plusDays(1)), hasSize(2));
    }

    @Test
    public void everyTripRunsWhenThereAreNoCalendars() {
        ScheduleReference.Builder builder = new ScheduleReference.Builder("feed", new Route("C51", "C51", null));
        builder.addStop(new Stop("S0", null, 38.90, -77.03));
        builder.addStop(new Stop("S1", null, 38.91, -77.03));
        addTrip(builder, "T1", "S0", "08:00:00", "S1", "08:04:00");
        ScheduleReference schedule = builder.build();
        assertThat(schedule.hasServiceCalendars, equalTo(false));
        // A Sunday.
        assertThat(schedule.activeTrips("C51", LocalDate.of(2024, 3, 17)), hasSize(1));
    }

    @Test
    public void tripOfUnknownServiceNeverRuns() {
        ScheduleReference.Builder builder = TestUtils.c51ScheduleBuilder();
        builder.addTrip(new Trip("NS", "C51", "NO_SUCH_SERVICE"));
        builder.addStopTime(new StopTime("NS", "S0", 1, seconds("09:00:00"), seconds("09:00:00")));
        builder.addStopTime(new StopTime("NS", "S1", 2, seconds("09:04:00"), seconds("09:04:00")));
        ScheduleReference schedule = builder.build();
        assertThat(schedule.isActive(schedule.getTrip("NS"), DAY), equalTo(false));
    }

    @Test
    public void routeStopsAreOnlyThoseItsTripsVisit() {
        ScheduleReference schedule = TestUtils.c51ScheduleBuilder()
                .addStop(new Stop("Z9", "Elsewhere", 39.5, -76.5))
                .build();
        assertThat(schedule.stopsForRoute("C51").stream().map(stop -> stop.stop_id).toArray(),
                equalTo(new Object[] {"S0", "S1", "S2"}));
        assertThat(schedule.getShapePoints("nope"), hasSize(0));
        assertThat(schedule.getShapePoints(null), hasSize(0));
    }

}
