package com.conveyal.transitperf;

import com.conveyal.transitperf.model.Calendar;
import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.model.Route;
import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.Stop;
import com.conveyal.transitperf.model.StopTime;
import com.conveyal.transitperf.model.Trip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

/**
 * Shared fixtures. The test route C51 runs due north along longitude -77.03 through three stops about 1.1 km apart,
 * with two weekday trips eighteen minutes apart:
 *
 * <pre>
 *   stop  lat     T1        T2
 *   S0    38.90   08:00:00  08:18:00
 *   S1    38.91   08:04:00  08:22:00
 *   S2    38.92   08:08:00  08:26:00
 * </pre>
 */
public class TestUtils {

    private static final Logger LOG = LoggerFactory.getLogger(TestUtils.class);

    public static final ZoneId ZONE = ZoneId.of("America/New_York");
    /** A Tuesday. */
    public static final LocalDate DAY = LocalDate.of(2024, 3, 12);
    public static final String ROUTE_ID = "C51";
    public static final double STOP_LON = -77.03;

    /** Meters per degree of latitude on the sphere used for great-circle distances. */
    public static final double METERS_PER_DEGREE = 6371000 * Math.PI / 180;

    public static DataSource createTestDataSource () {
        String url = String.format("jdbc:h2:mem:test_%s;DB_CLOSE_DELAY=-1", randomIdString());
        return TransitPerf.createDataSource(url, null, null);
    }

    public static String randomIdString () {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 10);
    }

    /** @return the instant of the given local time on the test day. */
    public static Instant at (String localTime) {
        return DAY.atTime(LocalTime.parse(localTime)).atZone(ZONE).toInstant();
    }

    public static int seconds (String localTime) {
        return LocalTime.parse(localTime).toSecondOfDay();
    }

    /** @return the latitude the given number of meters north of the given one. */
    public static double north (double lat, double meters) {
        return lat + meters / METERS_PER_DEGREE;
    }

    public static PositionSample sample (long id, String vehicleId, String tripHint, double lat, double lon,
                                         String localTime) {
        return new PositionSample(id, vehicleId, ROUTE_ID, tripHint, lat, lon, at(localTime));
    }

    public static Calendar weekdayCalendar (String serviceId) {
        Calendar calendar = new Calendar();
        calendar.service_id = serviceId;
        calendar.start_date = LocalDate.of(2024, 1, 1);
        calendar.end_date = LocalDate.of(2024, 12, 31);
        calendar.monday = calendar.tuesday = calendar.wednesday = calendar.thursday = calendar.friday = 1;
        return calendar;
    }

    public static ScheduleReference.Builder c51ScheduleBuilder () {
        ScheduleReference.Builder builder = new ScheduleReference.Builder("feed", new Route(ROUTE_ID, "C51", "Crosstown"));
        builder.addStop(new Stop("S0", "First", 38.90, STOP_LON));
        builder.addStop(new Stop("S1", "Middle", 38.91, STOP_LON));
        builder.addStop(new Stop("S2", "Last", 38.92, STOP_LON));
        addTrip(builder, "T1", "08:00:00");
        addTrip(builder, "T2", "08:18:00");
        builder.addCalendar(weekdayCalendar("WK"));
        return builder;
    }

    public static ScheduleReference c51Schedule () {
        return c51ScheduleBuilder().build();
    }

    private static void addTrip (ScheduleReference.Builder builder, String tripId, String firstDeparture) {
        builder.addTrip(new Trip(tripId, ROUTE_ID, "WK"));
        int start = seconds(firstDeparture);
        for (int i = 0; i < 3; i++) {
            int time = start + i * 240;
            builder.addStopTime(new StopTime(tripId, "S" + i, i + 1, time, time));
        }
    }

    /**
     * Create the tables of a loaded GTFS feed in the given namespace and fill them with route C51.
     *
     * @param withCalendars when false the calendar tables are left out altogether.
     */
    public static void loadC51Feed (DataSource dataSource, String namespace, boolean withCalendars) {
        List<String> statements = new ArrayList<>();
        String p = namespace + ".";
        statements.add("create schema if not exists " + namespace);
        statements.add("create table " + p + "routes (route_id varchar, route_short_name varchar, route_long_name varchar)");
        statements.add("create table " + p + "trips (trip_id varchar, route_id varchar, service_id varchar, " +
                "direction_id integer, shape_id varchar)");
        statements.add("create table " + p + "stop_times (trip_id varchar, stop_id varchar, stop_sequence integer, " +
                "arrival_time integer, departure_time integer)");
        statements.add("create table " + p + "stops (stop_id varchar, stop_name varchar, stop_lat double precision, " +
                "stop_lon double precision)");
        statements.add("create table " + p + "shapes (shape_id varchar, shape_pt_lat double precision, " +
                "shape_pt_lon double precision, shape_pt_sequence integer)");
        statements.add("insert into " + p + "routes values ('C51', 'C51', 'Crosstown')");
        statements.add("insert into " + p + "stops values ('S0', 'First', 38.90, -77.03), ('S1', 'Middle', 38.91, -77.03), " +
                "('S2', 'Last', 38.92, -77.03), ('Z9', 'Elsewhere', 39.5, -76.5)");
        statements.add("insert into " + p + "trips values ('T1', 'C51', 'WK', 0, null), ('T2', 'C51', 'WK', 0, null), " +
                "('R1', 'R99', 'WK', 0, null)");
        for (String[] trip : new String[][] {{"T1", "28800"}, {"T2", "29880"}}) {
            int start = Integer.parseInt(trip[1]);
            for (int i = 0; i < 3; i++) {
                int time = start + i * 240;
                statements.add(String.format("insert into %sstop_times values ('%s', 'S%d', %d, %d, %d)", p, trip[0], i,
                        i + 1, time, time));
            }
        }
        statements.add("insert into " + p + "stop_times values ('R1', 'Z9', 1, 28800, 28800)");
        if (withCalendars) {
            statements.add("create table " + p + "calendar (service_id varchar, start_date varchar, end_date varchar, " +
                    "monday integer, tuesday integer, wednesday integer, thursday integer, friday integer, " +
                    "saturday integer, sunday integer)");
            statements.add("create table " + p + "calendar_dates (service_id varchar, date varchar, exception_type integer)");
            statements.add("insert into " + p + "calendar values ('WK', '20240101', '20241231', 1, 1, 1, 1, 1, 0, 0)");
            // No service on the Wednesday after the test day.
            statements.add("insert into " + p + "calendar_dates values ('WK', '20240313', 2)");
        }
        execute(dataSource, statements.toArray(new String[0]));
    }

    public static void createPositionTables (DataSource dataSource) {
        execute(dataSource,
            "create table vehicle_positions (id bigint, vehicle_id varchar, route_id varchar, trip_id varchar, " +
                "latitude double precision, longitude double precision, speed double precision, " +
                "bearing double precision, observed_at timestamp with time zone)",
            "create table vendor_deviations (vehicle_id varchar, route_id varchar, deviation_minutes double precision, " +
                "observed_at timestamp with time zone)"
        );
    }

    public static void insertPositions (DataSource dataSource, String routeId, List<PositionSample> samples) {
        String sql = "insert into vehicle_positions (id, vehicle_id, route_id, trip_id, latitude, longitude, " +
                "observed_at) values (?, ?, ?, ?, ?, ?, ?)";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            for (PositionSample sample : samples) {
                statement.setLong(1, sample.id);
                statement.setString(2, sample.vehicle_id);
                statement.setString(3, routeId);
                statement.setString(4, sample.trip_id_hint);
                statement.setDouble(5, sample.latitude);
                statement.setDouble(6, sample.longitude);
                statement.setObject(7, sample.observed_at.atOffset(ZoneOffset.UTC));
                statement.addBatch();
            }
            statement.executeBatch();
            connection.commit();
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    public static void execute (DataSource dataSource, String... statements) {
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                LOG.debug(sql);
                statement.execute(sql);
            }
            connection.commit();
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
    }

    /** @return every row of the query result as a list of column values, for comparing whole tables. */
    public static List<List<Object>> readRows (DataSource dataSource, String sql) {
        List<List<Object>> rows = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             ResultSet resultSet = connection.createStatement().executeQuery(sql)) {
            ResultSetMetaData metaData = resultSet.getMetaData();
            while (resultSet.next()) {
                List<Object> row = new ArrayList<>();
                for (int c = 1; c <= metaData.getColumnCount(); c++) row.add(resultSet.getObject(c));
                rows.add(row);
            }
        } catch (SQLException e) {
            throw new RuntimeException(e);
        }
        return rows;
    }

    /**
     * Asserts that the result of a SQL count statement is equal to an expected value
     *
     * @param sql A SQL statement in the form of `SELECT count(*) FROM ...`
     * @param expectedCount The expected count that is returned from the result of the SQL statement.
     */
    public static void assertThatSqlCountQueryYieldsExpectedCount(DataSource dataSource, String sql, int expectedCount) {
        int count = -1;
        LOG.info(sql);
        // Encapsulate connection in try-with-resources to ensure it is closed and does not interfere with other tests.
        try (Connection connection = dataSource.getConnection()) {
            ResultSet resultSet = connection.prepareStatement(sql).executeQuery();
            if (resultSet.next()) {
                count = resultSet.getInt(1);
            }
        } catch (SQLException e) {
            LOG.error("SQL error encountered", e);
        }
        assertThat(
            "Records matching query should equal expected count.",
            count,
            equalTo(expectedCount)
        );
    }

}
