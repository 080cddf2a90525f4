package com.conveyal.transitperf.loader;

import com.conveyal.transitperf.model.Calendar;
import com.conveyal.transitperf.model.CalendarDate;
import com.conveyal.transitperf.model.Entity;
import com.conveyal.transitperf.model.Route;
import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.ShapePoint;
import com.conveyal.transitperf.model.Stop;
import com.conveyal.transitperf.model.StopTime;
import com.conveyal.transitperf.model.Trip;
import com.conveyal.transitperf.storage.StorageException;
import com.conveyal.transitperf.util.Util;
import com.google.common.collect.ImmutableSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Set;

/**
 * Reads the schedule of one route from a GTFS feed loaded into a relational database, with one schema (namespace)
 * per feed version. Only the rows relevant to the route are selected: its trips, their stop times, the stops and
 * shapes they use and the calendars of their services.
 *
 * Dates are stored as yyyyMMdd strings and times as integer seconds after midnight, as the GTFS loader writes them.
 */
public class JdbcScheduleReader implements ScheduleSource {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcScheduleReader.class);

    /** Undefined table, as reported by PostgreSQL and by H2. */
    private static final Set<String> UNDEFINED_TABLE_STATES = ImmutableSet.of("42P01", "42S02", "42S03", "42S04");

    private static final DateTimeFormatter GTFS_DATE = DateTimeFormatter.BASIC_ISO_DATE;

    private final DataSource dataSource;
    private final String namespace;
    private final String tablePrefix;

    public JdbcScheduleReader (DataSource dataSource, String namespace) {
        this.dataSource = dataSource;
        this.namespace = namespace;
        this.tablePrefix = Util.tablePrefix(namespace);
    }

    @Override
    public ScheduleReference forRoute (String routeId) {
        try (Connection connection = dataSource.getConnection()) {
            Route route = readRoute(connection, routeId);
            if (route == null) {
                LOG.info("Route {} is not in feed {}", routeId, namespace);
                return null;
            }
            ScheduleReference.Builder builder = new ScheduleReference.Builder(namespace, route);
            int trips = readTrips(connection, routeId, builder);
            int stopTimes = readStopTimes(connection, routeId, builder);
            readStops(connection, routeId, builder);
            readShapePoints(connection, routeId, builder);
            readCalendars(connection, routeId, builder);
            readCalendarDates(connection, routeId, builder);
            connection.rollback();
            ScheduleReference schedule = builder.build();
            LOG.info("Read {} trips with {} stop times for route {} ({}) from feed {} ({} trips skipped)",
                    trips, stopTimes, routeId, route.getDisplayName(), namespace, schedule.integrityErrors.size());
            return schedule;
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    private Route readRoute (Connection connection, String routeId) throws SQLException {
        String sql = String.format("select route_id, route_short_name, route_long_name from %sroutes where route_id = ?",
                tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) return null;
                return new Route(resultSet.getString("route_id"), resultSet.getString("route_short_name"),
                        resultSet.getString("route_long_name"));
            }
        }
    }

    private int readTrips (Connection connection, String routeId, ScheduleReference.Builder builder) throws SQLException {
        String sql = String.format("select trip_id, route_id, service_id, direction_id, shape_id from %strips " +
                "where route_id = ?", tablePrefix);
        int count = 0;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Trip trip = new Trip(resultSet.getString("trip_id"), resultSet.getString("route_id"),
                            resultSet.getString("service_id"));
                    trip.direction_id = getIntOrMissing(resultSet, "direction_id");
                    trip.shape_id = resultSet.getString("shape_id");
                    builder.addTrip(trip);
                    count++;
                }
            }
        }
        return count;
    }

    private int readStopTimes (Connection connection, String routeId, ScheduleReference.Builder builder)
            throws SQLException {
        String sql = String.format("select st.trip_id, st.stop_id, st.stop_sequence, st.arrival_time, " +
                "st.departure_time from %sstop_times st join %strips t on st.trip_id = t.trip_id where t.route_id = ?",
                tablePrefix, tablePrefix);
        int count = 0;
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    builder.addStopTime(new StopTime(
                        resultSet.getString("trip_id"),
                        resultSet.getString("stop_id"),
                        resultSet.getInt("stop_sequence"),
                        getIntOrMissing(resultSet, "arrival_time"),
                        getIntOrMissing(resultSet, "departure_time")
                    ));
                    count++;
                }
            }
        }
        return count;
    }

    private void readStops (Connection connection, String routeId, ScheduleReference.Builder builder) throws SQLException {
        String sql = String.format("select stop_id, stop_name, stop_lat, stop_lon from %sstops where stop_id in " +
                "(select st.stop_id from %sstop_times st join %strips t on st.trip_id = t.trip_id where t.route_id = ?)",
                tablePrefix, tablePrefix, tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    builder.addStop(new Stop(resultSet.getString("stop_id"), resultSet.getString("stop_name"),
                            resultSet.getDouble("stop_lat"), resultSet.getDouble("stop_lon")));
                }
            }
        }
    }

    private void readShapePoints (Connection connection, String routeId, ScheduleReference.Builder builder)
            throws SQLException {
        String sql = String.format("select shape_id, shape_pt_lat, shape_pt_lon, shape_pt_sequence from %sshapes " +
                "where shape_id in (select shape_id from %strips where route_id = ?)", tablePrefix, tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    builder.addShapePoint(new ShapePoint(resultSet.getString("shape_id"),
                            resultSet.getDouble("shape_pt_lat"), resultSet.getDouble("shape_pt_lon"),
                            resultSet.getInt("shape_pt_sequence")));
                }
            }
        } catch (SQLException e) {
            // Shapes are optional in GTFS. Without them paths are drawn from stop to stop.
            if (!isUndefinedTable(e)) throw e;
            LOG.info("Feed {} has no shapes table", namespace);
            connection.rollback();
        }
    }

    private void readCalendars (Connection connection, String routeId, ScheduleReference.Builder builder)
            throws SQLException {
        String sql = String.format("select service_id, start_date, end_date, monday, tuesday, wednesday, thursday, " +
                "friday, saturday, sunday from %scalendar where service_id in " +
                "(select service_id from %strips where route_id = ?)", tablePrefix, tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    Calendar calendar = new Calendar();
                    calendar.service_id = resultSet.getString("service_id");
                    calendar.start_date = parseDate(resultSet.getString("start_date"));
                    calendar.end_date = parseDate(resultSet.getString("end_date"));
                    calendar.monday = resultSet.getInt("monday");
                    calendar.tuesday = resultSet.getInt("tuesday");
                    calendar.wednesday = resultSet.getInt("wednesday");
                    calendar.thursday = resultSet.getInt("thursday");
                    calendar.friday = resultSet.getInt("friday");
                    calendar.saturday = resultSet.getInt("saturday");
                    calendar.sunday = resultSet.getInt("sunday");
                    builder.addCalendar(calendar);
                }
            }
        } catch (SQLException e) {
            if (!isUndefinedTable(e)) throw e;
            LOG.info("Feed {} has no calendar table", namespace);
            connection.rollback();
        }
    }

    private void readCalendarDates (Connection connection, String routeId, ScheduleReference.Builder builder)
            throws SQLException {
        String sql = String.format("select service_id, date, exception_type from %scalendar_dates where service_id in " +
                "(select service_id from %strips where route_id = ?)", tablePrefix, tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    LocalDate date = parseDate(resultSet.getString("date"));
                    if (date == null) continue;
                    builder.addCalendarDate(new CalendarDate(resultSet.getString("service_id"), date,
                            resultSet.getInt("exception_type")));
                }
            }
        } catch (SQLException e) {
            if (!isUndefinedTable(e)) throw e;
            LOG.info("Feed {} has no calendar_dates table", namespace);
            connection.rollback();
        }
    }

    private static int getIntOrMissing (ResultSet resultSet, String column) throws SQLException {
        int value = resultSet.getInt(column);
        return resultSet.wasNull() ? Entity.INT_MISSING : value;
    }

    private static LocalDate parseDate (String value) {
        if (value == null || value.isEmpty()) return null;
        try {
            return LocalDate.parse(value, GTFS_DATE);
        } catch (DateTimeParseException e) {
            LOG.warn("Ignoring unparseable service date {}", value);
            return null;
        }
    }

    private static boolean isUndefinedTable (SQLException e) {
        return UNDEFINED_TABLE_STATES.contains(e.getSQLState());
    }

}
