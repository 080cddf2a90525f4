package com.conveyal.transitperf.storage;

import com.conveyal.transitperf.stats.OtpSummary;
import com.conveyal.transitperf.stats.TimePeriod;
import com.conveyal.transitperf.stats.VendorDeviationSummary;
import com.conveyal.transitperf.stats.model.DailyMetric;
import com.conveyal.transitperf.stats.model.RollingSummary;
import com.conveyal.transitperf.util.Util;
import org.apache.commons.dbutils.DbUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static com.conveyal.transitperf.storage.JdbcValues.getDate;
import static com.conveyal.transitperf.storage.JdbcValues.getDouble;
import static com.conveyal.transitperf.storage.JdbcValues.getInstant;
import static com.conveyal.transitperf.storage.JdbcValues.setDate;
import static com.conveyal.transitperf.storage.JdbcValues.setDouble;
import static com.conveyal.transitperf.storage.JdbcValues.setInstant;
import static com.conveyal.transitperf.storage.JdbcValues.setString;

/**
 * Reads and writes the metrics tables, which are the only thing the serving layer reads. Nothing but the metrics
 * aggregator writes to them.
 *
 * Writes are keyed by route and day and replace whatever was there before. Each write of a daily metric also
 * rebuilds the route's rolling summary from the stored daily metrics, in the same transaction, so the two can never
 * disagree.
 */
public class MetricsStore {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsStore.class);

    private static final String DAILY_METRIC_COLUMNS = "route_id, service_date, otp_percentage, early_percentage, " +
            "late_percentage, total_arrivals, avg_deviation_seconds, reference_stop_id, headway_count, " +
            "avg_headway_minutes, median_headway_minutes, min_headway_minutes, max_headway_minutes, " +
            "headway_std_dev_minutes, headway_cv, headway_data_gaps, avg_speed_mph, median_speed_mph, " +
            "speed_sample_count, matched_samples, total_samples, unique_vehicles, unique_trips, last_sample_at";

    private static final String ROLLING_SUMMARY_COLUMNS = "route_id, window_start, window_end, window_days, " +
            "days_with_data, avg_otp_percentage, avg_early_percentage, avg_late_percentage, avg_headway_minutes, " +
            "avg_headway_cv, avg_speed_mph, total_arrivals, total_samples, total_matched_samples, vehicle_days, " +
            "last_sample_at";

    private final DataSource dataSource;
    private final String tablePrefix;

    /**
     * @param namespace schema holding the metrics tables, or null / empty for the default schema.
     */
    public MetricsStore (DataSource dataSource, String namespace) {
        this.dataSource = dataSource;
        this.tablePrefix = Util.tablePrefix(namespace);
    }

    /** Create the metrics tables if they do not exist yet. */
    public void createTables () {
        String otpColumns = "early_count integer not null, on_time_count integer not null, late_count integer not null, " +
                "otp_percentage double precision, avg_deviation_seconds double precision";
        String[] statements = {
            String.format("create table if not exists %sdaily_metrics (route_id varchar not null, " +
                "service_date date not null, otp_percentage double precision, early_percentage double precision, " +
                "late_percentage double precision, total_arrivals integer not null, avg_deviation_seconds double precision, " +
                "reference_stop_id varchar, headway_count integer not null, avg_headway_minutes double precision, " +
                "median_headway_minutes double precision, min_headway_minutes double precision, " +
                "max_headway_minutes double precision, headway_std_dev_minutes double precision, " +
                "headway_cv double precision, headway_data_gaps integer not null, avg_speed_mph double precision, " +
                "median_speed_mph double precision, speed_sample_count integer not null, " +
                "matched_samples integer not null, total_samples integer not null, unique_vehicles integer not null, " +
                "unique_trips integer not null, last_sample_at timestamp with time zone, " +
                "primary key (route_id, service_date))", tablePrefix),
            String.format("create table if not exists %sdaily_stop_otp (route_id varchar not null, " +
                "service_date date not null, stop_id varchar not null, %s, " +
                "primary key (route_id, service_date, stop_id))", tablePrefix, otpColumns),
            String.format("create table if not exists %sdaily_period_otp (route_id varchar not null, " +
                "service_date date not null, time_period varchar not null, %s, " +
                "primary key (route_id, service_date, time_period))", tablePrefix, otpColumns),
            String.format("create table if not exists %srolling_summaries (route_id varchar not null primary key, " +
                "window_start date not null, window_end date not null, window_days integer not null, " +
                "days_with_data integer not null, avg_otp_percentage double precision, " +
                "avg_early_percentage double precision, avg_late_percentage double precision, " +
                "avg_headway_minutes double precision, avg_headway_cv double precision, avg_speed_mph double precision, " +
                "total_arrivals bigint not null, total_samples bigint not null, total_matched_samples bigint not null, " +
                "vehicle_days bigint not null, last_sample_at timestamp with time zone)", tablePrefix),
            String.format("create table if not exists %svendor_deviation_daily (route_id varchar not null, " +
                "service_date date not null, observations integer not null, on_time_percentage double precision, " +
                "early_percentage double precision, late_percentage double precision, " +
                "avg_deviation_minutes double precision, primary key (route_id, service_date))", tablePrefix)
        };
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            try (Statement statement = connection.createStatement()) {
                for (String sql : statements) {
                    LOG.debug(sql);
                    statement.execute(sql);
                }
            }
            connection.commit();
            LOG.info("Metrics tables are ready{}", tablePrefix.isEmpty() ? "" : " in " + tablePrefix);
        } catch (SQLException e) {
            DbUtils.rollbackAndCloseQuietly(connection);
            connection = null;
            throw new StorageException(e);
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    /** @return the days in [firstDay, lastDay] that already have a daily metric for the route. */
    public Set<LocalDate> daysWithMetrics (String routeId, LocalDate firstDay, LocalDate lastDay) {
        Set<LocalDate> days = new TreeSet<>();
        String sql = String.format("select service_date from %sdaily_metrics where route_id = ? " +
                "and service_date >= ? and service_date <= ?", tablePrefix);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            setDate(statement, 2, firstDay);
            setDate(statement, 3, lastDay);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) days.add(getDate(resultSet, "service_date"));
            }
        } catch (SQLException e) {
            throw new StorageException(e);
        }
        return days;
    }

    /**
     * Replace the daily metric of one route and day (with its per-stop and per-period rows and, if given, the vendor
     * deviation summary), then rebuild the route's rolling summary. Everything is committed together or not at all.
     *
     * @return the rolling summary as written.
     */
    public RollingSummary persist (DailyMetric metric, VendorDeviationSummary vendorSummary, int windowDays) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            deleteDay(connection, "daily_metrics", metric);
            deleteDay(connection, "daily_stop_otp", metric);
            deleteDay(connection, "daily_period_otp", metric);
            deleteDay(connection, "vendor_deviation_daily", metric);
            insertDailyMetric(connection, metric);
            insertStopOtp(connection, metric);
            insertPeriodOtp(connection, metric);
            if (vendorSummary != null) insertVendorSummary(connection, metric, vendorSummary);

            LocalDate latest = latestDay(connection, metric.route_id);
            List<DailyMetric> window = readDailyMetrics(connection, metric.route_id,
                    latest.minusDays(windowDays - 1), latest);
            RollingSummary summary = RollingSummary.fromDailyMetrics(metric.route_id, windowDays, window);
            replaceRollingSummary(connection, summary);
            connection.commit();
            LOG.info("Stored metrics for route {} on {}; rolling summary covers {} to {}", metric.route_id,
                    metric.service_date, summary.window_start, summary.window_end);
            return summary;
        } catch (SQLException e) {
            DbUtils.rollbackAndCloseQuietly(connection);
            connection = null;
            throw new StorageException(e);
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    private void deleteDay (Connection connection, String table, DailyMetric metric) throws SQLException {
        String sql = String.format("delete from %s%s where route_id = ? and service_date = ?", tablePrefix, table);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, metric.route_id);
            setDate(statement, 2, metric.service_date);
            statement.executeUpdate();
        }
    }

    private void insertDailyMetric (Connection connection, DailyMetric m) throws SQLException {
        String sql = String.format("insert into %sdaily_metrics (%s) values (%s)", tablePrefix, DAILY_METRIC_COLUMNS,
                placeholders(DAILY_METRIC_COLUMNS));
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int i = 1;
            statement.setString(i++, m.route_id);
            setDate(statement, i++, m.service_date);
            setDouble(statement, i++, m.otp_percentage);
            setDouble(statement, i++, m.early_percentage);
            setDouble(statement, i++, m.late_percentage);
            statement.setInt(i++, m.total_arrivals);
            setDouble(statement, i++, m.avg_deviation_seconds);
            setString(statement, i++, m.reference_stop_id);
            statement.setInt(i++, m.headway_count);
            setDouble(statement, i++, m.avg_headway_minutes);
            setDouble(statement, i++, m.median_headway_minutes);
            setDouble(statement, i++, m.min_headway_minutes);
            setDouble(statement, i++, m.max_headway_minutes);
            setDouble(statement, i++, m.headway_std_dev_minutes);
            setDouble(statement, i++, m.headway_cv);
            statement.setInt(i++, m.headway_data_gaps);
            setDouble(statement, i++, m.avg_speed_mph);
            setDouble(statement, i++, m.median_speed_mph);
            statement.setInt(i++, m.speed_sample_count);
            statement.setInt(i++, m.matched_samples);
            statement.setInt(i++, m.total_samples);
            statement.setInt(i++, m.unique_vehicles);
            statement.setInt(i++, m.unique_trips);
            setInstant(statement, i, m.last_sample_at);
            statement.executeUpdate();
        }
    }

    private void insertStopOtp (Connection connection, DailyMetric metric) throws SQLException {
        insertOtpRows(connection, "daily_stop_otp", "stop_id", metric, metric.stop_otp);
    }

    private void insertPeriodOtp (Connection connection, DailyMetric metric) throws SQLException {
        Map<String, OtpSummary> byName = new LinkedHashMap<>();
        for (Map.Entry<TimePeriod, OtpSummary> entry : metric.period_otp.entrySet()) {
            byName.put(entry.getKey().name(), entry.getValue());
        }
        insertOtpRows(connection, "daily_period_otp", "time_period", metric, byName);
    }

    private void insertOtpRows (Connection connection, String table, String keyColumn, DailyMetric metric,
                                Map<String, OtpSummary> summaries) throws SQLException {
        if (summaries.isEmpty()) return;
        String sql = String.format("insert into %s%s (route_id, service_date, %s, early_count, on_time_count, " +
                "late_count, otp_percentage, avg_deviation_seconds) values (?, ?, ?, ?, ?, ?, ?, ?)",
                tablePrefix, table, keyColumn);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (Map.Entry<String, OtpSummary> entry : summaries.entrySet()) {
                OtpSummary otp = entry.getValue();
                statement.setString(1, metric.route_id);
                setDate(statement, 2, metric.service_date);
                statement.setString(3, entry.getKey());
                statement.setInt(4, otp.early_count);
                statement.setInt(5, otp.on_time_count);
                statement.setInt(6, otp.late_count);
                setDouble(statement, 7, otp.getOnTimePercentage());
                setDouble(statement, 8, otp.avg_deviation_seconds);
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private void insertVendorSummary (Connection connection, DailyMetric metric, VendorDeviationSummary vendor)
            throws SQLException {
        String sql = String.format("insert into %svendor_deviation_daily (route_id, service_date, observations, " +
                "on_time_percentage, early_percentage, late_percentage, avg_deviation_minutes) " +
                "values (?, ?, ?, ?, ?, ?, ?)", tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, metric.route_id);
            setDate(statement, 2, metric.service_date);
            statement.setInt(3, vendor.observations);
            setDouble(statement, 4, vendor.getOnTimePercentage());
            setDouble(statement, 5, vendor.getEarlyPercentage());
            setDouble(statement, 6, vendor.getLatePercentage());
            setDouble(statement, 7, vendor.avg_deviation_minutes);
            statement.executeUpdate();
        }
    }

    private LocalDate latestDay (Connection connection, String routeId) throws SQLException {
        String sql = String.format("select max(service_date) as latest from %sdaily_metrics where route_id = ?", tablePrefix);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return getDate(resultSet, "latest");
            }
        }
    }

    private void replaceRollingSummary (Connection connection, RollingSummary s) throws SQLException {
        try (PreparedStatement delete = connection.prepareStatement(
                String.format("delete from %srolling_summaries where route_id = ?", tablePrefix))) {
            delete.setString(1, s.route_id);
            delete.executeUpdate();
        }
        String sql = String.format("insert into %srolling_summaries (%s) values (%s)", tablePrefix,
                ROLLING_SUMMARY_COLUMNS, placeholders(ROLLING_SUMMARY_COLUMNS));
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int i = 1;
            statement.setString(i++, s.route_id);
            setDate(statement, i++, s.window_start);
            setDate(statement, i++, s.window_end);
            statement.setInt(i++, s.window_days);
            statement.setInt(i++, s.days_with_data);
            setDouble(statement, i++, s.avg_otp_percentage);
            setDouble(statement, i++, s.avg_early_percentage);
            setDouble(statement, i++, s.avg_late_percentage);
            setDouble(statement, i++, s.avg_headway_minutes);
            setDouble(statement, i++, s.avg_headway_cv);
            setDouble(statement, i++, s.avg_speed_mph);
            statement.setLong(i++, s.total_arrivals);
            statement.setLong(i++, s.total_samples);
            statement.setLong(i++, s.total_matched_samples);
            statement.setLong(i++, s.vehicle_days);
            setInstant(statement, i, s.last_sample_at);
            statement.executeUpdate();
        }
    }

    /**
     * Read the daily metrics of a route over an inclusive range of days, ordered by day. The per-stop and per-period
     * breakdowns are not read back.
     */
    public List<DailyMetric> readDailyMetrics (String routeId, LocalDate firstDay, LocalDate lastDay) {
        try (Connection connection = dataSource.getConnection()) {
            return readDailyMetrics(connection, routeId, firstDay, lastDay);
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    /** @return the daily metric of the route on that day, or null if there is none. */
    public DailyMetric readDailyMetric (String routeId, LocalDate day) {
        List<DailyMetric> metrics = readDailyMetrics(routeId, day, day);
        return metrics.isEmpty() ? null : metrics.get(0);
    }

    private List<DailyMetric> readDailyMetrics (Connection connection, String routeId, LocalDate firstDay,
                                                LocalDate lastDay) throws SQLException {
        String sql = String.format("select %s from %sdaily_metrics where route_id = ? and service_date >= ? " +
                "and service_date <= ? order by service_date", DAILY_METRIC_COLUMNS, tablePrefix);
        List<DailyMetric> metrics = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            setDate(statement, 2, firstDay);
            setDate(statement, 3, lastDay);
            try (ResultSet r = statement.executeQuery()) {
                while (r.next()) {
                    DailyMetric m = new DailyMetric(r.getString("route_id"), getDate(r, "service_date"));
                    m.otp_percentage = getDouble(r, "otp_percentage");
                    m.early_percentage = getDouble(r, "early_percentage");
                    m.late_percentage = getDouble(r, "late_percentage");
                    m.total_arrivals = r.getInt("total_arrivals");
                    m.avg_deviation_seconds = getDouble(r, "avg_deviation_seconds");
                    m.reference_stop_id = r.getString("reference_stop_id");
                    m.headway_count = r.getInt("headway_count");
                    m.avg_headway_minutes = getDouble(r, "avg_headway_minutes");
                    m.median_headway_minutes = getDouble(r, "median_headway_minutes");
                    m.min_headway_minutes = getDouble(r, "min_headway_minutes");
                    m.max_headway_minutes = getDouble(r, "max_headway_minutes");
                    m.headway_std_dev_minutes = getDouble(r, "headway_std_dev_minutes");
                    m.headway_cv = getDouble(r, "headway_cv");
                    m.headway_data_gaps = r.getInt("headway_data_gaps");
                    m.avg_speed_mph = getDouble(r, "avg_speed_mph");
                    m.median_speed_mph = getDouble(r, "median_speed_mph");
                    m.speed_sample_count = r.getInt("speed_sample_count");
                    m.matched_samples = r.getInt("matched_samples");
                    m.total_samples = r.getInt("total_samples");
                    m.unique_vehicles = r.getInt("unique_vehicles");
                    m.unique_trips = r.getInt("unique_trips");
                    m.last_sample_at = getInstant(r, "last_sample_at");
                    metrics.add(m);
                }
            }
        }
        return metrics;
    }

    /** @return the stored rolling summary of the route, or null if there is none. */
    public RollingSummary readRollingSummary (String routeId) {
        String sql = String.format("select %s from %srolling_summaries where route_id = ?", ROLLING_SUMMARY_COLUMNS,
                tablePrefix);
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            try (ResultSet r = statement.executeQuery()) {
                if (!r.next()) return null;
                RollingSummary s = new RollingSummary();
                s.route_id = r.getString("route_id");
                s.window_start = getDate(r, "window_start");
                s.window_end = getDate(r, "window_end");
                s.window_days = r.getInt("window_days");
                s.days_with_data = r.getInt("days_with_data");
                s.avg_otp_percentage = getDouble(r, "avg_otp_percentage");
                s.avg_early_percentage = getDouble(r, "avg_early_percentage");
                s.avg_late_percentage = getDouble(r, "avg_late_percentage");
                s.avg_headway_minutes = getDouble(r, "avg_headway_minutes");
                s.avg_headway_cv = getDouble(r, "avg_headway_cv");
                s.avg_speed_mph = getDouble(r, "avg_speed_mph");
                s.total_arrivals = r.getLong("total_arrivals");
                s.total_samples = r.getLong("total_samples");
                s.total_matched_samples = r.getLong("total_matched_samples");
                s.vehicle_days = r.getLong("vehicle_days");
                s.last_sample_at = getInstant(r, "last_sample_at");
                return s;
            }
        } catch (SQLException e) {
            throw new StorageException(e);
        }
    }

    /**
     * Rebuild a route's rolling summary from the stored daily metrics alone, for example after it was damaged or
     * deleted. Does nothing if the route has no daily metrics.
     */
    public RollingSummary rebuildRollingSummary (String routeId, int windowDays) {
        Connection connection = null;
        try {
            connection = dataSource.getConnection();
            LocalDate latest = latestDay(connection, routeId);
            if (latest == null) return null;
            List<DailyMetric> window = readDailyMetrics(connection, routeId, latest.minusDays(windowDays - 1), latest);
            RollingSummary summary = RollingSummary.fromDailyMetrics(routeId, windowDays, window);
            replaceRollingSummary(connection, summary);
            connection.commit();
            return summary;
        } catch (SQLException e) {
            DbUtils.rollbackAndCloseQuietly(connection);
            connection = null;
            throw new StorageException(e);
        } finally {
            DbUtils.closeQuietly(connection);
        }
    }

    private static String placeholders (String columns) {
        int n = columns.split(",").length;
        return String.join(", ", Collections.nCopies(n, "?"));
    }

}
