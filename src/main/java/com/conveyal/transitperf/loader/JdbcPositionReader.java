package com.conveyal.transitperf.loader;

import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.model.VendorDeviationSample;
import com.conveyal.transitperf.storage.StorageException;
import com.conveyal.transitperf.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.conveyal.transitperf.storage.JdbcValues.getDouble;
import static com.conveyal.transitperf.storage.JdbcValues.getInstant;
import static com.conveyal.transitperf.storage.JdbcValues.setInstant;

/**
 * Reads position samples from the table the ingestion process appends to, and optionally the vendor's deviation
 * feed from a second table. Rows are returned as they are stored: missing coordinates become NaN and are rejected
 * later by the matcher as malformed samples.
 */
public class JdbcPositionReader implements PositionSource {

    private static final Logger LOG = LoggerFactory.getLogger(JdbcPositionReader.class);

    private final DataSource dataSource;
    private final String positionTable;
    /** Null when there is no vendor deviation feed. */
    private final String vendorTable;

    public JdbcPositionReader (DataSource dataSource, String positionTable, String vendorTable) {
        Util.ensureValidTableName(positionTable);
        if (vendorTable != null) Util.ensureValidTableName(vendorTable);
        this.dataSource = dataSource;
        this.positionTable = positionTable;
        this.vendorTable = vendorTable;
    }

    @Override
    public List<PositionSample> samplesForRoute (String routeId, Instant from, Instant to) {
        String sql = String.format("select id, vehicle_id, route_id, trip_id, latitude, longitude, speed, bearing, " +
                "observed_at from %s where route_id = ? and observed_at >= ? and observed_at < ? " +
                "order by observed_at, vehicle_id, id", positionTable);
        List<PositionSample> samples = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            setInstant(statement, 2, from);
            setInstant(statement, 3, to);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    PositionSample sample = new PositionSample();
                    sample.id = resultSet.getLong("id");
                    sample.vehicle_id = resultSet.getString("vehicle_id");
                    sample.route_id = resultSet.getString("route_id");
                    sample.trip_id_hint = resultSet.getString("trip_id");
                    sample.latitude = orNaN(getDouble(resultSet, "latitude"));
                    sample.longitude = orNaN(getDouble(resultSet, "longitude"));
                    sample.speed = getDouble(resultSet, "speed");
                    sample.bearing = getDouble(resultSet, "bearing");
                    sample.observed_at = getInstant(resultSet, "observed_at");
                    samples.add(sample);
                }
            }
            connection.rollback();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
        LOG.debug("Read {} samples for route {} between {} and {}", samples.size(), routeId, from, to);
        return samples;
    }

    @Override
    public List<String> routesWithSamples (Instant from, Instant to) {
        String sql = String.format("select distinct route_id from %s where observed_at >= ? and observed_at < ? " +
                "and route_id is not null order by route_id", positionTable);
        List<String> routeIds = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            setInstant(statement, 1, from);
            setInstant(statement, 2, to);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) routeIds.add(resultSet.getString(1));
            }
            connection.rollback();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
        return routeIds;
    }

    @Override
    public List<VendorDeviationSample> vendorDeviations (String routeId, Instant from, Instant to) {
        if (vendorTable == null) return Collections.emptyList();
        String sql = String.format("select vehicle_id, route_id, deviation_minutes, observed_at from %s " +
                "where route_id = ? and observed_at >= ? and observed_at < ? order by observed_at, vehicle_id",
                vendorTable);
        List<VendorDeviationSample> samples = new ArrayList<>();
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, routeId);
            setInstant(statement, 2, from);
            setInstant(statement, 3, to);
            try (ResultSet resultSet = statement.executeQuery()) {
                while (resultSet.next()) {
                    samples.add(new VendorDeviationSample(resultSet.getString("vehicle_id"),
                            resultSet.getString("route_id"), getDouble(resultSet, "deviation_minutes"),
                            getInstant(resultSet, "observed_at")));
                }
            }
            connection.rollback();
        } catch (SQLException e) {
            throw new StorageException(e);
        }
        return samples;
    }

    private static double orNaN (Double value) {
        return value == null ? Double.NaN : value;
    }

}
