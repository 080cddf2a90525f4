package com.conveyal.transitperf.storage;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Conversions between nullable Java values and JDBC parameters and columns. Times are stored as timestamps with
 * time zone, written in UTC, and dates as SQL dates.
 */
public abstract class JdbcValues {

    public static void setDouble (PreparedStatement statement, int oneBasedIndex, Double value) throws SQLException {
        if (value == null) statement.setNull(oneBasedIndex, Types.DOUBLE);
        else statement.setDouble(oneBasedIndex, value);
    }

    public static void setString (PreparedStatement statement, int oneBasedIndex, String value) throws SQLException {
        if (value == null) statement.setNull(oneBasedIndex, Types.VARCHAR);
        else statement.setString(oneBasedIndex, value);
    }

    public static void setInstant (PreparedStatement statement, int oneBasedIndex, Instant value) throws SQLException {
        if (value == null) statement.setNull(oneBasedIndex, Types.TIMESTAMP_WITH_TIMEZONE);
        else statement.setObject(oneBasedIndex, value.atOffset(ZoneOffset.UTC));
    }

    public static void setDate (PreparedStatement statement, int oneBasedIndex, LocalDate value) throws SQLException {
        if (value == null) statement.setNull(oneBasedIndex, Types.DATE);
        else statement.setObject(oneBasedIndex, value);
    }

    public static Double getDouble (ResultSet resultSet, String column) throws SQLException {
        double value = resultSet.getDouble(column);
        return resultSet.wasNull() ? null : value;
    }

    public static Instant getInstant (ResultSet resultSet, String column) throws SQLException {
        OffsetDateTime value = resultSet.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    public static LocalDate getDate (ResultSet resultSet, String column) throws SQLException {
        return resultSet.getObject(column, LocalDate.class);
    }

}
