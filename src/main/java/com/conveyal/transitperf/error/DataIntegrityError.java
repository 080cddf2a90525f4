package com.conveyal.transitperf.error;

import com.conveyal.transitperf.model.Entity;

import java.io.Serializable;

/**
 * A single record that was skipped because it is inconsistent. These are collected and counted rather than thrown,
 * since one bad trip or sample should not stop a whole route from being measured.
 */
public class DataIntegrityError implements Serializable {

    private static final long serialVersionUID = 1L;

    public final MetricsErrorType errorType;
    public final String entityType;
    public final String entityId;
    public final String badValue;

    public DataIntegrityError (MetricsErrorType errorType, String entityType, String entityId, String badValue) {
        this.errorType = errorType;
        this.entityType = entityType;
        this.entityId = entityId;
        this.badValue = badValue;
    }

    public static DataIntegrityError forEntity (Entity entity, MetricsErrorType errorType, String badValue) {
        return new DataIntegrityError(errorType, entity.getClass().getSimpleName(), entity.getId(), badValue);
    }

    @Override
    public String toString () {
        return String.format("%s %s %s: %s", errorType, entityType, entityId, badValue);
    }

}
