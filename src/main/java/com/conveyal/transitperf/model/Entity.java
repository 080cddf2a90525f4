package com.conveyal.transitperf.model;

import java.io.Serializable;

/**
 * A row of the schedule reference. Field names follow the GTFS column names so that rows read from a loaded feed
 * map one to one onto the public fields.
 */
public abstract class Entity implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int INT_MISSING = Integer.MIN_VALUE;

    /** @return the GTFS identifier of this entity, used when reporting problems with it. */
    public abstract String getId ();

}
