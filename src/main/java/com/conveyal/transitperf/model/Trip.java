package com.conveyal.transitperf.model;

import java.util.ArrayList;
import java.util.List;

public class Trip extends Entity {

    private static final long serialVersionUID = -4869384750974542712L;
    public String trip_id;
    public String route_id;
    public String service_id;
    public int    direction_id = INT_MISSING;
    public String shape_id;

    /** Ordered by stop_sequence once the trip has been read into a {@link ScheduleReference}. */
    public List<StopTime> stop_times = new ArrayList<>();

    public Trip () { }

    public Trip (String trip_id, String route_id, String service_id) {
        this.trip_id = trip_id;
        this.route_id = route_id;
        this.service_id = service_id;
    }

    @Override
    public String getId () {
        return trip_id;
    }

}
