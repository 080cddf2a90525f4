package com.conveyal.transitperf.loader;

import com.conveyal.transitperf.model.ScheduleReference;

/**
 * Where the schedule reference comes from. The schedule store is owned by another system and is only ever read.
 */
public interface ScheduleSource {

    /**
     * @return everything needed to measure the route, or null if the schedule has no such route.
     */
    ScheduleReference forRoute (String routeId);

}
