package com.conveyal.transitperf.pipeline;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * What one run is asked to compute: an inclusive range of service days, optionally limited to one route.
 */
public class RunParameters {

    public final LocalDate firstDay;
    public final LocalDate lastDay;
    /** Null to compute every route that has samples in the range. */
    public final String routeId;
    /** Overwrite route/days that already have metrics instead of skipping them. */
    public final boolean recalculate;

    public RunParameters (LocalDate firstDay, LocalDate lastDay, String routeId, boolean recalculate) {
        if (firstDay == null || lastDay == null) throw new IllegalArgumentException("Both ends of the day range are required");
        if (lastDay.isBefore(firstDay)) {
            throw new IllegalArgumentException(String.format("Day range ends (%s) before it starts (%s)", lastDay, firstDay));
        }
        this.firstDay = firstDay;
        this.lastDay = lastDay;
        this.routeId = routeId;
        this.recalculate = recalculate;
    }

    public static RunParameters singleDay (LocalDate day, String routeId, boolean recalculate) {
        return new RunParameters(day, day, routeId, recalculate);
    }

    /** @return every day of the range in order. */
    public List<LocalDate> days () {
        List<LocalDate> days = new ArrayList<>();
        for (LocalDate day = firstDay; !day.isAfter(lastDay); day = day.plusDays(1)) days.add(day);
        return days;
    }

    @Override
    public String toString () {
        return String.format("%s to %s, %s%s", firstDay, lastDay, routeId == null ? "all routes" : "route " + routeId,
                recalculate ? ", recalculating" : "");
    }

}
