package com.conveyal.transitperf.model;

import com.google.common.collect.Maps;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Map;

/**
 * This table does not exist in GTFS. It is a join of calendars and calendar_dates on service_id.
 * There should only be one Calendar per service_id. There should only be one calendar_date per tuple of
 * (service_id, date), which means there can be many calendar_dates per service_id.
 */
public class Service implements Serializable {

    private static final long serialVersionUID = 7966238549509747091L;

    public String   service_id;
    public Calendar calendar;
    public Map<LocalDate, CalendarDate> calendar_dates = Maps.newHashMap();

    public Service (String service_id) {
        this.service_id = service_id;
    }

    /**
     * Is this service active on the specified date? Exceptions in calendar_dates take precedence over the weekly
     * pattern, so a date removed by an exception (exception_type 2) is inactive even on a scheduled weekday.
     */
    public boolean activeOn (LocalDate date) {
        CalendarDate exception = calendar_dates.get(date);
        if (exception != null) return exception.exception_type == CalendarDate.SERVICE_ADDED;
        if (calendar == null) return false;
        return calendar.includes(date);
    }

}
