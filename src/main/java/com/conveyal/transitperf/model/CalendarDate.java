package com.conveyal.transitperf.model;

import java.time.LocalDate;

public class CalendarDate extends Entity {

    private static final long serialVersionUID = 6936614582249119431L;

    public static final int SERVICE_ADDED = 1;
    public static final int SERVICE_REMOVED = 2;

    public String    service_id;
    public LocalDate date;
    public int       exception_type;

    public CalendarDate () { }

    public CalendarDate (String service_id, LocalDate date, int exception_type) {
        this.service_id = service_id;
        this.date = date;
        this.exception_type = exception_type;
    }

    @Override
    public String getId () {
        return service_id;
    }

}
