package com.conveyal.transitperf.model;

import java.time.LocalDate;

public class Calendar extends Entity {

    private static final long serialVersionUID = 6634236680822635875L;

    public String service_id;

    public LocalDate start_date;
    public LocalDate end_date;

    public int monday;
    public int tuesday;
    public int wednesday;
    public int thursday;
    public int friday;
    public int saturday;
    public int sunday;

    @Override
    public String getId () {
        return service_id;
    }

    /** @return whether the weekly pattern and date range include the given date, ignoring exceptions. */
    public boolean includes (LocalDate date) {
        if (start_date != null && date.isBefore(start_date)) return false;
        if (end_date != null && date.isAfter(end_date)) return false;
        switch (date.getDayOfWeek()) {
            case MONDAY: return monday == 1;
            case TUESDAY: return tuesday == 1;
            case WEDNESDAY: return wednesday == 1;
            case THURSDAY: return thursday == 1;
            case FRIDAY: return friday == 1;
            case SATURDAY: return saturday == 1;
            case SUNDAY: return sunday == 1;
            default: return false;
        }
    }

}
