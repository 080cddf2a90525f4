package com.conveyal.transitperf.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * One polled vehicle position, as appended by the ingestion process. Samples are never modified after they are
 * written; this class is only ever populated from the position store or from tests.
 */
public class PositionSample implements Serializable {

    private static final long serialVersionUID = 2740529174408745031L;

    /** Deterministic processing order: observation time, then vehicle, then row id. */
    public static final Comparator<PositionSample> OBSERVATION_ORDER = Comparator
            .comparing((PositionSample s) -> s.observed_at, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(s -> s.vehicle_id, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparingLong(s -> s.id);

    public long    id;
    public String  vehicle_id;
    public String  route_id;
    /** Trip reported by the vehicle. Frequently missing or stale, so it is only a hint. */
    public String  trip_id_hint;
    public double  latitude;
    public double  longitude;
    public Double  speed;
    public Double  bearing;
    public Instant observed_at;

    public PositionSample () { }

    public PositionSample (long id, String vehicle_id, String route_id, String trip_id_hint,
                           double latitude, double longitude, Instant observed_at) {
        this.id = id;
        this.vehicle_id = vehicle_id;
        this.route_id = route_id;
        this.trip_id_hint = trip_id_hint;
        this.latitude = latitude;
        this.longitude = longitude;
        this.observed_at = observed_at;
    }

    /**
     * Key identifying repeated reports of the same position. Feeds often re-serve an unchanged position on
     * consecutive polls.
     */
    public List<Object> duplicateKey () {
        return Arrays.asList(vehicle_id, observed_at, latitude, longitude);
    }

    @Override
    public String toString () {
        return String.format("sample %d (vehicle %s at %s)", id, vehicle_id, observed_at);
    }

}
