package com.conveyal.transitperf.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * A schedule deviation as self-reported by the secondary vendor feed. The vendor computes it with its own,
 * undocumented method, so it is only summarized on its own for cross-checking and never feeds arrival
 * classification.
 */
public class VendorDeviationSample implements Serializable {

    private static final long serialVersionUID = -1785293475320598457L;

    public String  vehicle_id;
    public String  route_id;
    /** Positive means late. Null when the vendor did not report one. */
    public Double  deviation_minutes;
    public Instant observed_at;

    public VendorDeviationSample () { }

    public VendorDeviationSample (String vehicle_id, String route_id, Double deviation_minutes, Instant observed_at) {
        this.vehicle_id = vehicle_id;
        this.route_id = route_id;
        this.deviation_minutes = deviation_minutes;
        this.observed_at = observed_at;
    }

}
