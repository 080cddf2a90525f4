package com.conveyal.transitperf.loader;

import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.model.VendorDeviationSample;

import java.time.Instant;
import java.util.List;

/**
 * Read access to the append-only position samples written by the ingestion process. All time ranges are half-open,
 * including from and excluding to.
 */
public interface PositionSource {

    /** @return the route's samples observed in the range, in observation order. */
    List<PositionSample> samplesForRoute (String routeId, Instant from, Instant to);

    /** @return the IDs of all routes with at least one sample in the range, sorted. */
    List<String> routesWithSamples (Instant from, Instant to);

    /** @return the vendor's self-reported deviations for the route, or an empty list if that feed is not in use. */
    List<VendorDeviationSample> vendorDeviations (String routeId, Instant from, Instant to);

}
