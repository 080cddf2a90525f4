package com.conveyal.transitperf.util;

import org.apache.commons.math3.util.FastMath;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.regex.Pattern;

/**
 * Small geographic and numeric helpers shared by the matching, classification and storage code.
 */
public abstract class Util {

    public static GeometryFactory geometryFactory = new GeometryFactory();

    public static final double METERS_PER_DEGREE_LATITUDE = 111111.111;

    /** Mean earth radius used for great-circle distances. */
    public static final double EARTH_RADIUS_METERS = 6371000;

    public static final double METERS_PER_SECOND_PER_MPH = 0.44704;

    private static final Pattern VALID_NAMESPACE = Pattern.compile("[A-Za-z0-9_]*");
    private static final Pattern VALID_TABLE_NAME = Pattern.compile("([A-Za-z0-9_]+\\.)?[A-Za-z0-9_]+");

    public static String human (int n) {
        if (n >= 1000000000) return String.format("%.1fG", n/1000000000.0);
        if (n >= 1000000) return String.format("%.1fM", n/1000000.0);
        if (n >= 1000) return String.format("%dk", n/1000);
        else return String.format("%d", n);
    }

    public static double yMetersForLat (double latDegrees) {
        return latDegrees * METERS_PER_DEGREE_LATITUDE;
    }

    /**
     * The x scale depends on the latitude of a reference point. Every point of one geometry must be projected with
     * the same reference latitude or lengths along the geometry will be distorted.
     */
    public static double xMetersForLon (double referenceLatDegrees, double lonDegrees) {
        double xScale = FastMath.cos(FastMath.toRadians(referenceLatDegrees));
        return xScale * lonDegrees * METERS_PER_DEGREE_LATITUDE;
    }

    public static Coordinate projectLatLonToMeters (double referenceLat, double lat, double lon) {
        return new Coordinate(xMetersForLon(referenceLat, lon), yMetersForLat(lat));
    }

    /** Inverse of {@link #projectLatLonToMeters}. The returned coordinate holds lon in x and lat in y. */
    public static Coordinate unprojectMeters (double referenceLat, Coordinate projected) {
        double xScale = FastMath.cos(FastMath.toRadians(referenceLat));
        double lat = projected.y / METERS_PER_DEGREE_LATITUDE;
        double lon = projected.x / (xScale * METERS_PER_DEGREE_LATITUDE);
        return new Coordinate(lon, lat);
    }

    /**
     * @return great-circle distance in meters between two points given in degrees.
     */
    public static double haversineDistance (double lat0, double lon0, double lat1, double lon1) {
        double phi0 = FastMath.toRadians(lat0);
        double phi1 = FastMath.toRadians(lat1);
        double dPhi = phi1 - phi0;
        double dLambda = FastMath.toRadians(lon1 - lon0);
        double a = FastMath.sin(dPhi / 2) * FastMath.sin(dPhi / 2)
                + FastMath.cos(phi0) * FastMath.cos(phi1) * FastMath.sin(dLambda / 2) * FastMath.sin(dLambda / 2);
        double c = 2 * FastMath.asin(FastMath.sqrt(FastMath.min(1, a)));
        return EARTH_RADIUS_METERS * c;
    }

    public static boolean isValidCoordinate (double lat, double lon) {
        return Double.isFinite(lat) && Double.isFinite(lon) && lat >= -90 && lat <= 90 && lon >= -180 && lon <= 180
                && !(lat == 0 && lon == 0);
    }

    public static double metersPerSecondToMph (double metersPerSecond) {
        return metersPerSecond / METERS_PER_SECOND_PER_MPH;
    }

    /** Midnight of the service day in the agency time zone. Samples of the service day are taken from here. */
    public static Instant serviceDayStart (LocalDate day, ZoneId zone) {
        return day.atStartOfDay(zone).toInstant();
    }

    /**
     * The instant GTFS times of the service day are counted from: noon local time minus twelve hours. This is local
     * midnight except on daylight saving change days, where it keeps 08:00:00 in the schedule meaning 08:00 on the
     * wall clock.
     */
    public static Instant serviceTimeOrigin (LocalDate day, ZoneId zone) {
        return day.atTime(LocalTime.NOON).atZone(zone).minusHours(12).toInstant();
    }

    /**
     * The instant expressed as a GTFS time of the service day. May exceed 24 hours for after-midnight service.
     */
    public static int secondsOfServiceDay (Instant instant, LocalDate day, ZoneId zone) {
        return (int) (instant.getEpochSecond() - serviceTimeOrigin(day, zone).getEpochSecond());
    }

    /**
     * Round half-up to the given number of decimal places. Boxed so that an unavailable (null) value stays null.
     */
    public static Double round (Double value, int places) {
        if (value == null || value.isNaN() || value.isInfinite()) return null;
        double scale = FastMath.pow(10, places);
        return FastMath.round(value * scale) / scale;
    }

    /**
     * Table prefixes are concatenated into SQL, so they are restricted to characters that cannot break out of an
     * identifier.
     */
    public static void ensureValidNamespace (String namespace) {
        if (namespace != null && !VALID_NAMESPACE.matcher(namespace).matches()) {
            throw new IllegalStateException("Namespace must only have alphanumeric characters or the underscore symbol");
        }
    }

    /** Table names may be qualified with a schema, as in "realtime.vehicle_positions". */
    public static void ensureValidTableName (String tableName) {
        if (tableName == null || !VALID_TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
    }

    /** @return "namespace." for a non-empty namespace, or the empty string. */
    public static String tablePrefix (String namespace) {
        ensureValidNamespace(namespace);
        return namespace == null || namespace.isEmpty() ? "" : namespace + ".";
    }

}
