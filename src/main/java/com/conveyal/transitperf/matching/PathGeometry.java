package com.conveyal.transitperf.matching;

import com.conveyal.transitperf.model.ShapePoint;
import com.conveyal.transitperf.model.Stop;
import com.conveyal.transitperf.util.Util;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;

import java.util.ArrayList;
import java.util.List;

/**
 * The path a vehicle follows, as a polyline in a local metric projection. Distances along the path are measured
 * in meters from its first point. Positions are located on the path by snapping them to the nearest point of the
 * polyline.
 */
public class PathGeometry {

    /** All points are projected with this latitude so that lengths along the path are consistent. */
    private final double referenceLat;
    private final LengthIndexedLine indexedLine;
    private final Coordinate singlePoint;
    private final double length;

    private PathGeometry (List<Coordinate> latLonPoints) {
        List<Coordinate> projected = new ArrayList<>();
        referenceLat = latLonPoints.isEmpty() ? 0 : latLonPoints.get(0).y;
        for (Coordinate point : latLonPoints) {
            Coordinate c = Util.projectLatLonToMeters(referenceLat, point.y, point.x);
            // Repeated points add nothing and would make a degenerate segment.
            if (!projected.isEmpty() && projected.get(projected.size() - 1).equals2D(c)) continue;
            projected.add(c);
        }
        if (projected.size() >= 2) {
            LineString lineString = Util.geometryFactory.createLineString(projected.toArray(new Coordinate[0]));
            indexedLine = new LengthIndexedLine(lineString);
            length = lineString.getLength();
            singlePoint = null;
        } else {
            indexedLine = null;
            length = 0;
            singlePoint = projected.isEmpty() ? new Coordinate(0, 0) : projected.get(0);
        }
    }

    /** Build the path from GTFS shape points, which must already be ordered by sequence. */
    public static PathGeometry fromShapePoints (List<ShapePoint> shapePoints) {
        List<Coordinate> points = new ArrayList<>(shapePoints.size());
        for (ShapePoint point : shapePoints) {
            points.add(new Coordinate(point.shape_pt_lon, point.shape_pt_lat));
        }
        return new PathGeometry(points);
    }

    /**
     * A stand-in path when the feed has no shape for a trip: straight lines between its stops, in visiting order.
     */
    public static PathGeometry fromStops (List<Stop> stops) {
        List<Coordinate> points = new ArrayList<>(stops.size());
        for (Stop stop : stops) {
            points.add(new Coordinate(stop.stop_lon, stop.stop_lat));
        }
        return new PathGeometry(points);
    }

    /** @return distance in meters from the start of the path to the point of the path closest to the position. */
    public double project (double lat, double lon) {
        if (indexedLine == null) return 0;
        return indexedLine.project(Util.projectLatLonToMeters(referenceLat, lat, lon));
    }

    /**
     * Same as {@link #project(double, double)} but never returning a distance before minimum. Used to place the
     * stops of a trip in order along paths that pass close to the same place more than once.
     */
    public double projectAfter (double lat, double lon, double minimum) {
        if (indexedLine == null) return 0;
        Coordinate c = Util.projectLatLonToMeters(referenceLat, lat, lon);
        double distance = indexedLine.project(c);
        if (distance >= minimum) return distance;
        // Project onto the remaining part of the path only.
        LineString rest = (LineString) indexedLine.extractLine(minimum, length);
        if (rest.getNumPoints() < 2 || rest.getLength() == 0) return minimum;
        return minimum + new LengthIndexedLine(rest).project(c);
    }

    /** @return the position at the given distance along the path, with longitude in x and latitude in y. */
    public Coordinate pointAt (double distanceAlong) {
        Coordinate projected;
        if (indexedLine == null) {
            projected = singlePoint;
        } else {
            double clamped = Math.max(0, Math.min(length, distanceAlong));
            projected = indexedLine.extractPoint(clamped);
        }
        return Util.unprojectMeters(referenceLat, projected);
    }

    public double length () {
        return length;
    }

}
