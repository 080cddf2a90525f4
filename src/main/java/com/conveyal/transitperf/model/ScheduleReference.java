package com.conveyal.transitperf.model;

import com.conveyal.transitperf.error.DataIntegrityError;
import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static com.conveyal.transitperf.error.MetricsErrorType.MISSING_STOP;
import static com.conveyal.transitperf.error.MetricsErrorType.STOP_TIMES_OUT_OF_SEQUENCE;
import static com.conveyal.transitperf.error.MetricsErrorType.TRIP_TOO_FEW_STOP_TIMES;

/**
 * A read-only view of the part of one schedule feed version that is needed to measure a single route: the route
 * itself, its trips with their ordered stop times, the stops those trips visit, their shapes and their service
 * calendars. Instances are never modified once built, so one instance can safely be read from the job that owns it
 * without any locking.
 *
 * Trips that cannot be located in time (stop times going backwards, fewer than two timed stops, unknown stops) are
 * left out when the reference is built, and recorded in {@link #integrityErrors}.
 */
public class ScheduleReference {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleReference.class);

    /** The feed namespace (version) this reference was read from. */
    public final String feedVersion;
    public final Route route;

    /** Sorted by ID so that every iteration over trips happens in the same order on every run. */
    private final Map<String, Trip> trips;
    private final Map<String, Stop> stops;
    private final Map<String, List<ShapePoint>> shapePointsForShape;
    private final Map<String, Service> services;

    /**
     * Feeds loaded without calendar tables give no way to tell when a service runs. In that case every trip is
     * considered active on every day.
     */
    public final boolean hasServiceCalendars;

    public final List<DataIntegrityError> integrityErrors;

    private ScheduleReference (Builder builder, Map<String, Trip> validTrips, List<DataIntegrityError> errors) {
        this.feedVersion = builder.feedVersion;
        this.route = builder.route;
        this.trips = Collections.unmodifiableMap(validTrips);
        this.stops = Collections.unmodifiableMap(new TreeMap<>(builder.stops));
        Map<String, List<ShapePoint>> shapes = new TreeMap<>();
        for (String shapeId : builder.shapePoints.keySet()) {
            List<ShapePoint> points = new ArrayList<>(builder.shapePoints.get(shapeId));
            points.sort(Comparator.comparingInt(p -> p.shape_pt_sequence));
            shapes.put(shapeId, Collections.unmodifiableList(points));
        }
        this.shapePointsForShape = Collections.unmodifiableMap(shapes);
        this.services = Collections.unmodifiableMap(new TreeMap<>(builder.services));
        this.hasServiceCalendars = builder.hasServiceCalendars;
        this.integrityErrors = Collections.unmodifiableList(errors);
    }

    public Trip getTrip (String tripId) {
        if (tripId == null) return null;
        return trips.get(tripId);
    }

    public Stop getStop (String stopId) {
        return stops.get(stopId);
    }

    /** @return all usable trips of the given route, ordered by trip ID. */
    public List<Trip> tripsForRoute (String routeId) {
        return trips.values().stream()
                .filter(trip -> trip.route_id.equals(routeId))
                .collect(Collectors.toList());
    }

    /** @return the trips of the route whose service runs on the given date, ordered by trip ID. */
    public List<Trip> activeTrips (String routeId, LocalDate date) {
        return tripsForRoute(routeId).stream()
                .filter(trip -> isActive(trip, date))
                .collect(Collectors.toList());
    }

    public boolean isActive (Trip trip, LocalDate date) {
        if (!hasServiceCalendars) return true;
        Service service = services.get(trip.service_id);
        return service != null && service.activeOn(date);
    }

    /**
     * @return the stops visited by at least one trip of the route, ordered by stop ID. This is deliberately not the
     * full set of stops in the feed.
     */
    public List<Stop> stopsForRoute (String routeId) {
        Map<String, Stop> visited = new TreeMap<>();
        for (Trip trip : tripsForRoute(routeId)) {
            for (StopTime stopTime : trip.stop_times) {
                Stop stop = stops.get(stopTime.stop_id);
                if (stop != null) visited.put(stop.stop_id, stop);
            }
        }
        return new ArrayList<>(visited.values());
    }

    /** @return the shape points ordered by sequence, or an empty list if the shape is unknown. */
    public List<ShapePoint> getShapePoints (String shapeId) {
        if (shapeId == null) return Collections.emptyList();
        return shapePointsForShape.getOrDefault(shapeId, Collections.emptyList());
    }

    /**
     * Collects schedule rows in any order and assembles them into a consistent reference.
     */
    public static class Builder {

        private final String feedVersion;
        private final Route route;
        private final Map<String, Trip> trips = new HashMap<>();
        private final ListMultimap<String, StopTime> stopTimesForTrip = ArrayListMultimap.create();
        private final Map<String, Stop> stops = new HashMap<>();
        private final ListMultimap<String, ShapePoint> shapePoints = ArrayListMultimap.create();
        private final Map<String, Service> services = new HashMap<>();
        private boolean hasServiceCalendars = false;

        public Builder (String feedVersion, Route route) {
            this.feedVersion = feedVersion;
            this.route = route;
        }

        public Builder addTrip (Trip trip) {
            trips.put(trip.trip_id, trip);
            return this;
        }

        public Builder addStopTime (StopTime stopTime) {
            stopTimesForTrip.put(stopTime.trip_id, stopTime);
            return this;
        }

        public Builder addStop (Stop stop) {
            stops.put(stop.stop_id, stop);
            return this;
        }

        public Builder addShapePoint (ShapePoint shapePoint) {
            shapePoints.put(shapePoint.shape_id, shapePoint);
            return this;
        }

        public Builder addCalendar (Calendar calendar) {
            hasServiceCalendars = true;
            services.computeIfAbsent(calendar.service_id, Service::new).calendar = calendar;
            return this;
        }

        public Builder addCalendarDate (CalendarDate calendarDate) {
            hasServiceCalendars = true;
            services.computeIfAbsent(calendarDate.service_id, Service::new)
                    .calendar_dates.put(calendarDate.date, calendarDate);
            return this;
        }

        public ScheduleReference build () {
            Map<String, Trip> validTrips = new TreeMap<>();
            List<DataIntegrityError> errors = new ArrayList<>();
            for (Trip trip : new TreeMap<>(trips).values()) {
                List<StopTime> stopTimes = new ArrayList<>(stopTimesForTrip.get(trip.trip_id));
                stopTimes.sort(Comparator.comparingInt(st -> st.stop_sequence));
                DataIntegrityError error = checkStopTimes(trip, stopTimes);
                if (error != null) {
                    LOG.warn("Skipping trip: {}", error);
                    errors.add(error);
                    continue;
                }
                trip.stop_times = Collections.unmodifiableList(stopTimes);
                validTrips.put(trip.trip_id, trip);
            }
            return new ScheduleReference(this, validTrips, errors);
        }

        private DataIntegrityError checkStopTimes (Trip trip, List<StopTime> stopTimes) {
            int previousTime = Entity.INT_MISSING;
            int timedStopTimes = 0;
            for (StopTime stopTime : stopTimes) {
                if (!stops.containsKey(stopTime.stop_id)) {
                    return DataIntegrityError.forEntity(trip, MISSING_STOP, stopTime.stop_id);
                }
                if (!stopTime.isTimed()) continue;
                int time = stopTime.getScheduledTime();
                if (previousTime != Entity.INT_MISSING && time < previousTime) {
                    return DataIntegrityError.forEntity(trip, STOP_TIMES_OUT_OF_SEQUENCE,
                            String.format("stop_sequence %d at %d after %d", stopTime.stop_sequence, time, previousTime));
                }
                previousTime = time;
                timedStopTimes++;
            }
            if (timedStopTimes < 2) {
                return DataIntegrityError.forEntity(trip, TRIP_TOO_FEW_STOP_TIMES, Integer.toString(timedStopTimes));
            }
            return null;
        }

    }

}
