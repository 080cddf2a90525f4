package com.conveyal.transitperf.pipeline;

import com.conveyal.transitperf.error.MetricsErrorType;
import com.conveyal.transitperf.error.MetricsException;
import com.conveyal.transitperf.loader.PositionSource;
import com.conveyal.transitperf.matching.MatchResult;
import com.conveyal.transitperf.matching.MatchScorer;
import com.conveyal.transitperf.matching.StopIndex;
import com.conveyal.transitperf.matching.TripMatcher;
import com.conveyal.transitperf.matching.TripScheduleCache;
import com.conveyal.transitperf.matching.UnmatchedReason;
import com.conveyal.transitperf.model.PositionSample;
import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.model.VendorDeviationSample;
import com.conveyal.transitperf.stats.ArrivalEvent;
import com.conveyal.transitperf.stats.ClassifiedEvents;
import com.conveyal.transitperf.stats.EventClassifier;
import com.conveyal.transitperf.stats.HeadwayEstimator;
import com.conveyal.transitperf.stats.HeadwayObservation;
import com.conveyal.transitperf.stats.HeadwayStatistics;
import com.conveyal.transitperf.stats.OtpBreakdown;
import com.conveyal.transitperf.stats.SpeedStatistics;
import com.conveyal.transitperf.stats.VendorDeviationSummary;
import com.conveyal.transitperf.stats.model.DailyMetric;
import com.conveyal.transitperf.storage.MetricsStore;
import com.conveyal.transitperf.storage.StorageException;
import com.conveyal.transitperf.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.conveyal.transitperf.error.MetricsErrorType.NO_SAMPLES;
import static com.conveyal.transitperf.error.MetricsErrorType.NO_SCHEDULE;
import static com.conveyal.transitperf.error.MetricsErrorType.PERSISTENCE_FAILED;
import static com.conveyal.transitperf.error.MetricsErrorType.TIMEOUT;

/**
 * Computes and stores the metrics of one route on one service day. Everything up to the final write works on data
 * held in memory, so a job that fails or runs out of time leaves the metrics tables exactly as they were.
 *
 * A job never throws: whatever goes wrong ends up as a FAILED result with a reason code.
 */
public class RouteDayJob {

    private static final Logger LOG = LoggerFactory.getLogger(RouteDayJob.class);

    /** Samples matched between two checks of the time budget. */
    private static final int DEADLINE_CHECK_INTERVAL = 256;

    private final String routeId;
    private final LocalDate day;
    /** Null when the schedule has no such route. */
    private final ScheduleReference schedule;
    private final PositionSource positions;
    private final MetricsStore store;
    private final AggregationConfig config;
    private final MatchScorer scorer;

    private final JobResult result;
    private JobState state = JobState.PENDING;
    private long deadlineNanos;

    public RouteDayJob (String routeId, LocalDate day, ScheduleReference schedule, PositionSource positions,
                        MetricsStore store, AggregationConfig config, MatchScorer scorer) {
        this.routeId = routeId;
        this.day = day;
        this.schedule = schedule;
        this.positions = positions;
        this.store = store;
        this.config = config;
        this.scorer = scorer;
        this.result = new JobResult(routeId, day.toString());
    }

    public JobResult run () {
        long startTime = System.currentTimeMillis();
        deadlineNanos = System.nanoTime() + TimeUnit.SECONDS.toNanos(config.jobTimeoutSeconds);
        LOG.info("Computing metrics for route {} on {}", routeId, day);
        try {
            DailyMetric metric = compute();
            VendorDeviationSummary vendorSummary = summarizeVendorDeviations();
            checkDeadline();
            persist(metric, vendorSummary);
            setState(JobState.PERSISTED);
            LOG.info("Route {} on {}: OTP {}% over {} arrivals, {} of {} samples matched", routeId, day,
                    metric.otp_percentage, metric.total_arrivals, metric.matched_samples, metric.total_samples);
        } catch (MetricsException e) {
            fail(e.errorType, e.getMessage());
            if (e.errorType == NO_SCHEDULE || e.errorType == NO_SAMPLES) {
                LOG.warn("Route {} on {} skipped: {}", routeId, day, e.getMessage());
            } else {
                LOG.error("Route {} on {} failed while {}: {}", routeId, day, state, e.getMessage());
            }
        } catch (StorageException e) {
            fail(e.errorType, e.badValue);
            LOG.error(String.format("Route %s on %s failed while %s", routeId, day, state), e);
        } catch (Exception e) {
            fail(MetricsErrorType.OTHER, e.toString());
            LOG.error(String.format("Route %s on %s failed while %s", routeId, day, state), e);
        }
        result.elapsed_millis = System.currentTimeMillis() - startTime;
        return result;
    }

    private DailyMetric compute () {
        if (schedule == null) throw new MetricsException(NO_SCHEDULE, routeId);
        ZoneId zone = config.getZoneId();
        result.integrity_errors += schedule.integrityErrors.size();

        List<PositionSample> samples = readSamples(zone);

        setState(JobState.MATCHING);
        TripScheduleCache tripSchedules = new TripScheduleCache(schedule);
        StopIndex stopIndex = StopIndex.forRoute(schedule, routeId);
        TripMatcher matcher = new TripMatcher(tripSchedules, stopIndex, day, zone, config.candidateToleranceSeconds,
                scorer);
        List<MatchResult> matches = new ArrayList<>(samples.size());
        for (PositionSample sample : samples) {
            if (matches.size() % DEADLINE_CHECK_INTERVAL == 0) checkDeadline();
            matches.add(matcher.match(sample));
        }
        result.samples_matched = matcher.getCounts().getMatched();
        result.samples_unmatched = matcher.getCounts().getUnmatched();
        result.integrity_errors += matcher.getCounts().getUnmatched(UnmatchedReason.MALFORMED_SAMPLE);
        LOG.info("Route {} on {}: {}", routeId, day, matcher.getCounts());
        checkDeadline();

        setState(JobState.CLASSIFYING);
        ClassifiedEvents events = new EventClassifier(tripSchedules, zone).classify(routeId, day, matches);
        result.events_produced = events.arrivals.size();
        result.speed_samples = events.speeds.size();
        checkDeadline();

        setState(JobState.AGGREGATING);
        DailyMetric metric = new DailyMetric(routeId, day);
        metric.setOtp(OtpBreakdown.of(events.arrivals));

        String referenceStopId = HeadwayEstimator.selectReferenceStop(schedule, routeId, day);
        List<ArrivalEvent> atReferenceStop = events.stopObservations.stream()
                .filter(event -> event.stop_id.equals(referenceStopId))
                .collect(Collectors.toList());
        List<HeadwayObservation> headways = new HeadwayEstimator().estimate(routeId, day, atReferenceStop);
        result.headway_observations = headways.size();
        metric.setHeadways(referenceStopId, HeadwayStatistics.of(headways, config.maxHeadwayMinutes));
        metric.setSpeeds(SpeedStatistics.of(events.speeds));

        Set<String> vehicles = new TreeSet<>();
        Set<String> trips = new TreeSet<>();
        for (MatchResult match : matches) {
            if (!match.isMatched()) continue;
            if (match.sample.vehicle_id != null) vehicles.add(match.sample.vehicle_id);
            trips.add(match.trip_id);
        }
        metric.matched_samples = result.samples_matched;
        metric.total_samples = samples.size();
        metric.unique_vehicles = vehicles.size();
        metric.unique_trips = trips.size();
        for (PositionSample sample : samples) {
            if (sample.observed_at == null) continue;
            if (metric.last_sample_at == null || sample.observed_at.isAfter(metric.last_sample_at)) {
                metric.last_sample_at = sample.observed_at;
            }
        }
        return metric;
    }

    /**
     * @return the samples of the service day without repeated reports, in observation order.
     */
    private List<PositionSample> readSamples (ZoneId zone) {
        Instant from = Util.serviceDayStart(day, zone);
        Instant to = Util.serviceDayStart(day.plusDays(1), zone);
        List<PositionSample> raw = new ArrayList<>(positions.samplesForRoute(routeId, from, to));
        result.samples_seen = raw.size();
        raw.sort(PositionSample.OBSERVATION_ORDER);
        Map<List<Object>, PositionSample> distinct = new LinkedHashMap<>();
        for (PositionSample sample : raw) {
            distinct.putIfAbsent(sample.duplicateKey(), sample);
        }
        result.duplicates_removed = raw.size() - distinct.size();
        if (distinct.size() < config.minSamples) {
            throw new MetricsException(NO_SAMPLES, String.format("%d samples, %d needed", distinct.size(),
                    config.minSamples));
        }
        if (result.duplicates_removed > 0) {
            LOG.debug("Removed {} repeated samples for route {} on {}", result.duplicates_removed, routeId, day);
        }
        return new ArrayList<>(distinct.values());
    }

    /** @return null when there is no vendor feed or it reported nothing for this route and day. */
    private VendorDeviationSummary summarizeVendorDeviations () {
        ZoneId zone = config.getZoneId();
        List<VendorDeviationSample> samples = positions.vendorDeviations(routeId, Util.serviceDayStart(day, zone),
                Util.serviceDayStart(day.plusDays(1), zone));
        if (samples.isEmpty()) return null;
        return VendorDeviationSummary.of(samples);
    }

    /**
     * Write the metrics, retrying with exponential backoff. Each attempt is a single transaction, so a failed attempt
     * leaves nothing behind.
     */
    private void persist (DailyMetric metric, VendorDeviationSummary vendorSummary) {
        long backoff = config.persistBackoffMillis;
        for (int attempt = 1; ; attempt++) {
            try {
                store.persist(metric, vendorSummary, config.windowDays);
                return;
            } catch (StorageException e) {
                if (attempt >= config.persistAttempts) {
                    LOG.error(String.format("Giving up writing route %s on %s after %d attempts", routeId, day,
                            attempt), e);
                    throw new MetricsException(PERSISTENCE_FAILED, e.badValue);
                }
                LOG.warn("Attempt {} to write route {} on {} failed, retrying in {} ms: {}", attempt, routeId, day,
                        backoff, e.badValue);
            }
            try {
                Thread.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MetricsException(PERSISTENCE_FAILED, "interrupted while waiting to retry");
            }
            backoff *= 2;
        }
    }

    private void checkDeadline () {
        if (System.nanoTime() > deadlineNanos) {
            throw new MetricsException(TIMEOUT, String.format("more than %d s while %s", config.jobTimeoutSeconds, state));
        }
    }

    private void setState (JobState next) {
        if (state.isFinal()) throw new IllegalStateException(String.format("Job is already %s", state));
        LOG.debug("Route {} on {}: {} -> {}", routeId, day, state, next);
        state = next;
        result.status = next;
    }

    private void fail (MetricsErrorType errorType, String detail) {
        state = JobState.FAILED;
        result.status = JobState.FAILED;
        result.reason = errorType.code;
        result.detail = detail;
    }

}
