package com.conveyal.transitperf.pipeline;

import com.conveyal.transitperf.error.MetricsErrorType;
import com.conveyal.transitperf.loader.PositionSource;
import com.conveyal.transitperf.loader.ScheduleSource;
import com.conveyal.transitperf.matching.ConfidenceScore;
import com.conveyal.transitperf.matching.MatchScorer;
import com.conveyal.transitperf.model.ScheduleReference;
import com.conveyal.transitperf.storage.MetricsStore;
import com.conveyal.transitperf.storage.StorageException;
import com.conveyal.transitperf.util.Util;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the metrics computation over a range of days and a set of routes, and collects the per-unit report.
 *
 * The unit of work is one route on one day. All the days of one route run one after the other on the same worker,
 * because every day written also rewrites that route's rolling summary. Different routes run in parallel on a fixed
 * pool of workers. The schedule of a route is read once and shared by its days.
 */
public class MetricsAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsAggregator.class);

    private final ScheduleSource schedules;
    private final PositionSource positions;
    private final MetricsStore store;
    private final AggregationConfig config;
    private final MatchScorer scorer;

    public MetricsAggregator (ScheduleSource schedules, PositionSource positions, MetricsStore store,
                              AggregationConfig config) {
        this(schedules, positions, store, config, ConfidenceScore.WEIGHTED);
    }

    public MetricsAggregator (ScheduleSource schedules, PositionSource positions, MetricsStore store,
                              AggregationConfig config, MatchScorer scorer) {
        config.validate();
        this.schedules = schedules;
        this.positions = positions;
        this.store = store;
        this.config = config;
        this.scorer = scorer;
    }

    public RunResult run (RunParameters parameters) {
        long startTime = System.currentTimeMillis();
        LOG.info("Starting metrics run: {}", parameters);
        RunResult runResult = new RunResult();
        runResult.firstDay = parameters.firstDay.toString();
        runResult.lastDay = parameters.lastDay.toString();
        runResult.routeFilter = parameters.routeId;
        runResult.recalculate = parameters.recalculate;

        store.createTables();
        List<String> routeIds = planRoutes(parameters);
        LOG.info("{} routes to process over {} days", routeIds.size(), parameters.days().size());

        Map<String, Future<List<JobResult>>> futures = new LinkedHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(config.workerThreads, routeIds.size())));
        try {
            for (String routeId : routeIds) {
                futures.put(routeId, executor.submit(() -> runRoute(routeId, parameters)));
            }
            for (Map.Entry<String, Future<List<JobResult>>> entry : futures.entrySet()) {
                List<JobResult> jobs;
                try {
                    jobs = entry.getValue().get();
                } catch (ExecutionException e) {
                    LOG.error("Worker for route " + entry.getKey() + " failed", e.getCause());
                    jobs = failAll(entry.getKey(), parameters.days(), MetricsErrorType.OTHER, e.getCause().toString());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.error("Interrupted while waiting for route {}", entry.getKey());
                    jobs = failAll(entry.getKey(), parameters.days(), MetricsErrorType.OTHER, "interrupted");
                }
                jobs.forEach(runResult::add);
            }
        } finally {
            executor.shutdownNow();
        }
        runResult.runTimeMillis = System.currentTimeMillis() - startTime;
        LOG.info("Metrics run finished in {} ms: {} persisted, {} failed, {} skipped, {} samples read",
                runResult.runTimeMillis, runResult.persisted, runResult.failed, runResult.skipped,
                Util.human((int) Math.min(Integer.MAX_VALUE, runResult.totalSamples)));
        return runResult;
    }

    /** @return the filter route alone, or every route with samples in the range, sorted. */
    private List<String> planRoutes (RunParameters parameters) {
        if (parameters.routeId != null) return Collections.singletonList(parameters.routeId);
        ZoneId zone = config.getZoneId();
        Set<String> routeIds = new TreeSet<>(positions.routesWithSamples(
                Util.serviceDayStart(parameters.firstDay, zone),
                Util.serviceDayStart(parameters.lastDay.plusDays(1), zone)));
        return new ArrayList<>(routeIds);
    }

    /**
     * Run every day of one route in order. Never throws: each day ends up with a result.
     */
    List<JobResult> runRoute (String routeId, RunParameters parameters) {
        List<LocalDate> days = parameters.days();
        Set<LocalDate> done;
        try {
            done = parameters.recalculate ? Collections.emptySet()
                    : store.daysWithMetrics(routeId, parameters.firstDay, parameters.lastDay);
        } catch (StorageException e) {
            LOG.error("Could not check existing metrics for route " + routeId, e);
            return failAll(routeId, days, e.errorType, e.badValue);
        }
        List<LocalDate> pending = new ArrayList<>();
        for (LocalDate day : days) {
            if (!done.contains(day)) pending.add(day);
        }
        ScheduleReference schedule = null;
        if (!pending.isEmpty()) {
            try {
                schedule = schedules.forRoute(routeId);
            } catch (StorageException e) {
                LOG.error("Could not read the schedule of route " + routeId, e);
                return failAll(routeId, days, e.errorType, e.badValue);
            }
        }
        List<JobResult> results = new ArrayList<>();
        for (LocalDate day : days) {
            if (done.contains(day)) {
                JobResult skipped = new JobResult(routeId, day.toString());
                skipped.status = JobState.SKIPPED;
                LOG.info("Route {} on {} already has metrics, skipping", routeId, day);
                results.add(skipped);
            } else {
                results.add(new RouteDayJob(routeId, day, schedule, positions, store, config, scorer).run());
            }
        }
        return results;
    }

    private static List<JobResult> failAll (String routeId, List<LocalDate> days, MetricsErrorType errorType,
                                            String detail) {
        List<JobResult> results = new ArrayList<>();
        for (LocalDate day : days) {
            JobResult failed = new JobResult(routeId, day.toString());
            failed.status = JobState.FAILED;
            failed.reason = errorType.code;
            failed.detail = detail;
            results.add(failed);
        }
        return results;
    }

}
