package com.conveyal.transitperf.stats;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A day's on-time performance for one route at three levels: the whole line, each stop, and each time period.
 * The line level is the unweighted share over all events, not an average of the stop or period figures.
 */
public class OtpBreakdown {

    public final OtpSummary line;
    public final SortedMap<String, OtpSummary> byStop;
    public final Map<TimePeriod, OtpSummary> byPeriod;

    private OtpBreakdown (OtpSummary line, SortedMap<String, OtpSummary> byStop, Map<TimePeriod, OtpSummary> byPeriod) {
        this.line = line;
        this.byStop = Collections.unmodifiableSortedMap(byStop);
        this.byPeriod = Collections.unmodifiableMap(byPeriod);
    }

    public static OtpBreakdown of (List<ArrivalEvent> events) {
        ListMultimap<String, ArrivalEvent> eventsForStop = MultimapBuilder.treeKeys().arrayListValues().build();
        ListMultimap<TimePeriod, ArrivalEvent> eventsForPeriod = ArrayListMultimap.create();
        for (ArrivalEvent event : events) {
            eventsForStop.put(event.stop_id, event);
            eventsForPeriod.put(event.getTimePeriod(), event);
        }
        SortedMap<String, OtpSummary> byStop = new TreeMap<>();
        for (String stopId : eventsForStop.keySet()) {
            byStop.put(stopId, OtpSummary.of(eventsForStop.get(stopId)));
        }
        Map<TimePeriod, OtpSummary> byPeriod = new EnumMap<>(TimePeriod.class);
        for (TimePeriod period : TimePeriod.values()) {
            if (eventsForPeriod.containsKey(period)) {
                byPeriod.put(period, OtpSummary.of(eventsForPeriod.get(period)));
            }
        }
        return new OtpBreakdown(OtpSummary.of(events), byStop, byPeriod);
    }

}
