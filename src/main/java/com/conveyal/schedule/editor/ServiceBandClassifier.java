package com.conveyal.schedule.editor;

import com.conveyal.schedule.model.ExcludedPeriods;
import com.conveyal.schedule.model.ServiceBandClass;
import com.conveyal.schedule.model.TravelTimeRow;
import com.conveyal.schedule.util.TimeUtil;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Assigns departure times to one of the five travel-time classes.
 *
 * When a travel time analysis is available, the median running times of all segments are summed per 30 minute
 * period and the period totals are ranked: a period whose total falls in the lowest fifth is the fastest class, the
 * highest fifth the slowest. Without an analysis, classes follow fixed hour-of-day ranges.
 *
 * Instances are immutable and side-effect free once constructed.
 */
public class ServiceBandClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ServiceBandClassifier.class);

    private static final int[] PERCENTILES = {20, 40, 60, 80};

    /** Class used for times that fall in no analyzed period. */
    public static final ServiceBandClass DEFAULT_CLASS = ServiceBandClass.STANDARD;

    /** Rounded median running time of the whole route, keyed on period label, in table order. */
    private final Map<String, Integer> periodTotals;

    /** Ascending thresholds at the 20th, 40th, 60th and 80th percentile of the period totals. */
    private final int[] thresholds;

    /** Precomputed class for each analyzed period, keyed on the minute the period starts. */
    private final Map<Integer, ServiceBandClass> classByPeriodStart;

    /** A classifier with no travel time analysis, which uses the hour-of-day ranges only. */
    public ServiceBandClassifier () {
        this(ImmutableList.of(), ExcludedPeriods.NONE);
    }

    public ServiceBandClassifier (List<TravelTimeRow> travelTimes, ExcludedPeriods excludedPeriods) {
        Map<String, Double> sums = new LinkedHashMap<>();
        for (TravelTimeRow row : travelTimes) {
            if (row.timePeriod == null || excludedPeriods.contains(row.timePeriod)) continue;
            sums.merge(row.timePeriod, row.percentile50, Double::sum);
        }
        Map<String, Integer> totals = new LinkedHashMap<>();
        sums.forEach((period, sum) -> totals.put(period, (int) Math.round(sum)));
        this.periodTotals = ImmutableMap.copyOf(totals);
        this.thresholds = computeThresholds(new ArrayList<>(totals.values()));

        Map<Integer, ServiceBandClass> byStart = new LinkedHashMap<>();
        totals.forEach((period, total) -> {
            int start = TimeUtil.parsePeriodStart(period);
            if (isMissing(start)) {
                LOG.warn("Ignoring travel time period with unreadable label '{}'.", period);
                return;
            }
            byStart.putIfAbsent(TimeUtil.periodStart(start), classifyTotal(total));
        });
        this.classByPeriodStart = ImmutableMap.copyOf(byStart);
        LOG.debug("Classifier built from {} periods ({} excluded).", totals.size(), excludedPeriods.size());
    }

    private static int[] computeThresholds (List<Integer> totals) {
        if (totals.isEmpty()) return new int[0];
        Collections.sort(totals);
        int n = totals.size();
        int[] thresholds = new int[PERCENTILES.length];
        for (int i = 0; i < PERCENTILES.length; i++) {
            int index = (int) Math.ceil(PERCENTILES[i] / 100.0 * n) - 1;
            thresholds[i] = totals.get(Math.max(0, index));
        }
        return thresholds;
    }

    public boolean hasTravelTimes () {
        return !periodTotals.isEmpty();
    }

    /**
     * Classify a departure by the analyzed period that contains it. Without an analysis this uses the hour ranges;
     * with one, a time matching no analyzed period gets {@link #DEFAULT_CLASS}.
     */
    public ServiceBandClass classify (int departureTime) {
        if (isMissing(departureTime)) {
            LOG.warn("Cannot classify a missing departure time, using {}.", DEFAULT_CLASS);
            return DEFAULT_CLASS;
        }
        if (!hasTravelTimes()) return classifyByHour(departureTime);
        int timeOfDay = Math.floorMod(departureTime, TimeUtil.MINUTES_PER_DAY);
        for (Map.Entry<String, Integer> entry : periodTotals.entrySet()) {
            int start = TimeUtil.parsePeriodStart(entry.getKey());
            int end = TimeUtil.parsePeriodEnd(entry.getKey());
            if (isMissing(start) || isMissing(end)) continue;
            if (timeOfDay >= start && timeOfDay <= end) return classifyTotal(entry.getValue());
        }
        return DEFAULT_CLASS;
    }

    /**
     * Look up the precomputed class of the 30 minute window containing the time, falling back on the hour ranges
     * when that window was not analyzed.
     */
    public ServiceBandClass determineServiceBandForTime (int time) {
        if (isMissing(time)) return classify(time);
        ServiceBandClass bandClass = classByPeriodStart.get(TimeUtil.periodStart(time));
        return bandClass != null ? bandClass : classifyByHour(time);
    }

    private ServiceBandClass classifyTotal (int total) {
        if (thresholds.length == 0) return DEFAULT_CLASS;
        if (total < thresholds[0]) return ServiceBandClass.FASTEST;
        if (total < thresholds[1]) return ServiceBandClass.FAST;
        if (total < thresholds[2]) return ServiceBandClass.STANDARD;
        if (total < thresholds[3]) return ServiceBandClass.SLOW;
        return ServiceBandClass.SLOWEST;
    }

    /** Fixed ranges used when no analysis is available: quickest in the early morning, slowest in the evening. */
    public static ServiceBandClass classifyByHour (int time) {
        if (isMissing(time)) return DEFAULT_CLASS;
        int hour = Math.floorMod(time, TimeUtil.MINUTES_PER_DAY) / 60;
        if (hour >= 6 && hour < 9) return ServiceBandClass.FASTEST;
        if (hour >= 9 && hour < 12) return ServiceBandClass.FAST;
        if (hour >= 12 && hour < 15) return ServiceBandClass.STANDARD;
        if (hour >= 15 && hour < 18) return ServiceBandClass.SLOW;
        return ServiceBandClass.SLOWEST;
    }

    /** Rounded total median running time of each analyzed period. */
    public Map<String, Integer> periodTotals () {
        return periodTotals;
    }

}
