package com.conveyal.schedule.editor;

import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.ServiceBand;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.conveyal.schedule.util.TimeUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the times of a new trip by walking the route from a start time, adding running time between timepoints and
 * recovery at each timepoint. The trip number is left at zero for the caller to renumber.
 */
public abstract class TripBuilder {

    /** Running minutes between two timepoints when the band gives no segment times. */
    public static final int DEFAULT_SEGMENT_MINUTES = 10;

    /**
     * Running minutes for each of the route's segments: the band's own segment times where it has them, the default
     * elsewhere.
     */
    public static List<Integer> segmentMinutes (ServiceBand band, int timePointCount, int defaultMinutes) {
        List<Integer> segments = new ArrayList<>();
        for (int i = 0; i < timePointCount - 1; i++) {
            Integer minutes = null;
            if (band != null && band.hasSegmentTimes() && i < band.segmentTimes.size()) minutes = band.segmentTimes.get(i);
            segments.add(minutes != null ? minutes : defaultMinutes);
        }
        return segments;
    }

    /** Walk forward from the start time using the given segment running times and recovery template. */
    public static Trip build (
        List<TimePoint> timePoints,
        int blockNumber,
        String serviceBand,
        int startTime,
        List<Integer> segmentMinutes,
        List<Integer> template
    ) {
        checkRoute(timePoints);
        Trip trip = new Trip();
        trip.blockNumber = blockNumber;
        trip.serviceBand = serviceBand;
        int time = startTime;
        for (int i = 0; i < timePoints.size(); i++) {
            String timePointId = timePoints.get(i).id;
            if (i > 0) time += segmentMinutes.get(i - 1);
            int recovery = RecoveryTemplates.valueAt(template, i);
            trip.arrivalTimes.put(timePointId, time);
            trip.recoveryTimes.put(timePointId, recovery);
            time += recovery;
            trip.departureTimes.put(timePointId, time);
        }
        TripTimes.updateDerivedFields(trip, timePoints);
        return trip;
    }

    /**
     * Build a trip that leaves its last timepoint exactly at the target end time. Running time is spread evenly over
     * the segments; rounding is absorbed by the last segment. When there are fewer running minutes than segments,
     * the leading segments take zero minutes.
     *
     * @throws IllegalArgumentException if no running time at all is left between start and end once recovery is
     * taken out.
     */
    public static Trip buildToFit (
        List<TimePoint> timePoints,
        int blockNumber,
        String serviceBand,
        int startTime,
        int targetEndTime,
        List<Integer> template
    ) {
        checkRoute(timePoints);
        int segments = timePoints.size() - 1;
        int totalRecovery = 0;
        for (int i = 1; i < timePoints.size(); i++) totalRecovery += RecoveryTemplates.valueAt(template, i);
        int runningMinutes = targetEndTime - startTime - totalRecovery;
        if (runningMinutes <= 0) {
            throw new IllegalArgumentException(String.format(
                "Cannot fit a trip with %d min of recovery between %s and %s.",
                totalRecovery, TimeUtil.formatMinutes(startTime), TimeUtil.formatMinutes(targetEndTime)));
        }
        List<Integer> segmentMinutes = new ArrayList<>();
        for (int i = 0; i < segments; i++) segmentMinutes.add(runningMinutes / segments);
        Trip trip = build(timePoints, blockNumber, serviceBand, startTime, segmentMinutes, template);
        String lastId = timePoints.get(segments).id;
        trip.departureTimes.put(lastId, targetEndTime);
        trip.arrivalTimes.put(lastId, targetEndTime - trip.getRecovery(lastId));
        TripTimes.updateDerivedFields(trip, timePoints);
        return trip;
    }

    private static void checkRoute (List<TimePoint> timePoints) {
        if (timePoints.size() < 2) {
            throw new IllegalArgumentException("A route needs at least two timepoints to build trips on.");
        }
    }

}
