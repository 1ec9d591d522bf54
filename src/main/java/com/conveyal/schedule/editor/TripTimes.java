package com.conveyal.schedule.editor;

import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.conveyal.schedule.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Arithmetic on the times of a single trip. All methods modify the trip passed in, so callers must hand them a
 * clone of any trip that is already part of a schedule.
 */
public abstract class TripTimes {

    private static final Logger LOG = LoggerFactory.getLogger(TripTimes.class);

    /**
     * Set the recovery at one timepoint and move the rest of the trip accordingly: the departure from that
     * timepoint becomes its arrival plus the new recovery, and every later arrival and departure moves by the change
     * in recovery. Truncation backups follow the same edit so that a later restore brings back consistent times.
     *
     * @return the number of minutes the rest of the trip moved.
     */
    public static int setRecovery (Trip trip, List<TimePoint> timePoints, int index, int recoveryMinutes) {
        return setRecovery(trip, timePoints, index, recoveryMinutes, true);
    }

    /**
     * Set the recovery at one timepoint of the live times only, leaving any truncation backups untouched. Used when
     * tail recovery is hidden or handed back, which concerns the trip as it currently runs.
     */
    public static int setLiveRecovery (Trip trip, List<TimePoint> timePoints, int index, int recoveryMinutes) {
        return setRecovery(trip, timePoints, index, recoveryMinutes, false);
    }

    private static int setRecovery (Trip trip, List<TimePoint> timePoints, int index, int recoveryMinutes, boolean backups) {
        String timePointId = timePoints.get(index).id;
        int delta = recoveryMinutes - trip.getRecovery(timePointId);
        applyRecovery(trip.arrivalTimes, trip.departureTimes, trip.recoveryTimes, timePoints, index, recoveryMinutes, delta);
        if (backups && trip.originalRecoveryTimes != null) {
            int originalDelta = recoveryMinutes - valueOrZero(trip.originalRecoveryTimes.get(timePointId));
            applyRecovery(trip.originalArrivalTimes, trip.originalDepartureTimes, trip.originalRecoveryTimes,
                timePoints, index, recoveryMinutes, originalDelta);
        }
        if (!trip.arrivalTimes.containsKey(timePointId)) {
            LOG.warn("{} has no arrival at {}, departure there was not derived from the new recovery.", trip, timePointId);
        }
        updateDerivedFields(trip, timePoints);
        return delta;
    }

    private static void applyRecovery (
        Map<String, Integer> arrivals,
        Map<String, Integer> departures,
        Map<String, Integer> recoveries,
        List<TimePoint> timePoints,
        int index,
        int recoveryMinutes,
        int delta
    ) {
        if (arrivals == null || departures == null || recoveries == null) return;
        String timePointId = timePoints.get(index).id;
        recoveries.put(timePointId, recoveryMinutes);
        Integer arrival = arrivals.get(timePointId);
        if (arrival != null) {
            departures.put(timePointId, arrival + recoveryMinutes);
        } else if (departures.containsKey(timePointId)) {
            departures.put(timePointId, departures.get(timePointId) + delta);
        }
        if (delta == 0) return;
        for (int i = index + 1; i < timePoints.size(); i++) {
            String laterId = timePoints.get(i).id;
            shiftEntry(arrivals, laterId, delta);
            shiftEntry(departures, laterId, delta);
        }
    }

    /** Move every time of the trip, backups included, by the given number of minutes. */
    public static void shift (Trip trip, int minutes) {
        if (minutes == 0) return;
        shiftAll(trip.arrivalTimes, minutes);
        shiftAll(trip.departureTimes, minutes);
        shiftAll(trip.originalArrivalTimes, minutes);
        shiftAll(trip.originalDepartureTimes, minutes);
        trip.departureTime = TimeUtil.addMinutes(trip.departureTime, minutes);
    }

    /** Recompute the cached departure time and recovery total from the time maps. */
    public static void updateDerivedFields (Trip trip, List<TimePoint> timePoints) {
        trip.recoveryMinutes = trip.sumActiveRecovery(timePoints);
        trip.departureTime = trip.deriveDepartureTime(timePoints);
    }

    private static void shiftAll (Map<String, Integer> times, int minutes) {
        if (times == null) return;
        times.replaceAll((id, time) -> time == null ? null : time + minutes);
    }

    private static void shiftEntry (Map<String, Integer> times, String timePointId, int minutes) {
        Integer time = times.get(timePointId);
        if (time != null) times.put(timePointId, time + minutes);
    }

    private static int valueOrZero (Integer value) {
        return value == null ? 0 : value;
    }

}
