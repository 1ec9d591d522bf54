package com.conveyal.schedule.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.conveyal.schedule.util.TimeUtil.INT_MISSING;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * One vehicle run visiting the route's timepoints in sequence. Times are minutes after midnight keyed on timepoint
 * id; a timepoint the trip does not serve simply has no entry. Once placed in a {@link Schedule}, trips are by
 * convention immutable: editing code clones a trip before changing it, so two schedule snapshots never share a trip
 * that differs between them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Trip implements Cloneable, Serializable {

    private static final long serialVersionUID = 1L;

    public int tripNumber;
    public int blockNumber;
    /** Cached earliest known time of the trip. Must be kept in sync with the time maps. */
    public int departureTime = INT_MISSING;
    public String serviceBand;
    public Map<String, Integer> arrivalTimes = new HashMap<>();
    public Map<String, Integer> departureTimes = new HashMap<>();
    public Map<String, Integer> recoveryTimes = new HashMap<>();
    public int recoveryMinutes;

    /** Index of the last timepoint served when the trip has been ended early, otherwise null. */
    public Integer tripEndIndex;

    // Copies of the times from before the trip was ended early. Only present while tripEndIndex is set.
    public Map<String, Integer> originalArrivalTimes;
    public Map<String, Integer> originalDepartureTimes;
    public Map<String, Integer> originalRecoveryTimes;

    /** Recovery the trip would carry if it were not the last trip of its block. */
    public Map<String, Integer> hiddenTailRecoveryTimes;

    public int getRecovery (String timePointId) {
        Integer recovery = recoveryTimes.get(timePointId);
        return recovery == null ? 0 : recovery;
    }

    public int getArrival (String timePointId) {
        Integer time = arrivalTimes.get(timePointId);
        return time == null ? INT_MISSING : time;
    }

    public int getDeparture (String timePointId) {
        Integer time = departureTimes.get(timePointId);
        return time == null ? INT_MISSING : time;
    }

    /** The departure from a timepoint, or the arrival if the trip only records one time there. */
    public int getDepartureOrArrival (String timePointId) {
        int departure = getDeparture(timePointId);
        return isMissing(departure) ? getArrival(timePointId) : departure;
    }

    @JsonIgnore
    public boolean isTruncated () {
        return tripEndIndex != null;
    }

    /** Whether the trip still serves the timepoint at the given index. */
    public boolean isActive (int timePointIndex) {
        return tripEndIndex == null || timePointIndex <= tripEndIndex;
    }

    public int lastActiveIndex (int timePointCount) {
        if (tripEndIndex == null) return timePointCount - 1;
        return Math.min(tripEndIndex, timePointCount - 1);
    }

    /** Time the trip leaves its first timepoint. */
    public int firstDeparture (List<TimePoint> timePoints) {
        if (timePoints.isEmpty()) return INT_MISSING;
        return getDepartureOrArrival(timePoints.get(0).id);
    }

    /** Time the trip leaves the last timepoint it serves, which is when the next trip of its block may start. */
    public int lastActiveDeparture (List<TimePoint> timePoints) {
        if (timePoints.isEmpty()) return INT_MISSING;
        return getDepartureOrArrival(timePoints.get(lastActiveIndex(timePoints.size())).id);
    }

    /**
     * The earliest known time of the trip: the first timepoint in sequence with a departure or arrival, falling back
     * on the earliest departure recorded anywhere and finally on the cached value.
     */
    public int deriveDepartureTime (List<TimePoint> timePoints) {
        for (TimePoint timePoint : timePoints) {
            int time = getDepartureOrArrival(timePoint.id);
            if (!isMissing(time)) return time;
        }
        return departureTimes.values().stream()
            .filter(Objects::nonNull)
            .min(Integer::compare)
            .orElse(departureTime);
    }

    /** Sum of recovery over the timepoints the trip still serves. */
    public int sumActiveRecovery (List<TimePoint> timePoints) {
        int total = 0;
        for (int i = 0; i < timePoints.size(); i++) {
            if (isActive(i)) total += getRecovery(timePoints.get(i).id);
        }
        return total;
    }

    @Override
    public Trip clone () {
        try {
            Trip copy = (Trip) super.clone();
            copy.arrivalTimes = new HashMap<>(arrivalTimes);
            copy.departureTimes = new HashMap<>(departureTimes);
            copy.recoveryTimes = new HashMap<>(recoveryTimes);
            copy.originalArrivalTimes = copyOrNull(originalArrivalTimes);
            copy.originalDepartureTimes = copyOrNull(originalDepartureTimes);
            copy.originalRecoveryTimes = copyOrNull(originalRecoveryTimes);
            copy.hiddenTailRecoveryTimes = copyOrNull(hiddenTailRecoveryTimes);
            return copy;
        } catch (CloneNotSupportedException e) {
            throw new RuntimeException(e);
        }
    }

    private static Map<String, Integer> copyOrNull (Map<String, Integer> map) {
        return map == null ? null : new HashMap<>(map);
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Trip trip = (Trip) o;
        return tripNumber == trip.tripNumber &&
            blockNumber == trip.blockNumber &&
            departureTime == trip.departureTime &&
            recoveryMinutes == trip.recoveryMinutes &&
            Objects.equals(serviceBand, trip.serviceBand) &&
            Objects.equals(arrivalTimes, trip.arrivalTimes) &&
            Objects.equals(departureTimes, trip.departureTimes) &&
            Objects.equals(recoveryTimes, trip.recoveryTimes) &&
            Objects.equals(tripEndIndex, trip.tripEndIndex) &&
            Objects.equals(originalArrivalTimes, trip.originalArrivalTimes) &&
            Objects.equals(originalDepartureTimes, trip.originalDepartureTimes) &&
            Objects.equals(originalRecoveryTimes, trip.originalRecoveryTimes) &&
            Objects.equals(hiddenTailRecoveryTimes, trip.hiddenTailRecoveryTimes);
    }

    @Override
    public int hashCode () {
        return Objects.hash(
            tripNumber,
            blockNumber,
            departureTime,
            serviceBand,
            arrivalTimes,
            departureTimes,
            recoveryTimes,
            recoveryMinutes,
            tripEndIndex,
            originalArrivalTimes,
            originalDepartureTimes,
            originalRecoveryTimes,
            hiddenTailRecoveryTimes
        );
    }

    @Override
    public String toString () {
        return String.format("Trip %d (block %d, %s)", tripNumber, blockNumber, serviceBand);
    }
}
