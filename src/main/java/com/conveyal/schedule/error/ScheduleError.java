package com.conveyal.schedule.error;

import com.conveyal.schedule.model.Trip;

import java.util.Objects;

/**
 * A problem found while editing or validating a schedule. Errors carry an enum type rather than living in a class
 * hierarchy so they can be listed, counted and serialized uniformly.
 */
public class ScheduleError {

    public final ScheduleErrorType type;

    // Trip and block are often unknown (e.g. a bad time in a block configuration), so these are nullable.
    public final Integer tripNumber;
    public final Integer blockNumber;

    public String badValue;

    private ScheduleError(ScheduleErrorType type, Integer tripNumber, Integer blockNumber) {
        this.type = type;
        this.tripNumber = tripNumber;
        this.blockNumber = blockNumber;
    }

    public static ScheduleError forSchedule (ScheduleErrorType type, String badValue) {
        return new ScheduleError(type, null, null).setBadValue(badValue);
    }

    public static ScheduleError forTrip (Trip trip, ScheduleErrorType type) {
        return new ScheduleError(type, trip.tripNumber, trip.blockNumber);
    }

    public static ScheduleError forBlock (int blockNumber, ScheduleErrorType type) {
        return new ScheduleError(type, null, blockNumber);
    }

    public ScheduleError setBadValue (String badValue) {
        this.badValue = badValue;
        return this;
    }

    public String getMessageWithContext () {
        StringBuilder sb = new StringBuilder();
        if (blockNumber != null) sb.append("block ").append(blockNumber).append(' ');
        if (tripNumber != null) sb.append("trip ").append(tripNumber).append(' ');
        sb.append(type.name()).append(": ").append(type.englishMessage);
        if (badValue != null) sb.append(" (").append(badValue).append(')');
        return sb.toString();
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScheduleError that = (ScheduleError) o;
        return type == that.type &&
            Objects.equals(tripNumber, that.tripNumber) &&
            Objects.equals(blockNumber, that.blockNumber) &&
            Objects.equals(badValue, that.badValue);
    }

    @Override
    public int hashCode () {
        return Objects.hash(type, tripNumber, blockNumber, badValue);
    }

    @Override
    public String toString () {
        return "ScheduleError: " + getMessageWithContext();
    }

}
