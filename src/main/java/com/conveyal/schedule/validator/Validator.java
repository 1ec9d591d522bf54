package com.conveyal.schedule.validator;

import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.error.ScheduleErrorType;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.Trip;

/**
 * A Validator examines a whole schedule for one kind of inconsistency. It accumulates errors for the problems it
 * finds in the error storage it was given, and never modifies the schedule.
 */
public abstract class Validator {

    ScheduleErrorStorage errorStorage;

    public Validator(ScheduleErrorStorage errorStorage) {
        this.errorStorage = errorStorage;
    }

    /**
     * Store an error that affects a single trip. Wraps the underlying error factory method.
     */
    public void registerError(Trip trip, ScheduleErrorType errorType) {
        errorStorage.storeError(ScheduleError.forTrip(trip, errorType));
    }

    /**
     * Store an error that affects a single trip.
     * Add a bad value to it.
     */
    public void registerError(Trip trip, ScheduleErrorType errorType, Object badValue) {
        errorStorage.storeError(ScheduleError.forTrip(trip, errorType).setBadValue(badValue.toString()));
    }

    /**
     * Check the schedule, storing an error for every problem found.
     */
    public abstract void validate(Schedule schedule);

}
