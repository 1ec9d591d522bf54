package com.conveyal.schedule.validator;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.Trip;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.schedule.error.ScheduleErrorType.TRIP_NUMBERS_NOT_SEQUENTIAL;

/**
 * Trip numbers should rank trips 1..N in chronological order, ties broken by block number.
 */
public class TripNumberValidator extends Validator {

    public TripNumberValidator(ScheduleErrorStorage errorStorage) {
        super(errorStorage);
    }

    @Override
    public void validate(Schedule schedule) {
        List<Trip> sorted = new ArrayList<>(schedule.trips);
        sorted.sort(Schedule.CHRONOLOGICAL);
        for (int i = 0; i < sorted.size(); i++) {
            Trip trip = sorted.get(i);
            if (trip.tripNumber != i + 1) {
                registerError(trip, TRIP_NUMBERS_NOT_SEQUENTIAL, "expected " + (i + 1));
            }
        }
    }

}
