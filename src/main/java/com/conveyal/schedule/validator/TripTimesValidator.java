package com.conveyal.schedule.validator;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;

import java.util.List;

import static com.conveyal.schedule.error.ScheduleErrorType.BACKUP_WITHOUT_TRUNCATION;
import static com.conveyal.schedule.error.ScheduleErrorType.DEPARTURE_NOT_ARRIVAL_PLUS_RECOVERY;
import static com.conveyal.schedule.error.ScheduleErrorType.TRUNCATION_WITHOUT_BACKUP;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Within each trip, the departure from every timepoint after the first that the trip still serves should be the
 * arrival there plus the recovery. Backup times should exist exactly while a trip is ended early.
 */
public class TripTimesValidator extends Validator {

    public static final int ERROR_LIMIT = 2000;

    public TripTimesValidator(ScheduleErrorStorage errorStorage) {
        super(errorStorage);
    }

    @Override
    public void validate(Schedule schedule) {
        List<TimePoint> timePoints = schedule.timePoints;
        int departureErrorCount = 0;
        for (Trip trip : schedule.trips) {
            for (int i = 1; i < timePoints.size(); i++) {
                if (!trip.isActive(i)) break;
                String timePointId = timePoints.get(i).id;
                int arrival = trip.getArrival(timePointId);
                int departure = trip.getDeparture(timePointId);
                // Timepoints the trip does not serve have no times to compare.
                if (isMissing(arrival) || isMissing(departure)) continue;
                if (departure != arrival + trip.getRecovery(timePointId)) {
                    if (departureErrorCount < ERROR_LIMIT) {
                        registerError(trip, DEPARTURE_NOT_ARRIVAL_PLUS_RECOVERY, timePointId);
                    }
                    departureErrorCount++;
                }
            }
            boolean hasBackup = trip.originalArrivalTimes != null
                || trip.originalDepartureTimes != null
                || trip.originalRecoveryTimes != null;
            if (hasBackup && !trip.isTruncated()) {
                registerError(trip, BACKUP_WITHOUT_TRUNCATION);
            } else if (!hasBackup && trip.isTruncated()) {
                registerError(trip, TRUNCATION_WITHOUT_BACKUP, trip.tripEndIndex);
            }
        }
    }

}
