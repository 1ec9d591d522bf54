package com.conveyal.schedule.validator;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.google.common.collect.ListMultimap;

import java.util.List;

import static com.conveyal.schedule.error.ScheduleErrorType.BLOCK_CHAIN_GAP;
import static com.conveyal.schedule.error.ScheduleErrorType.TAIL_RECOVERY_NOT_ZERO;
import static com.conveyal.schedule.error.ScheduleErrorType.TRIP_OVERLAP_IN_BLOCK;
import static com.conveyal.schedule.util.TimeUtil.formatMinutes;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Checks that the trips of each block form an unbroken chain, each starting when the previous one leaves its last
 * timepoint, and that the last trip of each block carries no recovery.
 */
public class BlockValidator extends Validator {

    public BlockValidator(ScheduleErrorStorage errorStorage) {
        super(errorStorage);
    }

    @Override
    public void validate(Schedule schedule) {
        List<TimePoint> timePoints = schedule.timePoints;
        ListMultimap<Integer, Trip> tripsByBlock = schedule.tripsByBlock();
        for (Integer blockNumber : tripsByBlock.keySet()) {
            List<Trip> trips = tripsByBlock.get(blockNumber);
            for (int k = 1; k < trips.size(); k++) {
                Trip previous = trips.get(k - 1);
                Trip trip = trips.get(k);
                int previousEnd = previous.lastActiveDeparture(timePoints);
                int start = trip.firstDeparture(timePoints);
                if (isMissing(previousEnd) || isMissing(start)) continue;
                if (start < previousEnd) {
                    registerError(trip, TRIP_OVERLAP_IN_BLOCK, previous.tripNumber);
                } else if (start > previousEnd) {
                    registerError(trip, BLOCK_CHAIN_GAP,
                        formatMinutes(previousEnd) + " - " + formatMinutes(start));
                }
            }
            Trip last = trips.get(trips.size() - 1);
            if (last.recoveryMinutes != 0 || last.sumActiveRecovery(timePoints) != 0) {
                registerError(last, TAIL_RECOVERY_NOT_ZERO, last.sumActiveRecovery(timePoints));
            }
        }
    }

}
