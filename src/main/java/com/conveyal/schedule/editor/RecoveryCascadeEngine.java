package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.Trip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.schedule.error.ScheduleErrorType.MISSING_REFERENCE;
import static com.conveyal.schedule.error.ScheduleErrorType.RECOVERY_AT_INACTIVE_TIMEPOINT;

/**
 * Applies recovery time edits. Changing the recovery at one timepoint moves the rest of that trip, then every later
 * trip of the same block, after which the trips are put back in chronological order and renumbered and the tail
 * recovery rule is enforced again.
 */
public class RecoveryCascadeEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecoveryCascadeEngine.class);

    private final BlockCascade blockCascade;
    private final TailRecoveryEnforcer tailRecoveryEnforcer;
    private final ScheduleErrorStorage errorStorage;

    public RecoveryCascadeEngine (ServiceBandClassifier classifier, ScheduleErrorStorage errorStorage) {
        this(new BlockCascade(classifier, errorStorage), errorStorage);
    }

    public RecoveryCascadeEngine (BlockCascade blockCascade, ScheduleErrorStorage errorStorage) {
        this(blockCascade, new TailRecoveryEnforcer(blockCascade), errorStorage);
    }

    public RecoveryCascadeEngine (
        BlockCascade blockCascade,
        TailRecoveryEnforcer tailRecoveryEnforcer,
        ScheduleErrorStorage errorStorage
    ) {
        this.blockCascade = blockCascade;
        this.tailRecoveryEnforcer = tailRecoveryEnforcer;
        this.errorStorage = errorStorage;
    }

    /** One recovery change in a batch. */
    public static class RecoveryEdit {
        public final int tripNumber;
        public final String timePointId;
        public final int recoveryMinutes;

        public RecoveryEdit (int tripNumber, String timePointId, int recoveryMinutes) {
            this.tripNumber = tripNumber;
            this.timePointId = timePointId;
            this.recoveryMinutes = recoveryMinutes;
        }
    }

    /**
     * Set the recovery of one trip at one timepoint and propagate the change through the trip and its block,
     * finishing with the tail recovery pass.
     */
    public Schedule applyRecoveryEdit (Schedule schedule, int tripNumber, String timePointId, int recoveryMinutes) {
        Schedule cascaded = cascadeRecoveryEdit(schedule, tripNumber, timePointId, recoveryMinutes);
        return cascaded == schedule ? schedule : tailRecoveryEnforcer.enforce(cascaded);
    }

    /**
     * Like {@link #applyRecoveryEdit} but without the closing tail recovery pass, so the edited value stays visible
     * even on the last trip of a block.
     */
    public Schedule cascadeRecoveryEdit (Schedule schedule, int tripNumber, String timePointId, int recoveryMinutes) {
        int index = schedule.indexOfTimePoint(timePointId);
        if (index < 0) {
            LOG.info("Timepoint {} does not exist, recovery edit ignored.", timePointId);
            errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, timePointId));
            return schedule;
        }
        Schedule edited = editRecovery(schedule, tripNumber, index, recoveryMinutes);
        return edited == schedule ? schedule : edited.sortAndRenumber();
    }

    /**
     * Apply several edits against the trip numbers of the given schedule, renumbering and enforcing the tail rule
     * once at the end.
     */
    public Schedule applyRecoveryEdits (Schedule schedule, List<RecoveryEdit> edits) {
        Schedule result = schedule;
        for (RecoveryEdit edit : edits) {
            int index = result.indexOfTimePoint(edit.timePointId);
            if (index < 0) {
                errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, edit.timePointId));
                continue;
            }
            result = editRecovery(result, edit.tripNumber, index, edit.recoveryMinutes);
        }
        if (result == schedule) return schedule;
        return tailRecoveryEnforcer.enforce(result.sortAndRenumber());
    }

    /**
     * Change one recovery value and cascade it, leaving trip order and numbering as they were. Edits at the first
     * timepoint or beyond the end of a truncated trip are ignored.
     */
    Schedule editRecovery (Schedule schedule, int tripNumber, int timePointIndex, int recoveryMinutes) {
        if (recoveryMinutes < 0) {
            throw new IllegalArgumentException("Recovery minutes must not be negative: " + recoveryMinutes);
        }
        Trip trip = schedule.findTrip(tripNumber);
        if (trip == null) {
            LOG.info("Trip {} does not exist, recovery edit ignored.", tripNumber);
            errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, "trip " + tripNumber));
            return schedule;
        }
        String timePointId = schedule.timePoints.get(timePointIndex).id;
        if (timePointIndex == 0 || !trip.isActive(timePointIndex)) {
            LOG.info("{} does not take recovery at {}, edit ignored.", trip, timePointId);
            errorStorage.storeError(ScheduleError.forTrip(trip, RECOVERY_AT_INACTIVE_TIMEPOINT).setBadValue(timePointId));
            return schedule;
        }
        boolean hidden = trip.hiddenTailRecoveryTimes != null && trip.hiddenTailRecoveryTimes.containsKey(timePointId);
        if (!hidden && trip.recoveryTimes.containsKey(timePointId) && trip.getRecovery(timePointId) == recoveryMinutes) {
            return schedule;
        }
        Trip edited = trip.clone();
        if (hidden) {
            // The edited value replaces whatever was kept aside; the tail pass hides it again if it has to.
            edited.hiddenTailRecoveryTimes.remove(timePointId);
            if (edited.hiddenTailRecoveryTimes.isEmpty()) edited.hiddenTailRecoveryTimes = null;
        }
        int delta = TripTimes.setRecovery(edited, schedule.timePoints, timePointIndex, recoveryMinutes);
        List<Trip> trips = new ArrayList<>(schedule.trips);
        BlockCascade.replaceIdentity(trips, trip, edited);
        if (delta != 0) {
            LOG.debug("Recovery of {} at {} changed by {} min, cascading through block {}.",
                trip, timePointId, delta, trip.blockNumber);
            blockCascade.cascade(trips, schedule.timePoints, edited);
        }
        return schedule.withTrips(trips);
    }

    public TailRecoveryEnforcer getTailRecoveryEnforcer () {
        return tailRecoveryEnforcer;
    }

}
