package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keeps the last trip of every block free of recovery time. The recovery such a trip would otherwise carry is kept
 * aside in its hidden tail recovery, and handed back when another trip is appended to the block so that the trip
 * is no longer last.
 *
 * Enforcement is idempotent: a schedule that already satisfies the rule is returned as the same object, and trips
 * that need no change are never copied.
 */
public class TailRecoveryEnforcer {

    private static final Logger LOG = LoggerFactory.getLogger(TailRecoveryEnforcer.class);

    private final BlockCascade blockCascade;

    public TailRecoveryEnforcer (ServiceBandClassifier classifier, ScheduleErrorStorage errorStorage) {
        this(new BlockCascade(classifier, errorStorage));
    }

    public TailRecoveryEnforcer (BlockCascade blockCascade) {
        this.blockCascade = blockCascade;
    }

    public Schedule enforce (Schedule schedule) {
        List<TimePoint> timePoints = schedule.timePoints;
        List<Trip> trips = new ArrayList<>(schedule.trips);
        boolean changed = false;
        for (Integer blockNumber : schedule.tripsByBlock().keySet()) {
            // Restoring a stash moves the rest of the block, so the block is re-read after each restore.
            List<Trip> block = blockTrips(trips, blockNumber);
            for (int i = 0; i < block.size() - 1; i++) {
                Trip trip = block.get(i);
                if (trip.hiddenTailRecoveryTimes == null) continue;
                Trip restored = restoreHiddenRecovery(trip, timePoints);
                BlockCascade.replaceIdentity(trips, trip, restored);
                blockCascade.cascade(trips, timePoints, restored);
                block = blockTrips(trips, blockNumber);
                changed = true;
            }
            Trip last = block.get(block.size() - 1);
            if (carriesRecovery(last, timePoints)) {
                BlockCascade.replaceIdentity(trips, last, hideRecovery(last, timePoints));
                changed = true;
            }
        }
        if (!changed) return schedule;
        return schedule.withTrips(trips).sortAndRenumber();
    }

    private static List<Trip> blockTrips (List<Trip> trips, int blockNumber) {
        return trips.stream()
            .filter(t -> t.blockNumber == blockNumber)
            .sorted(Schedule.CHRONOLOGICAL)
            .collect(Collectors.toList());
    }

    /** Whether any timepoint the trip serves has non-zero recovery. */
    private static boolean carriesRecovery (Trip trip, List<TimePoint> timePoints) {
        if (trip.recoveryMinutes != 0) return true;
        for (int i = 0; i < timePoints.size(); i++) {
            if (trip.isActive(i) && trip.getRecovery(timePoints.get(i).id) != 0) return true;
        }
        return false;
    }

    private static Trip restoreHiddenRecovery (Trip trip, List<TimePoint> timePoints) {
        Trip restored = trip.clone();
        for (int i = 0; i < timePoints.size(); i++) {
            Integer hidden = trip.hiddenTailRecoveryTimes.get(timePoints.get(i).id);
            if (hidden == null || !restored.isActive(i)) continue;
            TripTimes.setLiveRecovery(restored, timePoints, i, hidden);
        }
        restored.hiddenTailRecoveryTimes = null;
        TripTimes.updateDerivedFields(restored, timePoints);
        LOG.debug("Restored hidden recovery of {} ({} min).", restored, restored.recoveryMinutes);
        return restored;
    }

    private static Trip hideRecovery (Trip trip, List<TimePoint> timePoints) {
        Trip hidden = trip.clone();
        Map<String, Integer> stash = trip.hiddenTailRecoveryTimes == null
            ? new HashMap<>()
            : new HashMap<>(trip.hiddenTailRecoveryTimes);
        for (int i = 0; i < timePoints.size(); i++) {
            String timePointId = timePoints.get(i).id;
            int recovery = trip.getRecovery(timePointId);
            if (!trip.isActive(i) || recovery == 0) continue;
            stash.put(timePointId, recovery);
            TripTimes.setLiveRecovery(hidden, timePoints, i, 0);
        }
        hidden.hiddenTailRecoveryTimes = stash;
        TripTimes.updateDerivedFields(hidden, timePoints);
        LOG.debug("Hid {} min of tail recovery on {}.", trip.recoveryMinutes, trip);
        return hidden;
    }

}
