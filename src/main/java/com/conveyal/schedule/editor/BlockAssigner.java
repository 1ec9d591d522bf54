package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.google.common.collect.ListMultimap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.conveyal.schedule.error.ScheduleErrorType.MALFORMED_TRIP_WINDOW;
import static com.conveyal.schedule.util.TimeUtil.MINUTES_PER_DAY;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Partitions trips into vehicle blocks so that no vehicle runs two trips at once. Trips are taken in order of their
 * start and each goes to the vehicle that became free the longest time ago, or to a new vehicle if none is free.
 * This uses the smallest possible number of blocks.
 */
public class BlockAssigner {

    private static final Logger LOG = LoggerFactory.getLogger(BlockAssigner.class);

    /** A time more than this far before the previous time of the same trip is taken to be after midnight. */
    private static final int ROLLOVER_THRESHOLD = MINUTES_PER_DAY / 2;

    private final ScheduleErrorStorage errorStorage;

    public BlockAssigner (ScheduleErrorStorage errorStorage) {
        this.errorStorage = errorStorage;
    }

    /**
     * Whether block numbers look unusable: a number below one, two overlapping trips sharing a block, or one block per
     * trip, which is what importers produce when the source has no block information.
     */
    public boolean needsBlockRecompute (Schedule schedule) {
        if (schedule.trips.isEmpty()) return false;
        Set<Integer> blockNumbers = new HashSet<>();
        for (Trip trip : schedule.trips) {
            if (trip.blockNumber <= 0) return true;
            blockNumbers.add(trip.blockNumber);
        }
        if (schedule.trips.size() > 1 && blockNumbers.size() == schedule.trips.size()) return true;
        ListMultimap<Integer, Trip> tripsByBlock = schedule.tripsByBlock();
        for (Integer blockNumber : tripsByBlock.keySet()) {
            List<BlockInterval> intervals = new ArrayList<>();
            for (Trip trip : tripsByBlock.get(blockNumber)) {
                BlockInterval interval = BlockInterval.forTrip(trip, schedule.timePoints);
                if (interval != null) intervals.add(interval);
            }
            intervals.sort(Comparator.comparingInt(i -> i.start));
            for (int i = 1; i < intervals.size(); i++) {
                if (intervals.get(i).start < intervals.get(i - 1).end) return true;
            }
        }
        return false;
    }

    public Schedule reassignBlocksIfNeeded (Schedule schedule) {
        if (!needsBlockRecompute(schedule)) return schedule;
        return reassignBlocks(schedule);
    }

    /**
     * Recompute every block number. Trips without usable times keep their block, and new blocks never reuse a
     * number held by such a trip.
     */
    public Schedule reassignBlocks (Schedule schedule) {
        List<BlockInterval> intervals = new ArrayList<>();
        Set<Integer> reserved = new HashSet<>();
        for (int i = 0; i < schedule.trips.size(); i++) {
            Trip trip = schedule.trips.get(i);
            BlockInterval interval = BlockInterval.forTrip(trip, schedule.timePoints);
            if (interval == null) {
                LOG.warn("{} has no usable times, keeping block {}.", trip, trip.blockNumber);
                errorStorage.storeError(ScheduleError.forTrip(trip, MALFORMED_TRIP_WINDOW));
                reserved.add(trip.blockNumber);
                continue;
            }
            interval.index = i;
            intervals.add(interval);
        }
        intervals.sort(Comparator.<BlockInterval>comparingInt(i -> i.start).thenComparingInt(i -> i.index));

        List<Vehicle> vehicles = new ArrayList<>();
        int nextBlockNumber = 1;
        int[] assigned = new int[schedule.trips.size()];
        for (BlockInterval interval : intervals) {
            Vehicle chosen = null;
            for (Vehicle vehicle : vehicles) {
                if (vehicle.availableAt > interval.start) continue;
                if (chosen == null || vehicle.availableAt < chosen.availableAt) chosen = vehicle;
            }
            if (chosen == null) {
                while (reserved.contains(nextBlockNumber)) nextBlockNumber++;
                chosen = new Vehicle(nextBlockNumber++);
                vehicles.add(chosen);
            }
            chosen.availableAt = interval.end;
            assigned[interval.index] = chosen.blockNumber;
        }

        List<Trip> trips = new ArrayList<>(schedule.trips);
        int changed = 0;
        for (BlockInterval interval : intervals) {
            Trip trip = trips.get(interval.index);
            if (trip.blockNumber == assigned[interval.index]) continue;
            Trip reassigned = trip.clone();
            reassigned.blockNumber = assigned[interval.index];
            trips.set(interval.index, reassigned);
            changed++;
        }
        LOG.info("Assigned {} trips to {} blocks ({} trips moved).", intervals.size(), vehicles.size(), changed);
        if (changed == 0) return schedule;
        return schedule.withTrips(trips).sortAndRenumber();
    }

    private static class Vehicle {
        final int blockNumber;
        int availableAt = Integer.MIN_VALUE;

        Vehicle (int blockNumber) {
            this.blockNumber = blockNumber;
        }
    }

    /** The span of time a trip occupies its vehicle, from first departure to last active departure. */
    static class BlockInterval {
        int start;
        int end;
        int index;

        /** @return the trip's interval, or null if it has no times at all. */
        static BlockInterval forTrip (Trip trip, List<TimePoint> timePoints) {
            Integer start = null;
            int previous = 0;
            int offset = 0;
            int end = 0;
            for (int i = 0; i < timePoints.size(); i++) {
                if (!trip.isActive(i)) break;
                String timePointId = timePoints.get(i).id;
                for (int time : new int[] {trip.getArrival(timePointId), trip.getDeparture(timePointId)}) {
                    if (isMissing(time)) continue;
                    if (start != null && time + offset < previous - ROLLOVER_THRESHOLD) offset += MINUTES_PER_DAY;
                    int unwrapped = time + offset;
                    if (start == null) start = unwrapped;
                    previous = unwrapped;
                    end = Math.max(end, unwrapped);
                }
            }
            if (start == null) return null;
            BlockInterval interval = new BlockInterval();
            interval.start = start;
            interval.end = end;
            return interval;
        }
    }

}
