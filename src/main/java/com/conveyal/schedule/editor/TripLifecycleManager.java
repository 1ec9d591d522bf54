package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleEditException;
import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.conveyal.schedule.error.ScheduleErrorType.MALFORMED_TIME;
import static com.conveyal.schedule.error.ScheduleErrorType.MISSING_REFERENCE;
import static com.conveyal.schedule.error.ScheduleErrorType.REBUILD_SOURCE_MISSING;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Adds, ends early, restores and deletes trips. Every operation returns a new snapshot with trips in chronological
 * order, numbered 1..N, and the tail recovery rule enforced.
 */
public class TripLifecycleManager {

    private static final Logger LOG = LoggerFactory.getLogger(TripLifecycleManager.class);

    private final ServiceBandClassifier classifier;
    private final BlockCascade blockCascade;
    private final TailRecoveryEnforcer tailRecoveryEnforcer;
    private final ScheduleErrorStorage errorStorage;
    private final int defaultSegmentMinutes;

    public TripLifecycleManager (ServiceBandClassifier classifier, ScheduleErrorStorage errorStorage) {
        this(classifier, new BlockCascade(classifier, errorStorage), errorStorage, TripBuilder.DEFAULT_SEGMENT_MINUTES);
    }

    public TripLifecycleManager (
        ServiceBandClassifier classifier,
        BlockCascade blockCascade,
        ScheduleErrorStorage errorStorage,
        int defaultSegmentMinutes
    ) {
        this.classifier = classifier;
        this.blockCascade = blockCascade;
        this.tailRecoveryEnforcer = new TailRecoveryEnforcer(blockCascade);
        this.errorStorage = errorStorage;
        this.defaultSegmentMinutes = defaultSegmentMinutes;
    }

    /**
     * Insert one trip as described by the request.
     *
     * @throws IllegalArgumentException if the request lacks a time its mode needs or the trip cannot fit.
     */
    public Schedule addTrip (Schedule schedule, AddTripRequest request, RecoveryTemplates templates) {
        List<TimePoint> timePoints = schedule.timePoints;
        Trip added;
        switch (request.mode) {
            case AFTER_LAST: {
                List<Trip> block = anchorBlock(schedule, request);
                if (block == null) return schedule;
                Trip last = block.get(block.size() - 1);
                int start = last.lastActiveDeparture(timePoints);
                if (isMissing(start)) {
                    errorStorage.storeError(ScheduleError.forTrip(last, MALFORMED_TIME).setBadValue("last departure"));
                    return schedule;
                }
                String band = bandFor(request, start);
                added = TripBuilder.build(timePoints, last.blockNumber, band, start,
                    TripBuilder.segmentMinutes(schedule.findServiceBand(band), timePoints.size(), defaultSegmentMinutes),
                    templates.get(band));
                break;
            }
            case EARLY: {
                List<Trip> block = anchorBlock(schedule, request);
                if (block == null) return schedule;
                Trip first = block.get(0);
                int end = first.firstDeparture(timePoints);
                if (isMissing(end)) {
                    errorStorage.storeError(ScheduleError.forTrip(first, MALFORMED_TIME).setBadValue("first departure"));
                    return schedule;
                }
                int start = required(request.startTime, request);
                String band = bandFor(request, start);
                added = TripBuilder.buildToFit(timePoints, first.blockNumber, band, start, end, templates.get(band));
                break;
            }
            case MID_ROUTE: {
                int start = required(request.startTime, request);
                String band = bandFor(request, start);
                int blockNumber = lowestUnusedBlockNumber(schedule);
                if (request.targetEndTime != null) {
                    added = TripBuilder.buildToFit(timePoints, blockNumber, band, start, request.targetEndTime,
                        templates.get(band));
                } else {
                    added = TripBuilder.build(timePoints, blockNumber, band, start,
                        TripBuilder.segmentMinutes(schedule.findServiceBand(band), timePoints.size(), defaultSegmentMinutes),
                        templates.get(band));
                }
                break;
            }
            default:
                throw new IllegalArgumentException("Unknown add mode " + request.mode);
        }
        LOG.info("Adding trip in block {} from {} ({}).", added.blockNumber, added.departureTime, request.mode);
        List<Trip> trips = new ArrayList<>(schedule.trips);
        trips.add(added);
        return finish(schedule.withTrips(trips));
    }

    /**
     * End a trip early at the given timepoint index. Its full times are backed up the first time it is ended, and
     * the later trips of its block are deleted.
     */
    public Schedule endTrip (Schedule schedule, int tripNumber, int endIndex) {
        List<TimePoint> timePoints = schedule.timePoints;
        Trip trip = schedule.findTrip(tripNumber);
        if (trip == null) {
            errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, "trip " + tripNumber));
            return schedule;
        }
        if (endIndex < 1 || endIndex >= timePoints.size() - 1) {
            LOG.info("Cannot end {} at timepoint index {}.", trip, endIndex);
            errorStorage.storeError(ScheduleError.forTrip(trip, MISSING_REFERENCE).setBadValue("timepoint index " + endIndex));
            return schedule;
        }
        Trip ended = trip.clone();
        if (ended.originalArrivalTimes == null) {
            ended.originalArrivalTimes = new HashMap<>(trip.arrivalTimes);
            ended.originalDepartureTimes = new HashMap<>(trip.departureTimes);
            ended.originalRecoveryTimes = new HashMap<>(trip.recoveryTimes);
        } else {
            // Ending an already ended trip starts again from its full times.
            ended.arrivalTimes = new HashMap<>(trip.originalArrivalTimes);
            ended.departureTimes = new HashMap<>(trip.originalDepartureTimes);
            ended.recoveryTimes = new HashMap<>(trip.originalRecoveryTimes);
        }
        ended.tripEndIndex = endIndex;
        String cutId = timePoints.get(endIndex).id;
        ended.recoveryTimes.put(cutId, 0);
        Integer arrival = ended.arrivalTimes.get(cutId);
        if (arrival != null) ended.departureTimes.put(cutId, arrival);
        for (int i = endIndex + 1; i < timePoints.size(); i++) {
            String timePointId = timePoints.get(i).id;
            ended.arrivalTimes.remove(timePointId);
            ended.departureTimes.remove(timePointId);
            if (ended.recoveryTimes.containsKey(timePointId)) ended.recoveryTimes.put(timePointId, 0);
        }
        TripTimes.updateDerivedFields(ended, timePoints);

        List<Trip> trips = new ArrayList<>(schedule.trips);
        BlockCascade.replaceIdentity(trips, trip, ended);
        List<Trip> block = schedule.tripsByBlock().get(trip.blockNumber);
        List<Trip> cancelled = block.subList(BlockCascade.indexOfIdentity(block, trip) + 1, block.size());
        for (Trip later : cancelled) trips.remove(BlockCascade.indexOfIdentity(trips, later));
        LOG.info("Ended {} at {}, cancelling {} later trips of block {}.",
            trip, cutId, cancelled.size(), trip.blockNumber);
        return finish(schedule.withTrips(trips));
    }

    /**
     * Undo {@link #endTrip} for a single trip: its full times come back from the backups and the rest of its block
     * is realigned behind it. Trips deleted when it was ended are not regenerated.
     *
     * @throws ScheduleEditException if the trip is ended but its backups are gone.
     */
    public Schedule restoreTrip (Schedule schedule, int tripNumber) {
        Trip trip = schedule.findTrip(tripNumber);
        if (trip == null) {
            errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, "trip " + tripNumber));
            return schedule;
        }
        if (!trip.isTruncated()) {
            LOG.info("{} was not ended early, nothing to restore.", trip);
            return schedule;
        }
        if (trip.originalArrivalTimes == null || trip.originalDepartureTimes == null || trip.originalRecoveryTimes == null) {
            throw new ScheduleEditException(REBUILD_SOURCE_MISSING,
                String.format("trip %d has no backup times to restore", trip.tripNumber));
        }
        Trip restored = trip.clone();
        restored.arrivalTimes = new HashMap<>(trip.originalArrivalTimes);
        restored.departureTimes = new HashMap<>(trip.originalDepartureTimes);
        restored.recoveryTimes = new HashMap<>(trip.originalRecoveryTimes);
        restored.tripEndIndex = null;
        restored.originalArrivalTimes = null;
        restored.originalDepartureTimes = null;
        restored.originalRecoveryTimes = null;
        TripTimes.updateDerivedFields(restored, schedule.timePoints);

        List<Trip> trips = new ArrayList<>(schedule.trips);
        BlockCascade.replaceIdentity(trips, trip, restored);
        blockCascade.cascade(trips, schedule.timePoints, restored);
        LOG.info("Restored {}. Trips of block {} cancelled when it was ended are not regenerated.",
            restored, restored.blockNumber);
        return finish(schedule.withTrips(trips));
    }

    /** Remove a trip. The rest of its block is left where it is, so a mid-block deletion leaves a gap. */
    public Schedule deleteTrip (Schedule schedule, int tripNumber) {
        Trip trip = schedule.findTrip(tripNumber);
        if (trip == null) {
            errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, "trip " + tripNumber));
            return schedule;
        }
        List<Trip> trips = new ArrayList<>(schedule.trips);
        trips.remove(BlockCascade.indexOfIdentity(trips, trip));
        LOG.info("Deleted {}.", trip);
        return finish(schedule.withTrips(trips));
    }

    private Schedule finish (Schedule schedule) {
        return tailRecoveryEnforcer.enforce(schedule.sortAndRenumber());
    }

    private List<Trip> anchorBlock (Schedule schedule, AddTripRequest request) {
        Trip anchor = request.anchorTripNumber == null ? null : schedule.findTrip(request.anchorTripNumber);
        if (anchor == null) {
            LOG.info("Anchor trip {} does not exist, no trip added.", request.anchorTripNumber);
            errorStorage.storeError(ScheduleError.forSchedule(MISSING_REFERENCE, "trip " + request.anchorTripNumber));
            return null;
        }
        return schedule.tripsByBlock().get(anchor.blockNumber);
    }

    private String bandFor (AddTripRequest request, int start) {
        if (request.serviceBand != null) return request.serviceBand;
        return classifier.determineServiceBandForTime(start).displayName;
    }

    private static int required (Integer time, AddTripRequest request) {
        if (time == null) throw new IllegalArgumentException("A start time is required for " + request);
        return time;
    }

    /** The lowest block number, starting from 1, that no trip uses. */
    static int lowestUnusedBlockNumber (Schedule schedule) {
        Set<Integer> used = new HashSet<>();
        for (Trip trip : schedule.trips) used.add(trip.blockNumber);
        int blockNumber = 1;
        while (used.contains(blockNumber)) blockNumber++;
        return blockNumber;
    }

}
