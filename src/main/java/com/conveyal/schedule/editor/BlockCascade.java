package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.conveyal.schedule.util.TimeUtil;
import com.google.common.base.Stopwatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.conveyal.schedule.error.ScheduleErrorType.CASCADE_ABORTED;
import static com.conveyal.schedule.error.ScheduleErrorType.MALFORMED_TIME;
import static com.conveyal.schedule.error.ScheduleErrorType.SERVICE_BAND_CHANGED;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Realigns the trips of a block that follow a changed trip, so that each starts exactly when its predecessor leaves
 * the last timepoint it serves. Propagation is bounded by an iteration count and a time budget per block; when
 * either runs out the remaining trips are left where they are and a warning is stored.
 */
public class BlockCascade {

    private static final Logger LOG = LoggerFactory.getLogger(BlockCascade.class);

    public static final int DEFAULT_MAX_ITERATIONS = 100;
    public static final Duration DEFAULT_TIME_BUDGET = Duration.ofSeconds(5);

    private final ServiceBandClassifier classifier;
    private final ScheduleErrorStorage errorStorage;
    private final int maxIterations;
    private final Duration timeBudget;

    public BlockCascade (ServiceBandClassifier classifier, ScheduleErrorStorage errorStorage) {
        this(classifier, errorStorage, DEFAULT_MAX_ITERATIONS, DEFAULT_TIME_BUDGET);
    }

    /**
     * @param classifier used to relabel trips that move into another 30 minute period, or null to keep labels.
     */
    public BlockCascade (
        ServiceBandClassifier classifier,
        ScheduleErrorStorage errorStorage,
        int maxIterations,
        Duration timeBudget
    ) {
        this.classifier = classifier;
        this.errorStorage = errorStorage;
        this.maxIterations = maxIterations;
        this.timeBudget = timeBudget;
    }

    /**
     * Shift every trip in the same block as the given one that comes after it in time. The trips list is the working
     * copy of a schedule's trips: shifted trips are replaced in it by modified clones, and unchanged trips are left
     * as they are.
     *
     * @param changed a trip already present in the list (by identity) whose times have just been changed.
     * @return false if propagation was aborted before reaching the end of the block.
     */
    public boolean cascade (List<Trip> trips, List<TimePoint> timePoints, Trip changed) {
        List<Trip> block = trips.stream()
            .filter(t -> t.blockNumber == changed.blockNumber)
            .sorted(Schedule.CHRONOLOGICAL)
            .collect(Collectors.toList());
        int position = indexOfIdentity(block, changed);
        if (position < 0) {
            throw new IllegalArgumentException("Changed trip is not part of the trips being cascaded: " + changed);
        }
        Stopwatch stopwatch = Stopwatch.createStarted();
        Trip previous = changed;
        int iterations = 0;
        for (Trip trip : block.subList(position + 1, block.size())) {
            iterations += 1;
            if (iterations > maxIterations || stopwatch.elapsed(TimeUnit.MILLISECONDS) > timeBudget.toMillis()) {
                LOG.warn("Cascade through block {} stopped after {} trips ({} ms).",
                    changed.blockNumber, iterations - 1, stopwatch.elapsed(TimeUnit.MILLISECONDS));
                errorStorage.storeError(ScheduleError.forBlock(changed.blockNumber, CASCADE_ABORTED)
                    .setBadValue(String.format("stopped before trip %d", trip.tripNumber)));
                return false;
            }
            int newStart = previous.lastActiveDeparture(timePoints);
            int oldStart = trip.firstDeparture(timePoints);
            if (isMissing(newStart) || isMissing(oldStart)) {
                LOG.warn("Cannot chain {} after {}, a start or end time is missing.", trip, previous);
                errorStorage.storeError(ScheduleError.forTrip(trip, MALFORMED_TIME)
                    .setBadValue("first or previous last departure"));
                return true;
            }
            if (newStart == oldStart) {
                previous = trip;
                continue;
            }
            Trip shifted = trip.clone();
            TripTimes.shift(shifted, newStart - oldStart);
            TripTimes.updateDerivedFields(shifted, timePoints);
            reclassify(shifted, oldStart, newStart);
            replaceIdentity(trips, trip, shifted);
            previous = shifted;
        }
        LOG.debug("Cascade through block {} finished in {}.", changed.blockNumber, stopwatch);
        return true;
    }

    /**
     * A trip moved into another 30 minute period gets the band of its new period. Segment travel times are not
     * recomputed for the new band.
     */
    private void reclassify (Trip trip, int oldStart, int newStart) {
        if (classifier == null) return;
        if (TimeUtil.periodStart(oldStart) == TimeUtil.periodStart(newStart)) return;
        String band = classifier.determineServiceBandForTime(newStart).displayName;
        if (Objects.equals(band, trip.serviceBand)) return;
        LOG.info("{} moved to {} and is now in band '{}' (was '{}'); segment times were not recomputed.",
            trip, TimeUtil.formatMinutes(newStart), band, trip.serviceBand);
        errorStorage.storeError(ScheduleError.forTrip(trip, SERVICE_BAND_CHANGED)
            .setBadValue(trip.serviceBand + " -> " + band));
        trip.serviceBand = band;
    }

    static int indexOfIdentity (List<Trip> trips, Trip trip) {
        for (int i = 0; i < trips.size(); i++) {
            if (trips.get(i) == trip) return i;
        }
        return -1;
    }

    static void replaceIdentity (List<Trip> trips, Trip original, Trip replacement) {
        int index = indexOfIdentity(trips, original);
        if (index < 0) throw new IllegalArgumentException("Trip to replace not found: " + original);
        trips.set(index, replacement);
    }

}
