package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleEditException;
import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.BlockConfiguration;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.ServiceBand;
import com.conveyal.schedule.model.ServiceBandClass;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.conveyal.schedule.util.TimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.schedule.error.ScheduleErrorType.MALFORMED_TIME;
import static com.conveyal.schedule.error.ScheduleErrorType.REBUILD_SOURCE_MISSING;
import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Generates a full day of trips from block configurations. Each block runs trips back to back from its start time;
 * no trip starts at or after the block's end time.
 */
public class TripGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(TripGenerator.class);

    private final ServiceBandClassifier classifier;
    private final TailRecoveryEnforcer tailRecoveryEnforcer;
    private final ScheduleErrorStorage errorStorage;
    private final int defaultSegmentMinutes;

    public TripGenerator (ServiceBandClassifier classifier, ScheduleErrorStorage errorStorage) {
        this(classifier, new TailRecoveryEnforcer(classifier, errorStorage), errorStorage,
            TripBuilder.DEFAULT_SEGMENT_MINUTES);
    }

    public TripGenerator (
        ServiceBandClassifier classifier,
        TailRecoveryEnforcer tailRecoveryEnforcer,
        ScheduleErrorStorage errorStorage,
        int defaultSegmentMinutes
    ) {
        this.classifier = classifier;
        this.tailRecoveryEnforcer = tailRecoveryEnforcer;
        this.errorStorage = errorStorage;
        this.defaultSegmentMinutes = defaultSegmentMinutes;
    }

    /**
     * @param serviceBands the bands of the new schedule, or an empty list for the five standard classes.
     * @throws ScheduleEditException if there are no block configurations to generate from.
     */
    public Schedule generate (
        List<TimePoint> timePoints,
        List<ServiceBand> serviceBands,
        List<BlockConfiguration> blocks,
        RecoveryTemplates templates
    ) {
        if (blocks == null || blocks.isEmpty()) {
            throw new ScheduleEditException(REBUILD_SOURCE_MISSING, "no block configurations to generate trips from");
        }
        List<ServiceBand> bands = new ArrayList<>(serviceBands);
        if (bands.isEmpty()) {
            for (ServiceBandClass bandClass : ServiceBandClass.values()) bands.add(ServiceBand.forClass(bandClass, null));
        }
        Schedule empty = new Schedule(timePoints, bands, null);
        List<Trip> trips = new ArrayList<>();
        for (BlockConfiguration block : blocks) {
            int start = TimeUtil.parseMinutes(block.startTime);
            int end = TimeUtil.parseMinutes(block.endTime);
            if (isMissing(start) || isMissing(end)) {
                LOG.warn("Skipping block {} with unreadable service window {} - {}.",
                    block.blockNumber, block.startTime, block.endTime);
                errorStorage.storeError(ScheduleError.forBlock(block.blockNumber, MALFORMED_TIME)
                    .setBadValue(block.startTime + " - " + block.endTime));
                continue;
            }
            if (end < start) end += TimeUtil.MINUTES_PER_DAY;
            int tripsInBlock = 0;
            int time = start;
            while (time < end) {
                String band = block.serviceBand != null
                    ? block.serviceBand
                    : classifier.determineServiceBandForTime(time).displayName;
                List<Integer> segments = TripBuilder.segmentMinutes(empty.findServiceBand(band), timePoints.size(),
                    defaultSegmentMinutes);
                Trip trip = TripBuilder.build(timePoints, block.blockNumber, band, time, segments, templates.get(band));
                trips.add(trip);
                tripsInBlock++;
                int next = trip.lastActiveDeparture(timePoints);
                if (next <= time) {
                    LOG.warn("Trips of block {} take no time, stopping generation for the block.", block.blockNumber);
                    break;
                }
                time = next;
            }
            LOG.info("Generated {} trips for block {}.", tripsInBlock, block.blockNumber);
        }
        return tailRecoveryEnforcer.enforce(empty.withTrips(trips).sortAndRenumber());
    }

}
