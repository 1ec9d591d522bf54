package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.conveyal.schedule.TestUtils.FASTEST;
import static com.conveyal.schedule.TestUtils.minutes;
import static com.conveyal.schedule.TestUtils.schedule;
import static com.conveyal.schedule.TestUtils.timePoints;
import static com.conveyal.schedule.TestUtils.trip;
import static com.conveyal.schedule.error.ScheduleErrorType.MALFORMED_TRIP_WINDOW;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;

public class BlockAssignerTest {

    private static final List<TimePoint> ROUTE = timePoints("A", "B");
    private static final int[] HALF_HOUR = {30};
    private static final int[] NO_RECOVERY = {0, 0};

    private ScheduleErrorStorage errorStorage;
    private BlockAssigner assigner;

    @BeforeEach
    public void setUp() {
        errorStorage = new ScheduleErrorStorage();
        assigner = new BlockAssigner(errorStorage);
    }

    @Test
    public void overlappingTripsInOneBlockAreSplit() {
        Schedule schedule = schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 1, FASTEST, "06:15", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 1, FASTEST, "06:30", HALF_HOUR, NO_RECOVERY));
        assertThat(assigner.needsBlockRecompute(schedule), is(true));

        Schedule after = assigner.reassignBlocksIfNeeded(schedule);
        assertThat(after.findTrip(1).blockNumber, is(1));
        assertThat(after.findTrip(2).blockNumber, is(2));
        // The first vehicle is free again when the third trip starts.
        assertThat(after.findTrip(3).blockNumber, is(1));
        assertThat(assigner.needsBlockRecompute(after), is(false));
    }

    @Test
    public void oneBlockPerTripIsMerged() {
        Schedule schedule = schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 2, FASTEST, "06:30", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 3, FASTEST, "07:00", HALF_HOUR, NO_RECOVERY));
        assertThat(assigner.needsBlockRecompute(schedule), is(true));

        Schedule after = assigner.reassignBlocksIfNeeded(schedule);
        for (Trip trip : after.trips) assertThat(trip.blockNumber, is(1));
    }

    @Test
    public void reassignmentIsIdempotent() {
        Schedule schedule = schedule(ROUTE,
            trip(ROUTE, 4, FASTEST, "06:00", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 4, FASTEST, "06:10", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 4, FASTEST, "06:40", HALF_HOUR, NO_RECOVERY));
        Schedule once = assigner.reassignBlocksIfNeeded(schedule);
        assertThat(assigner.reassignBlocksIfNeeded(once), sameInstance(once));
        assertThat(assigner.reassignBlocks(once), sameInstance(once));
    }

    @Test
    public void usableBlocksAreKept() {
        Schedule schedule = schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 1, FASTEST, "06:30", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 2, FASTEST, "06:10", HALF_HOUR, NO_RECOVERY));
        assertThat(assigner.needsBlockRecompute(schedule), is(false));
        assertThat(assigner.reassignBlocksIfNeeded(schedule), sameInstance(schedule));
    }

    @Test
    public void nonPositiveBlockNumberForcesRecompute() {
        Schedule schedule = schedule(ROUTE,
            trip(ROUTE, 0, FASTEST, "06:00", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 0, FASTEST, "06:30", HALF_HOUR, NO_RECOVERY));
        assertThat(assigner.needsBlockRecompute(schedule), is(true));
        Schedule after = assigner.reassignBlocksIfNeeded(schedule);
        assertThat(after.findTrip(1).blockNumber, is(1));
        assertThat(after.findTrip(2).blockNumber, is(1));
    }

    @Test
    public void emptyScheduleNeedsNothing() {
        assertThat(assigner.needsBlockRecompute(schedule(ROUTE)), is(false));
    }

    @Test
    public void tripWithoutTimesKeepsItsBlock() {
        Trip empty = new Trip();
        empty.blockNumber = 1;
        empty.serviceBand = FASTEST;
        Schedule schedule = schedule(ROUTE,
            empty,
            trip(ROUTE, 5, FASTEST, "06:00", HALF_HOUR, NO_RECOVERY),
            trip(ROUTE, 5, FASTEST, "06:15", HALF_HOUR, NO_RECOVERY));

        Schedule after = assigner.reassignBlocksIfNeeded(schedule);
        // Trips without times sort last.
        assertThat(after.findTrip(3).blockNumber, is(1));
        assertThat(after.findTrip(1).blockNumber, is(2));
        assertThat(after.findTrip(2).blockNumber, is(3));
        assertThat(errorStorage.hasErrorOfType(MALFORMED_TRIP_WINDOW), is(true));
    }

    @Test
    public void intervalRollsOverMidnight() {
        Trip owl = new Trip();
        owl.arrivalTimes.put("A", minutes("23:50"));
        owl.departureTimes.put("A", minutes("23:50"));
        owl.arrivalTimes.put("B", minutes("00:20"));
        owl.departureTimes.put("B", minutes("00:20"));

        BlockAssigner.BlockInterval interval = BlockAssigner.BlockInterval.forTrip(owl, ROUTE);
        assertThat(interval.start, is(minutes("23:50")));
        assertThat(interval.end, is(minutes("24:20")));
        assertThat(BlockAssigner.BlockInterval.forTrip(new Trip(), ROUTE), nullValue());
    }
}
