package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleEditException;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.conveyal.schedule.TestUtils.FASTEST;
import static com.conveyal.schedule.TestUtils.assertConsistent;
import static com.conveyal.schedule.TestUtils.minutes;
import static com.conveyal.schedule.TestUtils.schedule;
import static com.conveyal.schedule.TestUtils.timePoints;
import static com.conveyal.schedule.TestUtils.trip;
import static com.conveyal.schedule.error.ScheduleErrorType.MISSING_REFERENCE;
import static com.conveyal.schedule.error.ScheduleErrorType.REBUILD_SOURCE_MISSING;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasEntry;
import static org.hamcrest.Matchers.hasKey;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class TripLifecycleManagerTest {

    private static final List<TimePoint> ROUTE = timePoints("A", "B", "C");

    private ScheduleErrorStorage errorStorage;
    private TripLifecycleManager manager;
    private Schedule schedule;

    /**
     * Block 1 runs trips at 06:00 and 06:50, block 2 one trip at 07:00. Trips take 20 minutes per segment with five
     * minutes of recovery at B and C, which the last trip of each block gives up.
     */
    @BeforeEach
    public void setUp() {
        errorStorage = new ScheduleErrorStorage();
        ServiceBandClassifier classifier = new ServiceBandClassifier();
        manager = new TripLifecycleManager(classifier, errorStorage);
        schedule = new TailRecoveryEnforcer(classifier, errorStorage).enforce(schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", new int[] {20, 20}, new int[] {0, 5, 5}),
            trip(ROUTE, 1, FASTEST, "06:50", new int[] {20, 20}, new int[] {0, 5, 5}),
            trip(ROUTE, 2, FASTEST, "07:00", new int[] {20, 20}, new int[] {0, 5, 5})));
        errorStorage.clear();
    }

    @Test
    public void addAfterLastTripOfBlock() {
        Schedule after = manager.addTrip(schedule, AddTripRequest.afterLast(1, FASTEST), RecoveryTemplates.EMPTY);

        assertThat(after.trips.size(), is(4));
        // The former last trip gets its recovery back and the new trip moves behind it.
        Trip previous = after.findTrip(2);
        assertThat(previous.getRecovery("C"), is(5));
        assertThat(previous.hiddenTailRecoveryTimes, nullValue());
        Trip added = after.findTrip(4);
        assertThat(added.blockNumber, is(1));
        assertThat(added.serviceBand, is(FASTEST));
        assertThat(added.departureTime, is(minutes("07:15")));
        assertThat(added.departureTimes.get("C"), is(minutes("07:35")));
        assertConsistent(after);
    }

    @Test
    public void addEarlyTripEndingAtFirstTripOfBlock() {
        Schedule after = manager.addTrip(schedule, AddTripRequest.early(1, minutes("05:00"), FASTEST),
            RecoveryTemplates.EMPTY);

        Trip added = after.findTrip(1);
        assertThat(added.blockNumber, is(1));
        assertThat(added.departureTime, is(minutes("05:00")));
        assertThat(added.arrivalTimes.get("B"), is(minutes("05:30")));
        assertThat(added.departureTimes.get("C"), is(minutes("06:00")));
        assertThat(after.findTrip(2).departureTime, is(minutes("06:00")));
        assertConsistent(after);
    }

    @Test
    public void earlyTripWithOneMinuteRunsZeroMinuteSegments() {
        Schedule after = manager.addTrip(schedule, AddTripRequest.early(1, minutes("05:59"), FASTEST),
            RecoveryTemplates.EMPTY);

        Trip added = after.findTrip(1);
        assertThat(added.departureTime, is(minutes("05:59")));
        assertThat(added.arrivalTimes.get("B"), is(minutes("05:59")));
        assertThat(added.arrivalTimes.get("C"), is(minutes("06:00")));
        assertThat(added.departureTimes.get("C"), is(minutes("06:00")));
        assertConsistent(after);
    }

    @Test
    public void earlyTripThatCannotFitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.addTrip(schedule,
            AddTripRequest.early(1, minutes("06:00"), FASTEST), RecoveryTemplates.EMPTY));
    }

    @Test
    public void addMidRouteTripInNewBlock() {
        Schedule after = manager.addTrip(schedule, AddTripRequest.midRoute(minutes("08:00"), null, null),
            RecoveryTemplates.EMPTY);

        Trip added = after.findTrip(4);
        assertThat(added.blockNumber, is(3));
        assertThat(added.serviceBand, is(FASTEST));
        assertThat(added.departureTimes.get("C"), is(minutes("08:20")));
        assertConsistent(after);
    }

    @Test
    public void addMidRouteTripToTargetEnd() {
        Schedule after = manager.addTrip(schedule,
            AddTripRequest.midRoute(minutes("08:00"), minutes("09:00"), FASTEST), RecoveryTemplates.EMPTY);

        Trip added = after.findTrip(4);
        assertThat(added.arrivalTimes.get("B"), is(minutes("08:30")));
        assertThat(added.departureTimes.get("C"), is(minutes("09:00")));
    }

    @Test
    public void addAfterUnknownAnchorIsIgnored() {
        Schedule after = manager.addTrip(schedule, AddTripRequest.afterLast(42, FASTEST), RecoveryTemplates.EMPTY);
        assertThat(after, sameInstance(schedule));
        assertThat(errorStorage.hasErrorOfType(MISSING_REFERENCE), is(true));
    }

    @Test
    public void endTripCancelsRestOfBlock() {
        Schedule after = manager.endTrip(schedule, 1, 1);

        assertThat(after.trips.size(), is(2));
        Trip ended = after.findTrip(1);
        assertThat(ended.isTruncated(), is(true));
        assertThat(ended.tripEndIndex, is(1));
        assertThat(ended.getRecovery("B"), is(0));
        assertThat(ended.departureTimes.get("B"), is(minutes("06:20")));
        assertThat(ended.departureTimes, not(hasKey("C")));
        assertThat(ended.originalDepartureTimes, hasEntry("C", minutes("06:50")));
        assertThat(ended.originalRecoveryTimes, hasEntry("B", 5));
        // Block 2 is untouched and renumbered behind the ended trip.
        assertThat(after.findTrip(2).blockNumber, is(2));
        assertConsistent(after);
    }

    @Test
    public void endTripOutsideRouteIsIgnored() {
        assertThat(manager.endTrip(schedule, 1, 0), sameInstance(schedule));
        assertThat(manager.endTrip(schedule, 1, 2), sameInstance(schedule));
        assertThat(manager.endTrip(schedule, 9, 1), sameInstance(schedule));
        assertThat(errorStorage.getErrorCount(), is(3));
    }

    @Test
    public void restoreBringsBackFullTimes() {
        Schedule ended = manager.endTrip(schedule, 1, 1);
        Schedule restored = manager.restoreTrip(ended, 1);

        Trip trip = restored.findTrip(1);
        assertThat(trip.isTruncated(), is(false));
        assertThat(trip.originalArrivalTimes, nullValue());
        assertThat(trip.arrivalTimes.get("C"), is(minutes("06:40")));
        assertThat(trip.departureTimes.get("C"), is(minutes("06:40")));
        // The restored trip is the last of its block again, so its recovery is hidden.
        assertThat(trip.recoveryMinutes, is(0));
        assertThat(trip.hiddenTailRecoveryTimes, hasEntry("B", 5));
        assertThat(trip.hiddenTailRecoveryTimes, hasEntry("C", 5));
        // Cancelled trips are not regenerated.
        assertThat(restored.trips.size(), is(2));
        assertConsistent(restored);
    }

    @Test
    public void restoringAFullTripDoesNothing() {
        assertThat(manager.restoreTrip(schedule, 1), sameInstance(schedule));
    }

    @Test
    public void restoreWithoutBackupsFails() {
        Trip broken = schedule.findTrip(1).clone();
        broken.tripEndIndex = 1;
        List<Trip> trips = new ArrayList<>(schedule.trips);
        trips.set(0, broken);
        Schedule corrupt = schedule.withTrips(trips);

        ScheduleEditException e = assertThrows(ScheduleEditException.class, () -> manager.restoreTrip(corrupt, 1));
        assertThat(e.errorType, is(REBUILD_SOURCE_MISSING));
    }

    @Test
    public void deleteRenumbersRemainingTrips() {
        Schedule after = manager.deleteTrip(schedule, 1);

        assertThat(after.trips.size(), is(2));
        for (int i = 0; i < after.trips.size(); i++) {
            assertThat(after.trips.get(i).tripNumber, is(i + 1));
        }
        assertThat(after.findTrip(1).departureTime, is(minutes("06:50")));
        assertThat(after.findTrip(2).departureTime, is(minutes("07:00")));
        assertConsistent(after);
    }

    @Test
    public void deleteUnknownTripIsIgnored() {
        assertThat(manager.deleteTrip(schedule, 7), sameInstance(schedule));
        assertThat(errorStorage.hasErrorOfType(MISSING_REFERENCE), is(true));
    }

    @Test
    public void lowestUnusedBlockNumberFillsGaps() {
        Schedule gapped = schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", new int[] {20, 20}, new int[] {0, 0, 0}),
            trip(ROUTE, 3, FASTEST, "06:00", new int[] {20, 20}, new int[] {0, 0, 0}));
        assertThat(TripLifecycleManager.lowestUnusedBlockNumber(gapped), is(2));
    }
}
