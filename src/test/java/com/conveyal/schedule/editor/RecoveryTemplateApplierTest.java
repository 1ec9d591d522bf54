package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.ServiceBand;
import com.conveyal.schedule.model.ServiceBandClass;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.conveyal.schedule.TestUtils.FAST;
import static com.conveyal.schedule.TestUtils.FASTEST;
import static com.conveyal.schedule.TestUtils.assertConsistent;
import static com.conveyal.schedule.TestUtils.minutes;
import static com.conveyal.schedule.TestUtils.schedule;
import static com.conveyal.schedule.TestUtils.timePoints;
import static com.conveyal.schedule.TestUtils.trip;
import static com.conveyal.schedule.error.ScheduleErrorType.BAND_TRAVEL_TIME_UNKNOWN;
import static com.conveyal.schedule.error.ScheduleErrorType.EMPTY_RECOVERY_TEMPLATE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RecoveryTemplateApplierTest {

    private static final List<TimePoint> ROUTE = timePoints("A", "B", "C", "D", "E");
    private static final int[] TEN_MINUTE_SEGMENTS = {10, 10, 10, 10};
    private static final int[] NO_RECOVERY = {0, 0, 0, 0, 0};

    private ScheduleErrorStorage errorStorage;
    private RecoveryTemplateApplier applier;
    private TailRecoveryEnforcer tailRecoveryEnforcer;

    /** Two back to back trips of 40 minutes travel in one block. */
    private static Schedule twoTripBlock() {
        return schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", TEN_MINUTE_SEGMENTS, NO_RECOVERY),
            trip(ROUTE, 1, FASTEST, "06:40", TEN_MINUTE_SEGMENTS, NO_RECOVERY));
    }

    @BeforeEach
    public void setUp() {
        errorStorage = new ScheduleErrorStorage();
        RecoveryCascadeEngine engine = new RecoveryCascadeEngine(new ServiceBandClassifier(), errorStorage);
        applier = new RecoveryTemplateApplier(engine, errorStorage);
        tailRecoveryEnforcer = engine.getTailRecoveryEnforcer();
    }

    @Test
    public void twentyPercentOfFortyMinutesOverFiveTimepoints() {
        List<Integer> template = RecoveryTemplateApplier.deriveTargetPercentageTemplate(40, 20, 5);
        assertThat(template, contains(0, 2, 2, 2, 2));
        assertThat(template.stream().mapToInt(Integer::intValue).sum(), is(8));
    }

    @Test
    public void remainderGoesToLastTimepoint() {
        // 20% of 43 rounds to 9 minutes.
        assertThat(RecoveryTemplateApplier.deriveTargetPercentageTemplate(43, 20, 5), contains(0, 2, 2, 2, 3));
        assertThat(RecoveryTemplateApplier.deriveTargetPercentageTemplate(30, 10, 5), contains(0, 0, 0, 0, 3));
        assertThat(RecoveryTemplateApplier.deriveTargetPercentageTemplate(30, 10, 1), contains(0));
    }

    @Test
    public void targetPercentageFromAverageTravelTime() {
        Schedule after = applier.applyTargetRecoveryPercentage(twoTripBlock(), FASTEST, 20);

        Trip first = after.findTrip(1);
        assertThat(first.recoveryMinutes, is(8));
        assertThat(first.getRecovery("B"), is(2));
        assertThat(first.departureTimes.get("E"), is(minutes("06:48")));
        // The second trip is pushed back and, as the last trip of the block, keeps its recovery hidden.
        Trip second = after.findTrip(2);
        assertThat(second.departureTime, is(minutes("06:48")));
        assertThat(second.recoveryMinutes, is(0));
        assertThat(second.hiddenTailRecoveryTimes.get("E"), is(2));
        assertConsistent(after);
    }

    @Test
    public void declaredBandTotalWinsOverTripAverage() {
        Schedule schedule = twoTripBlock();
        Schedule declared = schedule.withServiceBands(ImmutableList.of(ServiceBand.forClass(ServiceBandClass.FASTEST, 60)));
        assertThat(applier.bandTravelMinutes(schedule, FASTEST), is(40));
        assertThat(applier.bandTravelMinutes(declared, FASTEST), is(60));
        assertThat(applier.targetPercentageTemplate(declared, FASTEST, 10), contains(0, 1, 1, 1, 3));
    }

    @Test
    public void unknownTravelTimeLeavesScheduleAlone() {
        Schedule schedule = twoTripBlock();
        assertThat(applier.targetPercentageTemplate(schedule, FAST, 20), nullValue());
        assertThat(applier.applyTargetRecoveryPercentage(schedule, FAST, 20), sameInstance(schedule));
        assertThat(errorStorage.hasErrorOfType(BAND_TRAVEL_TIME_UNKNOWN), is(true));
    }

    @Test
    public void shortTemplateRepeatsItsLastValue() {
        Schedule after = applier.applyTemplate(twoTripBlock(), FASTEST, Arrays.asList(0, 3));

        Trip first = after.findTrip(1);
        for (String id : new String[] {"B", "C", "D", "E"}) assertThat(first.getRecovery(id), is(3));
        assertThat(first.recoveryMinutes, is(12));
        assertThat(after.findTrip(2).departureTime, is(minutes("06:52")));
        assertConsistent(after);
    }

    /** Block 1 with two trips that both take three minutes at B, the second one hidden by the tail pass. */
    private Schedule blockWithHiddenTail() {
        List<TimePoint> route = timePoints("A", "B");
        return tailRecoveryEnforcer.enforce(schedule(route,
            trip(route, 1, FASTEST, "06:00", new int[] {30}, new int[] {0, 3}),
            trip(route, 1, FASTEST, "06:33", new int[] {30}, new int[] {0, 3})));
    }

    /** Append a trip with no recovery behind the last trip of block 1 and run the tail pass. */
    private Schedule appendToBlockOne(Schedule schedule) {
        Trip last = schedule.findTrip(2);
        List<Trip> trips = new ArrayList<>(schedule.trips);
        trips.add(TripBuilder.build(schedule.timePoints, 1, FASTEST, last.lastActiveDeparture(schedule.timePoints),
            Arrays.asList(30), Arrays.asList(0, 0)));
        return tailRecoveryEnforcer.enforce(schedule.withTrips(trips).sortAndRenumber());
    }

    @Test
    public void zeroTemplateClearsHiddenTailRecovery() {
        Schedule before = blockWithHiddenTail();
        assertThat(before.findTrip(2).hiddenTailRecoveryTimes.get("B"), is(3));

        Schedule after = applier.applyTemplate(before, FASTEST, Arrays.asList(0, 0));
        assertThat(after.findTrip(1).getRecovery("B"), is(0));
        assertThat(after.findTrip(2).hiddenTailRecoveryTimes, nullValue());

        // Once the trip is no longer last, the template value is what it runs with.
        Schedule appended = appendToBlockOne(after);
        assertThat(appended.findTrip(2).getRecovery("B"), is(0));
        assertThat(appended.findTrip(3).departureTime, is(minutes("07:00")));
        assertConsistent(appended);
    }

    @Test
    public void nonZeroTemplateReplacesHiddenTailRecovery() {
        Schedule after = applier.applyTemplate(blockWithHiddenTail(), FASTEST, Arrays.asList(0, 5));
        assertThat(after.findTrip(2).getRecovery("B"), is(0));
        assertThat(after.findTrip(2).hiddenTailRecoveryTimes.get("B"), is(5));

        Schedule appended = appendToBlockOne(after);
        assertThat(appended.findTrip(2).getRecovery("B"), is(5));
        assertThat(appended.findTrip(3).departureTime, is(minutes("07:10")));
        assertConsistent(appended);
    }

    @Test
    public void emptyTemplateIsRejected() {
        Schedule schedule = twoTripBlock();
        assertThat(applier.applyTemplate(schedule, FASTEST, ImmutableList.of()), sameInstance(schedule));
        assertThat(errorStorage.hasErrorOfType(EMPTY_RECOVERY_TEMPLATE), is(true));
    }

    @Test
    public void tripsOfOtherBandsAreNotTouched() {
        Schedule schedule = schedule(ROUTE,
            trip(ROUTE, 1, FASTEST, "06:00", TEN_MINUTE_SEGMENTS, NO_RECOVERY),
            trip(ROUTE, 2, FAST, "06:10", TEN_MINUTE_SEGMENTS, NO_RECOVERY));
        Schedule after = applier.applyTemplate(schedule, FAST, Arrays.asList(0, 5));

        assertThat(after.findTrip(1), sameInstance(schedule.findTrip(1)));
    }

    @Test
    public void updateTemplateCellPadsWithZeros() {
        RecoveryTemplates templates = applier.updateTemplateCell(RecoveryTemplates.EMPTY, FAST, 3, 4);
        assertThat(templates.get(FAST), contains(0, 0, 0, 4));

        RecoveryTemplates updated = applier.updateTemplateCell(templates, FAST, 1, 2);
        assertThat(updated.get(FAST), contains(0, 2, 0, 4));
        assertThat(templates.get(FAST), contains(0, 0, 0, 4));

        assertThrows(IllegalArgumentException.class, () -> applier.updateTemplateCell(templates, FAST, 1, -1));
    }

    @Test
    public void masterTemplateCoversEveryBand() {
        RecoveryTemplates templates = RecoveryTemplates.of(ImmutableMap.of("Owl Service", Arrays.asList(0, 9)));
        RecoveryTemplates result = applier.applyMasterTemplate(templates, Arrays.asList(0, 1, 2));

        assertThat(result.bandNames(), hasItems("Owl Service", FASTEST, FAST, "Slowest Service"));
        for (String band : result.bandNames()) assertThat(result.get(band), contains(0, 1, 2));
    }
}
