package com.conveyal.schedule.stats;

import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import com.conveyal.schedule.util.TimeUtil;
import com.google.common.collect.ListMultimap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * Running time figures for the trips of a schedule. Trip time runs from the first departure to the departure from
 * the last timepoint the trip serves; travel time is trip time less recovery.
 */
public class ScheduleStats {

    private final Schedule schedule;
    private final List<TimePoint> timePoints;

    public ScheduleStats(Schedule schedule) {
        this.schedule = schedule;
        this.timePoints = schedule.timePoints;
    }

    public int getTripCount() {
        return schedule.trips.size();
    }

    public int getBlockCount() {
        return schedule.tripsByBlock().keySet().size();
    }

    /** Minutes from first departure to last active departure, or 0 if either is unknown. */
    public int getTripTime(Trip trip) {
        int first = trip.firstDeparture(timePoints);
        int last = trip.lastActiveDeparture(timePoints);
        if (isMissing(first) || isMissing(last)) return 0;
        return last - first;
    }

    public int getRecoveryTime(Trip trip) {
        return trip.sumActiveRecovery(timePoints);
    }

    public int getTravelTime(Trip trip) {
        return Math.max(0, getTripTime(trip) - getRecoveryTime(trip));
    }

    public double getRecoveryPercentage(Trip trip) {
        return recoveryPercentage(getRecoveryTime(trip), getTravelTime(trip));
    }

    /** Recovery as a percentage of travel time, 0 when there is no travel time. */
    public static double recoveryPercentage(int recoveryMinutes, int travelMinutes) {
        if (travelMinutes == 0) return 0;
        return recoveryMinutes * 100.0 / travelMinutes;
    }

    /** Average travel time of the trips in a band, or empty if the band has no trips with known times. */
    public OptionalDouble getAverageTravelTime(String serviceBand) {
        return schedule.trips.stream()
            .filter(t -> Objects.equals(t.serviceBand, serviceBand))
            .filter(t -> getTripTime(t) > 0)
            .mapToInt(this::getTravelTime)
            .average();
    }

    public ScheduleSummary getSummary() {
        int tripMinutes = 0;
        int travelMinutes = 0;
        int recoveryMinutes = 0;
        int tripCount = 0;
        for (Trip trip : schedule.trips) {
            int tripTime = getTripTime(trip);
            if (tripTime <= 0) continue;
            int recovery = getRecoveryTime(trip);
            tripMinutes += tripTime;
            recoveryMinutes += recovery;
            travelMinutes += Math.max(0, tripTime - recovery);
            tripCount++;
        }
        ScheduleSummary summary = new ScheduleSummary();
        summary.setTripCount(tripCount);
        summary.setTotalTripMinutes(tripMinutes);
        summary.setTotalTravelMinutes(travelMinutes);
        summary.setTotalRecoveryMinutes(recoveryMinutes);
        summary.setAverageRecoveryPercent(recoveryPercentage(recoveryMinutes, travelMinutes));
        return summary;
    }

    public List<BlockSummary> getBlockSummaries() {
        List<BlockSummary> summaries = new ArrayList<>();
        ListMultimap<Integer, Trip> tripsByBlock = schedule.tripsByBlock();
        for (Integer blockNumber : tripsByBlock.keySet()) {
            List<Trip> trips = tripsByBlock.get(blockNumber);
            int start = trips.get(0).firstDeparture(timePoints);
            int end = trips.get(trips.size() - 1).lastActiveDeparture(timePoints);
            BlockSummary summary = new BlockSummary();
            summary.setBlockNumber(blockNumber);
            summary.setTripCount(trips.size());
            summary.setStartTime(TimeUtil.formatMinutes(start));
            summary.setEndTime(TimeUtil.formatMinutes(end));
            summary.setServiceMinutes(isMissing(start) || isMissing(end) ? 0 : end - start);
            summary.setRecoveryMinutes(trips.stream().mapToInt(this::getRecoveryTime).sum());
            summaries.add(summary);
        }
        return summaries;
    }

    /** Minutes as hours and minutes, e.g. 125 as "2:05". */
    public static String formatHours(int minutes) {
        return String.format("%d:%02d", minutes / 60, minutes % 60);
    }

}
