package com.conveyal.schedule.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import static com.conveyal.schedule.util.TimeUtil.isMissing;

/**
 * The root aggregate of a day of service on one route: its ordered timepoints, the service bands in use and the
 * trips. A schedule is an immutable snapshot. Operations produce a new snapshot that shares every trip they did not
 * change with the old one.
 */
public class Schedule implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Global chronological order: earliest departure first, trips with no known time last, ties broken by block and
     * then by the existing trip number.
     */
    public static final Comparator<Trip> CHRONOLOGICAL = Comparator
        .comparing((Trip t) -> isMissing(t.departureTime))
        .thenComparingInt(t -> t.departureTime)
        .thenComparingInt(t -> t.blockNumber)
        .thenComparingInt(t -> t.tripNumber);

    public final List<TimePoint> timePoints;
    public final List<ServiceBand> serviceBands;
    public final List<Trip> trips;

    @JsonCreator
    public Schedule(
        @JsonProperty("timePoints") List<TimePoint> timePoints,
        @JsonProperty("serviceBands") List<ServiceBand> serviceBands,
        @JsonProperty("trips") List<Trip> trips
    ) {
        this.timePoints = timePoints == null ? ImmutableList.of() : ImmutableList.sortedCopyOf(
            Comparator.comparingInt((TimePoint tp) -> tp.sequence), timePoints);
        this.serviceBands = serviceBands == null ? ImmutableList.of() : ImmutableList.copyOf(serviceBands);
        this.trips = trips == null ? ImmutableList.of() : ImmutableList.copyOf(trips);
    }

    /** A new snapshot with the same timepoints and bands and the given trips. */
    public Schedule withTrips (List<Trip> trips) {
        return new Schedule(timePoints, serviceBands, trips);
    }

    public Schedule withServiceBands (List<ServiceBand> serviceBands) {
        return new Schedule(timePoints, serviceBands, trips);
    }

    /** @return the trip with the given number, or null if there is none. */
    public Trip findTrip (int tripNumber) {
        for (Trip trip : trips) {
            if (trip.tripNumber == tripNumber) return trip;
        }
        return null;
    }

    /** @return the position of the timepoint in traversal order, or -1 if the route has no such timepoint. */
    public int indexOfTimePoint (String timePointId) {
        for (int i = 0; i < timePoints.size(); i++) {
            if (timePoints.get(i).id.equals(timePointId)) return i;
        }
        return -1;
    }

    /** @return the band with the given name, or null if the schedule does not declare it. */
    public ServiceBand findServiceBand (String name) {
        for (ServiceBand band : serviceBands) {
            if (band.name.equals(name)) return band;
        }
        return null;
    }

    /** Trips grouped by block, blocks in ascending order, each block's trips in chronological order. */
    public ListMultimap<Integer, Trip> tripsByBlock () {
        ListMultimap<Integer, Trip> tripsByBlock = MultimapBuilder.treeKeys().arrayListValues().build();
        List<Trip> sorted = new ArrayList<>(trips);
        sorted.sort(CHRONOLOGICAL);
        for (Trip trip : sorted) tripsByBlock.put(trip.blockNumber, trip);
        return tripsByBlock;
    }

    /**
     * Sort trips chronologically and renumber them 1..N. Trips whose number does not change are kept as the same
     * objects, and if neither order nor numbering changes this snapshot itself is returned.
     */
    public Schedule sortAndRenumber () {
        List<Trip> sorted = new ArrayList<>(trips);
        sorted.sort(CHRONOLOGICAL);
        boolean changed = false;
        for (int i = 0; i < sorted.size(); i++) {
            Trip trip = sorted.get(i);
            if (trip != trips.get(i)) changed = true;
            if (trip.tripNumber != i + 1) {
                Trip renumbered = trip.clone();
                renumbered.tripNumber = i + 1;
                sorted.set(i, renumbered);
                changed = true;
            }
        }
        return changed ? withTrips(sorted) : this;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Schedule schedule = (Schedule) o;
        return Objects.equals(timePoints, schedule.timePoints) &&
            Objects.equals(serviceBands, schedule.serviceBands) &&
            Objects.equals(trips, schedule.trips);
    }

    @Override
    public int hashCode () {
        return Objects.hash(timePoints, serviceBands, trips);
    }

    @Override
    public String toString () {
        return String.format("Schedule (%d timepoints, %d trips)", timePoints.size(), trips.size());
    }
}
