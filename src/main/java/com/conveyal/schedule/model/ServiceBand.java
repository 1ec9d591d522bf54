package com.conveyal.schedule.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

/**
 * A named travel-time class as it appears in a particular schedule, with its display color and, when the analysis
 * provided them, the band's total running time and per-segment running times.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServiceBand implements Serializable {

    private static final long serialVersionUID = 1L;

    public final String name;
    public final String color;
    public final Integer totalMinutes;
    /** Running minutes between consecutive timepoints; element i covers timepoint i to i + 1. */
    public final List<Integer> segmentTimes;

    @JsonCreator
    public ServiceBand(
        @JsonProperty("name") String name,
        @JsonProperty("color") String color,
        @JsonProperty("totalMinutes") Integer totalMinutes,
        @JsonProperty("segmentTimes") List<Integer> segmentTimes
    ) {
        this.name = name;
        this.color = color != null ? color : ServiceBandClass.colorFor(name);
        this.totalMinutes = totalMinutes;
        this.segmentTimes = segmentTimes == null ? null : ImmutableList.copyOf(segmentTimes);
    }

    public static ServiceBand forClass (ServiceBandClass bandClass, Integer totalMinutes) {
        return new ServiceBand(bandClass.displayName, bandClass.color, totalMinutes, null);
    }

    public boolean hasSegmentTimes () {
        return segmentTimes != null && !segmentTimes.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ServiceBand that = (ServiceBand) o;
        return Objects.equals(name, that.name) &&
            Objects.equals(color, that.color) &&
            Objects.equals(totalMinutes, that.totalMinutes) &&
            Objects.equals(segmentTimes, that.segmentTimes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, color, totalMinutes, segmentTimes);
    }
}
