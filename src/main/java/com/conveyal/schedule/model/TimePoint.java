package com.conveyal.schedule.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * A stop along the route where times are recorded. The sequence defines traversal order and does not change once
 * a schedule is loaded.
 */
public class TimePoint implements Serializable {

    private static final long serialVersionUID = 1L;

    public final String id;
    public final String name;
    public final int sequence;

    @JsonCreator
    public TimePoint(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("sequence") int sequence
    ) {
        this.id = id;
        this.name = name;
        this.sequence = sequence;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TimePoint timePoint = (TimePoint) o;
        return sequence == timePoint.sequence &&
            Objects.equals(id, timePoint.id) &&
            Objects.equals(name, timePoint.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, sequence);
    }

    @Override
    public String toString() {
        return String.format("TimePoint %s (%s, #%d)", id, name, sequence);
    }
}
