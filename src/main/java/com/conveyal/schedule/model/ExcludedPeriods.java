package com.conveyal.schedule.model;

import com.google.common.collect.ImmutableSet;

import java.util.Collection;

/**
 * Analysis windows (e.g. "07:00 - 07:29") that the user removed and that must not contribute to service banding.
 */
public class ExcludedPeriods {

    public static final ExcludedPeriods NONE = new ExcludedPeriods(ImmutableSet.of());

    private final ImmutableSet<String> timePeriods;

    private ExcludedPeriods (ImmutableSet<String> timePeriods) {
        this.timePeriods = timePeriods;
    }

    public static ExcludedPeriods of (String... timePeriods) {
        return new ExcludedPeriods(ImmutableSet.copyOf(timePeriods));
    }

    public static ExcludedPeriods of (Collection<String> timePeriods) {
        return new ExcludedPeriods(ImmutableSet.copyOf(timePeriods));
    }

    public boolean contains (String timePeriod) {
        return timePeriods.contains(timePeriod);
    }

    public int size () {
        return timePeriods.size();
    }

}
