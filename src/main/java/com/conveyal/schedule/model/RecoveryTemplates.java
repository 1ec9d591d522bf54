package com.conveyal.schedule.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-band recovery templates: for each service band name, the recovery minutes to schedule at each timepoint index.
 * Instances are immutable; the with* methods return modified copies.
 */
public class RecoveryTemplates {

    public static final RecoveryTemplates EMPTY = new RecoveryTemplates(ImmutableMap.of());

    private final ImmutableMap<String, ImmutableList<Integer>> templates;

    private RecoveryTemplates (ImmutableMap<String, ImmutableList<Integer>> templates) {
        this.templates = templates;
    }

    public static RecoveryTemplates of (Map<String, List<Integer>> templates) {
        ImmutableMap.Builder<String, ImmutableList<Integer>> builder = ImmutableMap.builder();
        templates.forEach((band, template) -> builder.put(band, ImmutableList.copyOf(template)));
        return new RecoveryTemplates(builder.build());
    }

    /** @return the template for a band, or an empty list if the band has none. */
    public List<Integer> get (String bandName) {
        ImmutableList<Integer> template = templates.get(bandName);
        return template == null ? ImmutableList.of() : template;
    }

    public Set<String> bandNames () {
        return templates.keySet();
    }

    public RecoveryTemplates with (String bandName, List<Integer> template) {
        Map<String, ImmutableList<Integer>> copy = new LinkedHashMap<>(templates);
        copy.put(bandName, ImmutableList.copyOf(template));
        return new RecoveryTemplates(ImmutableMap.copyOf(copy));
    }

    /**
     * The recovery minutes for the given timepoint index. A template shorter than the route is extended with its
     * last value; the first timepoint never carries recovery.
     */
    public static int valueAt (List<Integer> template, int index) {
        if (index == 0 || template.isEmpty()) return 0;
        Integer value = index < template.size() ? template.get(index) : template.get(template.size() - 1);
        return value == null ? 0 : value;
    }

    @Override
    public boolean equals (Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return templates.equals(((RecoveryTemplates) o).templates);
    }

    @Override
    public int hashCode () {
        return templates.hashCode();
    }

    @Override
    public String toString () {
        return "RecoveryTemplates" + templates;
    }
}
