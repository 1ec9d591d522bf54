package com.conveyal.schedule.editor;

import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.ServiceBand;
import com.conveyal.schedule.model.ServiceBandClass;
import com.conveyal.schedule.model.Trip;
import com.conveyal.schedule.stats.ScheduleStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

import static com.conveyal.schedule.error.ScheduleErrorType.BAND_TRAVEL_TIME_UNKNOWN;
import static com.conveyal.schedule.error.ScheduleErrorType.EMPTY_RECOVERY_TEMPLATE;

/**
 * Edits per-band recovery templates and rewrites the recovery of every trip in a band from its template. Each trip
 * is changed through the same cascade as a manual edit, so later trips of its block move with it.
 */
public class RecoveryTemplateApplier {

    private static final Logger LOG = LoggerFactory.getLogger(RecoveryTemplateApplier.class);

    private final RecoveryCascadeEngine cascadeEngine;
    private final ScheduleErrorStorage errorStorage;

    public RecoveryTemplateApplier (RecoveryCascadeEngine cascadeEngine, ScheduleErrorStorage errorStorage) {
        this.cascadeEngine = cascadeEngine;
        this.errorStorage = errorStorage;
    }

    /** Set one cell of a band's template, padding the template with zeros up to that index. */
    public RecoveryTemplates updateTemplateCell (RecoveryTemplates templates, String band, int index, int minutes) {
        if (index < 0 || minutes < 0) {
            throw new IllegalArgumentException(String.format("Invalid template cell %d = %d", index, minutes));
        }
        List<Integer> template = new ArrayList<>(templates.get(band));
        while (template.size() <= index) template.add(0);
        template.set(index, minutes);
        return templates.with(band, template);
    }

    /** Copy one template over the template of every band, including the five standard classes. */
    public RecoveryTemplates applyMasterTemplate (RecoveryTemplates templates, List<Integer> master) {
        Set<String> bands = new LinkedHashSet<>();
        for (ServiceBandClass bandClass : ServiceBandClass.values()) bands.add(bandClass.displayName);
        bands.addAll(templates.bandNames());
        RecoveryTemplates result = templates;
        for (String band : bands) result = result.with(band, master);
        return result;
    }

    /**
     * A template distributing a percentage of the travel time evenly over every timepoint but the first. Whatever
     * does not divide evenly goes to the last timepoint.
     */
    public static List<Integer> deriveTargetPercentageTemplate (int travelMinutes, double percentage, int timePointCount) {
        List<Integer> template = new ArrayList<>();
        if (timePointCount <= 0) return template;
        template.add(0);
        int stops = timePointCount - 1;
        if (stops == 0) return template;
        int total = (int) Math.round(travelMinutes * percentage / 100);
        int each = total / stops;
        for (int i = 0; i < stops; i++) template.add(each);
        template.set(stops, each + total - each * stops);
        return template;
    }

    /**
     * Travel minutes of a band: its declared total, or else the average travel time of its trips.
     *
     * @return the travel minutes, or null if neither is known.
     */
    public Integer bandTravelMinutes (Schedule schedule, String band) {
        ServiceBand serviceBand = schedule.findServiceBand(band);
        if (serviceBand != null && serviceBand.totalMinutes != null) return serviceBand.totalMinutes;
        OptionalDouble average = new ScheduleStats(schedule).getAverageTravelTime(band);
        if (average.isPresent()) return (int) Math.round(average.getAsDouble());
        LOG.warn("No travel time known for band '{}'.", band);
        errorStorage.storeError(ScheduleError.forSchedule(BAND_TRAVEL_TIME_UNKNOWN, band));
        return null;
    }

    /** @return the target percentage template for a band, or null if the band's travel time is unknown. */
    public List<Integer> targetPercentageTemplate (Schedule schedule, String band, double percentage) {
        Integer travelMinutes = bandTravelMinutes(schedule, band);
        if (travelMinutes == null) return null;
        List<Integer> template = deriveTargetPercentageTemplate(travelMinutes, percentage, schedule.timePoints.size());
        LOG.info("{}% of {} min travel in band '{}' gives recovery template {}.", percentage, travelMinutes, band, template);
        return template;
    }

    /** Derive the target percentage template for a band and apply it to the band's trips. */
    public Schedule applyTargetRecoveryPercentage (Schedule schedule, String band, double percentage) {
        List<Integer> template = targetPercentageTemplate(schedule, band, percentage);
        if (template == null) return schedule;
        return applyTemplate(schedule, band, template);
    }

    /**
     * Rewrite the recovery of every trip in the band from the template, extending a short template with its last
     * value. Trips are processed in chronological order.
     */
    public Schedule applyTemplate (Schedule schedule, String band, List<Integer> template) {
        if (template.isEmpty()) {
            errorStorage.storeError(ScheduleError.forSchedule(EMPTY_RECOVERY_TEMPLATE, band));
            return schedule;
        }
        List<Integer> tripNumbers = schedule.trips.stream()
            .filter(t -> Objects.equals(t.serviceBand, band))
            .sorted(Schedule.CHRONOLOGICAL)
            .map(t -> t.tripNumber)
            .collect(Collectors.toList());
        Schedule result = schedule;
        for (int tripNumber : tripNumbers) {
            Trip trip = result.findTrip(tripNumber);
            for (int i = 1; i < result.timePoints.size(); i++) {
                if (!trip.isActive(i)) break;
                result = cascadeEngine.editRecovery(result, tripNumber, i, RecoveryTemplates.valueAt(template, i));
            }
        }
        LOG.info("Applied recovery template {} to {} trips in band '{}'.", template, tripNumbers.size(), band);
        if (result == schedule) return schedule;
        return cascadeEngine.getTailRecoveryEnforcer().enforce(result.sortAndRenumber());
    }

}
