package com.conveyal.schedule;

import com.conveyal.schedule.editor.AddTripRequest;
import com.conveyal.schedule.editor.BlockAssigner;
import com.conveyal.schedule.editor.BlockCascade;
import com.conveyal.schedule.editor.RecoveryCascadeEngine;
import com.conveyal.schedule.editor.RecoveryTemplateApplier;
import com.conveyal.schedule.editor.ServiceBandClassifier;
import com.conveyal.schedule.editor.TailRecoveryEnforcer;
import com.conveyal.schedule.editor.TripBuilder;
import com.conveyal.schedule.editor.TripGenerator;
import com.conveyal.schedule.editor.TripLifecycleManager;
import com.conveyal.schedule.error.ScheduleError;
import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.BlockConfiguration;
import com.conveyal.schedule.model.RecoveryTemplates;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.ServiceBandClass;
import com.conveyal.schedule.stats.ScheduleStats;
import com.conveyal.schedule.stats.ScheduleSummary;
import com.conveyal.schedule.storage.SchedulePersistence;
import com.conveyal.schedule.validator.ScheduleValidation;
import com.conveyal.schedule.validator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Holds the current schedule snapshot and applies edits to it one at a time. Each edit replaces the snapshot with a
 * new, consistent one, and the snapshot is handed to the persistence port once per edit that changed it.
 *
 * Problems absorbed during the last edit are available from {@link #getWarnings()}. An editor is not thread safe;
 * callers must serialize edits.
 */
public class ScheduleEditor {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleEditor.class);

    private final ScheduleErrorStorage errorStorage = new ScheduleErrorStorage();
    private final SchedulePersistence persistence;
    private final ServiceBandClassifier classifier;
    private final BlockAssigner blockAssigner;
    private final RecoveryCascadeEngine cascadeEngine;
    private final TailRecoveryEnforcer tailRecoveryEnforcer;
    private final TripLifecycleManager lifecycleManager;
    private final RecoveryTemplateApplier templateApplier;
    private final TripGenerator tripGenerator;

    private Schedule schedule;
    private RecoveryTemplates templates;

    public ScheduleEditor (
        Schedule schedule,
        ServiceBandClassifier classifier,
        RecoveryTemplates templates,
        SchedulePersistence persistence
    ) {
        this(schedule, classifier, templates, persistence, BlockCascade.DEFAULT_MAX_ITERATIONS,
            BlockCascade.DEFAULT_TIME_BUDGET, TripBuilder.DEFAULT_SEGMENT_MINUTES);
    }

    /**
     * @param persistence where committed snapshots are stored, or null to keep them in memory only.
     * @param maxIterations trips a single cascade may move in one block before it is stopped.
     * @param timeBudget time a single cascade may take in one block before it is stopped.
     * @param defaultSegmentMinutes running time between timepoints for new trips whose band has no segment times.
     */
    public ScheduleEditor (
        Schedule schedule,
        ServiceBandClassifier classifier,
        RecoveryTemplates templates,
        SchedulePersistence persistence,
        int maxIterations,
        Duration timeBudget,
        int defaultSegmentMinutes
    ) {
        this.schedule = schedule;
        this.classifier = classifier;
        this.templates = templates;
        this.persistence = persistence;
        BlockCascade blockCascade = new BlockCascade(classifier, errorStorage, maxIterations, timeBudget);
        this.tailRecoveryEnforcer = new TailRecoveryEnforcer(blockCascade);
        this.cascadeEngine = new RecoveryCascadeEngine(blockCascade, tailRecoveryEnforcer, errorStorage);
        this.blockAssigner = new BlockAssigner(errorStorage);
        this.lifecycleManager = new TripLifecycleManager(classifier, blockCascade, errorStorage, defaultSegmentMinutes);
        this.templateApplier = new RecoveryTemplateApplier(cascadeEngine, errorStorage);
        this.tripGenerator = new TripGenerator(classifier, tailRecoveryEnforcer, errorStorage, defaultSegmentMinutes);
    }

    public Schedule getSchedule () {
        return schedule;
    }

    public RecoveryTemplates getTemplates () {
        return templates;
    }

    /** Problems absorbed during the most recent operation. */
    public List<ScheduleError> getWarnings () {
        return errorStorage.getErrors();
    }

    public Schedule applyRecoveryEdit (int tripNumber, String timePointId, int recoveryMinutes) {
        begin();
        return commit(cascadeEngine.applyRecoveryEdit(schedule, tripNumber, timePointId, recoveryMinutes));
    }

    public Schedule applyRecoveryEdits (List<RecoveryCascadeEngine.RecoveryEdit> edits) {
        begin();
        return commit(cascadeEngine.applyRecoveryEdits(schedule, edits));
    }

    public Schedule endTrip (int tripNumber, int endIndex) {
        begin();
        return commit(lifecycleManager.endTrip(schedule, tripNumber, endIndex));
    }

    public Schedule restoreTrip (int tripNumber) {
        begin();
        return commit(lifecycleManager.restoreTrip(schedule, tripNumber));
    }

    public Schedule deleteTrip (int tripNumber) {
        begin();
        return commit(lifecycleManager.deleteTrip(schedule, tripNumber));
    }

    public Schedule addTrip (AddTripRequest request) {
        begin();
        return commit(lifecycleManager.addTrip(schedule, request, templates));
    }

    /** Set one cell of a band's recovery template without touching any trip. */
    public RecoveryTemplates updateTemplateCell (String band, int index, int minutes) {
        templates = templateApplier.updateTemplateCell(templates, band, index, minutes);
        return templates;
    }

    /** Copy one template over every band's template without touching any trip. */
    public RecoveryTemplates applyMasterTemplate (List<Integer> master) {
        templates = templateApplier.applyMasterTemplate(templates, master);
        return templates;
    }

    /** Rewrite the recovery of every trip in the band from the band's current template. */
    public Schedule applyRecoveryTemplate (String band) {
        begin();
        return commit(templateApplier.applyTemplate(schedule, band, templates.get(band)));
    }

    /** Replace a band's template with a percentage of its travel time and apply it to the band's trips. */
    public Schedule applyTargetRecoveryPercentage (String band, double percentage) {
        begin();
        List<Integer> template = templateApplier.targetPercentageTemplate(schedule, band, percentage);
        if (template == null) return schedule;
        templates = templates.with(band, template);
        return commit(templateApplier.applyTemplate(schedule, band, template));
    }

    public Schedule reassignBlocksIfNeeded () {
        begin();
        return commit(blockAssigner.reassignBlocksIfNeeded(schedule));
    }

    public Schedule enforceTailRecoveryRules () {
        begin();
        return commit(tailRecoveryEnforcer.enforce(schedule));
    }

    /** Replace all trips with trips generated from block configurations. */
    public Schedule generateTrips (List<BlockConfiguration> blocks) {
        begin();
        return commit(tripGenerator.generate(schedule.timePoints, schedule.serviceBands, blocks, templates));
    }

    public ServiceBandClass classifyServiceBand (int departureTime) {
        return classifier.classify(departureTime);
    }

    public ScheduleSummary summarize () {
        return new ScheduleStats(schedule).getSummary();
    }

    public ValidationResult validate () {
        return ScheduleValidation.validate(schedule);
    }

    private void begin () {
        errorStorage.clear();
    }

    private Schedule commit (Schedule next) {
        if (next == schedule || next.equals(schedule)) {
            LOG.debug("Operation left the schedule unchanged ({} warnings).", errorStorage.getErrorCount());
            return schedule;
        }
        if (persistence != null) persistence.store(next);
        schedule = next;
        LOG.debug("Committed {} ({} warnings).", schedule, errorStorage.getErrorCount());
        return schedule;
    }

}
