package com.conveyal.schedule.error;

public enum ScheduleErrorType {
    // Problems absorbed during editing.
    CASCADE_ABORTED(Priority.HIGH, "Propagation of a time change through a block exceeded its iteration or time budget and was stopped."),
    MALFORMED_TIME(Priority.MEDIUM, "A time value could not be read, so the derivation that depended on it was skipped."),
    MALFORMED_TRIP_WINDOW(Priority.MEDIUM, "A trip has no usable times, so its block could not be recomputed."),
    MISSING_REFERENCE(Priority.LOW, "The referenced trip, timepoint or service band does not exist. Nothing was changed."),
    RECOVERY_AT_INACTIVE_TIMEPOINT(Priority.LOW, "Recovery can only be edited at active timepoints after the first one."),
    EMPTY_RECOVERY_TEMPLATE(Priority.LOW, "A recovery template without any values cannot be applied."),
    SERVICE_BAND_CHANGED(Priority.LOW, "A shifted trip moved into a different service band. Its segment travel times were not recomputed."),
    BAND_TRAVEL_TIME_UNKNOWN(Priority.MEDIUM, "No travel time is known for a service band, so no recovery target could be derived from it."),

    // Invariant violations found by validators.
    DEPARTURE_NOT_ARRIVAL_PLUS_RECOVERY(Priority.HIGH, "The departure time at a timepoint is not its arrival time plus its recovery time."),
    BACKUP_WITHOUT_TRUNCATION(Priority.MEDIUM, "A trip carries backup times although it is not truncated."),
    TRUNCATION_WITHOUT_BACKUP(Priority.HIGH, "A truncated trip has no backup times to restore from."),
    BLOCK_CHAIN_GAP(Priority.LOW, "A trip does not start when the previous trip in its block leaves its last timepoint."),
    TRIP_OVERLAP_IN_BLOCK(Priority.HIGH, "A trip starts before the previous trip in its block has finished."),
    TAIL_RECOVERY_NOT_ZERO(Priority.MEDIUM, "The last trip of a block carries recovery time."),
    TRIP_NUMBERS_NOT_SEQUENTIAL(Priority.MEDIUM, "Trip numbers do not run 1..N in chronological order."),

    // Loud failures.
    REBUILD_SOURCE_MISSING(Priority.HIGH, "The source data needed to rebuild or restore trips is not available."),
    EMPTY_SCHEDULE_FILE(Priority.HIGH, "A stored schedule file exists but holds no schedule."),

    // Unknown errors.
    OTHER(Priority.LOW, "Other errors.");

    public final Priority priority;
    public final String englishMessage;

    ScheduleErrorType(Priority priority, String englishMessage) {
        this.priority = priority;
        this.englishMessage = englishMessage;
    }

}
