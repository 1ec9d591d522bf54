package com.conveyal.schedule.error;

/**
 * Thrown when an edit cannot be carried out without silently losing or corrupting schedule data, for example when
 * a truncated trip has to be restored but its backup times are gone. Unlike the problems kept in
 * {@link ScheduleErrorStorage}, these are never absorbed.
 */
public class ScheduleEditException extends RuntimeException {

    public final ScheduleErrorType errorType;

    /** This is the string that will make it out to the client, explaining what is missing. */
    public final String badValue;

    public ScheduleEditException(ScheduleErrorType errorType, String badValue) {
        super(errorType.englishMessage + " " + badValue);
        this.errorType = errorType;
        this.badValue = badValue;
    }

}
