package com.conveyal.schedule.storage;

import com.conveyal.schedule.error.ScheduleErrorType;

/**
 * Some errors are detected way down the call stack, in a persistence adapter, where we don't have a reference to
 * the error storage. We throw this exception to signal the caller that a schedule could not be loaded or stored.
 * It also wraps unexpected IO and serialization problems.
 */
public class StorageException extends RuntimeException {

    /** For expected, recognized errors that have a defined enum value. */
    public ScheduleErrorType errorType = ScheduleErrorType.OTHER;

    /** This is the string that will make it out to the client, explaining what went wrong. */
    public String badValue = null;

    /** This is the constructor for expected errors that have a defined enum value. */
    public StorageException(ScheduleErrorType errorType, String badValue) {
        super(errorType.englishMessage);
        this.errorType = errorType;
        this.badValue = badValue;
    }

    /** This is the constructor for wrapping unexpected and unhandled exceptions. */
    public StorageException(Exception ex) {
        super(ex);
        // Expose the exception type and message to the outside world.
        badValue = ex.toString();
    }

}
