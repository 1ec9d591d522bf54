package com.conveyal.schedule.error;

/**
 * How urgently a schedule problem should be looked at.
 */
public enum Priority {
    HIGH,
    MEDIUM,
    LOW,
    UNKNOWN
}
