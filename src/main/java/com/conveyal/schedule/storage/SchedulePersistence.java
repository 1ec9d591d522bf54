package com.conveyal.schedule.storage;

import com.conveyal.schedule.model.Schedule;

/**
 * Where committed schedule snapshots go. The editor calls {@link #store} once for every operation that changed the
 * schedule; implementations resolve conflicts between sessions themselves.
 */
public interface SchedulePersistence {

    /** @return the last stored snapshot, or null if nothing has been stored yet. */
    Schedule load();

    /** @throws StorageException if the snapshot could not be stored. */
    void store(Schedule schedule);

}
