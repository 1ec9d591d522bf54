package com.conveyal.schedule.error;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates the non-fatal problems encountered by editing components and validators, one by one. Components log
 * each problem as it is stored, so the storage is for callers that want to show warnings after an operation.
 */
public class ScheduleErrorStorage {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleErrorStorage.class);

    private final List<ScheduleError> errors = new ArrayList<>();

    public void storeError (ScheduleError error) {
        LOG.debug("Storing {}", error);
        errors.add(error);
    }

    public List<ScheduleError> getErrors () {
        return ImmutableList.copyOf(errors);
    }

    public int getErrorCount () {
        return errors.size();
    }

    public boolean hasErrorOfType (ScheduleErrorType type) {
        return errors.stream().anyMatch(e -> e.type == type);
    }

    public void clear () {
        errors.clear();
    }

}
