package com.conveyal.schedule.validator;

import com.conveyal.schedule.error.Priority;
import com.conveyal.schedule.error.ScheduleError;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * An instance of this class is returned by the validator.
 * It groups together the errors found and summary information about the validation run.
 *
 * Ignore unknown properties on deserialization to avoid conflicts with past versions.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ValidationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public int tripCount;
    public int blockCount;
    public int errorCount;
    public List<ScheduleError> errors = new ArrayList<>();
    public long validationTime;

    public boolean isValid() {
        return errorCount == 0;
    }

    public long countByPriority(Priority priority) {
        return errors.stream().filter(e -> e.type.priority == priority).count();
    }

}
