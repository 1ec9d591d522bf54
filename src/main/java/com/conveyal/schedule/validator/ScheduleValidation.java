package com.conveyal.schedule.validator;

import com.conveyal.schedule.error.ScheduleErrorStorage;
import com.conveyal.schedule.model.Schedule;
import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs every schedule validator and collects the result.
 */
public class ScheduleValidation {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleValidation.class);

    public static ValidationResult validate(Schedule schedule) {
        long startValidation = System.currentTimeMillis();
        ScheduleErrorStorage errorStorage = new ScheduleErrorStorage();
        List<Validator> validators = ImmutableList.of(
            new TripTimesValidator(errorStorage),
            new BlockValidator(errorStorage),
            new TripNumberValidator(errorStorage)
        );
        for (Validator validator : validators) {
            String validatorName = validator.getClass().getSimpleName();
            LOG.debug("Running {}.", validatorName);
            int errorCountBefore = errorStorage.getErrorCount();
            validator.validate(schedule);
            LOG.debug("{} found {} errors.", validatorName, errorStorage.getErrorCount() - errorCountBefore);
        }
        ValidationResult result = new ValidationResult();
        result.tripCount = schedule.trips.size();
        result.blockCount = schedule.tripsByBlock().keySet().size();
        result.errors = errorStorage.getErrors();
        result.errorCount = result.errors.size();
        result.validationTime = System.currentTimeMillis() - startValidation;
        LOG.info("Validation found {} errors in {} trips ({} ms).", result.errorCount, result.tripCount, result.validationTime);
        return result;
    }

}
