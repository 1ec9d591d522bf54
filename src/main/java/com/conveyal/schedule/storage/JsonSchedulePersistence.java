package com.conveyal.schedule.storage;

import com.conveyal.schedule.error.ScheduleErrorType;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.util.json.JsonManager;
import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Keeps the current schedule snapshot in a JSON file. Each store replaces the file; the previous version is kept
 * alongside it with a .bak suffix.
 */
public class JsonSchedulePersistence implements SchedulePersistence {

    private static final Logger LOG = LoggerFactory.getLogger(JsonSchedulePersistence.class);

    private final File file;
    private final JsonManager<Schedule> json = new JsonManager<>(Schedule.class);

    public JsonSchedulePersistence(File file) {
        this.file = file;
    }

    @Override
    public Schedule load() {
        if (!file.exists()) {
            LOG.info("No schedule stored at {} yet.", file.getAbsolutePath());
            return null;
        }
        try {
            Schedule schedule = json.read(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
            if (schedule == null) {
                throw new StorageException(ScheduleErrorType.EMPTY_SCHEDULE_FILE, file.getAbsolutePath());
            }
            LOG.info("Loaded {} from {}.", schedule, file.getAbsolutePath());
            return schedule;
        } catch (IOException e) {
            throw new StorageException(e);
        }
    }

    @Override
    public void store(Schedule schedule) {
        try {
            if (file.exists()) {
                FileUtils.copyFile(file, new File(file.getPath() + ".bak"));
            }
            FileUtils.writeStringToFile(file, json.writePretty(schedule), StandardCharsets.UTF_8);
            LOG.debug("Stored {} at {}.", schedule, file.getAbsolutePath());
        } catch (IOException e) {
            throw new StorageException(e);
        }
    }

}
