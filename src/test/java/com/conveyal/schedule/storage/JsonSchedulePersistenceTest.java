package com.conveyal.schedule.storage;

import com.conveyal.schedule.error.ScheduleErrorType;
import com.conveyal.schedule.model.Schedule;
import com.conveyal.schedule.model.TimePoint;
import com.conveyal.schedule.model.Trip;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;

import static com.conveyal.schedule.TestUtils.FASTEST;
import static com.conveyal.schedule.TestUtils.schedule;
import static com.conveyal.schedule.TestUtils.timePoints;
import static com.conveyal.schedule.TestUtils.trip;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class JsonSchedulePersistenceTest {

    private static final List<TimePoint> ROUTE = timePoints("A", "B", "C");

    @TempDir
    File tempDir;

    private static Schedule sampleSchedule() {
        Trip ended = trip(ROUTE, 1, FASTEST, "06:00", new int[] {10, 10}, new int[] {0, 2, 3});
        ended.originalArrivalTimes = new HashMap<>(ended.arrivalTimes);
        ended.originalDepartureTimes = new HashMap<>(ended.departureTimes);
        ended.originalRecoveryTimes = new HashMap<>(ended.recoveryTimes);
        ended.tripEndIndex = 1;
        Trip last = trip(ROUTE, 2, FASTEST, "06:30", new int[] {10, 10}, new int[] {0, 0, 0});
        last.hiddenTailRecoveryTimes = new HashMap<>();
        last.hiddenTailRecoveryTimes.put("C", 4);
        return schedule(ROUTE, ended, last);
    }

    @Test
    public void storedScheduleLoadsBackEqual() {
        JsonSchedulePersistence persistence = new JsonSchedulePersistence(new File(tempDir, "schedule.json"));
        Schedule schedule = sampleSchedule();
        persistence.store(schedule);

        Schedule loaded = persistence.load();
        assertThat(loaded, is(schedule));
        assertThat(loaded.findTrip(1).isTruncated(), is(true));
        assertThat(loaded.findTrip(2).hiddenTailRecoveryTimes.get("C"), is(4));
    }

    @Test
    public void previousVersionIsKept() throws IOException {
        File file = new File(tempDir, "schedule.json");
        JsonSchedulePersistence persistence = new JsonSchedulePersistence(file);
        Schedule schedule = sampleSchedule();
        persistence.store(schedule);
        persistence.store(schedule.withTrips(schedule.trips.subList(0, 1)));

        File backup = new File(tempDir, "schedule.json.bak");
        assertThat(backup.exists(), is(true));
        assertThat(FileUtils.readFileToString(backup, StandardCharsets.UTF_8), containsString("hiddenTailRecoveryTimes"));
        assertThat(FileUtils.readFileToString(file, StandardCharsets.UTF_8), not(containsString("hiddenTailRecoveryTimes")));
    }

    @Test
    public void missingFileLoadsNothing() {
        assertThat(new JsonSchedulePersistence(new File(tempDir, "absent.json")).load(), nullValue());
    }

    @Test
    public void unreadableFileFails() throws IOException {
        File file = new File(tempDir, "broken.json");
        FileUtils.writeStringToFile(file, "{ not json", StandardCharsets.UTF_8);
        StorageException e = assertThrows(StorageException.class, () -> new JsonSchedulePersistence(file).load());
        assertThat(e.errorType, is(ScheduleErrorType.OTHER));
    }

    @Test
    public void fileHoldingNullFailsWithItsPath() throws IOException {
        File file = new File(tempDir, "null.json");
        FileUtils.writeStringToFile(file, "null", StandardCharsets.UTF_8);
        StorageException e = assertThrows(StorageException.class, () -> new JsonSchedulePersistence(file).load());
        assertThat(e.errorType, is(ScheduleErrorType.EMPTY_SCHEDULE_FILE));
        assertThat(e.badValue, is(file.getAbsolutePath()));
    }
}
