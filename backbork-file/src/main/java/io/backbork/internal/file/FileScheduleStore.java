package io.backbork.internal.file;

import io.backbork.core.NotFoundException;
import io.backbork.core.Schedule;
import io.backbork.store.ScheduleStore;
import io.backbork.utils.JobIds;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class FileScheduleStore implements ScheduleStore {

    private final Path dir;
    private final FileIdLedger ids;
    private final JsonFiles json;

    FileScheduleStore(Path dir, FileIdLedger ids, JsonFiles json) {
        JsonFiles.createDirectories(dir);
        this.dir = dir;
        this.ids = ids;
        this.json = json;
    }

    @Override
    public void create(Schedule schedule) {
        ids.issue(schedule.id());
        json.write(JsonFiles.recordPath(dir, schedule.id()), schedule);
    }

    @Override
    public Optional<Schedule> get(String id) {
        if (!JobIds.isSafe(id)) {
            return Optional.empty();
        }
        return json.read(JsonFiles.recordPath(dir, id), Schedule.class);
    }

    @Override
    public List<Schedule> list() {
        List<Schedule> schedules = new ArrayList<>();
        for (String id : JsonFiles.listIds(dir)) {
            json.read(JsonFiles.recordPath(dir, id), Schedule.class).ifPresent(schedules::add);
        }
        schedules.sort(Comparator.comparing(Schedule::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Schedule::id));
        return schedules;
    }

    @Override
    public synchronized Schedule save(Schedule schedule) {
        Path file = JsonFiles.recordPath(dir, JobIds.requireSafe(schedule.id()));
        if (!Files.exists(file)) {
            throw new NotFoundException("Schedule", schedule.id());
        }
        json.write(file, schedule);
        return schedule;
    }

    @Override
    public boolean delete(String id) {
        if (!JobIds.isSafe(id)) {
            return false;
        }
        return JsonFiles.delete(JsonFiles.recordPath(dir, id));
    }
}
