package io.backbork.store;

import io.backbork.core.Schedule;

import java.util.List;
import java.util.Optional;

public interface ScheduleStore {

    /**
     * @throws io.backbork.core.DuplicateIdException if the id was ever issued before
     */
    void create(Schedule schedule);

    Optional<Schedule> get(String id);

    /**
     * All schedules ordered by creation time.
     */
    List<Schedule> list();

    /**
     * Replace an existing schedule.
     *
     * @throws io.backbork.core.NotFoundException if it does not exist
     */
    Schedule save(Schedule schedule);

    boolean delete(String id);
}
