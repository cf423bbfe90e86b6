package io.backbork.internal.mongo;

import io.backbork.core.NotFoundException;
import io.backbork.core.Schedule;
import io.backbork.store.ScheduleStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

public class MongoScheduleStore implements ScheduleStore {

    private static final Comparator<Schedule> BY_CREATION =
            Comparator.comparing(Schedule::createdAt).thenComparing(Schedule::id);

    private final MongoTemplate mongoTemplate;
    private final MongoIdLedger ids;
    private final MongoPayloads payloads;

    MongoScheduleStore(MongoTemplate mongoTemplate, MongoIdLedger ids, MongoPayloads payloads) {
        this.mongoTemplate = mongoTemplate;
        this.ids = ids;
        this.payloads = payloads;
    }

    @Override
    public void create(Schedule schedule) {
        ids.issue(schedule.id(), schedule.createdAt());
        mongoTemplate.insert(toDocument(schedule));
    }

    @Override
    public Optional<Schedule> get(String id) {
        if (id == null) {
            return Optional.empty();
        }
        ScheduleDocument doc = mongoTemplate.findById(id, ScheduleDocument.class);
        return Optional.ofNullable(doc).map(this::toSchedule);
    }

    @Override
    public List<Schedule> list() {
        Query q = new Query();
        q.with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        List<Schedule> schedules = new ArrayList<>();
        for (ScheduleDocument d : mongoTemplate.find(q, ScheduleDocument.class)) {
            schedules.add(toSchedule(d));
        }
        schedules.sort(BY_CREATION);
        return schedules;
    }

    @Override
    public Schedule save(Schedule schedule) {
        Query q = new Query(Criteria.where("_id").is(schedule.id()));
        Update u = new Update()
                .set("nextRun", schedule.nextRun())
                .set("enabled", schedule.enabled())
                .set("payload", payloads.toMap(schedule));
        if (mongoTemplate.updateFirst(q, u, ScheduleDocument.class).getMatchedCount() == 0) {
            throw new NotFoundException("Schedule", schedule.id());
        }
        return schedule;
    }

    @Override
    public boolean delete(String id) {
        Query q = new Query(Criteria.where("_id").is(id));
        return mongoTemplate.remove(q, ScheduleDocument.class).getDeletedCount() > 0;
    }

    private ScheduleDocument toDocument(Schedule schedule) {
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId(schedule.id());
        doc.setCreatedAt(schedule.createdAt());
        doc.setNextRun(schedule.nextRun());
        doc.setEnabled(schedule.enabled());
        doc.setPayload(payloads.toMap(schedule));
        return doc;
    }

    private Schedule toSchedule(ScheduleDocument doc) {
        return payloads.fromMap(doc.getPayload(), Schedule.class);
    }
}
