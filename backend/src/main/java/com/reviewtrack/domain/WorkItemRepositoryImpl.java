package com.reviewtrack.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Stream;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of WorkItemRepositoryCustom using MongoTemplate.
 */
@Repository
@RequiredArgsConstructor
public class WorkItemRepositoryImpl implements WorkItemRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public Stream<WorkItem> streamBySelector(ItemSelector selector) {
        Criteria criteria = where("trackId").is(selector.trackId());
        if (selector.model() != null) {
            criteria = criteria.and("model").is(selector.model());
        }
        return mongoTemplate.stream(new Query(criteria), WorkItem.class);
    }

    @Override
    public long updateStatus(Collection<String> ids, WorkItemStatus status, Instant at, String reason) {
        if (ids == null || ids.isEmpty()) {
            return 0;
        }
        Update update = statusUpdate(status, at);
        if (status == WorkItemStatus.PUBLISH_FAILED) {
            update.set("statusReason", reason);
        } else {
            update.unset("statusReason");
        }
        return mongoTemplate.updateMulti(new Query(where("_id").in(ids)), update, WorkItem.class)
                .getModifiedCount();
    }

    @Override
    public long transition(Collection<String> ids, Set<WorkItemStatus> from, WorkItemStatus to, Instant at,
                           String actorField, String actorId) {
        if (ids == null || ids.isEmpty() || from.isEmpty()) {
            return 0;
        }
        Update update = statusUpdate(to, at).unset("statusReason");
        if (actorField != null && actorId != null) {
            update.set(actorField, actorId);
        }
        Query query = new Query(where("_id").in(ids).and("status").in(from));
        return mongoTemplate.updateMulti(query, update, WorkItem.class).getModifiedCount();
    }

    private static Update statusUpdate(WorkItemStatus status, Instant at) {
        Update update = new Update()
                .set("status", status)
                .set("updatedAt", at);
        String stampField = stampField(status);
        if (stampField != null) {
            update.set(stampField, at);
        }
        return update;
    }

    static String stampField(WorkItemStatus status) {
        return switch (status) {
            case ANNOTATED -> "annotatedAt";
            case VALIDATED -> "validatedAt";
            case PUBLISHED -> "publishedAt";
            case PUBLISH_FAILED -> "publishFailedAt";
            case PENDING, LOADED -> null;
        };
    }
}
