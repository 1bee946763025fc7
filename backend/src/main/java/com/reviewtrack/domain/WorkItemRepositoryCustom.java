package com.reviewtrack.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Custom work_items operations using MongoTemplate (cursor reads and batch status writes).
 */
public interface WorkItemRepositoryCustom {

    /** Cursor over the selected items. Caller must close the stream. */
    Stream<WorkItem> streamBySelector(ItemSelector selector);

    /**
     * Batch transition: sets status and the matching stage timestamp on every id. reason is stored for PUBLISH_FAILED
     * and cleared otherwise. Returns the number of modified documents.
     */
    long updateStatus(Collection<String> ids, WorkItemStatus status, Instant at, String reason);

    /**
     * Conditional batch transition: only items currently in one of {@code from} move to {@code to}. actorField
     * (annotatorId / validatorId) is set to actorId when not null. Returns the number of modified documents.
     */
    long transition(Collection<String> ids, Set<WorkItemStatus> from, WorkItemStatus to, Instant at,
                    String actorField, String actorId);
}
