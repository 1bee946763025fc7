package com.reviewtrack.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for work_items. Reads by track (optionally model) feed the progress engine; group reads feed publishing.
 */
public interface WorkItemRepository extends MongoRepository<WorkItem, String>, WorkItemRepositoryCustom {

    List<WorkItem> findByTrackId(long trackId);

    List<WorkItem> findByTrackIdAndModel(long trackId, String model);

    /** Exact match on the ordered key array. */
    List<WorkItem> findByTrackIdAndGroupKey(long trackId, List<String> groupKey);
}
