package com.reviewtrack.progress.engine;

import com.reviewtrack.domain.GroupRef;
import com.reviewtrack.domain.WorkItemStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Derived roll-up of the work items sharing (trackId, groupKey). Never persisted; recomputed from a snapshot.
 * Sum of wordCountByStatus always equals totalWordCount.
 */
public record GroupProgress(
        long trackId,
        List<String> groupKey,
        long itemCount,
        long totalWordCount,
        Map<WorkItemStatus, Long> wordCountByStatus,
        CompletionVector completion,
        Instant lastInsertion,
        Instant lastAnnotation,
        ResolvedStatus resolvedStatus
) {

    public GroupRef ref() {
        return new GroupRef(trackId, groupKey);
    }

    public boolean publishEligible() {
        return resolvedStatus.isPublishEligible();
    }

    public String publishActionToken() {
        return PublishActionToken.of(resolvedStatus, groupKey, trackId);
    }

    public long wordCount(WorkItemStatus status) {
        return wordCountByStatus.getOrDefault(status, 0L);
    }
}
