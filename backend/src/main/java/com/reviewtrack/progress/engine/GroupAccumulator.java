package com.reviewtrack.progress.engine;

import com.reviewtrack.common.CompletionMath;
import com.reviewtrack.domain.WorkItemStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;

/**
 * Mutable running totals for one group during a single aggregation pass.
 */
final class GroupAccumulator {

    private final long trackId;
    private final List<String> groupKey;
    private final EnumMap<WorkItemStatus, Long> wordCountByStatus = new EnumMap<>(WorkItemStatus.class);
    private long itemCount;
    private long totalWordCount;
    private Instant lastInsertion;
    private Instant lastAnnotation;

    GroupAccumulator(long trackId, List<String> groupKey) {
        this.trackId = trackId;
        this.groupKey = groupKey;
        for (WorkItemStatus status : WorkItemStatus.values()) {
            wordCountByStatus.put(status, 0L);
        }
    }

    void add(WorkItemStatus status, int wordCount, Instant createdAt, Instant annotatedAt) {
        itemCount++;
        totalWordCount += wordCount;
        wordCountByStatus.merge(status, (long) wordCount, Long::sum);
        lastInsertion = max(lastInsertion, createdAt);
        lastAnnotation = max(lastAnnotation, annotatedAt);
    }

    GroupProgress toProgress() {
        long pendingWords = wordCountByStatus.get(WorkItemStatus.PENDING) + wordCountByStatus.get(WorkItemStatus.LOADED);
        CompletionVector completion = new CompletionVector(
                CompletionMath.percentage(pendingWords, totalWordCount),
                CompletionMath.percentage(wordCountByStatus.get(WorkItemStatus.ANNOTATED), totalWordCount),
                CompletionMath.percentage(wordCountByStatus.get(WorkItemStatus.VALIDATED), totalWordCount),
                CompletionMath.percentage(wordCountByStatus.get(WorkItemStatus.PUBLISHED), totalWordCount),
                CompletionMath.percentage(wordCountByStatus.get(WorkItemStatus.PUBLISH_FAILED), totalWordCount));
        return new GroupProgress(
                trackId,
                groupKey,
                itemCount,
                totalWordCount,
                Collections.unmodifiableMap(new EnumMap<>(wordCountByStatus)),
                completion,
                lastInsertion,
                lastAnnotation,
                StatusResolver.resolve(completion));
    }

    private static Instant max(Instant current, Instant candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
