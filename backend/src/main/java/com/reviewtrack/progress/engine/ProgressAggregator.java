package com.reviewtrack.progress.engine;

import com.reviewtrack.common.WordCounter;
import com.reviewtrack.domain.WorkItem;
import com.reviewtrack.domain.WorkItemStatus;
import com.reviewtrack.track.TrackSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Single-pass roll-up of work items into {@link GroupProgress} buckets. Each item is visited once; per-status totals,
 * latest insertion and latest annotation are accumulated in the same pass. Read-only: never touches the item store.
 * <p>
 * Per-item problems (missing text field, missing declared fields, unreadable payload) are isolated: the item counts
 * with 0 words in its status bucket and aggregation of every other item continues.
 */
@Component
@Slf4j
public class ProgressAggregator {

    static final Comparator<List<String>> KEY_ORDER = (a, b) -> {
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    public ProgressReport aggregate(TrackSchema schema, Iterable<WorkItem> items) {
        return aggregate(schema, items.iterator());
    }

    /**
     * Streaming variant: consumes the stream once, holding only one accumulator per group. Does not close the stream.
     */
    public ProgressReport aggregate(TrackSchema schema, Stream<WorkItem> items) {
        return aggregate(schema, items.iterator());
    }

    private ProgressReport aggregate(TrackSchema schema, Iterator<WorkItem> items) {
        Map<List<String>, GroupAccumulator> groups = new HashMap<>();
        long itemCount = 0;
        long integrityIssues = 0;

        while (items.hasNext()) {
            WorkItem item = items.next();
            if (item == null) {
                continue;
            }
            itemCount++;
            ItemMeasure measure = measure(schema, item);
            if (measure.integrityIssue()) {
                integrityIssues++;
            }
            groups.computeIfAbsent(measure.groupKey(), key -> new GroupAccumulator(schema.trackId(), key))
                    .add(measure.status(), measure.wordCount(), item.getCreatedAt(), item.getAnnotatedAt());
        }

        List<GroupProgress> result = new ArrayList<>(groups.size());
        for (GroupAccumulator accumulator : groups.values()) {
            result.add(accumulator.toProgress());
        }
        result.sort(Comparator.comparing(GroupProgress::groupKey, KEY_ORDER));

        if (integrityIssues > 0) {
            log.info("Track {}: {} of {} item(s) had payload integrity issues and were counted with fallback values",
                    schema.trackId(), integrityIssues, itemCount);
        }
        log.debug("Track {}: aggregated {} item(s) into {} group(s)", schema.trackId(), itemCount, result.size());
        return new ProgressReport(schema.trackId(), List.copyOf(result), itemCount, integrityIssues);
    }

    /**
     * Word count, status and group key for one item, with fallbacks for malformed data.
     */
    ItemMeasure measure(TrackSchema schema, WorkItem item) {
        boolean issue = false;
        int wordCount = 0;
        try {
            List<String> missing = schema.validate(item.getPayload());
            if (!missing.isEmpty()) {
                issue = true;
                log.debug("Work item {} missing declared field(s) {}", item.getId(), missing);
            }
            String text = schema.textOf(item.getPayload());
            if (text == null) {
                issue = true;
                log.debug("Work item {} has no readable '{}' field; word count 0", item.getId(), schema.textField());
            } else {
                wordCount = WordCounter.count(text);
            }
        } catch (RuntimeException e) {
            issue = true;
            wordCount = 0;
            log.debug("Work item {} payload unreadable; word count 0: {}", item.getId(), e.getMessage());
        }

        WorkItemStatus status = item.getStatus();
        if (status == null) {
            issue = true;
            status = WorkItemStatus.PENDING;
            log.debug("Work item {} has no status; counted as PENDING", item.getId());
        }

        List<String> stored = item.getGroupKey();
        List<String> groupKey;
        if (stored == null) {
            issue = true;
            groupKey = safeGroupKey(schema, item);
        } else if (stored.stream().anyMatch(Objects::isNull)) {
            issue = true;
            groupKey = stored.stream().map(v -> v != null ? v : "").toList();
        } else {
            groupKey = List.copyOf(stored);
        }
        return new ItemMeasure(groupKey, status, wordCount, issue);
    }

    private static List<String> safeGroupKey(TrackSchema schema, WorkItem item) {
        try {
            return schema.groupKeyOf(item.getPayload());
        } catch (RuntimeException e) {
            return schema.groupKeyOf(null);
        }
    }

    record ItemMeasure(List<String> groupKey, WorkItemStatus status, int wordCount, boolean integrityIssue) {
    }
}
