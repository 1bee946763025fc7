package com.reviewtrack.progress.engine;

import com.reviewtrack.domain.WorkItem;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Buckets stage timestamps (annotatedAt, validatedAt, publishedAt, publishFailedAt) by UTC month in one pass.
 * An item counts in every stage it has reached, not only its current one.
 */
@Component
public class MonthlyProgressAggregator {

    private static final int ANNOTATED = 0;
    private static final int VALIDATED = 1;
    private static final int PUBLISHED = 2;
    private static final int PUBLISH_FAILED = 3;

    public List<MonthlyProgress> aggregate(Iterable<WorkItem> items) {
        return aggregate(items.iterator());
    }

    public List<MonthlyProgress> aggregate(Stream<WorkItem> items) {
        return aggregate(items.iterator());
    }

    private List<MonthlyProgress> aggregate(Iterator<WorkItem> items) {
        Map<YearMonth, long[]> buckets = new TreeMap<>();
        while (items.hasNext()) {
            WorkItem item = items.next();
            if (item == null) {
                continue;
            }
            count(buckets, item.getAnnotatedAt(), ANNOTATED);
            count(buckets, item.getValidatedAt(), VALIDATED);
            count(buckets, item.getPublishedAt(), PUBLISHED);
            count(buckets, item.getPublishFailedAt(), PUBLISH_FAILED);
        }
        List<MonthlyProgress> result = new ArrayList<>(buckets.size());
        buckets.forEach((month, c) -> result.add(new MonthlyProgress(month, c[ANNOTATED], c[VALIDATED], c[PUBLISHED], c[PUBLISH_FAILED])));
        return List.copyOf(result);
    }

    private static void count(Map<YearMonth, long[]> buckets, Instant at, int stage) {
        if (at == null) {
            return;
        }
        YearMonth month = YearMonth.from(at.atZone(ZoneOffset.UTC));
        buckets.computeIfAbsent(month, m -> new long[4])[stage]++;
    }
}
