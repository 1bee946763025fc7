package com.reviewtrack.progress.query;

import com.reviewtrack.config.AsyncConfig;
import com.reviewtrack.domain.ItemSelector;
import com.reviewtrack.domain.WorkItem;
import com.reviewtrack.domain.WorkItemRepository;
import com.reviewtrack.progress.engine.MonthlyProgress;
import com.reviewtrack.progress.engine.MonthlyProgressAggregator;
import com.reviewtrack.progress.engine.ProgressAggregator;
import com.reviewtrack.progress.engine.ProgressReport;
import com.reviewtrack.track.TrackRegistry;
import com.reviewtrack.track.TrackSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Stream;

/**
 * Loads the item snapshot for a selector with one filtered read and hands it to the aggregators. Independent tracks
 * run in parallel on the aggregation executor. Nothing here writes to the item store, so cancelling a future simply
 * discards the in-flight accumulation.
 */
@Service
@Slf4j
public class ProgressQueryService {

    private final WorkItemRepository workItemRepository;
    private final TrackRegistry trackRegistry;
    private final ProgressAggregator progressAggregator;
    private final MonthlyProgressAggregator monthlyProgressAggregator;
    private final Executor aggregationExecutor;

    public ProgressQueryService(WorkItemRepository workItemRepository,
                                TrackRegistry trackRegistry,
                                ProgressAggregator progressAggregator,
                                MonthlyProgressAggregator monthlyProgressAggregator,
                                @Qualifier(AsyncConfig.AGGREGATION_EXECUTOR) Executor aggregationExecutor) {
        this.workItemRepository = workItemRepository;
        this.trackRegistry = trackRegistry;
        this.progressAggregator = progressAggregator;
        this.monthlyProgressAggregator = monthlyProgressAggregator;
        this.aggregationExecutor = aggregationExecutor;
    }

    /**
     * Group roll-ups for one selector from an in-memory snapshot. Empty selection returns an empty report.
     */
    public ProgressReport groups(ItemSelector selector) {
        TrackSchema schema = trackRegistry.schemaFor(selector.trackId());
        List<WorkItem> snapshot = load(selector);
        if (snapshot.isEmpty()) {
            log.debug("No work items for {}", selector);
            return ProgressReport.empty(selector.trackId());
        }
        ProgressReport report = progressAggregator.aggregate(schema, snapshot);
        log.info("Track {} (model {}): {} item(s) -> {} group(s)",
                selector.trackId(), selector.model(), report.itemCount(), report.groups().size());
        return report;
    }

    /**
     * Same result as {@link #groups} but reads through a database cursor, so memory stays bounded by the group count.
     */
    public ProgressReport groupsStreaming(ItemSelector selector) {
        TrackSchema schema = trackRegistry.schemaFor(selector.trackId());
        try (Stream<WorkItem> items = workItemRepository.streamBySelector(selector)) {
            ProgressReport report = progressAggregator.aggregate(schema, items);
            log.info("Track {} (model {}, streamed): {} item(s) -> {} group(s)",
                    selector.trackId(), selector.model(), report.itemCount(), report.groups().size());
            return report;
        }
    }

    public CompletableFuture<ProgressReport> groupsAsync(ItemSelector selector) {
        return CompletableFuture.supplyAsync(() -> groups(selector), aggregationExecutor);
    }

    /**
     * One aggregation task per selector, run in parallel. Result preserves the selector order.
     */
    public Map<ItemSelector, ProgressReport> groupsForTracks(List<ItemSelector> selectors) {
        Map<ItemSelector, CompletableFuture<ProgressReport>> futures = new LinkedHashMap<>();
        for (ItemSelector selector : selectors) {
            futures.computeIfAbsent(selector, this::groupsAsync);
        }
        Map<ItemSelector, ProgressReport> result = new LinkedHashMap<>();
        futures.forEach((selector, future) -> result.put(selector, future.join()));
        return result;
    }

    public List<MonthlyProgress> monthlyProgress(ItemSelector selector) {
        try (Stream<WorkItem> items = workItemRepository.streamBySelector(selector)) {
            return monthlyProgressAggregator.aggregate(items);
        }
    }

    private List<WorkItem> load(ItemSelector selector) {
        return selector.model() == null
                ? workItemRepository.findByTrackId(selector.trackId())
                : workItemRepository.findByTrackIdAndModel(selector.trackId(), selector.model());
    }
}
