package com.reviewtrack.api.controller;

import com.reviewtrack.api.dto.GroupListResponse;
import com.reviewtrack.api.dto.GroupResponse;
import com.reviewtrack.api.dto.MonthlyProgressResponse;
import com.reviewtrack.domain.ItemSelector;
import com.reviewtrack.domain.PublishAttempt;
import com.reviewtrack.domain.WorkItemStatus;
import com.reviewtrack.progress.engine.CompletionVector;
import com.reviewtrack.progress.engine.GroupProgress;
import com.reviewtrack.progress.engine.ProgressReport;
import com.reviewtrack.progress.query.ProgressQueryService;
import com.reviewtrack.publish.PublishAttemptQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Group roll-ups and monthly progress for the reporting layer.
 */
@RestController
@RequestMapping("/api/v1/tracks")
@RequiredArgsConstructor
public class ProgressController {

    private final ProgressQueryService progressQueryService;
    private final PublishAttemptQueryService publishAttemptQueryService;

    @GetMapping("/{trackId}/groups")
    public ResponseEntity<GroupListResponse> getGroups(
            @PathVariable long trackId,
            @RequestParam(required = false) String model,
            @RequestParam(required = false, defaultValue = "false") boolean streaming
    ) {
        ItemSelector selector = new ItemSelector(trackId, blankToNull(model));
        ProgressReport report = streaming
                ? progressQueryService.groupsStreaming(selector)
                : progressQueryService.groups(selector);
        Map<String, PublishAttempt> attempts = publishAttemptQueryService.openAttempts(trackId);
        List<GroupResponse> groups = report.groups().stream()
                .map(g -> toResponse(g, attempts.get(g.ref().key())))
                .toList();
        return ResponseEntity.ok(new GroupListResponse(trackId, selector.model(), report.itemCount(),
                report.integrityIssues(), groups));
    }

    @GetMapping("/{trackId}/monthly")
    public ResponseEntity<List<MonthlyProgressResponse>> getMonthly(
            @PathVariable long trackId,
            @RequestParam(required = false) String model
    ) {
        List<MonthlyProgressResponse> body = progressQueryService.monthlyProgress(new ItemSelector(trackId, blankToNull(model)))
                .stream()
                .map(m -> new MonthlyProgressResponse(m.month().toString(), m.annotated(), m.validated(),
                        m.published(), m.publishFailed()))
                .toList();
        return ResponseEntity.ok(body);
    }

    static GroupResponse toResponse(GroupProgress g, PublishAttempt attempt) {
        Map<String, Long> words = new LinkedHashMap<>();
        for (WorkItemStatus status : WorkItemStatus.values()) {
            words.put(status.name(), g.wordCount(status));
        }
        return new GroupResponse(
                g.groupKey(),
                g.itemCount(),
                g.totalWordCount(),
                words,
                completion(g.completion()),
                g.lastInsertion(),
                g.lastAnnotation(),
                g.resolvedStatus().name(),
                g.publishEligible(),
                g.publishActionToken(),
                attempt != null ? attempt.getState().name() : null,
                attempt != null ? attempt.getReason() : null);
    }

    private static Map<String, BigDecimal> completion(CompletionVector v) {
        Map<String, BigDecimal> pct = new LinkedHashMap<>();
        pct.put("PENDING", v.pending());
        pct.put("ANNOTATED", v.annotated());
        pct.put("VALIDATED", v.validated());
        pct.put("PUBLISHED", v.published());
        pct.put("PUBLISH_FAILED", v.publishFailed());
        return pct;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
