package com.reviewtrack.api.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One group roll-up as consumed by reporting. publishAction is the publish-action token ("" when not eligible);
 * publishAttempt is the open attempt state (IN_FLIGHT, FAILED, UNCERTAIN) or null.
 */
public record GroupResponse(
        List<String> groupKey,
        long itemCount,
        long totalWordCount,
        Map<String, Long> wordCountByStatus,
        Map<String, BigDecimal> completionPct,
        Instant lastInsertion,
        Instant lastAnnotation,
        String resolvedStatus,
        boolean publishEligible,
        String publishAction,
        String publishAttempt,
        String publishAttemptReason
) {
}
