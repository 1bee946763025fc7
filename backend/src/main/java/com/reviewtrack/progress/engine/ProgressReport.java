package com.reviewtrack.progress.engine;

import java.util.List;

/**
 * Result of one aggregation pass over a track's snapshot. integrityIssues counts items whose payload missed
 * declared fields or the text field; they are still included with their fallback word count.
 */
public record ProgressReport(long trackId, List<GroupProgress> groups, long itemCount, long integrityIssues) {

    public static ProgressReport empty(long trackId) {
        return new ProgressReport(trackId, List.of(), 0, 0);
    }
}
