package com.reviewtrack.api.dto;

import java.util.List;

/**
 * Result of a publish or resolve call. rejection is set only when outcome=REJECTED.
 */
public record PublishActionResponse(long trackId, List<String> groupKey, String outcome, String rejection,
                                    int itemCount, String reason) {
}
