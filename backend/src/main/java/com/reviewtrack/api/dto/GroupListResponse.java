package com.reviewtrack.api.dto;

import java.util.List;

/**
 * GET /api/v1/tracks/{trackId}/groups response.
 */
public record GroupListResponse(long trackId, String model, long itemCount, long integrityIssues,
                                List<GroupResponse> groups) {
}
