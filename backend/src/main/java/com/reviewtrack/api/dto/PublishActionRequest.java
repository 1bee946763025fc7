package com.reviewtrack.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * POST /api/v1/publish body: the group's publish-action token.
 */
public record PublishActionRequest(
        @NotBlank(message = "INVALID_PUBLISH_ACTION")
        String publishAction
) {
}
