package com.reviewtrack.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * POST /api/v1/publish/resolve body. confirmedPublished is the outcome a person verified with the collaborator.
 * The token is built from the group key and track id even when the group is not currently eligible.
 */
public record ResolveUncertainRequest(
        @NotBlank(message = "INVALID_PUBLISH_ACTION")
        String publishAction,

        @NotNull(message = "MISSING_OUTCOME")
        Boolean confirmedPublished,

        String reason
) {
}
