package com.reviewtrack.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * POST /api/v1/items/annotate and /validate body. actorId is the annotator or validator.
 */
public record TransitionRequest(
        @NotEmpty(message = "EMPTY_REQUEST")
        List<String> ids,

        @NotBlank(message = "MISSING_ACTOR")
        String actorId
) {
}
