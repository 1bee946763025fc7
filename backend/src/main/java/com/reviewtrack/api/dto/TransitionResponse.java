package com.reviewtrack.api.dto;

import java.util.List;

public record TransitionResponse(int requested, long transitioned, List<String> skippedIds) {
}
