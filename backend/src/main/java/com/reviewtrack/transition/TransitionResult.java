package com.reviewtrack.transition;

import java.util.List;

/**
 * Outcome of a batch transition. skippedIds are unknown ids or items not in an allowed source status.
 */
public record TransitionResult(int requested, long transitioned, List<String> skippedIds) {
}
