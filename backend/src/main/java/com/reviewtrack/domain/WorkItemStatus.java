package com.reviewtrack.domain;

/**
 * Lifecycle of a work item: PENDING / LOADED → ANNOTATED → VALIDATED → PUBLISHED | PUBLISH_FAILED.
 * PUBLISH_FAILED items can be published again.
 */
public enum WorkItemStatus {
    PENDING,
    LOADED,
    ANNOTATED,
    VALIDATED,
    PUBLISHED,
    PUBLISH_FAILED
}
