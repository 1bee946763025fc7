package com.reviewtrack.progress.engine;

/**
 * Roll-up status of a group. WIP covers every mixed group.
 */
public enum ResolvedStatus {
    PUBLISH_FAILED,
    PENDING,
    ANNOTATED,
    VALIDATED,
    PUBLISHED,
    WIP;

    /** Only VALIDATED and PUBLISH_FAILED groups may be (re)published. */
    public boolean isPublishEligible() {
        return this == VALIDATED || this == PUBLISH_FAILED;
    }
}
