package com.reviewtrack.publish;

import com.reviewtrack.domain.GroupRef;

/**
 * Outcome of one publish request. REJECTED means no external call was made and nothing was written.
 */
public record PublishResult(GroupRef group, Outcome outcome, Rejection rejection, int itemCount, String reason) {

    public enum Outcome {
        PUBLISHED,
        FAILED,
        UNCERTAIN,
        REJECTED
    }

    public enum Rejection {
        NOT_ELIGIBLE,
        LEASE_HELD,
        UNCERTAIN_PENDING_VERIFICATION,
        NO_ITEMS,
        RATE_LIMITED
    }

    public static PublishResult published(GroupRef group, int itemCount) {
        return new PublishResult(group, Outcome.PUBLISHED, null, itemCount, null);
    }

    public static PublishResult failed(GroupRef group, int itemCount, String reason) {
        return new PublishResult(group, Outcome.FAILED, null, itemCount, reason);
    }

    public static PublishResult uncertain(GroupRef group, int itemCount, String reason) {
        return new PublishResult(group, Outcome.UNCERTAIN, null, itemCount, reason);
    }

    public static PublishResult rejected(GroupRef group, Rejection rejection, String reason) {
        return new PublishResult(group, Outcome.REJECTED, rejection, 0, reason);
    }

    public boolean externalCallMade() {
        return outcome != Outcome.REJECTED;
    }
}
