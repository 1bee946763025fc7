package com.reviewtrack.publish;

import lombok.Getter;

/**
 * Thrown when a manual publish action does not fit the group's attempt state.
 * API layer maps NO_UNCERTAIN_ATTEMPT to 409 and LEASE_HELD to 409.
 */
@Getter
public class PublishStateException extends RuntimeException {

    /** NO_UNCERTAIN_ATTEMPT, LEASE_HELD. */
    private final String errorCode;

    public PublishStateException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
