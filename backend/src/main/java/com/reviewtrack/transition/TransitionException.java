package com.reviewtrack.transition;

import lombok.Getter;

/**
 * Thrown by WorkItemTransitionService when a request is invalid. API layer maps to 400.
 */
@Getter
public class TransitionException extends RuntimeException {

    /** EMPTY_REQUEST, MISSING_ACTOR. */
    private final String errorCode;

    public TransitionException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
}
