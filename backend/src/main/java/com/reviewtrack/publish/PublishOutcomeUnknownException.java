package com.reviewtrack.publish;

/**
 * The collaborator's response does not tell whether the publish was applied (e.g. gateway timeout).
 */
public class PublishOutcomeUnknownException extends RuntimeException {

    public PublishOutcomeUnknownException(String message, Throwable cause) {
        super(message, cause);
    }
}
