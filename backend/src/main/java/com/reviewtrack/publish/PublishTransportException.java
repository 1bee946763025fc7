package com.reviewtrack.publish;

/**
 * The publish call failed before the collaborator could apply it (connection refused, 5xx other than 504).
 */
public class PublishTransportException extends RuntimeException {

    public PublishTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
