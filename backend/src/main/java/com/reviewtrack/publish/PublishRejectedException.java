package com.reviewtrack.publish;

/**
 * The collaborator received the request and refused it.
 */
public class PublishRejectedException extends RuntimeException {

    public PublishRejectedException(String reason) {
        super(reason);
    }
}
