package com.reviewtrack.publish;

/**
 * Acknowledgement from the publish collaborator. reference may be null when the collaborator returns none.
 */
public record PublishReceipt(String reference) {
}
