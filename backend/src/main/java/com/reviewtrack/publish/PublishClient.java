package com.reviewtrack.publish;

import reactor.core.publisher.Mono;

/**
 * External publish collaborator. Errors: {@link PublishRejectedException} for an explicit refusal,
 * {@link PublishTransportException} when the call failed, {@link PublishOutcomeUnknownException} when the
 * collaborator may or may not have applied the request.
 */
public interface PublishClient {

    Mono<PublishReceipt> publish(PublishRequest request);
}
