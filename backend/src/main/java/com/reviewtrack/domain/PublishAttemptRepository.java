package com.reviewtrack.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for publish_attempts. Written by the publish orchestrator, read by reporting.
 */
public interface PublishAttemptRepository extends MongoRepository<PublishAttempt, String> {

    List<PublishAttempt> findByTrackIdAndStateIn(long trackId, List<PublishAttempt.AttemptState> states);
}
