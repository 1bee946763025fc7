package com.reviewtrack.publish;

import com.reviewtrack.domain.PublishAttempt;
import com.reviewtrack.domain.PublishAttemptRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Open publish attempts per track (IN_FLIGHT, FAILED, UNCERTAIN) for reporting, keyed by GroupRef.key().
 */
@Service
@RequiredArgsConstructor
public class PublishAttemptQueryService {

    static final List<PublishAttempt.AttemptState> OPEN_STATES = List.of(
            PublishAttempt.AttemptState.IN_FLIGHT,
            PublishAttempt.AttemptState.FAILED,
            PublishAttempt.AttemptState.UNCERTAIN);

    private final PublishAttemptRepository publishAttemptRepository;

    public Map<String, PublishAttempt> openAttempts(long trackId) {
        return publishAttemptRepository.findByTrackIdAndStateIn(trackId, OPEN_STATES).stream()
                .collect(Collectors.toMap(PublishAttempt::getId, a -> a, (a, b) -> a));
    }
}
