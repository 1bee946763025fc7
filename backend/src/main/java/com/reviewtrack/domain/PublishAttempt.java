package com.reviewtrack.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Latest publish attempt per group (id = GroupRef.key()). UNCERTAIN blocks re-publish until a person has verified
 * the external outcome. Does not feed the resolved status.
 */
@Document(collection = "publish_attempts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PublishAttempt {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private long trackId;
    private List<String> groupKey;
    private AttemptState state;
    private int itemCount;
    private int attemptCount;
    private String reason;
    private Instant startedAt;
    private Instant finishedAt;

    public enum AttemptState {
        IN_FLIGHT,
        SUCCEEDED,
        FAILED,
        UNCERTAIN
    }
}
