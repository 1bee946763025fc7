package com.reviewtrack.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One unit of review/translation work. Created by ingestion, mutated only by annotation, validation and publish
 * transitions, never deleted. groupKey holds the ordered values of the track's high-level key fields.
 */
@Document(collection = "work_items")
@CompoundIndexes({
    @CompoundIndex(name = "track_model", def = "{'trackId': 1, 'model': 1}"),
    @CompoundIndex(name = "track_groupKey", def = "{'trackId': 1, 'groupKey': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class WorkItem {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private long trackId;
    private String model;
    private List<String> groupKey;
    /** Raw field values; validated against the track schema, never coerced. */
    private Map<String, Object> payload;
    private WorkItemStatus status;
    private String annotatorId;
    private String validatorId;
    private Instant createdAt;
    private Instant annotatedAt;
    private Instant validatedAt;
    private Instant publishedAt;
    private Instant publishFailedAt;
    /** Failure reason when status=PUBLISH_FAILED. */
    private String statusReason;
    private Instant updatedAt;
}
