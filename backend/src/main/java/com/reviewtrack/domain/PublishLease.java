package com.reviewtrack.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Exclusive publish lease per group (id = GroupRef.key()). The unique _id makes acquisition atomic across processes.
 */
@Document(collection = "publish_leases")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PublishLease {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String holder;
    private Instant acquiredAt;
    @Indexed
    private Instant expiresAt;
}
