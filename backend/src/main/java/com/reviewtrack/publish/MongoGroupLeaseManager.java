package com.reviewtrack.publish;

import com.reviewtrack.domain.GroupRef;
import com.reviewtrack.domain.PublishLease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Lease store on publish_leases. Acquisition is an insert on the unique _id; an expired lease is taken over with a
 * conditional findAndModify, so two processes can never both hold a live lease for the same group.
 */
@Component
@Slf4j
public class MongoGroupLeaseManager implements GroupLeaseManager {

    private final MongoTemplate mongoTemplate;
    private final Duration ttl;

    public MongoGroupLeaseManager(MongoTemplate mongoTemplate, PublishProperties properties) {
        this.mongoTemplate = mongoTemplate;
        this.ttl = Duration.ofMillis(properties.getLeaseTtlMs());
    }

    @Override
    public Optional<Lease> tryAcquire(GroupRef group) {
        String key = group.key();
        String holder = UUID.randomUUID().toString();
        Instant now = Instant.now();
        Instant expiresAt = now.plus(ttl);

        PublishLease lease = new PublishLease();
        lease.setId(key);
        lease.setHolder(holder);
        lease.setAcquiredAt(now);
        lease.setExpiresAt(expiresAt);
        try {
            mongoTemplate.insert(lease);
            return Optional.of(new Lease(key, holder, expiresAt));
        } catch (DuplicateKeyException e) {
            log.debug("Lease {} exists; trying expired takeover", key);
        }

        PublishLease taken = mongoTemplate.findAndModify(
                new Query(where("_id").is(key).and("expiresAt").lt(now)),
                new Update().set("holder", holder).set("acquiredAt", now).set("expiresAt", expiresAt),
                FindAndModifyOptions.options().returnNew(true),
                PublishLease.class);
        if (taken != null && holder.equals(taken.getHolder())) {
            log.warn("Took over expired publish lease {}", key);
            return Optional.of(new Lease(key, holder, expiresAt));
        }
        return Optional.empty();
    }

    @Override
    public void release(Lease lease) {
        mongoTemplate.remove(new Query(where("_id").is(lease.key()).and("holder").is(lease.holder())), PublishLease.class);
    }

    /** Removes leases whose holder died without releasing. */
    @Scheduled(fixedDelayString = "${reviewtrack.publish.lease-cleanup-interval-ms:600000}")
    public void deleteExpiredLeases() {
        long removed = mongoTemplate.remove(new Query(where("expiresAt").lt(Instant.now())), PublishLease.class)
                .getDeletedCount();
        if (removed > 0) {
            log.info("Deleted {} expired publish lease(s)", removed);
        }
    }
}
