package com.reviewtrack.publish;

import com.reviewtrack.domain.GroupRef;

import java.time.Instant;
import java.util.Optional;

/**
 * Exclusive, expiring lease per group. At most one holder at a time; a lease past its expiry may be taken over.
 */
public interface GroupLeaseManager {

    /** Non-blocking: empty when another holder owns a live lease for the group. */
    Optional<Lease> tryAcquire(GroupRef group);

    /** Releases the lease if still held by the same holder; no-op otherwise. */
    void release(Lease lease);

    record Lease(String key, String holder, Instant expiresAt) {
    }
}
