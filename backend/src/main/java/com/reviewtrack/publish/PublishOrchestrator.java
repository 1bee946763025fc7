package com.reviewtrack.publish;

import com.reviewtrack.domain.GroupRef;
import com.reviewtrack.domain.PublishAttempt;
import com.reviewtrack.domain.PublishAttemptRepository;
import com.reviewtrack.domain.WorkItem;
import com.reviewtrack.domain.WorkItemRepository;
import com.reviewtrack.domain.WorkItemStatus;
import com.reviewtrack.progress.engine.GroupProgress;
import com.reviewtrack.progress.engine.ProgressAggregator;
import com.reviewtrack.progress.engine.ProgressReport;
import com.reviewtrack.track.TrackRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Exceptions;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Publishes eligible groups (resolved status VALIDATED or PUBLISH_FAILED) to the external collaborator.
 *
 * <pre>
 *  1. Reject ineligible groups without side effects
 *  2. Take the per-group lease (second caller is rejected with LEASE_HELD)
 *  3. Re-read members and re-resolve under the lease; refuse when an UNCERTAIN attempt awaits verification
 *  4. Call the collaborator, bounded by reviewtrack.publish.timeout-ms
 *  5. Accepted: members → PUBLISHED. Rejected or transport error: members → PUBLISH_FAILED with reason.
 *     Timeout or unknown outcome: attempt UNCERTAIN, members untouched.
 *  6. Release the lease
 * </pre>
 * No automatic retries. FAILED and UNCERTAIN surface through the group's status and its publish attempt.
 */
@Service
@Slf4j
public class PublishOrchestrator {

    static final String UNCONFIRMED_REASON = "Not confirmed after manual verification";

    private final WorkItemRepository workItemRepository;
    private final PublishAttemptRepository publishAttemptRepository;
    private final GroupLeaseManager leaseManager;
    private final PublishClient publishClient;
    private final ProgressAggregator progressAggregator;
    private final TrackRegistry trackRegistry;
    private final RateLimiter publishRateLimiter;
    private final Duration timeout;

    public PublishOrchestrator(WorkItemRepository workItemRepository,
                               PublishAttemptRepository publishAttemptRepository,
                               GroupLeaseManager leaseManager,
                               PublishClient publishClient,
                               ProgressAggregator progressAggregator,
                               TrackRegistry trackRegistry,
                               @Qualifier(PublishConfig.PUBLISH_RATE_LIMITER) RateLimiter publishRateLimiter,
                               PublishProperties properties) {
        this.workItemRepository = workItemRepository;
        this.publishAttemptRepository = publishAttemptRepository;
        this.leaseManager = leaseManager;
        this.publishClient = publishClient;
        this.progressAggregator = progressAggregator;
        this.trackRegistry = trackRegistry;
        this.publishRateLimiter = publishRateLimiter;
        this.timeout = Duration.ofMillis(properties.getTimeoutMs());
    }

    /**
     * Publish a group from a roll-up snapshot. The snapshot's status is checked first; the decision is then repeated
     * on fresh data under the lease.
     */
    public PublishResult publish(GroupProgress group) {
        if (!group.publishEligible()) {
            log.info("Publish rejected for {}: status {}", group.ref().key(), group.resolvedStatus());
            return PublishResult.rejected(group.ref(), PublishResult.Rejection.NOT_ELIGIBLE,
                    "Resolved status " + group.resolvedStatus() + " is not publishable");
        }
        return publish(group.ref());
    }

    public PublishResult publish(GroupRef ref) {
        Optional<GroupLeaseManager.Lease> lease = leaseManager.tryAcquire(ref);
        if (lease.isEmpty()) {
            log.warn("Publish rejected for {}: lease held by another caller", ref.key());
            return PublishResult.rejected(ref, PublishResult.Rejection.LEASE_HELD, "Publish already in progress");
        }
        try {
            return publishUnderLease(ref);
        } finally {
            leaseManager.release(lease.get());
        }
    }

    /**
     * Manual verification of an UNCERTAIN attempt. confirmedPublished=true moves members to PUBLISHED, false to
     * PUBLISH_FAILED so the group can be published again.
     */
    public PublishResult resolveUncertain(GroupRef ref, boolean confirmedPublished, String reason) {
        GroupLeaseManager.Lease lease = leaseManager.tryAcquire(ref)
                .orElseThrow(() -> new PublishStateException("LEASE_HELD", "Publish in progress for " + ref.key()));
        try {
            PublishAttempt attempt = publishAttemptRepository.findById(ref.key())
                    .filter(a -> a.getState() == PublishAttempt.AttemptState.UNCERTAIN)
                    .orElseThrow(() -> new PublishStateException("NO_UNCERTAIN_ATTEMPT",
                            "No uncertain publish attempt for " + ref.key()));
            List<String> ids = memberIds(workItemRepository.findByTrackIdAndGroupKey(ref.trackId(), ref.groupKey()));
            if (confirmedPublished) {
                markPublished(attempt, ids);
                return PublishResult.published(ref, ids.size());
            }
            String failureReason = reason != null && !reason.isBlank() ? reason : UNCONFIRMED_REASON;
            markFailed(attempt, ids, failureReason);
            return PublishResult.failed(ref, ids.size(), failureReason);
        } finally {
            leaseManager.release(lease);
        }
    }

    private PublishResult publishUnderLease(GroupRef ref) {
        PublishAttempt previous = publishAttemptRepository.findById(ref.key()).orElse(null);
        if (previous != null && previous.getState() == PublishAttempt.AttemptState.IN_FLIGHT) {
            // Holder lost its lease mid-call; the external outcome is unknown.
            finishAttempt(previous, PublishAttempt.AttemptState.UNCERTAIN, "Previous attempt never completed");
            log.warn("Publish attempt for {} found IN_FLIGHT without a lease; marked UNCERTAIN", ref.key());
        }
        if (previous != null && previous.getState() == PublishAttempt.AttemptState.UNCERTAIN) {
            return PublishResult.rejected(ref, PublishResult.Rejection.UNCERTAIN_PENDING_VERIFICATION,
                    "Previous attempt outcome unknown; verify before publishing again");
        }

        List<WorkItem> members = workItemRepository.findByTrackIdAndGroupKey(ref.trackId(), ref.groupKey());
        if (members.isEmpty()) {
            return PublishResult.rejected(ref, PublishResult.Rejection.NO_ITEMS, "Group has no work items");
        }
        ProgressReport report = progressAggregator.aggregate(trackRegistry.schemaFor(ref.trackId()), members);
        GroupProgress fresh = report.groups().get(0);
        if (!fresh.publishEligible()) {
            log.info("Publish rejected for {}: current status {}", ref.key(), fresh.resolvedStatus());
            return PublishResult.rejected(ref, PublishResult.Rejection.NOT_ELIGIBLE,
                    "Resolved status " + fresh.resolvedStatus() + " is not publishable");
        }
        if (!publishRateLimiter.acquirePermission()) {
            log.warn("Publish rejected for {}: rate limit", ref.key());
            return PublishResult.rejected(ref, PublishResult.Rejection.RATE_LIMITED, "Publish rate limit exceeded");
        }

        List<String> ids = memberIds(members);
        PublishAttempt attempt = startAttempt(ref, previous, ids.size());
        PublishRequest request = new PublishRequest(ref.trackId(), ref.groupKey(), fresh.publishActionToken(),
                members.stream().map(m -> new PublishRequest.Item(m.getId(), m.getPayload())).toList());
        PublishReceipt receipt;
        try {
            receipt = publishClient.publish(request).timeout(timeout).block();
        } catch (RuntimeException e) {
            return onCallError(ref, attempt, ids, Exceptions.unwrap(e));
        }
        if (receipt == null) {
            return markUncertain(ref, attempt, ids.size(), "Publish returned no acknowledgement");
        }
        // The external side effect happened; a bookkeeping failure from here on propagates and leaves the
        // attempt IN_FLIGHT, which the next caller turns into UNCERTAIN.
        markPublished(attempt, ids);
        log.info("Published {} ({} item(s), reference {})", ref.key(), ids.size(), receipt.reference());
        return PublishResult.published(ref, ids.size());
    }

    private PublishResult onCallError(GroupRef ref, PublishAttempt attempt, List<String> ids, Throwable cause) {
        if (cause instanceof TimeoutException) {
            return markUncertain(ref, attempt, ids.size(), "Publish timed out after " + timeout.toMillis() + "ms");
        }
        if (cause instanceof PublishOutcomeUnknownException) {
            return markUncertain(ref, attempt, ids.size(), cause.getMessage());
        }
        String reason = cause instanceof PublishRejectedException
                ? "Rejected: " + cause.getMessage()
                : "Transport error: " + cause.getMessage();
        markFailed(attempt, ids, reason);
        log.warn("Publish failed for {}: {}", ref.key(), reason);
        return PublishResult.failed(ref, ids.size(), reason);
    }

    private PublishAttempt startAttempt(GroupRef ref, PublishAttempt previous, int itemCount) {
        PublishAttempt attempt = previous != null ? previous : new PublishAttempt();
        attempt.setId(ref.key());
        attempt.setTrackId(ref.trackId());
        attempt.setGroupKey(ref.groupKey());
        attempt.setState(PublishAttempt.AttemptState.IN_FLIGHT);
        attempt.setItemCount(itemCount);
        attempt.setAttemptCount(attempt.getAttemptCount() + 1);
        attempt.setReason(null);
        attempt.setStartedAt(Instant.now());
        attempt.setFinishedAt(null);
        return publishAttemptRepository.save(attempt);
    }

    private void finishAttempt(PublishAttempt attempt, PublishAttempt.AttemptState state, String reason) {
        attempt.setState(state);
        attempt.setReason(reason);
        attempt.setFinishedAt(Instant.now());
        publishAttemptRepository.save(attempt);
    }

    private void markPublished(PublishAttempt attempt, List<String> ids) {
        workItemRepository.updateStatus(ids, WorkItemStatus.PUBLISHED, Instant.now(), null);
        finishAttempt(attempt, PublishAttempt.AttemptState.SUCCEEDED, null);
    }

    private void markFailed(PublishAttempt attempt, List<String> ids, String reason) {
        workItemRepository.updateStatus(ids, WorkItemStatus.PUBLISH_FAILED, Instant.now(), reason);
        finishAttempt(attempt, PublishAttempt.AttemptState.FAILED, reason);
    }

    private PublishResult markUncertain(GroupRef ref, PublishAttempt attempt, int itemCount, String reason) {
        finishAttempt(attempt, PublishAttempt.AttemptState.UNCERTAIN, reason);
        log.warn("Publish outcome uncertain for {}: {}. Manual verification required", ref.key(), reason);
        return PublishResult.uncertain(ref, itemCount, reason);
    }

    private static List<String> memberIds(List<WorkItem> members) {
        return members.stream().map(WorkItem::getId).toList();
    }
}
