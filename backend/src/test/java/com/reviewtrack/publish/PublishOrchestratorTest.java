package com.reviewtrack.publish;

import com.reviewtrack.domain.GroupRef;
import com.reviewtrack.domain.PublishAttempt;
import com.reviewtrack.domain.PublishAttemptRepository;
import com.reviewtrack.domain.WorkItem;
import com.reviewtrack.domain.WorkItemRepository;
import com.reviewtrack.domain.WorkItemStatus;
import com.reviewtrack.progress.engine.GroupProgress;
import com.reviewtrack.progress.engine.ProgressAggregator;
import com.reviewtrack.track.TrackRegistry;
import com.reviewtrack.track.TrackSchema;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PublishOrchestratorTest {

    private static final TrackSchema SCHEMA = new TrackSchema(7, "legal", List.of("text", "domain"), List.of("domain"), "text");
    private static final GroupRef REF = new GroupRef(7, List.of("tax"));
    private static final GroupLeaseManager.Lease LEASE =
            new GroupLeaseManager.Lease(REF.key(), "holder-1", Instant.parse("2030-01-01T00:00:00Z"));

    @Mock
    WorkItemRepository workItemRepository;
    @Mock
    PublishAttemptRepository publishAttemptRepository;
    @Mock
    GroupLeaseManager leaseManager;
    @Mock
    PublishClient publishClient;
    @Mock
    TrackRegistry trackRegistry;
    @Mock
    RateLimiter rateLimiter;

    private final ProgressAggregator aggregator = new ProgressAggregator();
    private PublishOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        PublishProperties properties = new PublishProperties();
        properties.setTimeoutMs(200);
        orchestrator = new PublishOrchestrator(workItemRepository, publishAttemptRepository, leaseManager,
                publishClient, aggregator, trackRegistry, rateLimiter, properties);
    }

    @Test
    @DisplayName("ANNOTATED group is rejected without a lease, a client call or any write")
    void ineligibleSnapshotRejected() {
        GroupProgress annotated = aggregator.aggregate(SCHEMA, List.of(item("1", WorkItemStatus.ANNOTATED))).groups().get(0);

        PublishResult result = orchestrator.publish(annotated);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.REJECTED);
        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.NOT_ELIGIBLE);
        assertThat(result.externalCallMade()).isFalse();
        verifyNoInteractions(leaseManager, publishClient, workItemRepository, publishAttemptRepository);
    }

    @Test
    @DisplayName("accepted publish moves every member to PUBLISHED and records SUCCEEDED")
    void publishSucceeds() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.VALIDATED), item("2", WorkItemStatus.VALIDATED)));
        stubAttemptSave();
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(publishClient.publish(any())).thenReturn(Mono.just(new PublishReceipt("ref-1")));

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.PUBLISHED);
        assertThat(result.itemCount()).isEqualTo(2);
        verify(workItemRepository).updateStatus(eq(List.of("1", "2")), eq(WorkItemStatus.PUBLISHED), any(), isNull());
        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        verify(publishClient).publish(request.capture());
        assertThat(request.getValue().publishActionToken()).isEqualTo("publishaction;tax;7");
        assertThat(request.getValue().items()).extracting(PublishRequest.Item::id).containsExactly("1", "2");
        assertThat(lastSavedAttempt().getState()).isEqualTo(PublishAttempt.AttemptState.SUCCEEDED);
        assertThat(lastSavedAttempt().getAttemptCount()).isEqualTo(1);
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("bookkeeping failure after an accepted publish propagates and never marks members PUBLISH_FAILED")
    void bookkeepingFailureAfterSuccess() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.VALIDATED)));
        when(publishAttemptRepository.save(any(PublishAttempt.class)))
                .thenAnswer(inv -> inv.getArgument(0))
                .thenThrow(new DataAccessResourceFailureException("connection reset"));
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(publishClient.publish(any())).thenReturn(Mono.just(new PublishReceipt("ref-1")));

        assertThatThrownBy(() -> orchestrator.publish(REF))
                .isInstanceOf(DataAccessResourceFailureException.class);

        verify(workItemRepository).updateStatus(eq(List.of("1")), eq(WorkItemStatus.PUBLISHED), any(), isNull());
        verify(workItemRepository, never()).updateStatus(anyList(), eq(WorkItemStatus.PUBLISH_FAILED), any(), any());
        verify(publishClient).publish(any());
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("explicit rejection moves members to PUBLISH_FAILED with the collaborator's reason")
    void publishRejectedByCollaborator() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.VALIDATED)));
        stubAttemptSave();
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(publishClient.publish(any())).thenReturn(Mono.error(new PublishRejectedException("glossary mismatch")));

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.FAILED);
        assertThat(result.reason()).isEqualTo("Rejected: glossary mismatch");
        verify(workItemRepository).updateStatus(eq(List.of("1")), eq(WorkItemStatus.PUBLISH_FAILED), any(),
                eq("Rejected: glossary mismatch"));
        assertThat(lastSavedAttempt().getState()).isEqualTo(PublishAttempt.AttemptState.FAILED);
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("transport error marks members PUBLISH_FAILED")
    void transportError() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.PUBLISH_FAILED)));
        stubAttemptSave();
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(publishClient.publish(any()))
                .thenReturn(Mono.error(new PublishTransportException("connection refused", null)));

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.FAILED);
        assertThat(result.reason()).startsWith("Transport error:");
        verify(workItemRepository).updateStatus(eq(List.of("1")), eq(WorkItemStatus.PUBLISH_FAILED), any(),
                eq("Transport error: connection refused"));
    }

    @Test
    @DisplayName("timeout leaves members untouched and records the attempt as UNCERTAIN")
    void timeoutIsUncertain() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.VALIDATED)));
        stubAttemptSave();
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(publishClient.publish(any())).thenReturn(Mono.never());

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.UNCERTAIN);
        assertThat(result.reason()).contains("timed out");
        verify(workItemRepository, never()).updateStatus(anyList(), any(), any(), any());
        assertThat(lastSavedAttempt().getState()).isEqualTo(PublishAttempt.AttemptState.UNCERTAIN);
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("gateway timeout from the collaborator is an unknown outcome")
    void outcomeUnknownIsUncertain() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.VALIDATED)));
        stubAttemptSave();
        when(rateLimiter.acquirePermission()).thenReturn(true);
        when(publishClient.publish(any()))
                .thenReturn(Mono.error(new PublishOutcomeUnknownException("Gateway timeout from publish collaborator", null)));

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.UNCERTAIN);
        verify(workItemRepository, never()).updateStatus(anyList(), any(), any(), any());
    }

    @Test
    @DisplayName("second caller is rejected with LEASE_HELD while a publish is in progress")
    void leaseHeld() {
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.empty());

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.LEASE_HELD);
        verifyNoInteractions(publishClient, workItemRepository);
        verify(leaseManager, never()).release(any());
    }

    @Test
    @DisplayName("stale snapshot: group re-resolved under the lease is no longer eligible")
    void staleSnapshotRejected() {
        GroupProgress validated = aggregator.aggregate(SCHEMA, List.of(item("1", WorkItemStatus.VALIDATED))).groups().get(0);
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.PUBLISHED)));

        PublishResult result = orchestrator.publish(validated);

        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.NOT_ELIGIBLE);
        verifyNoInteractions(publishClient, rateLimiter);
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("UNCERTAIN attempt blocks a new publish until verified")
    void uncertainBlocksRepublish() {
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.of(LEASE));
        when(publishAttemptRepository.findById(REF.key())).thenReturn(Optional.of(attempt(PublishAttempt.AttemptState.UNCERTAIN)));

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.UNCERTAIN_PENDING_VERIFICATION);
        verifyNoInteractions(publishClient, workItemRepository);
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("IN_FLIGHT attempt found without a lease is marked UNCERTAIN and blocks the publish")
    void abandonedInFlightBecomesUncertain() {
        PublishAttempt inFlight = attempt(PublishAttempt.AttemptState.IN_FLIGHT);
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.of(LEASE));
        when(publishAttemptRepository.findById(REF.key())).thenReturn(Optional.of(inFlight));

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.UNCERTAIN_PENDING_VERIFICATION);
        assertThat(inFlight.getState()).isEqualTo(PublishAttempt.AttemptState.UNCERTAIN);
        verify(publishAttemptRepository).save(inFlight);
        verifyNoInteractions(publishClient);
    }

    @Test
    @DisplayName("no rate-limiter permit: rejected before any attempt is recorded")
    void rateLimited() {
        stubLeaseAndMembers(List.of(item("1", WorkItemStatus.VALIDATED)));
        when(rateLimiter.acquirePermission()).thenReturn(false);

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.RATE_LIMITED);
        verifyNoInteractions(publishClient);
        verify(publishAttemptRepository, never()).save(any());
    }

    @Test
    @DisplayName("group with no members is rejected with NO_ITEMS")
    void noItems() {
        stubLeaseAndMembers(List.of());

        PublishResult result = orchestrator.publish(REF);

        assertThat(result.rejection()).isEqualTo(PublishResult.Rejection.NO_ITEMS);
        verifyNoInteractions(publishClient);
    }

    @Test
    @DisplayName("resolveUncertain(confirmed) moves members to PUBLISHED")
    void resolveConfirmed() {
        PublishAttempt uncertain = attempt(PublishAttempt.AttemptState.UNCERTAIN);
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.of(LEASE));
        when(publishAttemptRepository.findById(REF.key())).thenReturn(Optional.of(uncertain));
        when(workItemRepository.findByTrackIdAndGroupKey(7, List.of("tax"))).thenReturn(List.of(item("1", WorkItemStatus.VALIDATED)));

        PublishResult result = orchestrator.resolveUncertain(REF, true, null);

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.PUBLISHED);
        verify(workItemRepository).updateStatus(eq(List.of("1")), eq(WorkItemStatus.PUBLISHED), any(), isNull());
        assertThat(uncertain.getState()).isEqualTo(PublishAttempt.AttemptState.SUCCEEDED);
        verify(leaseManager).release(LEASE);
    }

    @Test
    @DisplayName("resolveUncertain(not confirmed) moves members to PUBLISH_FAILED with a default reason")
    void resolveNotConfirmed() {
        PublishAttempt uncertain = attempt(PublishAttempt.AttemptState.UNCERTAIN);
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.of(LEASE));
        when(publishAttemptRepository.findById(REF.key())).thenReturn(Optional.of(uncertain));
        when(workItemRepository.findByTrackIdAndGroupKey(7, List.of("tax"))).thenReturn(List.of(item("1", WorkItemStatus.VALIDATED)));

        PublishResult result = orchestrator.resolveUncertain(REF, false, " ");

        assertThat(result.outcome()).isEqualTo(PublishResult.Outcome.FAILED);
        assertThat(result.reason()).isEqualTo(PublishOrchestrator.UNCONFIRMED_REASON);
        verify(workItemRepository).updateStatus(eq(List.of("1")), eq(WorkItemStatus.PUBLISH_FAILED), any(),
                eq(PublishOrchestrator.UNCONFIRMED_REASON));
        assertThat(uncertain.getState()).isEqualTo(PublishAttempt.AttemptState.FAILED);
    }

    @Test
    @DisplayName("resolveUncertain without an UNCERTAIN attempt throws NO_UNCERTAIN_ATTEMPT and releases the lease")
    void resolveWithoutUncertain() {
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.of(LEASE));
        when(publishAttemptRepository.findById(REF.key())).thenReturn(Optional.of(attempt(PublishAttempt.AttemptState.SUCCEEDED)));

        assertThatThrownBy(() -> orchestrator.resolveUncertain(REF, true, null))
                .isInstanceOf(PublishStateException.class)
                .extracting("errorCode").isEqualTo("NO_UNCERTAIN_ATTEMPT");
        verify(leaseManager).release(LEASE);
        verifyNoInteractions(workItemRepository);
    }

    private void stubLeaseAndMembers(List<WorkItem> members) {
        when(leaseManager.tryAcquire(REF)).thenReturn(Optional.of(LEASE));
        when(publishAttemptRepository.findById(REF.key())).thenReturn(Optional.empty());
        when(workItemRepository.findByTrackIdAndGroupKey(7, List.of("tax"))).thenReturn(members);
        if (!members.isEmpty()) {
            when(trackRegistry.schemaFor(7)).thenReturn(SCHEMA);
        }
    }

    private void stubAttemptSave() {
        when(publishAttemptRepository.save(any(PublishAttempt.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private PublishAttempt lastSavedAttempt() {
        ArgumentCaptor<PublishAttempt> captor = ArgumentCaptor.forClass(PublishAttempt.class);
        verify(publishAttemptRepository, atLeastOnce()).save(captor.capture());
        return captor.getValue();
    }

    private static PublishAttempt attempt(PublishAttempt.AttemptState state) {
        PublishAttempt attempt = new PublishAttempt();
        attempt.setId(REF.key());
        attempt.setTrackId(7);
        attempt.setGroupKey(List.of("tax"));
        attempt.setState(state);
        attempt.setAttemptCount(1);
        return attempt;
    }

    static WorkItem item(String id, WorkItemStatus status) {
        WorkItem item = new WorkItem();
        item.setId(id);
        item.setTrackId(7);
        item.setGroupKey(List.of("tax"));
        item.setStatus(status);
        Map<String, Object> payload = new HashMap<>();
        payload.put("text", "one two three");
        payload.put("domain", "tax");
        item.setPayload(payload);
        return item;
    }
}
