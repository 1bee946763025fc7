package com.reviewtrack.transition;

import com.reviewtrack.domain.WorkItem;
import com.reviewtrack.domain.WorkItemRepository;
import com.reviewtrack.domain.WorkItemStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Annotation and validation transitions. Items outside the allowed source statuses are skipped, never forced.
 * The database update repeats the status condition, so a concurrent transition cannot be overwritten.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkItemTransitionService {

    static final Set<WorkItemStatus> ANNOTATABLE = EnumSet.of(WorkItemStatus.PENDING, WorkItemStatus.LOADED);
    static final Set<WorkItemStatus> VALIDATABLE = EnumSet.of(WorkItemStatus.ANNOTATED);

    private final WorkItemRepository workItemRepository;

    /** PENDING / LOADED → ANNOTATED, stamps annotatedAt and annotatorId. */
    public TransitionResult annotate(List<String> ids, String annotatorId) {
        return transition(ids, ANNOTATABLE, WorkItemStatus.ANNOTATED, "annotatorId", annotatorId);
    }

    /** ANNOTATED → VALIDATED, stamps validatedAt and validatorId. */
    public TransitionResult validate(List<String> ids, String validatorId) {
        return transition(ids, VALIDATABLE, WorkItemStatus.VALIDATED, "validatorId", validatorId);
    }

    private TransitionResult transition(List<String> ids, Set<WorkItemStatus> from, WorkItemStatus to,
                                        String actorField, String actorId) {
        if (ids == null || ids.isEmpty()) {
            throw new TransitionException("EMPTY_REQUEST", "No work item ids given");
        }
        if (actorId == null || actorId.isBlank()) {
            throw new TransitionException("MISSING_ACTOR", actorField + " is required");
        }
        Set<String> requested = new LinkedHashSet<>(ids);
        Set<String> eligible = new LinkedHashSet<>();
        for (WorkItem item : workItemRepository.findAllById(requested)) {
            if (item.getStatus() != null && from.contains(item.getStatus())) {
                eligible.add(item.getId());
            }
        }
        long transitioned = workItemRepository.transition(eligible, from, to, Instant.now(), actorField, actorId);
        List<String> skipped = requested.stream().filter(id -> !eligible.contains(id)).toList();
        if (!skipped.isEmpty()) {
            log.info("{} transition skipped {} item(s) not in {}", to, skipped.size(), from);
        }
        log.debug("{} transition by {}: {} of {} item(s)", to, actorId, transitioned, requested.size());
        return new TransitionResult(requested.size(), transitioned, skipped);
    }
}
