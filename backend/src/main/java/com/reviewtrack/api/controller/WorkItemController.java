package com.reviewtrack.api.controller;

import com.reviewtrack.api.dto.TransitionRequest;
import com.reviewtrack.api.dto.TransitionResponse;
import com.reviewtrack.transition.TransitionResult;
import com.reviewtrack.transition.WorkItemTransitionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * POST /items/annotate, POST /items/validate.
 */
@RestController
@RequestMapping("/api/v1/items")
@RequiredArgsConstructor
public class WorkItemController {

    private final WorkItemTransitionService workItemTransitionService;

    @PostMapping("/annotate")
    public ResponseEntity<TransitionResponse> annotate(@Valid @RequestBody TransitionRequest request) {
        return ResponseEntity.ok(toResponse(workItemTransitionService.annotate(request.ids(), request.actorId())));
    }

    @PostMapping("/validate")
    public ResponseEntity<TransitionResponse> validate(@Valid @RequestBody TransitionRequest request) {
        return ResponseEntity.ok(toResponse(workItemTransitionService.validate(request.ids(), request.actorId())));
    }

    private static TransitionResponse toResponse(TransitionResult result) {
        return new TransitionResponse(result.requested(), result.transitioned(), result.skippedIds());
    }
}
