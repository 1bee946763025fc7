package com.reviewtrack.api.controller;

import com.reviewtrack.api.dto.ErrorBody;
import com.reviewtrack.api.dto.PublishActionRequest;
import com.reviewtrack.api.dto.PublishActionResponse;
import com.reviewtrack.api.dto.ResolveUncertainRequest;
import com.reviewtrack.domain.GroupRef;
import com.reviewtrack.progress.engine.PublishActionToken;
import com.reviewtrack.publish.PublishOrchestrator;
import com.reviewtrack.publish.PublishResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

/**
 * Human-triggered publish actions. A publish runs synchronously; REJECTED maps to 409, every executed outcome to 200.
 */
@RestController
@RequestMapping("/api/v1/publish")
@RequiredArgsConstructor
public class PublishController {

    private final PublishOrchestrator publishOrchestrator;

    @PostMapping
    public ResponseEntity<?> publish(@Valid @RequestBody PublishActionRequest request) {
        Optional<GroupRef> ref = PublishActionToken.parse(request.publishAction());
        if (ref.isEmpty()) {
            return invalidToken();
        }
        PublishResult result = publishOrchestrator.publish(ref.get());
        HttpStatus status = result.outcome() == PublishResult.Outcome.REJECTED ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(toResponse(result));
    }

    @PostMapping("/resolve")
    public ResponseEntity<?> resolveUncertain(@Valid @RequestBody ResolveUncertainRequest request) {
        Optional<GroupRef> ref = PublishActionToken.parse(request.publishAction());
        if (ref.isEmpty()) {
            return invalidToken();
        }
        PublishResult result = publishOrchestrator.resolveUncertain(ref.get(), request.confirmedPublished(), request.reason());
        return ResponseEntity.ok(toResponse(result));
    }

    private static ResponseEntity<ErrorBody> invalidToken() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PUBLISH_ACTION", "Malformed publish-action token"));
    }

    private static PublishActionResponse toResponse(PublishResult result) {
        return new PublishActionResponse(
                result.group().trackId(),
                result.group().groupKey(),
                result.outcome().name(),
                result.rejection() != null ? result.rejection().name() : null,
                result.itemCount(),
                result.reason());
    }
}
