package com.reviewtrack.api.controller;

import com.reviewtrack.api.dto.ErrorBody;
import com.reviewtrack.publish.PublishStateException;
import com.reviewtrack.transition.TransitionException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps validation failures and service exceptions to ErrorBody (error, message, timestamp).
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(TransitionException.class)
    public ResponseEntity<ErrorBody> handleTransition(TransitionException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(PublishStateException.class)
    public ResponseEntity<ErrorBody> handlePublishState(PublishStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorBody.of(ex.getErrorCode(), ex.getMessage()));
    }
}
