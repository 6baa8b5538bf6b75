package com.autodev.coordinator.api;

import com.autodev.coordinator.service.CoordinationException;
import com.autodev.coordinator.service.LockConflictException;
import com.autodev.coordinator.service.NoProviderAvailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps coordination failures to HTTP statuses with a small JSON body:
 * {"error": KIND, "message": ..., plus holder/expiresAt or earliestReset}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(CoordinationException.class)
    public ResponseEntity<Map<String, Object>> coordination(CoordinationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error",   e.getKind().name());
        body.put("message", e.getMessage());
        if (e instanceof LockConflictException conflict) {
            body.put("holder",    conflict.getHolder());
            body.put("expiresAt", conflict.getExpiresAt());
        }
        if (e instanceof NoProviderAvailableException none) {
            body.put("earliestReset", none.getEarliestReset());
        }
        log.info("Request rejected: {}", e.getMessage());
        return ResponseEntity.status(statusFor(e.getKind())).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "BAD_REQUEST", "message", e.getMessage()));
    }

    // Two creates racing on the same dedup key: the unique index rejects the loser.
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> conflict(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("error", "CONFLICT", "message", "request conflicts with existing data"));
    }

    static HttpStatus statusFor(CoordinationException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND             -> HttpStatus.NOT_FOUND;
            case NOT_OWNER,
                 INVALID_TRANSITION,
                 DUPLICATE_VOTE,
                 ALREADY_RESOLVED      -> HttpStatus.CONFLICT;
            case LOCK_CONFLICT         -> HttpStatus.LOCKED;
            case NO_PROVIDER_AVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
