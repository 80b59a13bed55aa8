package com.interviewportal.scheduler.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(InterviewPortalException.class)
    public ResponseEntity<Map<String, Object>> handlePortal(InterviewPortalException ex) {
        if (ex.getStatus().is4xxClientError()) {
            log.warn("Rejected request [{}]: {}", ex.getCode(), ex.getMessage());
        }
        return body(ex.getStatus(), ex.getCode(), ex.getMessage(), ex.getDetails());
    }

    @ExceptionHandler(ObjectOptimisticLockingFailureException.class)
    public ResponseEntity<Map<String, Object>> handleConcurrentUpdate(ObjectOptimisticLockingFailureException ex) {
        log.warn("Concurrent modification detected: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "conflict", "Entity was modified concurrently, reload and retry",
                Map.of("reason", "concurrent_update"));
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> handleIntegrity(DataIntegrityViolationException ex) {
        log.warn("Unique key or integrity violation: {}", ex.getMostSpecificCause().getMessage());
        return body(HttpStatus.CONFLICT, "conflict", "Duplicate or inconsistent record",
                Map.of("reason", "duplicate_key"));
    }

    @ExceptionHandler({MissingRequestHeaderException.class, MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleMalformed(Exception ex) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request: " + summarize(ex), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnhandled(Exception ex) {
        log.error("Unhandled exception", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error", Map.of());
    }

    private static String summarize(Exception ex) {
        if (ex instanceof MissingRequestHeaderException missing) {
            return "missing header " + missing.getHeaderName();
        }
        if (ex instanceof MethodArgumentTypeMismatchException mismatch) {
            return "invalid value for " + mismatch.getName();
        }
        return "unreadable body";
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message,
                                                            Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("code", code);
        body.put("details", details);
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
