package com.campus.portal.error;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(PortalException.class)
    public ResponseEntity<Map<String, Object>> portal(PortalException ex) {
        log.debug("portal error {}: {}", ex.code(), ex.getMessage());
        return ResponseEntity.status(ex.code().status()).body(Map.of(
                "status", "error",
                "reason", ex.code().code(),
                "message", ex.getMessage() == null ? ex.code().code() : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> denied(PermissionDeniedException ex) {
        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of(
                "status", "error",
                "reason", ex.reason(),
                "action", ex.action().name(),
                "message", "permission denied",
                "ts", Instant.now().toString()
        ));
    }

    /** A unique constraint caught a race the service-level check could not see, e.g. two identical club names at once. */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<Map<String, Object>> integrity(DataIntegrityViolationException ex) {
        log.warn("constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return conflict(ErrorCode.CONSTRAINT_CONFLICT, "conflicting data, reload and retry");
    }

    @ExceptionHandler({PessimisticLockingFailureException.class, OptimisticLockingFailureException.class})
    public ResponseEntity<Map<String, Object>> concurrent(DataAccessException ex) {
        log.warn("concurrent update: {}", ex.getMessage());
        return conflict(ErrorCode.CONCURRENT_UPDATE, "resource was changed concurrently, retry");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "bad_request",
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> unreadable(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", ErrorCode.VALIDATION_ERROR.code(),
                "message", "malformed_request",
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> validation(MethodArgumentNotValidException ex) {
        Map<String, String> fields = new HashMap<>();
        for (FieldError fe : ex.getBindingResult().getFieldErrors()) {
            fields.put(fe.getField(), fe.getDefaultMessage() == null ? "invalid" : fe.getDefaultMessage());
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", ErrorCode.VALIDATION_ERROR.code(),
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", ErrorCode.VALIDATION_ERROR.code(),
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    private ResponseEntity<Map<String, Object>> conflict(ErrorCode code, String message) {
        return ResponseEntity.status(code.status()).body(Map.of(
                "status", "error",
                "reason", code.code(),
                "message", message,
                "ts", Instant.now().toString()
        ));
    }
}
