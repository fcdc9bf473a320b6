package com.teamA.cra.api.web;

import com.teamA.cra.common.lock.LockAcquisitionException;
import com.teamA.cra.common.request.RequestConflictException;
import com.teamA.cra.common.request.RequestNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * 예외 -> {error, message}
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RequestNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(RequestNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(RequestConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(RequestConflictException e) {
        return error(HttpStatus.CONFLICT, "conflict", e.getMessage());
    }

    @ExceptionHandler(LockAcquisitionException.class)
    public ResponseEntity<Map<String, Object>> handleLock(LockAcquisitionException e) {
        log.warn("[LOCK TIMEOUT] {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "lock_timeout", "Another save is in progress, retry");
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        String message = e.getMessage();
        if (e instanceof MethodArgumentNotValidException invalid) {
            FieldError field = invalid.getBindingResult().getFieldError();
            message = field == null ? "Invalid request" : field.getField() + " is required";
        } else if (e instanceof HttpMessageNotReadableException) {
            message = "Malformed request body";
        }
        return error(HttpStatus.BAD_REQUEST, "bad_request", message);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("[API ERROR] unhandled", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Internal server error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of("error", error, "message", message == null ? "" : message));
    }
}
