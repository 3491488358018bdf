package com.tutorflow.tutorbackend.error;

import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(BillingException.class)
    public ResponseEntity<Map<String, Object>> billing(BillingException ex) {
        ErrorKind kind = ex.getKind();
        if (kind == ErrorKind.EXTERNAL_PROVIDER) {
            log.error("Payment provider failure: {}", ex.getMessage());
        } else {
            log.warn("Rejected request [{}]: {}", ex.getError(), ex.getMessage());
        }
        return ResponseEntity.status(kind.getStatus()).body(Map.of(
                "status", "error",
                "reason", ex.getError().name().toLowerCase(),
                "kind", kind.name(),
                "message", ex.getMessage() == null ? ex.getError().name() : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "bad_request",
                "kind", ErrorKind.VALIDATION.name(),
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "bad_request",
                "kind", ErrorKind.VALIDATION.name(),
                "message", "malformed_body",
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
                "reason", "validation_error",
                "kind", ErrorKind.VALIDATION.name(),
                "message", "invalid_request",
                "fields", fields,
                "ts", Instant.now().toString()
        ));
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> validation(ConstraintViolationException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(Map.of(
                "status", "error",
                "reason", "validation_error",
                "kind", ErrorKind.VALIDATION.name(),
                "message", ex.getMessage() == null ? "invalid_request" : ex.getMessage(),
                "ts", Instant.now().toString()
        ));
    }
}
