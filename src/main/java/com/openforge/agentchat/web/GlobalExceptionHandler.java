package com.openforge.agentchat.web;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps controller exceptions to JSON bodies.
 *
 *   ResponseStatusException          → its status, {"error": reason}
 *   invalid or unreadable body       → 400, {"error": ...}
 *   other Spring MVC errors          → their own status
 *   anything else                    → 500, {"error", "message", "type"}
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException e) {
        HttpStatusCode status = e.getStatusCode();
        return ResponseEntity.status(status).body(Map.of("error", e.getReason() != null ? e.getReason() : status.toString()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalid(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + ": " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(Map.of("error", "Validation failed: " + detail));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "Malformed request body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse framework) {
            // Spring MVC's own 4xx (no handler, wrong method, missing parameter)
            return ResponseEntity.status(framework.getStatusCode())
                    .body(Map.of("error", framework.getBody().getDetail() != null
                            ? framework.getBody().getDetail() : framework.getStatusCode().toString()));
        }
        log.error("[GlobalExceptionHandler] Unhandled exception: {}", e.getMessage(), e);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", "Internal server error");
        body.put("message", "An unexpected error occurred. Please try again later.");
        body.put("type", e.getClass().getSimpleName());
        return ResponseEntity.internalServerError().body(body);
    }
}
