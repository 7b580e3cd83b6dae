package com.argus.app.web;

import com.argus.activity.provider.ActivityProviderException;
import com.argus.activity.provider.ActivityWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps activity failures to {@code {"error": code, "message": text}} responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ActivityWriteException.class)
    public ResponseEntity<Map<String, Object>> handleWriteFailure(ActivityWriteException e) {
        log.warn("Activity write failed ({}): {}", e.getOperation(), e.getMessage());
        Map<String, Object> body = body("write_failed", e.getMessage());
        body.put("operation", e.getOperation());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }

    @ExceptionHandler(ActivityProviderException.class)
    public ResponseEntity<Map<String, Object>> handleProviderFailure(ActivityProviderException e) {
        log.warn("Activity provider failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body("provider_failed", e.getMessage()));
    }

    @ExceptionHandler(NoCurrentSessionException.class)
    public ResponseEntity<Map<String, Object>> handleNoCurrentSession(NoCurrentSessionException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(body("no_current_session", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(body("invalid_argument", e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(body("invalid_body", e.getMostSpecificCause().getMessage()));
    }

    private static Map<String, Object> body(String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        return body;
    }
}
