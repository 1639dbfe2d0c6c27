package com.example.mediastore_backend.controller;

import com.example.mediastore_backend.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps storage failures escaping a controller to an HTTP status with a {@code code}/{@code message} body.
 */
@RestControllerAdvice(basePackages = "com.example.mediastore_backend.controller")
public class StorageExceptionAdvice {
    private static final Logger LOGGER = LoggerFactory.getLogger(StorageExceptionAdvice.class);

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, Object>> handleStorage(StorageException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case MALFORMED_PATH, UNSUPPORTED_OPERATION -> HttpStatus.BAD_REQUEST;
            case ALREADY_EXISTS -> HttpStatus.CONFLICT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            LOGGER.error("STORAGE ERROR kind={} message={}", e.getKind(), e.getMessage(), e);
        } else {
            LOGGER.debug("Storage request rejected kind={} message={}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(Map.of(
                "code", "STORAGE_" + e.getKind().name(),
                "message", e.getMessage() == null ? status.getReasonPhrase() : e.getMessage()
        ));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArg(IllegalArgumentException e) {
        String msg = e.getMessage() == null ? "Illegal argument" : e.getMessage();
        return ResponseEntity.badRequest().body(Map.of(
                "code", "BAD_REQUEST",
                "message", msg
        ));
    }
}
