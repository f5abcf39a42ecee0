package com.anchorinsights.metrics.exception;

import com.anchorinsights.common.exception.ApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Maps failures to {@code {"error": "..."}} bodies.
 *
 * <p>Only {@link ApiException} messages reach the client verbatim. Anything else is
 * logged with its stack trace and answered with a generic 500 message.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERIC_ERROR = "Internal server error";

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<Map<String, String>> handleApiException(ApiException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case NOT_FOUND      -> HttpStatus.NOT_FOUND;
            case BAD_REQUEST    -> HttpStatus.BAD_REQUEST;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) {
            log.error("Request failed. kind={} message={}", ex.getKind(), ex.getMessage(), ex);
        } else {
            log.warn("Request rejected. kind={} message={}", ex.getKind(), ex.getMessage());
        }
        return body(status, ex.getMessage());
    }

    // Covers ServerWebInputException (bad query parameter types) and explicit status errors.
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<Map<String, String>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        String reason = ex.getReason() != null ? ex.getReason() : "Request failed";
        log.warn("Request rejected. status={} reason={}", status.value(), reason);
        return body(status, reason);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_ERROR);
    }

    private static ResponseEntity<Map<String, String>> body(HttpStatusCode status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message));
    }
}
