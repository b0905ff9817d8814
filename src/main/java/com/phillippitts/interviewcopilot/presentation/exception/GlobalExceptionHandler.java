package com.phillippitts.interviewcopilot.presentation.exception;

import com.phillippitts.interviewcopilot.exception.SessionLimitExceededException;
import com.phillippitts.interviewcopilot.exception.SessionNotFoundException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps exceptions from the session REST endpoints to {@link ApiError} bodies.
 *
 * WebSocket traffic never reaches this class; protocol and generation failures on a live
 * session travel as {@code error} envelopes instead.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(SessionNotFoundException.class)
    ResponseEntity<ApiError> handleSessionNotFound(SessionNotFoundException ex) {
        LOG.info("Session not found: {}", ex.getSessionId());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Session not found",
                "No open session with id " + ex.getSessionId());
    }

    /** Capacity problem, retry later (HTTP 503). */
    @ExceptionHandler(SessionLimitExceededException.class)
    ResponseEntity<ApiError> handleSessionLimit(SessionLimitExceededException ex) {
        LOG.warn("Session limit reached: limit={}", ex.getLimit());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(), "Too many open sessions",
                "Retry once another session has closed");
    }

    /**
     * Catch-all (HTTP 500). The body names the request id from {@code MdcFilter} so the failure can
     * be found in the server log; the exception text itself stays server-side.
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        String requestId = ThreadContext.get("requestId");
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                requestId == null ? "No request id available" : "Request id " + requestId);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
