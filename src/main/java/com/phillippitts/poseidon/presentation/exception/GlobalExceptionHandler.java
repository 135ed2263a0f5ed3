package com.phillippitts.poseidon.presentation.exception;

import com.phillippitts.poseidon.exception.SessionNotActiveException;
import com.phillippitts.poseidon.service.conversation.ConversationReply;
import com.phillippitts.poseidon.service.conversation.ConversationReply.Outcome;
import com.phillippitts.poseidon.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    static final String NOT_ACTIVE_REFUSAL = "No active surf request. Send /surf first, then the screenshot.";

    /**
     * Session state violation - fixed refusal reply (HTTP 409).
     */
    @ExceptionHandler(SessionNotActiveException.class)
    ResponseEntity<ConversationReply> handleSessionNotActive(SessionNotActiveException ex) {
        LOG.info("Image refused, session not active: conversation={}",
                LogSanitizer.singleLine(ex.getConversationId(), 64));
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(ConversationReply.of(Outcome.NOT_ACTIVE, NOT_ACTIVE_REFUSAL));
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler({
        IllegalArgumentException.class,
        MethodArgumentNotValidException.class,
        MissingServletRequestPartException.class
    })
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
