package com.phillippitts.vibedj.presentation.exception;

import com.phillippitts.vibedj.exception.VibeDjException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Maps exceptions thrown by the DJ controls to HTTP responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Bad operator input, e.g. an unknown weight scope (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, ServletRequestBindingException.class,
            TypeMismatchException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Rejected request: {}", ex.getMessage());
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
     * Oracle, catalog or player unavailable (HTTP 503).
     */
    @ExceptionHandler(VibeDjException.class)
    ResponseEntity<ApiError> handleUnavailable(VibeDjException ex) {
        LOG.error("DJ dependency unavailable: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "DJ service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "See server logs",
                Instant.now()
            ));
    }

    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
