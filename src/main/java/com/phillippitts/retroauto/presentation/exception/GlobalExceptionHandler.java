package com.phillippitts.retroauto.presentation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.retroauto.exception.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Script errors carry their location; unexpected failures hide internals from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Invalid script (HTTP 400) with the offending line and column.
     */
    @ExceptionHandler(ParseException.class)
    ResponseEntity<ApiError> handleParse(ParseException ex) {
        LOG.warn("Script rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid script",
                ex.getReason(),
                ex.getLine(),
                ex.getColumn(),
                Instant.now()
            ));
    }

    /**
     * A session is already running, or the engine executor is busy (HTTP 409).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleConflict(IllegalStateException ex) {
        LOG.warn("Request conflicts with engine state: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError("EngineBusy", "Engine busy", ex.getMessage(), null, null, Instant.now()));
    }

    /**
     * Client error - invalid rules, breakpoints or request bodies (HTTP 400).
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ex.getClass().getSimpleName(), "Invalid request", ex.getMessage(),
                null, null, Instant.now()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(e -> e.getField() + " " + e.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationFailed", "Invalid request", details, null, null, Instant.now()));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity
            .status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
            .body(new ApiError("UnsupportedMediaType", "Unsupported content type", ex.getMessage(),
                null, null, Instant.now()));
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
                "See server logs with the request ID",
                null,
                null,
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ApiError(
        String errorCode,
        String message,
        String details,
        Integer line,
        Integer column,
        Instant timestamp
    ) {}
}
