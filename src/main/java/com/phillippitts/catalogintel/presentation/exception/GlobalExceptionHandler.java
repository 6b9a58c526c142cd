package com.phillippitts.catalogintel.presentation.exception;

import com.phillippitts.catalogintel.exception.AdmissionErrorType;
import com.phillippitts.catalogintel.exception.AdmissionException;
import com.phillippitts.catalogintel.exception.StageException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts admission and stage exceptions to HTTP responses with appropriate status codes.
 * Unexpected errors are logged in full but reported to clients without internal details.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Request refused before any processing (429, 413 or 400).
     */
    @ExceptionHandler(AdmissionException.class)
    ResponseEntity<ApiError> handleAdmission(AdmissionException ex) {
        HttpStatus status = statusFor(ex.getErrorType());
        LOG.warn("Admission rejected: type={}, product={}, status={}",
                ex.getErrorType(), ex.getProductId(), status.value());
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getErrorType().wireName(), ex.getMessage(), ex.getProductId(), Instant.now()));
    }

    /**
     * Single-record pipeline failure (HTTP 422).
     */
    @ExceptionHandler(StageException.class)
    ResponseEntity<StageError> handleStage(StageException ex) {
        LOG.warn("Prediction failed: product={}, stage={}, type={}",
                ex.getProductId(), ex.getStage(), ex.getErrorType());
        return ResponseEntity
            .status(HttpStatus.UNPROCESSABLE_ENTITY)
            .body(new StageError(ex.getProductId(), ex.getErrorType().wireName(), ex.getMessage(),
                    ex.getStage().wireName()));
    }

    /**
     * Bean validation failure on the request body (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        LOG.warn("Invalid request body: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("validation_failed", "Request body failed validation", details, Instant.now()));
    }

    /**
     * Unparseable JSON (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("malformed_request", "Request body could not be parsed", null, Instant.now()));
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
                "internal_error",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    static HttpStatus statusFor(AdmissionErrorType type) {
        return switch (type) {
            case RATE_LIMITED -> HttpStatus.TOO_MANY_REQUESTS;
            case BATCH_LIMIT_EXCEEDED, TEXT_LIMIT_EXCEEDED -> HttpStatus.PAYLOAD_TOO_LARGE;
            case DUPLICATE_PRODUCT_ID -> HttpStatus.BAD_REQUEST;
        };
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
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

    /**
     * Body for a record that failed inside the pipeline.
     */
    private record StageError(
        String productId,
        String errorType,
        String message,
        String stage
    ) {}
}
