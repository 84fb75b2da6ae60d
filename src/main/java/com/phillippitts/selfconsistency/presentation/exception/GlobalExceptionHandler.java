package com.phillippitts.selfconsistency.presentation.exception;

import com.phillippitts.selfconsistency.exception.AggregationException;
import com.phillippitts.selfconsistency.exception.AggregationTimeoutException;
import com.phillippitts.selfconsistency.exception.DocumentExtractionException;
import com.phillippitts.selfconsistency.exception.ProviderException;
import com.phillippitts.selfconsistency.exception.ValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts engine exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping model backend details away from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - request out of bounds (HTTP 400).
     */
    @ExceptionHandler(ValidationException.class)
    ResponseEntity<ApiError> handleValidation(ValidationException ex) {
        LOG.warn("Invalid request: field={}, reason={}", ex.getField(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    /**
     * Client error - unreadable document (HTTP 400).
     */
    @ExceptionHandler(DocumentExtractionException.class)
    ResponseEntity<ApiError> handleDocument(DocumentExtractionException ex) {
        LOG.warn("Document extraction failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Document could not be processed",
                ex.getMessage());
    }

    /**
     * Deadline expired before enough samples completed (HTTP 504).
     */
    @ExceptionHandler(AggregationTimeoutException.class)
    ResponseEntity<ApiError> handleTimeout(AggregationTimeoutException ex) {
        LOG.error("Aggregation timed out: obtained={}, required={}", ex.getObtained(), ex.getRequired());
        return error(HttpStatus.GATEWAY_TIMEOUT, ex.getClass().getSimpleName(), "Reasoning timed out",
                "Completed " + ex.getObtained() + " of the " + ex.getRequired() + " required reasoning paths within "
                        + ex.getDeadlineMs() + " ms");
    }

    /**
     * Model backend could not produce enough samples (HTTP 502).
     */
    @ExceptionHandler(AggregationException.class)
    ResponseEntity<ApiError> handleAggregation(AggregationException ex) {
        LOG.error("Aggregation failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(), "Reasoning backend unavailable",
                "Obtained " + ex.getObtained() + " of " + ex.getRequested() + " reasoning paths. Please retry.");
    }

    /**
     * Backend failure outside the fan-out (HTTP 502).
     */
    @ExceptionHandler(ProviderException.class)
    ResponseEntity<ApiError> handleProvider(ProviderException ex) {
        LOG.error("Provider failure: model={}", ex.getModel(), ex);
        return error(HttpStatus.BAD_GATEWAY, ex.getClass().getSimpleName(), "Reasoning backend unavailable",
                "Please retry in a few seconds");
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class,
            MethodArgumentTypeMismatchException.class
    })
    ResponseEntity<ApiError> handleMalformedRequest(Exception ex) {
        LOG.warn("Malformed request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Malformed request",
                ex instanceof HttpMessageNotReadableException ? "Request body is not valid JSON" : ex.getMessage());
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    ResponseEntity<ApiError> handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "UnsupportedMediaType", "Unsupported content type",
                ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    ResponseEntity<ApiError> handleMethod(HttpRequestMethodNotSupportedException ex) {
        return error(HttpStatus.METHOD_NOT_ALLOWED, "MethodNotAllowed", "Method not allowed", ex.getMessage());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleUploadSize(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload too large: {}", ex.getMessage());
        return error(HttpStatus.PAYLOAD_TOO_LARGE, "PayloadTooLarge", "Uploaded file too large", ex.getMessage());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    ResponseEntity<ApiError> handleNotFound(NoResourceFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "NotFound", "No such endpoint", ex.getResourcePath());
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError", "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
