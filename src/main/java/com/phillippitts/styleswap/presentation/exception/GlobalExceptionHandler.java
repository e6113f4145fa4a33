package com.phillippitts.styleswap.presentation.exception;

import com.phillippitts.styleswap.exception.ExternalModelException;
import com.phillippitts.styleswap.exception.ImageDecodeException;
import com.phillippitts.styleswap.exception.ModelNotFoundException;
import com.phillippitts.styleswap.exception.ResourceException;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * File paths and model details are logged, never returned to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - unreadable image (HTTP 400).
     */
    @ExceptionHandler(ImageDecodeException.class)
    ResponseEntity<ApiError> handleImageDecode(ImageDecodeException ex) {
        LOG.warn("Image decode failed: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Unreadable image",
                "Upload a PNG, JPEG, BMP or GIF image");
    }

    /**
     * Client error - missing multipart part (HTTP 400).
     */
    @ExceptionHandler(MissingServletRequestPartException.class)
    ResponseEntity<ApiError> handleMissingPart(MissingServletRequestPartException ex) {
        LOG.warn("Missing request part: {}", ex.getRequestPartName());
        return error(HttpStatus.BAD_REQUEST, "MissingRequestPart",
                "Missing image",
                "Both 'content' and 'style' parts are required");
    }

    /**
     * Feature maps could not be combined (HTTP 422).
     */
    @ExceptionHandler(ShapeMismatchException.class)
    ResponseEntity<ApiError> handleShapeMismatch(ShapeMismatchException ex) {
        LOG.error("Shape mismatch: {}", ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex.getClass().getSimpleName(),
                "Images could not be combined",
                "Feature maps of content and style are incompatible");
    }

    /**
     * Configuration/setup error - fail fast on startup, but if encountered at runtime return 503.
     */
    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.error("Model not found at path: {}", ex.getModelPath());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Style transfer service unavailable",
                "Model not loaded. Contact administrator.");
    }

    /**
     * Transient error - retry possible (HTTP 503).
     */
    @ExceptionHandler(ExternalModelException.class)
    ResponseEntity<ApiError> handleExternalModel(ExternalModelException ex) {
        LOG.error("Network failure: network={}", ex.getNetworkName(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Style transfer service temporarily unavailable",
                "Please retry in a few seconds");
    }

    /**
     * Local resource failure (HTTP 500).
     */
    @ExceptionHandler(ResourceException.class)
    ResponseEntity<ApiError> handleResource(ResourceException ex) {
        LOG.error("Resource failure: {}", ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex.getClass().getSimpleName(),
                "Could not produce result",
                "Please retry later");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity
            .status(status)
            .contentType(MediaType.APPLICATION_JSON)
            .body(new ApiError(code, message, details, Instant.now()));
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
