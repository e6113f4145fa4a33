package com.phillippitts.styleswap.presentation.exception;

import com.phillippitts.styleswap.exception.ExternalModelException;
import com.phillippitts.styleswap.exception.ImageDecodeException;
import com.phillippitts.styleswap.exception.ModelNotFoundException;
import com.phillippitts.styleswap.exception.ResourceException;
import com.phillippitts.styleswap.exception.ShapeMismatchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void imageDecodeReturns400WithoutPath() {
        ImageDecodeException ex = new ImageDecodeException("/tmp/uploads/secret-name.png", "corrupt header");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleImageDecode(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().errorCode()).isEqualTo("ImageDecodeException");
        assertThat(response.getBody().message()).isEqualTo("Unreadable image");
        assertThat(response.getBody().toString()).doesNotContain("/tmp/uploads");
    }

    @Test
    void missingPartReturns400() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleMissingPart(new MissingServletRequestPartException("style"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("MissingRequestPart");
    }

    @Test
    void shapeMismatchReturns422() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleShapeMismatch(new ShapeMismatchException("256 vs 512 channels"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().errorCode()).isEqualTo("ShapeMismatchException");
    }

    @Test
    void modelNotFoundReturns503WithoutPath() {
        ModelNotFoundException ex = new ModelNotFoundException("/secret/internal/path/vgg.onnx");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleModelNotFound(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().message()).isEqualTo("Style transfer service unavailable");
        assertThat(response.getBody().details()).contains("Model not loaded");
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal/path");
    }

    @Test
    void externalModelReturns503() {
        ExternalModelException ex = new ExternalModelException("Forward pass failed", "extractor");

        ResponseEntity<GlobalExceptionHandler.ApiError> response = handler.handleExternalModel(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).isEqualTo("Please retry in a few seconds");
    }

    @Test
    void resourceReturns500() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleResource(new ResourceException("Failed to create temporary file in /var/tmp/x"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString()).doesNotContain("/var/tmp/x");
    }

    @Test
    void unexpectedReturnsGeneric500() {
        ResponseEntity<GlobalExceptionHandler.ApiError> response =
                handler.handleUnexpected(new IllegalStateException("boom at /internal"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().timestamp()).isNotNull();
        assertThat(response.getBody().toString()).doesNotContain("boom");
    }
}
