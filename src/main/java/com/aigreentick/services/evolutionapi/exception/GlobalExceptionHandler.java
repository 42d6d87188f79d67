package com.aigreentick.services.evolutionapi.exception;

import com.aigreentick.services.evolutionapi.constants.EvolutionConstants;
import com.aigreentick.services.evolutionapi.dto.response.StatusResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global exception handler for all controllers
 * Every error leaves as {@code {status:"error", message}}
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // ========================
    // Webhook Exceptions
    // ========================

    @ExceptionHandler(InvalidPayloadException.class)
    public ResponseEntity<StatusResponse> handleInvalidPayload(
            InvalidPayloadException ex,
            HttpServletRequest request
    ) {
        log.warn("Invalid webhook payload - Path: {}", request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(StatusResponse.error(EvolutionConstants.ERROR_INVALID_PAYLOAD));
    }

    @ExceptionHandler(WebhookVerificationException.class)
    public ResponseEntity<StatusResponse> handleWebhookVerification(
            WebhookVerificationException ex,
            HttpServletRequest request
    ) {
        log.warn("Webhook verification failed: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.UNAUTHORIZED)
                .body(StatusResponse.error(ex.getMessage()));
    }

    @ExceptionHandler(WebhookProcessingException.class)
    public ResponseEntity<StatusResponse> handleWebhookProcessing(
            WebhookProcessingException ex,
            HttpServletRequest request
    ) {
        log.error("Webhook processing failed: {} - Path: {}", ex.getMessage(), request.getRequestURI(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(StatusResponse.error(ex.getMessage()));
    }

    // ========================
    // Request Format Exceptions
    // ========================

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<StatusResponse> handleNotReadable(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        log.warn("Unreadable request body - Path: {}", request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(StatusResponse.error(EvolutionConstants.ERROR_INVALID_PAYLOAD));
    }

    // ========================
    // Fallback Exception
    // ========================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<StatusResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        log.error("Unexpected error at path {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(StatusResponse.error(ex.getMessage() != null ? ex.getMessage() : "Internal server error"));
    }
}
