package com.orderflow.orderservice.exception;

import com.orderflow.common.dto.ErrorResponse;
import com.orderflow.common.dto.ValidationErrorResponse;
import com.orderflow.common.exception.AccessDeniedException;
import com.orderflow.common.exception.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String message, String errorCode,
            String correlationId, HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();
        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "RESOURCE_NOT_FOUND",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ErrorResponse> handleAccessDeniedException(
            AccessDeniedException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.FORBIDDEN, ex.getMessage(), "ACCESS_DENIED",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(TerminalStateException.class)
    public ResponseEntity<ErrorResponse> handleTerminalStateException(
            TerminalStateException ex,
            HttpServletRequest request) {
        String correlationId = generateCorrelationId();
        log.warn("[{}] Mutation rejected on closed order - Path: {} - status={}",
                correlationId, request.getRequestURI(), ex.getStatus());
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "ORDER_CLOSED",
                correlationId, request);
    }

    @ExceptionHandler(InvalidOrderStateException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOrderStateException(
            InvalidOrderStateException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "INVALID_ORDER_STATE",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(ManualChannelRequiredException.class)
    public ResponseEntity<ErrorResponse> handleManualChannelRequiredException(
            ManualChannelRequiredException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage(), "MANUAL_CHANNEL_REQUIRED",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(QuantityUnsatisfiableException.class)
    public ResponseEntity<ErrorResponse> handleQuantityUnsatisfiableException(
            QuantityUnsatisfiableException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "QUANTITY_UNSATISFIABLE",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(StockConflictException.class)
    public ResponseEntity<ErrorResponse> handleStockConflictException(
            StockConflictException ex,
            HttpServletRequest request) {
        String correlationId = generateCorrelationId();
        log.info("[{}] Stock conflict - Path: {} - productId={}", correlationId, request.getRequestURI(),
                ex.getProductId());
        // product ids stay in the log, the client gets an actionable message
        return buildResponse(HttpStatus.CONFLICT, "Insufficient stock, please refresh your cart and retry.",
                "STOCK_CONFLICT", correlationId, request);
    }

    @ExceptionHandler(SignatureInvalidException.class)
    public ResponseEntity<ErrorResponse> handleSignatureInvalidException(
            SignatureInvalidException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Payment verification failed", "SIGNATURE_INVALID",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(
            GatewayException ex,
            HttpServletRequest request) {
        String correlationId = generateCorrelationId();
        log.error("[{}] Payment gateway failure - Path: {} - {}", correlationId, request.getRequestURI(),
                ex.getMessage());
        return buildResponse(HttpStatus.BAD_GATEWAY,
                "Payment provider is unavailable. Please try again in a few minutes.",
                "GATEWAY_ERROR", correlationId, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .message("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, "Malformed request body", "VALIDATION_FAILED",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {
        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_ARGUMENT",
                generateCorrelationId(), request);
    }

    /**
     * Handles optimistic locking failures (concurrent modifications).
     * Typical case: an operator updates an order while a webhook for the
     * same order is being applied.
     */
    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLockingFailureException(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.warn("[{}] Optimistic locking conflict detected - Path: {} - User should retry",
                correlationId, request.getRequestURI());

        return buildResponse(HttpStatus.CONFLICT,
                "The order was modified by another request. Please refresh and try again.",
                "CONCURRENT_MODIFICATION", correlationId, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);
        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", correlationId, request);
    }
}
