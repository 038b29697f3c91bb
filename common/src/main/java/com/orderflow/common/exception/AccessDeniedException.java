package com.orderflow.common.exception;

/**
 * Exception thrown when a caller tries to read or modify an order they don't own,
 * or calls an operator-only operation without the ADMIN role
 * HTTP Status: 403 Forbidden (set in GlobalExceptionHandler)
 */
public class AccessDeniedException extends RuntimeException {

    public AccessDeniedException(String message) {
        super(message);
    }
}
