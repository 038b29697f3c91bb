package com.orderflow.orderservice.exception;

/**
 * Exception thrown when an order or payment state transition is invalid
 * For example: moving a SHIPPED order back to CONFIRMED
 * HTTP Status: 422 Unprocessable Entity
 */
public class InvalidOrderStateException extends RuntimeException {

    public InvalidOrderStateException(String message) {
        super(message);
    }

    public InvalidOrderStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
