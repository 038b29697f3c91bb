package com.orderflow.common.exception;

/**
 * Exception thrown when an order, product or cart cannot be found
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
