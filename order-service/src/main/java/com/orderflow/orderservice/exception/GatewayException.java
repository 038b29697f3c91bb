package com.orderflow.orderservice.exception;

/**
 * Exception thrown when the payment gateway is unreachable or rejects a call
 * HTTP Status: 502 Bad Gateway
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
