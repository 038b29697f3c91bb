package com.orderflow.orderservice.exception;

// a verified webhook body that cannot be applied no matter how often it is retried
public class WebhookPayloadException extends RuntimeException {

    public WebhookPayloadException(String message) {
        super(message);
    }

    public WebhookPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
