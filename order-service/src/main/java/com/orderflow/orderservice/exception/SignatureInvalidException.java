package com.orderflow.orderservice.exception;

/**
 * Exception thrown when a payment signature does not verify.
 * The message is always generic; never put the expected value in it.
 * HTTP Status: 400 Bad Request
 */
public class SignatureInvalidException extends RuntimeException {

    public SignatureInvalidException() {
        super("Payment verification failed");
    }
}
