package com.orderflow.orderservice.exception;

import java.util.UUID;

/**
 * Exception thrown when a line cannot reach its minimum order quantity
 * within the available stock and the per-line cap
 * HTTP Status: 400 Bad Request
 */
public class QuantityUnsatisfiableException extends RuntimeException {

    public QuantityUnsatisfiableException(UUID productId, String productName, int moq, int available) {
        super(String.format("'%s' needs at least %d units but only %d can be ordered right now",
                productName != null ? productName : productId, moq, available));
    }
}
