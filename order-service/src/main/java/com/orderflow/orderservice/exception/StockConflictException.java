package com.orderflow.orderservice.exception;

import java.util.UUID;

/**
 * Exception thrown when a conditional stock decrement loses the race
 * (stockQuantity dropped below the requested quantity)
 * HTTP Status: 409 Conflict. The client should re-read the cart and retry.
 */
public class StockConflictException extends RuntimeException {

    private final UUID productId;

    public StockConflictException(UUID productId, int requested) {
        super("Insufficient stock for product " + productId + ", requested " + requested);
        this.productId = productId;
    }

    public UUID getProductId() {
        return productId;
    }
}
