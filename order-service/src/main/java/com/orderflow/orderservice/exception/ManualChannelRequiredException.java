package com.orderflow.orderservice.exception;

/**
 * Exception thrown when a line asks for more units than online checkout accepts.
 * Such orders go through the sales team instead of being clamped.
 * HTTP Status: 422 Unprocessable Entity
 */
public class ManualChannelRequiredException extends RuntimeException {

    private final int threshold;

    public ManualChannelRequiredException(int desiredQty, int threshold) {
        super(String.format("Quantity %d is above the online limit of %d. Please contact our sales team to place this order.",
                desiredQty, threshold));
        this.threshold = threshold;
    }

    public int getThreshold() {
        return threshold;
    }
}
