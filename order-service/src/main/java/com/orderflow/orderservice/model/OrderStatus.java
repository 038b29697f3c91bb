package com.orderflow.orderservice.model;

/**
 * Fulfilment state of an order.
 * Moves forward only; CANCELLED is the single escape and is only
 * reachable before processing starts.
 */
public enum OrderStatus {
    PENDING(0),
    CONFIRMED(1),
    PROCESSING(2),
    SHIPPED(3),
    DELIVERED(4),
    CANCELLED(-1);

    private final int rank;

    OrderStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (isTerminal() || target == this) {
            return false;
        }
        if (target == CANCELLED) {
            return this == PENDING || this == CONFIRMED;
        }
        return target.rank > this.rank;
    }
}
