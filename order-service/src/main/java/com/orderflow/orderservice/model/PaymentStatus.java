package com.orderflow.orderservice.model;

public enum PaymentStatus {
    AWAITING_PAYMENT,
    COD_PENDING,
    PAID,
    FAILED,
    COD_PAID;

    public boolean isSettled() {
        return this == PAID || this == COD_PAID;
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return switch (this) {
            case AWAITING_PAYMENT -> target == PAID || target == FAILED;
            // a late capture after a failed attempt still counts
            case FAILED -> target == PAID;
            case COD_PENDING -> target == COD_PAID;
            case PAID, COD_PAID -> false;
        };
    }
}
