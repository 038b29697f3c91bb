package com.orderflow.orderservice.model;

public enum ShippingPaymentStatus {
    PENDING,
    PARTIAL,
    PAID,
    EXPIRED,
    CANCELLED;

    public boolean isOpen() {
        return this == PENDING || this == PARTIAL;
    }
}
