package com.orderflow.orderservice.model;

import java.util.Arrays;
import java.util.Optional;

public enum OutboxEventType {
    ORDER_CREATED("order.created"),
    ADMIN_NEW_ORDER("order.admin_alert"),
    ORDER_STATUS_CHANGED("order.status_changed"),
    SHIPPING_PAYMENT_LINK_CREATED("shipping_payment.link_created"),
    SHIPPING_PAYMENT_UPDATED("shipping_payment.updated");

    private final String value;

    OutboxEventType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<OutboxEventType> fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equals(value))
                .findFirst();
    }
}
