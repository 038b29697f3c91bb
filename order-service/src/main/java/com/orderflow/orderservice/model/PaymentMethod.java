package com.orderflow.orderservice.model;

public enum PaymentMethod {
    GATEWAY,
    CASH_ON_DELIVERY
}
