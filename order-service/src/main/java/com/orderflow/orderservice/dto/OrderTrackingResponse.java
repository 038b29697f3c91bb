package com.orderflow.orderservice.dto;

import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.PaymentStatus;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;

// public view, no customer details
@Data
@Builder
public class OrderTrackingResponse {
    private String orderNumber;
    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private String trackingNumber;
    private String carrierName;
    private Instant createdAt;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Instant cancelledAt;
}
