package com.orderflow.orderservice.dto;

import com.orderflow.common.model.Address;
import com.orderflow.orderservice.model.GstSnapshot;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.PaymentMethod;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.RefundStatus;
import com.orderflow.orderservice.model.ShippingPackage;
import com.orderflow.orderservice.model.ShippingPayment;
import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
public class OrderResponse {
    private UUID id;
    private String orderNumber;
    private UUID userId;
    private String customerEmail;
    private List<OrderItemResponse> items;
    private Address shippingAddress;
    private Address billingAddress;
    private PaymentMethod paymentMethod;
    private OrderStatus status;
    private PaymentStatus paymentStatus;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal shipping;
    private BigDecimal discount;
    private BigDecimal total;
    private GstSnapshot gst;
    // client passes this to the gateway checkout widget
    private String gatewayOrderId;
    private String paymentId;
    private Instant paidAt;
    private String trackingNumber;
    private String carrierName;
    private String customerNotes;
    private Instant shippedAt;
    private Instant deliveredAt;
    private Instant cancelledAt;
    private RefundStatus refundStatus;
    private BigDecimal refundAmount;
    private ShippingPackage shippingPackage;
    private ShippingPayment shippingPayment;
    private Instant createdAt;
    private Instant updatedAt;
}
