package com.orderflow.common.contracts;

import com.orderflow.common.model.Address;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Snapshot of an order as seen by the notification consumers.
 *
 * Used for events like:
 * - notification.order_confirmation
 * - notification.admin_new_order
 * - notification.order_status_update
 *
 * Carries everything an email/SMS template needs so consumers never
 * call back into order-service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderNotificationContract {
    private UUID orderId;
    private String orderNumber;
    private UUID userId;
    private String customerName;
    private String customerEmail;
    private String customerPhone;
    private String status;
    private String previousStatus; // only set for status updates
    private String paymentMethod;
    private String paymentStatus;
    private BigDecimal subtotal;
    private BigDecimal tax;
    private BigDecimal shipping;
    private BigDecimal discount;
    private BigDecimal total;
    private List<OrderLineContract> items;
    private Address shippingAddress;
    private String trackingNumber;
    private String carrierName;
    private Instant createdAt;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class OrderLineContract {
        private UUID productId;
        private String productName;
        private Integer quantity;
        private BigDecimal unitPrice;
    }
}
