package com.orderflow.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Shipping payment link state sent with notification.shipping_payment_link
 * and notification.shipping_payment_receipt.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingPaymentContract {
    private UUID orderId;
    private String orderNumber;
    private String linkId;
    private String shortUrl;
    private String status;      // PENDING, PARTIAL, PAID, EXPIRED, CANCELLED
    private String currency;
    private BigDecimal amount;
    private BigDecimal amountPaid;
    private String paymentId;   // payment that triggered a receipt, null for link creation
}
