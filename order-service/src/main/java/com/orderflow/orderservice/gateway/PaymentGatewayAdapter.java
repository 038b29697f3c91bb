package com.orderflow.orderservice.gateway;

import com.orderflow.orderservice.model.PaymentMethod;

import java.math.BigDecimal;
import java.util.Map;

public interface PaymentGatewayAdapter {

    /**
     * Opens a payment intent for an order.
     * For cash on delivery no call is made and a local {@code cod_} id is returned.
     *
     * @param amount  in major currency units; converted to minor units on the wire
     * @param receipt idempotency-safe receipt, at most 40 characters
     * @return the gateway order id the client checks out against
     * @throws com.orderflow.orderservice.exception.GatewayException on transport or upstream errors
     */
    String createIntent(PaymentMethod method, BigDecimal amount, String currency, String receipt,
            Map<String, String> notes);

    PaymentLink createPaymentLink(BigDecimal amount, String currency, PaymentLinkCustomer customer,
            String description, Map<String, String> notes);

    /**
     * Checks a client-submitted payment confirmation: the signature must be
     * HMAC-SHA256(keySecret, gatewayOrderId + "|" + paymentId).
     */
    boolean verify(String gatewayOrderId, String paymentId, String signature);

    // signature over the raw webhook body, with the webhook secret
    boolean verifyWebhook(byte[] rawBody, String signature);
}
