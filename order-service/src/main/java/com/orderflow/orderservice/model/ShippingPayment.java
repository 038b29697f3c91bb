package com.orderflow.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Secondary payment link for post-sale shipping charges.
 * Only webhook events move its status once the link exists.
 */
@Data
@Embeddable
public class ShippingPayment {

    @Column(name = "shipping_link_id", unique = true)
    private String linkId;

    @Column(name = "shipping_link_short_url")
    private String shortUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "shipping_link_status")
    private ShippingPaymentStatus status;

    @Column(name = "shipping_link_currency")
    private String currency;

    @Column(name = "shipping_link_amount")
    private BigDecimal amount;

    @Column(name = "shipping_link_amount_paid")
    private BigDecimal amountPaid;

    // gateway payment ids already counted into amountPaid
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "shipping_link_payment_ids", columnDefinition = "jsonb")
    private List<String> paymentIds = new ArrayList<>();

    @Column(name = "shipping_link_last_event_at")
    private Instant lastEventAt;
}
