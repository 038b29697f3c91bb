package com.orderflow.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Tax-invoice metadata captured once when the order is placed.
 * There are no setters: the block is written at creation and never recomputed.
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class GstSnapshot {

    @Column(name = "gst_want_invoice", updatable = false)
    private boolean wantInvoice;

    @Column(name = "gst_gstin", length = 15, updatable = false)
    private String gstin;

    @Column(name = "gst_legal_name", updatable = false)
    private String legalName;

    @Column(name = "gst_place_of_supply", updatable = false)
    private String placeOfSupply;

    @Column(name = "gst_email", updatable = false)
    private String email;

    @Column(name = "gst_tax_percent", updatable = false)
    private BigDecimal taxPercent;

    @Column(name = "gst_tax_base", updatable = false)
    private BigDecimal taxBase;

    @Column(name = "gst_tax_amount", updatable = false)
    private BigDecimal taxAmount;

    @Column(name = "gst_captured_at", updatable = false)
    private Instant capturedAt;
}
