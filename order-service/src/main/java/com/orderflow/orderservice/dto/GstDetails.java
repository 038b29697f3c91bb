package com.orderflow.orderservice.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

// GST input after alias resolution, consumed by PricingEngine
@Value
@Builder
public class GstDetails {
    boolean wantInvoice;
    String gstin;
    String legalName;
    String placeOfSupply;
    String email;
    BigDecimal taxPercent;
    BigDecimal taxAmount;
    Instant capturedAt;

    public static GstDetails none() {
        return GstDetails.builder().build();
    }
}
