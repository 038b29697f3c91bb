package com.orderflow.orderservice.service;

import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.dto.GstDetails;
import com.orderflow.orderservice.model.GstSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Computes order money fields and the GST snapshot. No I/O; the snapshot it
 * returns is stored on the order as-is.
 */
@Component
@RequiredArgsConstructor
public class PricingEngine {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int GSTIN_LENGTH = 15;

    private final OrderflowProperties properties;
    private final Clock clock;

    public PricingResult price(List<PricedLine> lines, BigDecimal discount, GstDetails gst) {
        GstDetails details = gst != null ? gst : GstDetails.none();
        OrderflowProperties.Pricing pricing = properties.getPricing();

        BigDecimal subtotal = lines.stream()
                .map(PricedLine::lineTotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal tax;
        if (details.getTaxAmount() != null) {
            tax = details.getTaxAmount();
        } else if (details.getTaxPercent() != null) {
            tax = percentOf(subtotal, details.getTaxPercent());
        } else {
            tax = percentOf(subtotal, pricing.getTaxPercent());
        }

        BigDecimal shipping = subtotal.compareTo(pricing.getFreeShippingAbove()) > 0
                ? BigDecimal.ZERO
                : pricing.getShippingFee();

        BigDecimal appliedDiscount = discount != null ? discount : BigDecimal.ZERO;
        BigDecimal total = subtotal.add(tax).add(shipping).subtract(appliedDiscount);

        return PricingResult.builder()
                .subtotal(subtotal)
                .tax(tax)
                .shipping(shipping)
                .discount(appliedDiscount)
                .total(total)
                .gst(snapshot(details, subtotal, tax, appliedDiscount))
                .build();
    }

    GstSnapshot snapshot(GstDetails details, BigDecimal subtotal, BigDecimal tax, BigDecimal discount) {
        String gstin = sanitizeGstin(details.getGstin());
        boolean wantInvoice = details.isWantInvoice() || gstin != null;

        BigDecimal taxPercent;
        if (details.getTaxPercent() != null) {
            taxPercent = details.getTaxPercent();
        } else if (subtotal.signum() == 0) {
            taxPercent = BigDecimal.ZERO;
        } else {
            taxPercent = tax.multiply(HUNDRED).divide(subtotal, 0, RoundingMode.HALF_UP);
        }

        Instant capturedAt = details.getCapturedAt();
        if (capturedAt == null && wantInvoice) {
            capturedAt = Instant.now(clock);
        }

        return GstSnapshot.builder()
                .wantInvoice(wantInvoice)
                .gstin(gstin)
                .legalName(trimToNull(details.getLegalName()))
                .placeOfSupply(upper(trimToNull(details.getPlaceOfSupply())))
                .email(trimToNull(details.getEmail()))
                .taxPercent(taxPercent)
                .taxBase(subtotal.subtract(discount))
                .taxAmount(tax)
                .capturedAt(capturedAt)
                .build();
    }

    static String sanitizeGstin(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return null;
        }
        return cleaned.length() > GSTIN_LENGTH ? cleaned.substring(0, GSTIN_LENGTH) : cleaned;
    }

    // rounded to whole rupees
    private static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return amount.multiply(percent).divide(HUNDRED, 0, RoundingMode.HALF_UP);
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String upper(String value) {
        return value != null ? value.toUpperCase(Locale.ROOT) : null;
    }
}
