package com.orderflow.orderservice.service;

import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.dto.GstDetails;
import com.orderflow.orderservice.model.GstSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class PricingEngineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private PricingEngine pricingEngine;

    @BeforeEach
    void setUp() {
        pricingEngine = new PricingEngine(new OrderflowProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void price_AppliesTaxAndWaivesShippingAboveThreshold() {
        PricingResult result = pricingEngine.price(
                List.of(new PricedLine(UUID.randomUUID(), new BigDecimal("100"), 10)),
                null,
                GstDetails.none());

        assertThat(result.getSubtotal()).isEqualByComparingTo("1000");
        assertThat(result.getTax()).isEqualByComparingTo("180");
        assertThat(result.getShipping()).isEqualByComparingTo("0");
        assertThat(result.getTotal()).isEqualByComparingTo("1180");
    }

    @Test
    void price_ChargesShippingAtOrBelowThreshold() {
        PricingResult result = pricingEngine.price(
                List.of(new PricedLine(UUID.randomUUID(), new BigDecimal("250"), 2)),
                null,
                GstDetails.none());

        assertThat(result.getShipping()).isEqualByComparingTo("50");
        assertThat(result.getTotal()).isEqualByComparingTo("640");
    }

    @Test
    void price_TotalEqualsSumOfParts() {
        PricingResult result = pricingEngine.price(
                List.of(new PricedLine(UUID.randomUUID(), new BigDecimal("33"), 7),
                        new PricedLine(UUID.randomUUID(), new BigDecimal("19.50"), 3)),
                new BigDecimal("20"),
                GstDetails.none());

        BigDecimal expected = result.getSubtotal().add(result.getTax()).add(result.getShipping())
                .subtract(result.getDiscount());
        assertThat(result.getTotal()).isEqualByComparingTo(expected);
        assertThat(result.getGst().getTaxBase()).isEqualByComparingTo(result.getSubtotal().subtract(new BigDecimal("20")));
    }

    @Test
    void price_UsesExplicitTaxAmount() {
        GstDetails gst = GstDetails.builder().taxAmount(new BigDecimal("90")).build();

        PricingResult result = pricingEngine.price(
                List.of(new PricedLine(UUID.randomUUID(), new BigDecimal("1000"), 1)), null, gst);

        assertThat(result.getTax()).isEqualByComparingTo("90");
        assertThat(result.getGst().getTaxPercent()).isEqualByComparingTo("9");
    }

    @Test
    void snapshot_SanitizesGstinAndImpliesInvoice() {
        GstDetails gst = GstDetails.builder()
                .gstin(" 27aapfu-0939f1zv ")
                .legalName("  Acme Traders ")
                .placeOfSupply("maharashtra")
                .build();

        GstSnapshot snapshot = pricingEngine.price(
                List.of(new PricedLine(UUID.randomUUID(), new BigDecimal("1000"), 1)), null, gst).getGst();

        assertThat(snapshot.getGstin()).isEqualTo("27AAPFU0939F1ZV");
        assertThat(snapshot.isWantInvoice()).isTrue();
        assertThat(snapshot.getLegalName()).isEqualTo("Acme Traders");
        assertThat(snapshot.getPlaceOfSupply()).isEqualTo("MAHARASHTRA");
        assertThat(snapshot.getCapturedAt()).isEqualTo(NOW);
    }

    @Test
    void sanitizeGstin_TruncatesToFifteenCharacters() {
        assertThat(PricingEngine.sanitizeGstin("27AAPFU0939F1ZVEXTRA")).hasSize(15);
        assertThat(PricingEngine.sanitizeGstin("--")).isNull();
        assertThat(PricingEngine.sanitizeGstin(null)).isNull();
    }
}
