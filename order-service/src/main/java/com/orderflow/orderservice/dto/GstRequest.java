package com.orderflow.orderservice.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import lombok.Data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * GST block of a checkout request. Older clients send the same values
 * under different keys; {@link #resolve()} applies one precedence order:
 * <ul>
 * <li>gstin, then gstNumber, then taxId</li>
 * <li>legalName, then businessName, then companyName</li>
 * <li>wantInvoice, then gstInvoice, then invoiceRequired</li>
 * <li>taxPercent, then taxRate</li>
 * </ul>
 */
@Data
public class GstRequest {

    private Boolean wantInvoice;
    private Boolean gstInvoice;
    private Boolean invoiceRequired;

    private String gstin;
    private String gstNumber;
    private String taxId;

    private String legalName;
    private String businessName;
    private String companyName;

    private String placeOfSupply;

    @Email(message = "GST email must be a valid email address")
    private String email;

    @DecimalMin(value = "0", message = "Tax percent cannot be negative")
    @DecimalMax(value = "100", message = "Tax percent cannot exceed 100")
    private BigDecimal taxPercent;

    @DecimalMin(value = "0", message = "Tax rate cannot be negative")
    @DecimalMax(value = "100", message = "Tax rate cannot exceed 100")
    private BigDecimal taxRate;

    @DecimalMin(value = "0", message = "Tax amount cannot be negative")
    private BigDecimal taxAmount;

    private Instant requestedAt;

    public GstDetails resolve() {
        Boolean invoiceFlag = firstNonNull(wantInvoice, gstInvoice, invoiceRequired);
        return GstDetails.builder()
                .wantInvoice(Boolean.TRUE.equals(invoiceFlag))
                .gstin(firstNonBlank(gstin, gstNumber, taxId))
                .legalName(firstNonBlank(legalName, businessName, companyName))
                .placeOfSupply(placeOfSupply)
                .email(email)
                .taxPercent(taxPercent != null ? taxPercent : taxRate)
                .taxAmount(taxAmount)
                .capturedAt(requestedAt)
                .build();
    }

    @SafeVarargs
    private static <T> T firstNonNull(T... values) {
        for (T value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
