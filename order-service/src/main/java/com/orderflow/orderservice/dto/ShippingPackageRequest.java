package com.orderflow.orderservice.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
public class ShippingPackageRequest {

    @NotNull(message = "Length is required")
    @DecimalMin(value = "0", inclusive = false, message = "Length must be positive")
    private BigDecimal lengthCm;

    @NotNull(message = "Breadth is required")
    @DecimalMin(value = "0", inclusive = false, message = "Breadth must be positive")
    private BigDecimal breadthCm;

    @NotNull(message = "Height is required")
    @DecimalMin(value = "0", inclusive = false, message = "Height must be positive")
    private BigDecimal heightCm;

    @NotNull(message = "Weight is required")
    @DecimalMin(value = "0", inclusive = false, message = "Weight must be positive")
    private BigDecimal weightKg;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    @Size(max = 5, message = "At most 5 package images are allowed")
    private List<@Pattern(regexp = "^https?://.+", message = "Image must be an http(s) URL") String> images = new ArrayList<>();

    // when set, a shipping payment link for this amount is created right away
    @DecimalMin(value = "0", inclusive = false, message = "Shipping charge must be positive")
    private BigDecimal shippingCharge;
}
