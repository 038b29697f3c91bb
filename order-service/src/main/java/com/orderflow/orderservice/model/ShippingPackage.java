package com.orderflow.orderservice.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Embeddable
public class ShippingPackage {

    @Column(name = "package_length_cm")
    private BigDecimal lengthCm;

    @Column(name = "package_breadth_cm")
    private BigDecimal breadthCm;

    @Column(name = "package_height_cm")
    private BigDecimal heightCm;

    @Column(name = "package_weight_kg")
    private BigDecimal weightKg;

    @Column(name = "package_notes")
    private String notes;

    // up to 5 photo URLs of the packed parcel
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "package_images", columnDefinition = "jsonb")
    private List<String> images = new ArrayList<>();

    @Column(name = "package_packed_at")
    private Instant packedAt;
}
