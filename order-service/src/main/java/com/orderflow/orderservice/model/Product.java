package com.orderflow.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Catalog record owned by the catalog admin. This service only reads it
 * and moves stockQuantity through ProductRepository's conditional updates.
 */
@Getter
@Setter
@ToString(onlyExplicitlyIncluded = true)
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "products")
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @ToString.Include
    private UUID id;

    @Column(nullable = false)
    @ToString.Include
    private String name;

    private String imageUrl;

    // category slug, used for the default MOQ lookup
    private String category;

    @Column(nullable = false)
    private BigDecimal basePrice;

    @Builder.Default
    @Column(nullable = false)
    private Integer stockQuantity = 0;

    // wins over the category default when >= 1
    private Integer minOrderQtyOverride;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private Boolean active = true;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "product_price_tiers", joinColumns = @JoinColumn(name = "product_id"))
    private List<PriceTier> priceTiers = new ArrayList<>();

    /**
     * Unit price for the given quantity: the tier with the highest minQty
     * not above qty, or the base price when no tier applies.
     */
    public BigDecimal unitPriceFor(int qty) {
        return priceTiers.stream()
                .filter(tier -> tier.getMinQty() != null && tier.getMinQty() <= qty)
                .max(Comparator.comparing(PriceTier::getMinQty))
                .map(PriceTier::getUnitPrice)
                .orElse(basePrice);
    }
}
