package com.orderflow.orderservice.service;

import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.exception.ManualChannelRequiredException;
import com.orderflow.orderservice.exception.QuantityUnsatisfiableException;
import com.orderflow.orderservice.model.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuantityResolverTest {

    private OrderflowProperties properties;
    private QuantityResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new OrderflowProperties();
        properties.getQuantity().getCategoryMoq().put("fasteners", 50);
        resolver = new QuantityResolver(properties);
    }

    @Test
    void resolve_SnapsUpToMoq() {
        assertThat(resolver.resolve(7, 10, 100, 1000)).isEqualTo(10);
    }

    @Test
    void resolve_SnapsBackDownToStock() {
        assertThat(resolver.resolve(25, 10, 15, 1000)).isEqualTo(10);
    }

    @Test
    void resolve_ReturnsZero_WhenStockBelowMoq() {
        assertThat(resolver.resolve(5, 10, 8, 1000)).isZero();
    }

    @Test
    void resolve_HugeDesiredQuantitySnapsToStock() {
        assertThat(resolver.resolve(Integer.MAX_VALUE, 10, 100, 1000)).isEqualTo(100);
        assertThat(resolver.resolve(Integer.MAX_VALUE - 3, 7, Integer.MAX_VALUE, Integer.MAX_VALUE))
                .isEqualTo((Integer.MAX_VALUE / 7) * 7);
    }

    @Test
    void resolve_IsZeroOrMultipleOfMoqWithinCap() {
        for (int desired = 1; desired <= 60; desired++) {
            for (int moq = 1; moq <= 12; moq++) {
                for (int stock = 0; stock <= 40; stock += 3) {
                    for (int globalMax : new int[]{5, 25, 500}) {
                        int resolved = resolver.resolve(desired, moq, stock, globalMax);
                        assertThat(resolved).isGreaterThanOrEqualTo(0);
                        if (resolved > 0) {
                            assertThat(resolved % moq).isZero();
                            assertThat(resolved).isLessThanOrEqualTo(Math.min(stock, globalMax));
                        }
                    }
                }
            }
        }
    }

    @Test
    void effectiveMoq_PrefersOverrideThenCategoryThenDefault() {
        Product product = product(40);
        product.setCategory("fasteners");
        product.setMinOrderQtyOverride(20);
        assertThat(resolver.effectiveMoq(product)).isEqualTo(20);

        product.setMinOrderQtyOverride(0);
        assertThat(resolver.effectiveMoq(product)).isEqualTo(50);

        product.setCategory("tools");
        assertThat(resolver.effectiveMoq(product)).isEqualTo(1);
    }

    @Test
    void resolveLine_RejectsDesiredAboveManualThreshold() {
        Product product = product(1000);

        assertThatThrownBy(() -> resolver.resolveLine(product, 101))
                .isInstanceOf(ManualChannelRequiredException.class);
    }

    @Test
    void resolveLine_ThrowsWhenUnsatisfiable() {
        Product product = product(8);
        product.setMinOrderQtyOverride(10);

        assertThatThrownBy(() -> resolver.resolveLine(product, 5))
                .isInstanceOf(QuantityUnsatisfiableException.class);
    }

    @Test
    void resolveLine_AdjustsToMoq() {
        Product product = product(100);
        product.setMinOrderQtyOverride(10);

        assertThat(resolver.resolveLine(product, 7)).isEqualTo(10);
    }

    private Product product(int stock) {
        Product product = new Product();
        product.setId(UUID.randomUUID());
        product.setName("Hex bolt M8");
        product.setStockQuantity(stock);
        return product;
    }
}
