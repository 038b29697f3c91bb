package com.orderflow.orderservice.service;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class PricedLine {
    UUID productId;
    BigDecimal unitPrice;
    int quantity;

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
