package com.orderflow.orderservice.service;

import com.orderflow.orderservice.model.GstSnapshot;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PricingResult {
    BigDecimal subtotal;
    BigDecimal tax;
    BigDecimal shipping;
    BigDecimal discount;
    BigDecimal total;
    GstSnapshot gst;
}
