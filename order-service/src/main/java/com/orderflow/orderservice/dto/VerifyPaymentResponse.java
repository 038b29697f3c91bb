package com.orderflow.orderservice.dto;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class VerifyPaymentResponse {
    private boolean verified;
    private OrderResponse order;
}
