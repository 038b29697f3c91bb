package com.orderflow.orderservice.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

@Data
public class VerifyPaymentRequest {

    @JsonAlias("razorpay_order_id")
    private String gatewayOrderId;

    @JsonAlias("razorpay_payment_id")
    private String paymentId;

    @JsonAlias("razorpay_signature")
    private String signature;
}
