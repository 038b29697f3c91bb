package com.orderflow.orderservice.dto;

import com.orderflow.orderservice.model.PaymentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class UpdatePaymentStatusRequest {

    @NotNull(message = "Payment status cannot be null")
    private PaymentStatus paymentStatus;
}
