package com.orderflow.orderservice.dto;

import com.orderflow.orderservice.model.OrderStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class UpdateOrderStatusRequest {

    @NotNull(message = "Status cannot be null")
    private OrderStatus status;

    private String trackingNumber;

    private String carrierName;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String notes;
}
