package com.orderflow.orderservice.dto;

import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CancelOrderRequest {

    @Size(max = 2000, message = "Reason must be at most 2000 characters")
    private String reason;
}
