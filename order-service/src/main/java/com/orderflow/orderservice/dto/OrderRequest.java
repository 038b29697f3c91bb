package com.orderflow.orderservice.dto;

import com.orderflow.common.model.Address;
import com.orderflow.orderservice.model.PaymentMethod;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class OrderRequest {

    @NotNull(message = "Shipping address cannot be null")
    @Valid
    private Address shippingAddress;

    // defaults to the shipping address
    @Valid
    private Address billingAddress;

    @NotNull(message = "Payment method cannot be null")
    private PaymentMethod paymentMethod;

    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    private String email;

    // empty means "order the saved cart"
    @Valid
    private List<OrderItemRequest> items;

    @Valid
    private GstRequest gst;

    @Size(max = 2000, message = "Notes must be at most 2000 characters")
    private String customerNotes;
}
