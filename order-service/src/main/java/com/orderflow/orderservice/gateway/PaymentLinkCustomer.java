package com.orderflow.orderservice.gateway;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PaymentLinkCustomer {
    String name;
    String email;
    String contact;
}
