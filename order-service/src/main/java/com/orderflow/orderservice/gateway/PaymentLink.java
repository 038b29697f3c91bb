package com.orderflow.orderservice.gateway;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PaymentLink {
    String linkId;
    String shortUrl;
}
