package com.orderflow.common.contracts;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingPaymentNoticeContract {
    private OrderNotificationContract order;
    private ShippingPaymentContract payment;
}
