package com.orderflow.orderservice.mapper;

import com.orderflow.common.contracts.OrderNotificationContract;
import com.orderflow.common.contracts.ShippingPaymentContract;
import com.orderflow.orderservice.dto.OrderItemResponse;
import com.orderflow.orderservice.dto.OrderResponse;
import com.orderflow.orderservice.dto.OrderTrackingResponse;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    OrderTrackingResponse toTrackingResponse(Order order);

    // Order -> notification snapshot (previousStatus is filled by the caller)
    @Mapping(source = "id", target = "orderId")
    @Mapping(target = "previousStatus", ignore = true)
    OrderNotificationContract toNotificationContract(Order order);

    OrderNotificationContract.OrderLineContract toLineContract(OrderItem orderItem);

    @Mapping(source = "id", target = "orderId")
    @Mapping(source = "shippingPayment.linkId", target = "linkId")
    @Mapping(source = "shippingPayment.shortUrl", target = "shortUrl")
    @Mapping(source = "shippingPayment.status", target = "status")
    @Mapping(source = "shippingPayment.currency", target = "currency")
    @Mapping(source = "shippingPayment.amount", target = "amount")
    @Mapping(source = "shippingPayment.amountPaid", target = "amountPaid")
    @Mapping(target = "paymentId", ignore = true)
    ShippingPaymentContract toShippingPaymentContract(Order order);
}
