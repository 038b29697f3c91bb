package com.orderflow.orderservice.service;

import com.orderflow.orderservice.dto.CancelOrderRequest;
import com.orderflow.orderservice.dto.OrderRequest;
import com.orderflow.orderservice.dto.OrderResponse;
import com.orderflow.orderservice.dto.OrderTrackingResponse;
import com.orderflow.orderservice.dto.ShippingPackageRequest;
import com.orderflow.orderservice.dto.UpdateOrderStatusRequest;
import com.orderflow.orderservice.dto.UpdatePaymentStatusRequest;
import com.orderflow.orderservice.dto.VerifyPaymentRequest;
import com.orderflow.orderservice.dto.VerifyPaymentResponse;
import org.springframework.security.oauth2.jwt.Jwt;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

public interface OrderService {

    OrderResponse createOrder(OrderRequest orderRequest, Jwt jwt);

    List<OrderResponse> getMyOrders(Jwt jwt);

    OrderResponse getOrderById(UUID orderId, Jwt jwt);

    OrderTrackingResponse trackOrder(String orderNumber);

    VerifyPaymentResponse verifyPayment(UUID orderId, VerifyPaymentRequest request, Jwt jwt);

    OrderResponse cancelOrder(UUID orderId, CancelOrderRequest request, Jwt jwt);

    // operator actions (ADMIN role)

    OrderResponse updateOrderStatus(UUID orderId, UpdateOrderStatusRequest request, Jwt jwt);

    OrderResponse updatePaymentStatus(UUID orderId, UpdatePaymentStatusRequest request, Jwt jwt);

    OrderResponse markCodCollected(UUID orderId, Jwt jwt);

    OrderResponse setShippingPackage(UUID orderId, ShippingPackageRequest request, Jwt jwt);

    OrderResponse createShippingPaymentLink(UUID orderId, BigDecimal amount, Jwt jwt);
}
