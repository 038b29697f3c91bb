package com.orderflow.orderservice.controller;

import com.orderflow.orderservice.dto.CancelOrderRequest;
import com.orderflow.orderservice.dto.OrderRequest;
import com.orderflow.orderservice.dto.OrderResponse;
import com.orderflow.orderservice.dto.OrderTrackingResponse;
import com.orderflow.orderservice.dto.VerifyPaymentRequest;
import com.orderflow.orderservice.dto.VerifyPaymentResponse;
import com.orderflow.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1/orders")
@RequiredArgsConstructor
public class OrderController {

    private final OrderService orderService;

    @PostMapping
    public ResponseEntity<OrderResponse> createOrder(
            @Valid @RequestBody OrderRequest orderRequest,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createOrder(orderRequest, jwt);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/my-orders")
    public ResponseEntity<List<OrderResponse>> getMyOrders(@AuthenticationPrincipal Jwt jwt) {
        List<OrderResponse> response = orderService.getMyOrders(jwt);
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<OrderResponse> getOrderById(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.getOrderById(orderId, jwt);
        return ResponseEntity.ok(response);
    }

    // public: customers track by order number without logging in
    @GetMapping("/track/{orderNumber}")
    public ResponseEntity<OrderTrackingResponse> trackOrder(@PathVariable String orderNumber) {
        return ResponseEntity.ok(orderService.trackOrder(orderNumber));
    }

    @PostMapping("/{orderId}/verify-payment")
    public ResponseEntity<VerifyPaymentResponse> verifyPayment(
            @PathVariable UUID orderId,
            @RequestBody VerifyPaymentRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        VerifyPaymentResponse response = orderService.verifyPayment(orderId, request, jwt);
        return ResponseEntity.ok(response);
    }

    @PostMapping("/{orderId}/cancel")
    public ResponseEntity<OrderResponse> cancelOrder(
            @PathVariable UUID orderId,
            @Valid @RequestBody(required = false) CancelOrderRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.cancelOrder(orderId, request, jwt);
        return ResponseEntity.ok(response);
    }
}
