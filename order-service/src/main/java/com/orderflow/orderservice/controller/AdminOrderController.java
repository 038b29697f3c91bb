package com.orderflow.orderservice.controller;

import com.orderflow.orderservice.dto.OrderResponse;
import com.orderflow.orderservice.dto.ShippingPackageRequest;
import com.orderflow.orderservice.dto.ShippingPaymentLinkRequest;
import com.orderflow.orderservice.dto.UpdateOrderStatusRequest;
import com.orderflow.orderservice.dto.UpdatePaymentStatusRequest;
import com.orderflow.orderservice.service.OrderService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Operator endpoints. Role checks happen in the service, same as for the
 * owner-or-admin checks on the customer endpoints.
 */
@RestController
@RequestMapping("/api/v1/admin/orders")
@RequiredArgsConstructor
public class AdminOrderController {

    private final OrderService orderService;

    @PatchMapping("/{orderId}/status")
    public ResponseEntity<OrderResponse> updateOrderStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody UpdateOrderStatusRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.updateOrderStatus(orderId, request, jwt));
    }

    @PatchMapping("/{orderId}/payment-status")
    public ResponseEntity<OrderResponse> updatePaymentStatus(
            @PathVariable UUID orderId,
            @Valid @RequestBody UpdatePaymentStatusRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.updatePaymentStatus(orderId, request, jwt));
    }

    @PostMapping("/{orderId}/cod-collected")
    public ResponseEntity<OrderResponse> markCodCollected(
            @PathVariable UUID orderId,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.markCodCollected(orderId, jwt));
    }

    @PutMapping("/{orderId}/shipping-package")
    public ResponseEntity<OrderResponse> setShippingPackage(
            @PathVariable UUID orderId,
            @Valid @RequestBody ShippingPackageRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        return ResponseEntity.ok(orderService.setShippingPackage(orderId, request, jwt));
    }

    @PostMapping("/{orderId}/shipping-payment-link")
    public ResponseEntity<OrderResponse> createShippingPaymentLink(
            @PathVariable UUID orderId,
            @Valid @RequestBody ShippingPaymentLinkRequest request,
            @AuthenticationPrincipal Jwt jwt) {
        OrderResponse response = orderService.createShippingPaymentLink(orderId, request.getAmount(), jwt);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
