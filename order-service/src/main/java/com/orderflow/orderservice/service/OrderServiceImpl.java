package com.orderflow.orderservice.service;

import com.orderflow.common.exception.AccessDeniedException;
import com.orderflow.common.exception.ResourceNotFoundException;
import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.dto.CancelOrderRequest;
import com.orderflow.orderservice.dto.OrderRequest;
import com.orderflow.orderservice.dto.OrderResponse;
import com.orderflow.orderservice.dto.OrderTrackingResponse;
import com.orderflow.orderservice.dto.ShippingPackageRequest;
import com.orderflow.orderservice.dto.UpdateOrderStatusRequest;
import com.orderflow.orderservice.dto.UpdatePaymentStatusRequest;
import com.orderflow.orderservice.dto.VerifyPaymentRequest;
import com.orderflow.orderservice.dto.VerifyPaymentResponse;
import com.orderflow.orderservice.exception.GatewayException;
import com.orderflow.orderservice.exception.InvalidOrderStateException;
import com.orderflow.orderservice.exception.SignatureInvalidException;
import com.orderflow.orderservice.gateway.PaymentGatewayAdapter;
import com.orderflow.orderservice.gateway.PaymentLink;
import com.orderflow.orderservice.gateway.PaymentLinkCustomer;
import com.orderflow.orderservice.mapper.OrderMapper;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.PaymentMethod;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.ShippingPackage;
import com.orderflow.orderservice.repository.CartRepository;
import com.orderflow.orderservice.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    static final String ADMIN_ROLE = "ADMIN";
    static final String CLIENT_ID = "orderflow-backend";

    private final OrderRepository orderRepository;
    private final CartRepository cartRepository;
    private final OrderPlacementService orderPlacementService;
    private final OrderLedger orderLedger;
    private final PaymentGatewayAdapter paymentGatewayAdapter;
    private final OrderMapper orderMapper;
    private final OrderflowProperties properties;

    /**
     * Places an order in three steps:
     * 1. one transaction: price, persist PENDING, commit stock
     * 2. open the payment intent, outside any transaction
     * 3. one transaction: store the gateway order id and queue notifications
     *
     * If step 2 fails the order from step 1 is compensated (stock restored,
     * order deleted) before the GatewayException reaches the caller.
     */
    @Override
    public OrderResponse createOrder(OrderRequest orderRequest, Jwt jwt) {
        UUID userId = UUID.fromString(jwt.getSubject());
        log.info("Order creation process started. userId={}, paymentMethod={}", userId, orderRequest.getPaymentMethod());

        Order placed = orderPlacementService.placeOrder(orderRequest, userId);

        String gatewayOrderId;
        try {
            gatewayOrderId = paymentGatewayAdapter.createIntent(
                    placed.getPaymentMethod(),
                    placed.getTotal(),
                    properties.getPricing().getCurrency(),
                    receiptFor(placed),
                    Map.of("orderId", placed.getId().toString(), "orderNumber", placed.getOrderNumber()));
        } catch (GatewayException e) {
            log.error("Payment intent failed, compensating. orderId={}, error={}", placed.getId(), e.getMessage());
            try {
                orderPlacementService.discardOrder(placed.getId());
            } catch (RuntimeException compensationFailure) {
                log.error("Compensation failed for orderId={}", placed.getId(), compensationFailure);
                e.addSuppressed(compensationFailure);
            }
            throw e;
        }

        Order order = orderPlacementService.attachIntent(placed.getId(), gatewayOrderId);
        log.info("Order created. orderId={}, orderNumber={}, total={}", order.getId(), order.getOrderNumber(),
                order.getTotal());
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public List<OrderResponse> getMyOrders(Jwt jwt) {
        UUID userId = UUID.fromString(jwt.getSubject());
        return orderRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(orderMapper::toOrderResponse)
                .collect(Collectors.toList());
    }

    @Override
    @Transactional(readOnly = true)
    public OrderResponse getOrderById(UUID orderId, Jwt jwt) {
        Order order = orderLedger.getOrder(orderId);
        assertOwnerOrAdmin(order, jwt);
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional(readOnly = true)
    public OrderTrackingResponse trackOrder(String orderNumber) {
        Order order = orderRepository.findByOrderNumber(orderNumber.trim().toUpperCase())
                .orElseThrow(() -> new ResourceNotFoundException("Order not found: " + orderNumber));
        return orderMapper.toTrackingResponse(order);
    }

    @Override
    @Transactional
    public VerifyPaymentResponse verifyPayment(UUID orderId, VerifyPaymentRequest request, Jwt jwt) {
        Order order = orderLedger.getOrder(orderId);
        assertOwnerOrAdmin(order, jwt);

        if (order.getPaymentMethod() == PaymentMethod.CASH_ON_DELIVERY) {
            // nothing to verify, the customer just confirmed a COD checkout
            orderLedger.assertMutable(order);
            if (order.getStatus() == OrderStatus.PENDING) {
                orderLedger.transitionStatus(order, OrderStatus.CONFIRMED);
            }
            clearCart(order.getUserId());
            return VerifyPaymentResponse.builder().verified(true).order(orderMapper.toOrderResponse(order)).build();
        }

        if (order.getPaymentStatus() == PaymentStatus.PAID
                && request.getPaymentId() != null
                && request.getPaymentId().equals(order.getPaymentId())) {
            log.warn("Payment already verified. Ignoring (idempotency). orderId={}", orderId);
            return VerifyPaymentResponse.builder().verified(true).order(orderMapper.toOrderResponse(order)).build();
        }

        if (order.getGatewayOrderId() == null
                || !order.getGatewayOrderId().equals(request.getGatewayOrderId())
                || !paymentGatewayAdapter.verify(request.getGatewayOrderId(), request.getPaymentId(),
                        request.getSignature())) {
            log.warn("Payment signature rejected. orderId={}", orderId);
            throw new SignatureInvalidException();
        }

        order.setPaymentId(request.getPaymentId());
        orderLedger.transitionPayment(order, PaymentStatus.PAID);
        orderLedger.recordPayment(order, request.getPaymentId(), OrderLedger.LEDGER_CAPTURED);
        clearCart(order.getUserId());

        log.info("Payment verified. orderId={}, paymentId={}", orderId, request.getPaymentId());
        return VerifyPaymentResponse.builder().verified(true).order(orderMapper.toOrderResponse(order)).build();
    }

    @Override
    @Transactional
    public OrderResponse cancelOrder(UUID orderId, CancelOrderRequest request, Jwt jwt) {
        log.info("Cancel order process started. orderId={}", orderId);
        Order order = orderLedger.getOrder(orderId);
        assertOwnerOrAdmin(order, jwt);

        if (request != null && request.getReason() != null && !request.getReason().isBlank()) {
            order.setCustomerNotes(request.getReason().trim());
        }
        orderLedger.transitionStatus(order, OrderStatus.CANCELLED);
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional
    public OrderResponse updateOrderStatus(UUID orderId, UpdateOrderStatusRequest request, Jwt jwt) {
        assertAdmin(jwt);
        Order order = orderLedger.getOrder(orderId);
        orderLedger.assertMutable(order);

        if (request.getTrackingNumber() != null) {
            order.setTrackingNumber(request.getTrackingNumber().trim());
        }
        if (request.getCarrierName() != null) {
            order.setCarrierName(request.getCarrierName().trim());
        }
        if (request.getNotes() != null) {
            order.setNotes(request.getNotes());
        }

        if (request.getStatus() == order.getStatus()) {
            // only the shipment details changed
            orderRepository.save(order);
        } else {
            orderLedger.transitionStatus(order, request.getStatus());
        }
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional
    public OrderResponse updatePaymentStatus(UUID orderId, UpdatePaymentStatusRequest request, Jwt jwt) {
        assertAdmin(jwt);
        Order order = orderLedger.getOrder(orderId);
        orderLedger.transitionPayment(order, request.getPaymentStatus());
        return orderMapper.toOrderResponse(order);
    }

    @Override
    @Transactional
    public OrderResponse markCodCollected(UUID orderId, Jwt jwt) {
        assertAdmin(jwt);
        Order order = orderLedger.getOrder(orderId);
        if (order.getPaymentMethod() != PaymentMethod.CASH_ON_DELIVERY) {
            throw new InvalidOrderStateException("Order " + order.getOrderNumber() + " is not a cash on delivery order");
        }
        orderLedger.transitionPayment(order, PaymentStatus.COD_PAID);
        return orderMapper.toOrderResponse(order);
    }

    @Override
    public OrderResponse setShippingPackage(UUID orderId, ShippingPackageRequest request, Jwt jwt) {
        assertAdmin(jwt);

        ShippingPackage shippingPackage = new ShippingPackage();
        shippingPackage.setLengthCm(request.getLengthCm());
        shippingPackage.setBreadthCm(request.getBreadthCm());
        shippingPackage.setHeightCm(request.getHeightCm());
        shippingPackage.setWeightKg(request.getWeightKg());
        shippingPackage.setNotes(request.getNotes());
        shippingPackage.setImages(new ArrayList<>(Optional.ofNullable(request.getImages()).orElse(List.of())));

        Order order = orderLedger.updatePackage(orderId, shippingPackage);
        if (request.getShippingCharge() != null) {
            return createShippingPaymentLink(orderId, request.getShippingCharge(), jwt);
        }
        return orderMapper.toOrderResponse(order);
    }

    @Override
    public OrderResponse createShippingPaymentLink(UUID orderId, BigDecimal amount, Jwt jwt) {
        assertAdmin(jwt);
        Order order = orderLedger.prepareShippingLink(orderId);
        String currency = properties.getPricing().getCurrency();

        PaymentLinkCustomer customer = PaymentLinkCustomer.builder()
                .name(order.getCustomerName())
                .email(order.getCustomerEmail())
                .contact(order.getCustomerPhone())
                .build();

        // gateway call stays outside the transaction
        PaymentLink link = paymentGatewayAdapter.createPaymentLink(
                amount,
                currency,
                customer,
                "Shipping charges for order " + order.getOrderNumber(),
                Map.of("orderId", order.getId().toString(), "purpose", "shipping_payment"));

        Order updated = orderLedger.attachShippingLink(orderId, link, amount, currency);
        return orderMapper.toOrderResponse(updated);
    }

    private void clearCart(UUID userId) {
        cartRepository.findByUserId(userId).ifPresent(cart -> {
            cart.getItems().clear();
            cartRepository.save(cart);
            log.info("Cart cleared. userId={}", userId);
        });
    }

    // ord_<last 8 of timestamp>_<last 8 of user id>, max 40 chars
    private String receiptFor(Order order) {
        String timestamp = String.valueOf(order.getCreatedAt().toEpochMilli());
        String user = order.getUserId().toString().replace("-", "");
        return "ord_" + lastChars(timestamp, 8) + "_" + lastChars(user, 8);
    }

    private static String lastChars(String value, int count) {
        return value.length() <= count ? value : value.substring(value.length() - count);
    }

    private void assertOwnerOrAdmin(Order order, Jwt jwt) {
        UUID userId = UUID.fromString(jwt.getSubject());
        if (!order.getUserId().equals(userId) && !isAdmin(jwt)) {
            log.warn("Access denied: user {} attempted to access order {}", userId, order.getId());
            throw new AccessDeniedException("Access Denied: You do not own this order");
        }
    }

    private void assertAdmin(Jwt jwt) {
        if (!isAdmin(jwt)) {
            log.warn("Access denied: user {} attempted an admin order operation", jwt.getSubject());
            throw new AccessDeniedException("Access Denied: Only administrators can perform this action");
        }
    }

    private boolean isAdmin(Jwt jwt) {
        return extractRoles(jwt).contains(ADMIN_ROLE);
    }

    // realm roles plus this client's roles (Keycloak token layout)
    private List<String> extractRoles(Jwt jwt) {
        List<String> realmRoles = rolesOf(jwt.getClaim("realm_access"));
        List<String> clientRoles = Optional.ofNullable(jwt.getClaim("resource_access"))
                .filter(Map.class::isInstance)
                .map(claim -> ((Map<?, ?>) claim).get(CLIENT_ID))
                .map(this::rolesOf)
                .orElse(List.of());
        return Stream.concat(realmRoles.stream(), clientRoles.stream()).toList();
    }

    private List<String> rolesOf(Object access) {
        return Optional.ofNullable(access)
                .filter(Map.class::isInstance)
                .map(map -> ((Map<?, ?>) map).get("roles"))
                .filter(List.class::isInstance)
                .map(roles -> (List<?>) roles)
                .map(list -> list.stream()
                        .filter(String.class::isInstance)
                        .map(String.class::cast)
                        .toList())
                .orElse(List.of());
    }
}
