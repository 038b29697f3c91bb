package com.orderflow.orderservice.service;

import com.orderflow.common.exception.ResourceNotFoundException;
import com.orderflow.common.model.Address;
import com.orderflow.orderservice.dto.GstDetails;
import com.orderflow.orderservice.dto.OrderItemRequest;
import com.orderflow.orderservice.dto.OrderRequest;
import com.orderflow.orderservice.exception.InvalidOrderStateException;
import com.orderflow.orderservice.model.Cart;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderItem;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.PaymentMethod;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.Product;
import com.orderflow.orderservice.repository.CartRepository;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Transactional steps of order creation. The gateway call sits between
 * {@link #placeOrder} and {@link #attachIntent} and runs outside any
 * transaction, see OrderServiceImpl#createOrder.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderPlacementService {

    private static final int MAX_ORDER_NUMBER_ATTEMPTS = 5;

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;
    private final CartRepository cartRepository;
    private final QuantityResolver quantityResolver;
    private final PricingEngine pricingEngine;
    private final StockLedger stockLedger;
    private final OrderOutbox orderOutbox;
    private final Clock clock;
    private final SecureRandom random = new SecureRandom();

    /**
     * Resolves quantities, prices the cart, stores the PENDING order and
     * commits its stock. A lost stock race throws StockConflictException and
     * rolls the whole thing back, so no pending order is left behind.
     */
    @Transactional
    public Order placeOrder(OrderRequest request, UUID userId) {
        Map<UUID, Integer> desired = desiredQuantities(request, userId);

        Map<UUID, Product> products = productRepository.findAllById(desired.keySet()).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
        log.info("Fetched {} products for checkout. userId={}", products.size(), userId);

        List<OrderItem> items = new ArrayList<>();
        List<PricedLine> pricedLines = new ArrayList<>();
        int lineNo = 0;
        for (Map.Entry<UUID, Integer> line : desired.entrySet()) {
            Product product = products.get(line.getKey());
            if (product == null) {
                log.warn("Product not found: productId={}", line.getKey());
                throw new ResourceNotFoundException("Product not found: " + line.getKey());
            }
            if (!Boolean.TRUE.equals(product.getActive())) {
                log.warn("Product not available: productId={}, name={}", product.getId(), product.getName());
                throw new InvalidOrderStateException("Product is not available: " + product.getName());
            }

            int quantity = quantityResolver.resolveLine(product, line.getValue());
            BigDecimal unitPrice = product.unitPriceFor(quantity);

            OrderItem item = new OrderItem();
            item.setLineNo(lineNo++);
            item.setProductId(product.getId());
            item.setProductName(product.getName());
            item.setImageUrl(product.getImageUrl());
            item.setUnitPrice(unitPrice);
            item.setQuantity(quantity);
            items.add(item);

            pricedLines.add(new PricedLine(product.getId(), unitPrice, quantity));
        }

        GstDetails gst = request.getGst() != null ? request.getGst().resolve() : GstDetails.none();
        PricingResult pricing = pricingEngine.price(pricedLines, BigDecimal.ZERO, gst);
        log.info("Cart priced. subtotal={}, tax={}, shipping={}, total={}",
                pricing.getSubtotal(), pricing.getTax(), pricing.getShipping(), pricing.getTotal());

        Address shippingAddress = request.getShippingAddress();
        Order order = new Order();
        order.setOrderNumber(nextOrderNumber());
        order.setUserId(userId);
        order.setCustomerEmail(request.getEmail().trim());
        order.setCustomerName(shippingAddress.getFullName());
        order.setCustomerPhone(shippingAddress.getPhone());
        order.setShippingAddress(shippingAddress);
        order.setBillingAddress(request.getBillingAddress() != null ? request.getBillingAddress() : shippingAddress);
        order.setPaymentMethod(request.getPaymentMethod());
        order.setStatus(OrderStatus.PENDING);
        order.setPaymentStatus(request.getPaymentMethod() == PaymentMethod.CASH_ON_DELIVERY
                ? PaymentStatus.COD_PENDING
                : PaymentStatus.AWAITING_PAYMENT);
        order.setSubtotal(pricing.getSubtotal());
        order.setTax(pricing.getTax());
        order.setShipping(pricing.getShipping());
        order.setDiscount(pricing.getDiscount());
        order.setTotal(pricing.getTotal());
        order.setGst(pricing.getGst());
        order.setCustomerNotes(request.getCustomerNotes());
        order.setInventoryCommitted(false);

        items.forEach(item -> item.setOrder(order));
        order.setItems(items);

        Order savedOrder = orderRepository.saveAndFlush(order);
        log.info("Order saved to database. orderId={}, orderNumber={}", savedOrder.getId(), savedOrder.getOrderNumber());

        stockLedger.decrementForOrder(savedOrder.getId());
        return savedOrder;
    }

    @Transactional
    public Order attachIntent(UUID orderId, String gatewayOrderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
        order.setGatewayOrderId(gatewayOrderId);
        Order saved = orderRepository.save(order);

        orderOutbox.orderPlaced(saved);
        log.info("Payment intent attached. orderId={}, gatewayOrderId={}", orderId, gatewayOrderId);
        return saved;
    }

    /**
     * Compensation when the payment intent could not be opened: give the
     * stock back and remove the order.
     */
    @Transactional
    public void discardOrder(UUID orderId) {
        stockLedger.restoreForOrder(orderId);
        orderRepository.deleteById(orderId);
        log.warn("Order discarded after failed payment intent. orderId={}", orderId);
    }

    private Map<UUID, Integer> desiredQuantities(OrderRequest request, UUID userId) {
        // same product twice in one cart counts as one line
        Map<UUID, Integer> desired = new LinkedHashMap<>();
        if (request.getItems() != null && !request.getItems().isEmpty()) {
            for (OrderItemRequest item : request.getItems()) {
                desired.merge(item.getProductId(), item.getQuantity(), OrderPlacementService::addQuantities);
            }
            return desired;
        }

        Cart cart = cartRepository.findByUserId(userId)
                .orElseThrow(() -> new IllegalArgumentException("Cart is empty"));
        cart.getItems().forEach(item -> desired.merge(item.getProductId(), item.getQuantity(),
                OrderPlacementService::addQuantities));
        if (desired.isEmpty()) {
            throw new IllegalArgumentException("Cart is empty");
        }
        return desired;
    }

    // saturates so the manual-sales threshold still sees an oversized total
    static int addQuantities(int a, int b) {
        return (int) Math.min((long) a + b, Integer.MAX_VALUE);
    }

    private String nextOrderNumber() {
        for (int attempt = 0; attempt < MAX_ORDER_NUMBER_ATTEMPTS; attempt++) {
            String candidate = String.format("ORD%d%03d", clock.millis(), random.nextInt(1000));
            if (!orderRepository.existsByOrderNumber(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not allocate a unique order number");
    }
}
