package com.orderflow.orderservice.service;

import com.orderflow.common.exception.ResourceNotFoundException;
import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.exception.InvalidOrderStateException;
import com.orderflow.orderservice.exception.TerminalStateException;
import com.orderflow.orderservice.gateway.PaymentLink;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.ShippingPackage;
import com.orderflow.orderservice.model.ShippingPayment;
import com.orderflow.orderservice.model.ShippingPaymentStatus;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.PaymentLedgerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.UUID;

/**
 * Order and payment state machines. Every mutation of an existing order
 * goes through here so terminal orders are rejected in one place and every
 * status change leaves an outbox event behind.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderLedger {

    // payment_ledger.status for a captured gateway payment
    public static final String LEDGER_CAPTURED = "captured";

    private final OrderRepository orderRepository;
    private final PaymentLedgerRepository paymentLedgerRepository;
    private final StockLedger stockLedger;
    private final OrderOutbox orderOutbox;
    private final OrderflowProperties properties;
    private final Clock clock;

    public Order getOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order not found with id: " + orderId);
                });
    }

    public void assertMutable(Order order) {
        if (order.getStatus().isTerminal()) {
            log.warn("Mutation attempted on closed order: orderId={}, status={}", order.getId(), order.getStatus());
            throw new TerminalStateException(order.getOrderNumber(), order.getStatus());
        }
    }

    /**
     * Moves the fulfilment status forward (or to CANCELLED) and applies the
     * side effects of the target state.
     *
     * @return the previous status
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OrderStatus transitionStatus(Order order, OrderStatus target) {
        assertMutable(order);

        OrderStatus previous = order.getStatus();
        if (!previous.canTransitionTo(target)) {
            log.warn("Invalid state transition: orderId={}, currentStatus={}, target={}",
                    order.getId(), previous, target);
            throw new InvalidOrderStateException(
                    "Cannot move order " + order.getOrderNumber() + " from " + previous + " to " + target);
        }

        Instant now = Instant.now(clock);
        switch (target) {
            case SHIPPED -> order.setShippedAt(now);
            case DELIVERED -> order.setDeliveredAt(now);
            case CANCELLED -> {
                order.setCancelledAt(now);
                stockLedger.restoreForOrder(order.getId());
            }
            default -> {
            }
        }

        order.setStatus(target);
        orderRepository.save(order);
        orderOutbox.statusChanged(order, previous);

        log.info("Order status updated: orderId={}, from={}, to={}", order.getId(), previous, target);
        return previous;
    }

    /**
     * @return false when the order already had this payment status
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean transitionPayment(Order order, PaymentStatus target) {
        PaymentStatus current = order.getPaymentStatus();
        if (current == target) {
            log.warn("Payment status already {}. Ignoring (idempotency). orderId={}", target, order.getId());
            return false;
        }
        assertMutable(order);

        if (!current.canTransitionTo(target)) {
            log.warn("Invalid payment transition: orderId={}, currentPaymentStatus={}, target={}",
                    order.getId(), current, target);
            throw new InvalidOrderStateException(
                    "Cannot move payment of order " + order.getOrderNumber() + " from " + current + " to " + target);
        }

        order.setPaymentStatus(target);
        if (target.isSettled()) {
            order.setPaidAt(Instant.now(clock));
            // payment never confirms the order; an operator does after review
            if (order.getStatus() == OrderStatus.PENDING) {
                transitionStatus(order, OrderStatus.PROCESSING);
            }
        }
        orderRepository.save(order);

        log.info("Payment status updated: orderId={}, from={}, to={}", order.getId(), current, target);
        return true;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void recordPayment(Order order, String paymentId, String status) {
        paymentLedgerRepository.upsert(paymentId, order.getId(), order.getGatewayOrderId(), order.getTotal(),
                properties.getPricing().getCurrency(), status, order.getPaymentMethod().name());
        log.info("Payment ledger entry upserted: orderId={}, paymentId={}, status={}", order.getId(), paymentId, status);
    }

    @Transactional
    public Order updatePackage(UUID orderId, ShippingPackage shippingPackage) {
        Order order = getOrder(orderId);
        assertMutable(order);

        shippingPackage.setPackedAt(Instant.now(clock));
        order.setShippingPackage(shippingPackage);
        Order saved = orderRepository.save(order);
        log.info("Shipping package saved: orderId={}, images={}", orderId, shippingPackage.getImages().size());
        return saved;
    }

    @Transactional(readOnly = true)
    public Order prepareShippingLink(UUID orderId) {
        Order order = getOrder(orderId);
        assertMutable(order);
        assertNoOpenLink(order);
        return order;
    }

    @Transactional
    public Order attachShippingLink(UUID orderId, PaymentLink link, BigDecimal amount, String currency) {
        Order order = getOrder(orderId);
        assertMutable(order);
        assertNoOpenLink(order);

        ShippingPayment shippingPayment = new ShippingPayment();
        shippingPayment.setLinkId(link.getLinkId());
        shippingPayment.setShortUrl(link.getShortUrl());
        shippingPayment.setStatus(ShippingPaymentStatus.PENDING);
        shippingPayment.setCurrency(currency);
        shippingPayment.setAmount(amount);
        shippingPayment.setAmountPaid(BigDecimal.ZERO);
        shippingPayment.setPaymentIds(new ArrayList<>());
        shippingPayment.setLastEventAt(Instant.now(clock));
        order.setShippingPayment(shippingPayment);

        Order saved = orderRepository.save(order);
        orderOutbox.shippingLinkCreated(saved);
        log.info("Shipping payment link attached: orderId={}, linkId={}", orderId, link.getLinkId());
        return saved;
    }

    private void assertNoOpenLink(Order order) {
        ShippingPayment existing = order.getShippingPayment();
        if (existing != null && existing.getStatus() != null && existing.getStatus().isOpen()) {
            throw new InvalidOrderStateException(
                    "Order " + order.getOrderNumber() + " already has an open shipping payment link");
        }
    }

}
