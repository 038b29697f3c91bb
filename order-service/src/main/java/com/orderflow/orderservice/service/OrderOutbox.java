package com.orderflow.orderservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.contracts.OrderNotificationContract;
import com.orderflow.common.contracts.ShippingPaymentContract;
import com.orderflow.common.contracts.ShippingPaymentNoticeContract;
import com.orderflow.orderservice.mapper.OrderMapper;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.OutboxEvent;
import com.orderflow.orderservice.model.OutboxEventType;
import com.orderflow.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Writes notification events into the outbox table inside the caller's
 * transaction. Nothing is sent from here; OutboxPublisher delivers them
 * after commit.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OrderOutbox {

    private final OutboxRepository outboxRepository;
    private final OrderMapper orderMapper;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public void orderPlaced(Order order) {
        OrderNotificationContract contract = orderMapper.toNotificationContract(order);
        save(order, OutboxEventType.ORDER_CREATED, contract);
        save(order, OutboxEventType.ADMIN_NEW_ORDER, contract);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void statusChanged(Order order, OrderStatus previousStatus) {
        OrderNotificationContract contract = orderMapper.toNotificationContract(order);
        contract.setPreviousStatus(previousStatus.name());
        save(order, OutboxEventType.ORDER_STATUS_CHANGED, contract);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void shippingLinkCreated(Order order) {
        save(order, OutboxEventType.SHIPPING_PAYMENT_LINK_CREATED, notice(order, null));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public void shippingPaymentUpdated(Order order, String paymentId) {
        save(order, OutboxEventType.SHIPPING_PAYMENT_UPDATED, notice(order, paymentId));
    }

    private ShippingPaymentNoticeContract notice(Order order, String paymentId) {
        ShippingPaymentContract payment = orderMapper.toShippingPaymentContract(order);
        payment.setPaymentId(paymentId);
        return ShippingPaymentNoticeContract.builder()
                .order(orderMapper.toNotificationContract(order))
                .payment(payment)
                .build();
    }

    private void save(Order order, OutboxEventType type, Object payloadObj) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(payloadObj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize outbox event " + type.value(), e);
        }

        OutboxEvent event = OutboxEvent.builder()
                .aggregateType("ORDER")
                .aggregateId(order.getId().toString())
                .type(type.value())
                .payload(payload)
                .createdAt(LocalDateTime.now())
                .processed(false)
                .build();
        outboxRepository.save(event);
        log.info("'{}' event saved to Outbox. orderId={}", type.value(), order.getId());
    }
}
