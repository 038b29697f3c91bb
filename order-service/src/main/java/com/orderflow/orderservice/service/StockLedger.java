package com.orderflow.orderservice.service;

import com.orderflow.common.exception.ResourceNotFoundException;
import com.orderflow.orderservice.exception.StockConflictException;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderItem;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Moves product stock for whole orders.
 *
 * The decrement runs in one database transaction together with the claim on
 * the order's inventoryCommitted flag: if any line's conditional update finds
 * too little stock, the exception rolls back every line and the claim. The
 * flag makes a retried call on an already committed order a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StockLedger {

    public enum Outcome {
        COMMITTED,
        ALREADY_COMMITTED,
        RESTORED,
        NOTHING_TO_RESTORE
    }

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    @Transactional
    public Outcome decrementForOrder(UUID orderId) {
        Order order = loadOrder(orderId);

        if (orderRepository.markInventoryCommitted(orderId) == 0) {
            log.warn("Stock already committed for order. Ignoring (idempotency). orderId={}", orderId);
            return Outcome.ALREADY_COMMITTED;
        }

        for (OrderItem item : order.getItems()) {
            int updatedRows = productRepository.decreaseStock(item.getProductId(), item.getQuantity());
            if (updatedRows == 0) {
                log.warn("Stock decrement lost: orderId={}, productId={}, quantity={}",
                        orderId, item.getProductId(), item.getQuantity());
                throw new StockConflictException(item.getProductId(), item.getQuantity());
            }
        }

        log.info("Stock committed for order: orderId={}, lines={}", orderId, order.getItems().size());
        return Outcome.COMMITTED;
    }

    @Transactional
    public Outcome restoreForOrder(UUID orderId) {
        Order order = loadOrder(orderId);

        if (orderRepository.releaseInventoryCommitted(orderId) == 0) {
            log.warn("No committed stock to restore. Ignoring (idempotency). orderId={}", orderId);
            return Outcome.NOTHING_TO_RESTORE;
        }

        for (OrderItem item : order.getItems()) {
            productRepository.increaseStock(item.getProductId(), item.getQuantity());
        }

        log.info("Stock restored for order: orderId={}, lines={}", orderId, order.getItems().size());
        return Outcome.RESTORED;
    }

    private Order loadOrder(UUID orderId) {
        return orderRepository.findById(orderId)
                .orElseThrow(() -> new ResourceNotFoundException("Order not found with id: " + orderId));
    }
}
