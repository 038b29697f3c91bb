package com.orderflow.orderservice;

import com.orderflow.orderservice.exception.StockConflictException;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderItem;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.PaymentMethod;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.Product;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.ProductRepository;
import com.orderflow.orderservice.service.StockLedger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class StockConcurrencyIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private StockLedger stockLedger;

    @Autowired
    private OrderRepository orderRepository;

    @Autowired
    private ProductRepository productRepository;

    @AfterEach
    void cleanup() {
        orderRepository.deleteAll();
        productRepository.deleteAll();
    }

    @Test
    void concurrent_decrements_for_the_last_units_yield_one_winner() throws Exception {
        // ARRANGE: exactly enough stock for one of the two orders
        Product product = productRepository.save(product(10));
        UUID first = orderRepository.save(pendingOrder(product, 10)).getId();
        UUID second = orderRepository.save(pendingOrder(product, 10)).getId();

        // ACT: both threads start together
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<StockLedger.Outcome>> results = new ArrayList<>();
        for (UUID orderId : List.of(first, second)) {
            Callable<StockLedger.Outcome> task = () -> {
                start.await();
                return stockLedger.decrementForOrder(orderId);
            };
            results.add(pool.submit(task));
        }
        start.countDown();

        int committed = 0;
        int conflicts = 0;
        for (Future<StockLedger.Outcome> result : results) {
            try {
                assertEquals(StockLedger.Outcome.COMMITTED, result.get(20, TimeUnit.SECONDS));
                committed++;
            } catch (ExecutionException e) {
                assertInstanceOf(StockConflictException.class, e.getCause());
                conflicts++;
            }
        }
        pool.shutdown();

        // ASSERT
        assertEquals(1, committed);
        assertEquals(1, conflicts);
        assertEquals(0, productRepository.findById(product.getId()).orElseThrow().getStockQuantity());

        long flagged = orderRepository.findAllById(List.of(first, second)).stream()
                .filter(Order::isInventoryCommitted)
                .count();
        assertEquals(1, flagged, "the losing order's claim must roll back with its decrement");
    }

    @Test
    void decrement_twice_for_the_same_order_takes_stock_once() {
        Product product = productRepository.save(product(25));
        UUID orderId = orderRepository.save(pendingOrder(product, 10)).getId();

        assertEquals(StockLedger.Outcome.COMMITTED, stockLedger.decrementForOrder(orderId));
        assertEquals(StockLedger.Outcome.ALREADY_COMMITTED, stockLedger.decrementForOrder(orderId));

        assertEquals(15, productRepository.findById(product.getId()).orElseThrow().getStockQuantity());
    }

    @Test
    void restore_after_decrement_returns_stock_once() {
        Product product = productRepository.save(product(25));
        UUID orderId = orderRepository.save(pendingOrder(product, 10)).getId();
        stockLedger.decrementForOrder(orderId);

        assertEquals(StockLedger.Outcome.RESTORED, stockLedger.restoreForOrder(orderId));
        assertEquals(StockLedger.Outcome.NOTHING_TO_RESTORE, stockLedger.restoreForOrder(orderId));

        assertEquals(25, productRepository.findById(product.getId()).orElseThrow().getStockQuantity());
    }

    public static Product product(int stock) {
        return Product.builder()
                .name("Hex bolt M8")
                .basePrice(new BigDecimal("100"))
                .stockQuantity(stock)
                .build();
    }

    public static Order pendingOrder(Product product, int quantity) {
        Order order = new Order();
        order.setOrderNumber("ORD" + System.nanoTime());
        order.setUserId(UUID.randomUUID());
        order.setPaymentMethod(PaymentMethod.GATEWAY);
        order.setStatus(OrderStatus.PENDING);
        order.setPaymentStatus(PaymentStatus.AWAITING_PAYMENT);
        BigDecimal subtotal = product.getBasePrice().multiply(BigDecimal.valueOf(quantity));
        order.setSubtotal(subtotal);
        order.setTax(BigDecimal.ZERO);
        order.setShipping(BigDecimal.ZERO);
        order.setTotal(subtotal);

        OrderItem item = new OrderItem();
        item.setLineNo(0);
        item.setOrder(order);
        item.setProductId(product.getId());
        item.setProductName(product.getName());
        item.setUnitPrice(product.getBasePrice());
        item.setQuantity(quantity);
        order.getItems().add(item);
        return order;
    }
}
