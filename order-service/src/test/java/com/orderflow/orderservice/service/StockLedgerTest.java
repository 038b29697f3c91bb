package com.orderflow.orderservice.service;

import com.orderflow.orderservice.exception.StockConflictException;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OrderItem;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.ProductRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class StockLedgerTest {

    @Mock
    private OrderRepository orderRepository;
    @Mock
    private ProductRepository productRepository;

    @InjectMocks
    private StockLedger stockLedger;

    private Order order;
    private UUID boltId;
    private UUID nutId;

    @BeforeEach
    void setUp() {
        boltId = UUID.randomUUID();
        nutId = UUID.randomUUID();

        order = new Order();
        order.setId(UUID.randomUUID());
        order.setItems(new ArrayList<>());
        order.getItems().add(item(boltId, 10));
        order.getItems().add(item(nutId, 20));

        when(orderRepository.findById(order.getId())).thenReturn(Optional.of(order));
    }

    @Test
    void decrementForOrder_DecrementsEveryLineOnce() {
        when(orderRepository.markInventoryCommitted(order.getId())).thenReturn(1);
        when(productRepository.decreaseStock(any(UUID.class), anyInt())).thenReturn(1);

        StockLedger.Outcome outcome = stockLedger.decrementForOrder(order.getId());

        assertThat(outcome).isEqualTo(StockLedger.Outcome.COMMITTED);
        verify(productRepository).decreaseStock(boltId, 10);
        verify(productRepository).decreaseStock(nutId, 20);
    }

    @Test
    void decrementForOrder_SecondCallIsNoOp() {
        when(orderRepository.markInventoryCommitted(order.getId())).thenReturn(0);

        StockLedger.Outcome outcome = stockLedger.decrementForOrder(order.getId());

        assertThat(outcome).isEqualTo(StockLedger.Outcome.ALREADY_COMMITTED);
        verifyNoInteractions(productRepository);
    }

    @Test
    void decrementForOrder_ThrowsConflictWhenStockRaceLost() {
        when(orderRepository.markInventoryCommitted(order.getId())).thenReturn(1);
        when(productRepository.decreaseStock(boltId, 10)).thenReturn(1);
        when(productRepository.decreaseStock(nutId, 20)).thenReturn(0);

        assertThatThrownBy(() -> stockLedger.decrementForOrder(order.getId()))
                .isInstanceOf(StockConflictException.class);
    }

    @Test
    void restoreForOrder_IncrementsEveryLine() {
        when(orderRepository.releaseInventoryCommitted(order.getId())).thenReturn(1);

        StockLedger.Outcome outcome = stockLedger.restoreForOrder(order.getId());

        assertThat(outcome).isEqualTo(StockLedger.Outcome.RESTORED);
        verify(productRepository).increaseStock(boltId, 10);
        verify(productRepository).increaseStock(nutId, 20);
    }

    @Test
    void restoreForOrder_WithoutCommittedStockIsNoOp() {
        when(orderRepository.releaseInventoryCommitted(order.getId())).thenReturn(0);

        StockLedger.Outcome outcome = stockLedger.restoreForOrder(order.getId());

        assertThat(outcome).isEqualTo(StockLedger.Outcome.NOTHING_TO_RESTORE);
        verifyNoInteractions(productRepository);
    }

    private OrderItem item(UUID productId, int quantity) {
        OrderItem item = new OrderItem();
        item.setProductId(productId);
        item.setQuantity(quantity);
        return item;
    }
}
