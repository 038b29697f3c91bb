package com.orderflow.orderservice.repository;

import com.orderflow.orderservice.model.Order;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OrderRepository extends JpaRepository<Order, UUID> {

    // customer's own orders, newest first
    List<Order> findByUserIdOrderByCreatedAtDesc(UUID userId);

    Optional<Order> findByOrderNumber(String orderNumber);

    Optional<Order> findByGatewayOrderId(String gatewayOrderId);

    Optional<Order> findByShippingPaymentLinkId(String linkId);

    boolean existsByOrderNumber(String orderNumber);

    // StockLedger claim: only the first caller flips the flag
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Order o SET o.inventoryCommitted = true WHERE o.id = :id AND o.inventoryCommitted = false")
    int markInventoryCommitted(@Param("id") UUID id);

    @Modifying(flushAutomatically = true)
    @Query("UPDATE Order o SET o.inventoryCommitted = false WHERE o.id = :id AND o.inventoryCommitted = true")
    int releaseInventoryCommitted(@Param("id") UUID id);
}
