package com.orderflow.orderservice.repository;

import com.orderflow.orderservice.model.PaymentLedgerEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentLedgerRepository extends JpaRepository<PaymentLedgerEntry, UUID> {

    Optional<PaymentLedgerEntry> findByPaymentId(String paymentId);

    // Insert-or-update on the unique payment_id so two racing callers end on one row
    @Modifying
    @Query(nativeQuery = true, value = "INSERT INTO payment_ledger "
            + "(id, payment_id, order_id, gateway_order_id, amount, currency, status, method, created_at, updated_at) "
            + "VALUES (gen_random_uuid(), :paymentId, :orderId, :gatewayOrderId, :amount, :currency, :status, :method, now(), now()) "
            + "ON CONFLICT (payment_id) DO UPDATE SET status = EXCLUDED.status, updated_at = now()")
    int upsert(@Param("paymentId") String paymentId,
               @Param("orderId") UUID orderId,
               @Param("gatewayOrderId") String gatewayOrderId,
               @Param("amount") BigDecimal amount,
               @Param("currency") String currency,
               @Param("status") String status,
               @Param("method") String method);
}
