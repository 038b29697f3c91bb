package com.orderflow.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One row per gateway payment id. Written through
 * PaymentLedgerRepository#upsert so repeated verification calls and
 * capture webhooks converge on the same row.
 */
@Entity
@Table(name = "payment_ledger")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentLedgerEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "payment_id", nullable = false, unique = true)
  private String paymentId;

  @Column(name = "order_id", nullable = false)
  private UUID orderId;

  @Column(name = "gateway_order_id")
  private String gatewayOrderId;

  @Column(nullable = false)
  private BigDecimal amount;

  @Column(nullable = false)
  private String currency;

  @Column(nullable = false)
  private String status;

  @Column(nullable = false)
  private String method;

  @Column(name = "created_at", nullable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;
}
