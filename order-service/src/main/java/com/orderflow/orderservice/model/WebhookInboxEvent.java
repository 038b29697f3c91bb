package com.orderflow.orderservice.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Verified gateway webhook body, stored exactly as received before the
 * endpoint acknowledges. Applied later by WebhookEventSubscriber.
 */
@Entity
@Table(name = "webhook_inbox")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookInboxEvent {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  // x-razorpay-event-id style header when the gateway sends one
  @Column(name = "gateway_event_id")
  private String gatewayEventId;

  @Column(name = "event_type")
  private String eventType;

  @Column(columnDefinition = "text", nullable = false)
  private String payload;

  @Column(nullable = false)
  private Instant receivedAt;

  @Column(nullable = false)
  private boolean processed;

  @Column(nullable = false)
  private int attempts;

  @Column(length = 1000)
  private String lastError;

  private Instant processedAt;
}
