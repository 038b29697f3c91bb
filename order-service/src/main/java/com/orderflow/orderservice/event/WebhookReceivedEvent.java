package com.orderflow.orderservice.event;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Published when a verified webhook body has been stored in the inbox.
 * Handled by a @TransactionalEventListener so the event is applied only
 * AFTER the inbox row has been committed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WebhookReceivedEvent {
    private UUID inboxId;
    private String eventType;
}
