package com.orderflow.orderservice.subscriber;

import com.orderflow.orderservice.config.AsyncConfig;
import com.orderflow.orderservice.event.WebhookReceivedEvent;
import com.orderflow.orderservice.service.WebhookProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Applies a webhook off the request thread once its inbox row has committed.
 * The endpoint has already answered the gateway by then.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookEventSubscriber {

    private final WebhookProcessor webhookProcessor;

    @Async(AsyncConfig.WEBHOOK_EXECUTOR)
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onWebhookReceived(WebhookReceivedEvent event) {
        log.info("Received webhook event after inbox commit. inboxId={}, type={}",
                event.getInboxId(), event.getEventType());
        webhookProcessor.process(event.getInboxId());
    }
}
