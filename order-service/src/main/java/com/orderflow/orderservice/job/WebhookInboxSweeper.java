package com.orderflow.orderservice.job;

import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.model.WebhookInboxEvent;
import com.orderflow.orderservice.repository.IdempotentEventRepository;
import com.orderflow.orderservice.repository.WebhookInboxRepository;
import com.orderflow.orderservice.service.WebhookProcessor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Retries inbox rows the async listener did not finish (crash, pool
 * rejection, transient failure) and prunes what is no longer needed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookInboxSweeper {

    private final WebhookInboxRepository inboxRepository;
    private final IdempotentEventRepository idempotentEventRepository;
    private final WebhookProcessor webhookProcessor;
    private final OrderflowProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${orderflow.webhook.sweep-interval-ms:30000}")
    public void retryUnprocessed() {
        OrderflowProperties.Webhook webhook = properties.getWebhook();
        Instant cutoff = Instant.now(clock).minus(webhook.getRetryAfter());

        List<WebhookInboxEvent> pending = inboxRepository
                .findTop50ByProcessedFalseAndReceivedAtBeforeAndAttemptsLessThanOrderByReceivedAtAsc(
                        cutoff, webhook.getMaxAttempts());
        if (pending.isEmpty()) {
            return;
        }

        log.info("Retrying {} unprocessed webhook events", pending.size());
        for (WebhookInboxEvent inbox : pending) {
            webhookProcessor.process(inbox.getId());
        }
    }

    // Runs every day at 3 AM
    @Scheduled(cron = "0 0 3 * * *")
    @Transactional
    public void cleanup() {
        Instant inboxCutoff = Instant.now(clock).minus(properties.getWebhook().getIdempotencyTtl());
        List<WebhookInboxEvent> processed = inboxRepository.findTop1000ByProcessedTrueAndReceivedAtBefore(inboxCutoff);
        if (!processed.isEmpty()) {
            inboxRepository.deleteAll(processed);
            log.info("Cleaned up {} processed webhook inbox rows", processed.size());
        }

        LocalDateTime keyCutoff = LocalDateTime.now(clock).minus(properties.getWebhook().getIdempotencyTtl());
        int deleted = idempotentEventRepository.deleteOlderThan(keyCutoff);
        if (deleted > 0) {
            log.info("Cleaned up {} expired idempotency keys", deleted);
        }
    }
}
