package com.orderflow.orderservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.orderservice.event.WebhookReceivedEvent;
import com.orderflow.orderservice.exception.SignatureInvalidException;
import com.orderflow.orderservice.gateway.PaymentGatewayAdapter;
import com.orderflow.orderservice.gateway.SignatureVerifier;
import com.orderflow.orderservice.model.WebhookInboxEvent;
import com.orderflow.orderservice.repository.WebhookInboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;

/**
 * Entry point for gateway webhooks. Verifies the signature over the exact
 * bytes received, stores the body in the inbox and returns. The event is
 * applied by WebhookProcessor once the inbox row has committed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookReconciler {

    private final PaymentGatewayAdapter paymentGatewayAdapter;
    private final SignatureVerifier signatureVerifier;
    private final WebhookInboxRepository inboxRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @param rawBody        request body exactly as received
     * @param signature      hex HMAC-SHA256 of the body under the webhook secret
     * @param gatewayEventId the gateway's delivery id, if it sent one
     * @return true when the event was stored; false when the signature did not match
     * @throws SignatureInvalidException when the signature is missing or not hex SHA-256
     */
    @Transactional
    public boolean receive(byte[] rawBody, String signature, String gatewayEventId) {
        if (!signatureVerifier.isWellFormed(signature)) {
            log.warn("Webhook rejected: missing or malformed signature header");
            throw new SignatureInvalidException();
        }

        if (!paymentGatewayAdapter.verifyWebhook(rawBody, signature)) {
            log.warn("Webhook signature mismatch. Dropping event. gatewayEventId={}, bytes={}",
                    gatewayEventId, rawBody.length);
            return false;
        }

        String payload = new String(rawBody, StandardCharsets.UTF_8);
        WebhookInboxEvent inbox = inboxRepository.save(WebhookInboxEvent.builder()
                .gatewayEventId(gatewayEventId)
                .eventType(peekEventType(payload))
                .payload(payload)
                .receivedAt(Instant.now(clock))
                .processed(false)
                .attempts(0)
                .build());

        eventPublisher.publishEvent(new WebhookReceivedEvent(inbox.getId(), inbox.getEventType()));
        log.info("Webhook stored in inbox. inboxId={}, type={}, gatewayEventId={}",
                inbox.getId(), inbox.getEventType(), gatewayEventId);
        return true;
    }

    private String peekEventType(String payload) {
        try {
            return objectMapper.readTree(payload).path("event").asText(null);
        } catch (JsonProcessingException e) {
            // stored anyway; the processor records the decode failure on the row
            log.warn("Webhook body is not valid JSON: {}", e.getOriginalMessage());
            return null;
        }
    }
}
