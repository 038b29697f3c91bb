package com.orderflow.orderservice.controller;

import com.orderflow.orderservice.service.WebhookReconciler;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "X-Signature";
    static final String EVENT_ID_HEADER = "X-Event-Id";

    private final WebhookReconciler webhookReconciler;

    // body stays byte[]: the signature covers the exact bytes sent
    @PostMapping("/payments")
    public ResponseEntity<Map<String, String>> receivePaymentEvent(
            @RequestBody byte[] rawBody,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(value = EVENT_ID_HEADER, required = false) String eventId) {
        // a mismatched signature is still acknowledged so the gateway stops redelivering it
        webhookReconciler.receive(rawBody, signature, eventId);
        return ResponseEntity.ok(Map.of("status", "ok"));
    }
}
