package com.orderflow.orderservice.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.orderservice.exception.WebhookPayloadException;
import com.orderflow.orderservice.model.IdempotentEvent;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.RefundHistoryEntry;
import com.orderflow.orderservice.model.RefundRecord;
import com.orderflow.orderservice.model.RefundStatus;
import com.orderflow.orderservice.model.ShippingPayment;
import com.orderflow.orderservice.model.ShippingPaymentStatus;
import com.orderflow.orderservice.model.WebhookInboxEvent;
import com.orderflow.orderservice.repository.IdempotentEventRepository;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.RefundRecordRepository;
import com.orderflow.orderservice.repository.WebhookInboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies stored webhook events to the ledger. Every handler checks the
 * current state before writing, so applying the same event twice leaves the
 * ledger as applying it once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookProcessor {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final WebhookInboxRepository inboxRepository;
    private final IdempotentEventRepository idempotentEventRepository;
    private final OrderRepository orderRepository;
    private final RefundRecordRepository refundRecordRepository;
    private final OrderLedger orderLedger;
    private final OrderOutbox orderOutbox;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    @Lazy
    private WebhookProcessor self;

    /**
     * Applies one inbox row. Failures are recorded on the row and left for
     * WebhookInboxSweeper; undecodable payloads are closed straight away.
     */
    public void process(UUID inboxId) {
        Optional<WebhookInboxEvent> found = inboxRepository.findById(inboxId);
        if (found.isEmpty()) {
            log.warn("Inbox row not found. inboxId={}", inboxId);
            return;
        }
        WebhookInboxEvent inbox = found.get();
        if (inbox.isProcessed()) {
            log.info("Inbox row already processed. Skipping. inboxId={}", inboxId);
            return;
        }

        // First Writer Wins on the gateway delivery id, in its own transaction
        String eventKey = inbox.getGatewayEventId() != null ? "WEBHOOK:" + inbox.getGatewayEventId() : null;
        if (eventKey != null && !self.tryCreateIdempotencyKey(eventKey)) {
            log.warn("Webhook event already applied (idempotency check). Skipping. key={}", eventKey);
            self.markProcessed(inboxId, "duplicate delivery of " + inbox.getGatewayEventId());
            return;
        }

        try {
            self.apply(inboxId);
        } catch (WebhookPayloadException e) {
            log.error("Webhook payload cannot be applied, closing it. inboxId={}, error={}", inboxId, e.getMessage());
            self.markProcessed(inboxId, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Webhook application failed, will retry. inboxId={}, error={}", inboxId, e.getMessage(), e);
            self.markFailed(inboxId, eventKey, e.getMessage());
        }
    }

    @Transactional
    public void apply(UUID inboxId) {
        WebhookInboxEvent inbox = inboxRepository.findById(inboxId)
                .orElseThrow(() -> new WebhookPayloadException("Inbox row vanished: " + inboxId));
        if (inbox.isProcessed()) {
            return;
        }

        JsonNode root = parse(inbox.getPayload());
        String type = root.path("event").asText("");
        JsonNode payload = root.path("payload");
        log.info("Applying webhook event. inboxId={}, type={}", inboxId, type);

        if (type.startsWith("refund.")) {
            applyRefund(type.substring("refund.".length()), payload);
        } else {
            switch (type) {
                case "payment.captured" -> applyCapture(payload);
                case "payment.failed" -> applyPaymentFailure(payload);
                case "payment_link.paid", "payment_link.partially_paid",
                        "payment_link.expired", "payment_link.cancelled" -> applyPaymentLink(type, payload);
                default -> log.warn("Unhandled webhook event type. Ignoring. inboxId={}, type={}", inboxId, type);
            }
        }

        inbox.setProcessed(true);
        inbox.setProcessedAt(Instant.now(clock));
        inbox.setAttempts(inbox.getAttempts() + 1);
        inboxRepository.save(inbox);
    }

    /**
     * Tries to create an idempotency key in a SEPARATE transaction.
     * Returns true if created successfully, false if already exists.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean tryCreateIdempotencyKey(String eventKey) {
        if (idempotentEventRepository.existsById(eventKey)) {
            log.info("Idempotency key already exists (duplicate detected): {}", eventKey);
            return false;
        }

        try {
            idempotentEventRepository.saveAndFlush(IdempotentEvent.builder()
                    .eventKey(eventKey)
                    .createdAt(LocalDateTime.now(clock))
                    .build());
            log.info("Created idempotency key: {}", eventKey);
            return true;
        } catch (DataIntegrityViolationException e) {
            log.info("Idempotency key already exists (duplicate caught by constraint): {}", eventKey);
            return false;
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markProcessed(UUID inboxId, String note) {
        inboxRepository.findById(inboxId).ifPresent(inbox -> {
            inbox.setProcessed(true);
            inbox.setProcessedAt(Instant.now(clock));
            inbox.setAttempts(inbox.getAttempts() + 1);
            inbox.setLastError(truncate(note));
            inboxRepository.save(inbox);
        });
    }

    /**
     * Records a failed attempt. The idempotency key is released so the
     * sweeper's retry is not mistaken for a duplicate.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID inboxId, String eventKey, String error) {
        inboxRepository.findById(inboxId).ifPresent(inbox -> {
            inbox.setAttempts(inbox.getAttempts() + 1);
            inbox.setLastError(truncate(error));
            inboxRepository.save(inbox);
        });
        if (eventKey != null) {
            idempotentEventRepository.deleteById(eventKey);
        }
    }

    private void applyRefund(String refundEvent, JsonNode payload) {
        JsonNode refund = payload.path("refund").path("entity");
        String refundId = text(refund, "id");
        if (refundId == null) {
            throw new WebhookPayloadException("refund." + refundEvent + " without refund id");
        }

        String action = "refund_" + refundEvent;
        RefundRecord record = refundRecordRepository.findByReference(refundId).orElseGet(() -> {
            RefundRecord created = new RefundRecord();
            created.setReference(refundId);
            return created;
        });
        if (record.hasRecorded(action, refundId)) {
            log.warn("Refund event already recorded. Ignoring (idempotency). refundId={}, action={}", refundId, action);
            return;
        }

        RefundStatus reported = switch (refundEvent) {
            case "processed" -> RefundStatus.REFUND_COMPLETED;
            case "failed" -> RefundStatus.REFUND_FAILED;
            default -> RefundStatus.REFUND_INITIATED;
        };
        // a late refund.created must not undo a completed refund
        RefundStatus status = reported.outranks(record.getStatus()) ? reported : record.getStatus();
        if (status != reported) {
            log.warn("Out-of-order refund event, keeping status. refundId={}, reported={}, current={}",
                    refundId, reported, status);
        }
        Instant now = Instant.now(clock);
        BigDecimal amount = refund.hasNonNull("amount") ? fromMinorUnits(refund.path("amount").asLong()) : null;
        UUID orderId = noteOrderId(refund);

        record.setStatus(status);
        if (amount != null) {
            record.setAmount(amount);
        }
        if (text(refund, "payment_id") != null) {
            record.setPaymentId(text(refund, "payment_id"));
        }
        if (orderId != null) {
            record.setOrderId(orderId);
        }
        record.getHistory().add(new RefundHistoryEntry(now, action, refundId));
        refundRecordRepository.save(record);

        if (orderId != null) {
            orderRepository.findById(orderId).ifPresent(order -> {
                order.setRefundId(refundId);
                if (amount != null) {
                    order.setRefundAmount(amount);
                }
                if (order.getRefundStatus() != status) {
                    order.setRefundStatus(status);
                    order.setRefundedAt(now);
                }
                orderRepository.save(order);
            });
        }
        log.info("Refund recorded. refundId={}, status={}, orderId={}", refundId, status, orderId);
    }

    private void applyCapture(JsonNode payload) {
        JsonNode payment = payload.path("payment").path("entity");
        String paymentId = text(payment, "id");
        if (paymentId == null) {
            throw new WebhookPayloadException("payment.captured without payment id");
        }

        Optional<Order> found = locateOrder(payment);
        if (found.isEmpty()) {
            log.warn("No order for captured payment. Ignoring. paymentId={}", paymentId);
            return;
        }
        Order order = found.get();
        if (order.getStatus().isTerminal()) {
            log.warn("Capture for closed order. Ignoring. orderId={}, status={}, paymentId={}",
                    order.getId(), order.getStatus(), paymentId);
            return;
        }
        PaymentStatus current = order.getPaymentStatus();
        if (current != PaymentStatus.PAID && !current.canTransitionTo(PaymentStatus.PAID)) {
            log.warn("Capture does not apply to payment status {}. Ignoring. orderId={}", current, order.getId());
            return;
        }

        if (order.getPaymentId() == null || current != PaymentStatus.PAID) {
            order.setPaymentId(paymentId);
        }
        orderLedger.transitionPayment(order, PaymentStatus.PAID);
        orderRepository.save(order);
        orderLedger.recordPayment(order, paymentId, OrderLedger.LEDGER_CAPTURED);
    }

    private void applyPaymentFailure(JsonNode payload) {
        JsonNode payment = payload.path("payment").path("entity");
        Optional<Order> found = locateOrder(payment);
        if (found.isEmpty()) {
            log.warn("No order for failed payment. Ignoring. paymentId={}", text(payment, "id"));
            return;
        }
        Order order = found.get();
        if (order.getStatus().isTerminal() || order.getPaymentStatus() != PaymentStatus.AWAITING_PAYMENT) {
            log.warn("Payment failure ignored. orderId={}, status={}, paymentStatus={}",
                    order.getId(), order.getStatus(), order.getPaymentStatus());
            return;
        }
        orderLedger.transitionPayment(order, PaymentStatus.FAILED);
    }

    private void applyPaymentLink(String type, JsonNode payload) {
        JsonNode link = payload.path("payment_link").path("entity");
        String linkId = text(link, "id");
        if (linkId == null) {
            throw new WebhookPayloadException(type + " without payment link id");
        }

        Optional<Order> found = orderRepository.findByShippingPaymentLinkId(linkId);
        if (found.isEmpty()) {
            log.warn("No order for payment link. Ignoring. linkId={}", linkId);
            return;
        }
        Order order = found.get();
        ShippingPayment shippingPayment = order.getShippingPayment();
        if (!shippingPayment.getStatus().isOpen()) {
            log.warn("Payment link already closed. Ignoring. orderId={}, linkId={}, status={}, event={}",
                    order.getId(), linkId, shippingPayment.getStatus(), type);
            return;
        }

        ShippingPaymentStatus target = switch (type) {
            case "payment_link.paid" -> ShippingPaymentStatus.PAID;
            case "payment_link.partially_paid" -> ShippingPaymentStatus.PARTIAL;
            case "payment_link.expired" -> ShippingPaymentStatus.EXPIRED;
            default -> ShippingPaymentStatus.CANCELLED;
        };

        boolean changed = false;
        JsonNode payment = payload.path("payment").path("entity");
        String paymentId = text(payment, "id");
        List<String> paymentIds = shippingPayment.getPaymentIds() != null
                ? shippingPayment.getPaymentIds()
                : List.of();
        if (paymentId != null && !paymentIds.contains(paymentId)) {
            List<String> updated = new ArrayList<>(paymentIds);
            updated.add(paymentId);
            shippingPayment.setPaymentIds(updated);
            BigDecimal paid = Optional.ofNullable(shippingPayment.getAmountPaid()).orElse(BigDecimal.ZERO);
            shippingPayment.setAmountPaid(paid.add(fromMinorUnits(payment.path("amount").asLong())));
            changed = true;
        }
        if (shippingPayment.getStatus() != target) {
            shippingPayment.setStatus(target);
            changed = true;
        }

        if (!changed) {
            log.warn("Payment link event changed nothing. Ignoring (idempotency). orderId={}, linkId={}, event={}",
                    order.getId(), linkId, type);
            return;
        }

        shippingPayment.setLastEventAt(Instant.now(clock));
        orderRepository.save(order);
        orderOutbox.shippingPaymentUpdated(order, paymentId);
        log.info("Shipping payment updated. orderId={}, linkId={}, status={}, amountPaid={}",
                order.getId(), linkId, target, shippingPayment.getAmountPaid());
    }

    private Optional<Order> locateOrder(JsonNode payment) {
        UUID orderId = noteOrderId(payment);
        if (orderId != null) {
            Optional<Order> byId = orderRepository.findById(orderId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        String gatewayOrderId = text(payment, "order_id");
        return gatewayOrderId != null ? orderRepository.findByGatewayOrderId(gatewayOrderId) : Optional.empty();
    }

    private UUID noteOrderId(JsonNode entity) {
        String value = text(entity.path("notes"), "orderId");
        if (value == null) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed orderId note: {}", value);
            return null;
        }
    }

    private JsonNode parse(String payload) {
        try {
            return objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new WebhookPayloadException("Undecodable webhook payload: " + e.getOriginalMessage(), e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.isTextual() && !value.asText().isBlank() ? value.asText() : null;
    }

    private static BigDecimal fromMinorUnits(long minor) {
        return BigDecimal.valueOf(minor).movePointLeft(2);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
