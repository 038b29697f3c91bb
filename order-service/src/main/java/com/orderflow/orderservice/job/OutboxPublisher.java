package com.orderflow.orderservice.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.contracts.OrderNotificationContract;
import com.orderflow.common.contracts.ShippingPaymentNoticeContract;
import com.orderflow.orderservice.model.OutboxEvent;
import com.orderflow.orderservice.model.OutboxEventType;
import com.orderflow.orderservice.notification.NotificationDispatcher;
import com.orderflow.orderservice.repository.OutboxRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Delivers outbox events to the NotificationDispatcher after the ledger
 * transaction that wrote them has committed. A failed dispatch leaves the
 * event unprocessed for the next run; it never reaches the order flow.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

  private final OutboxRepository outboxRepository;
  private final NotificationDispatcher notificationDispatcher;
  private final ObjectMapper objectMapper;

  @Scheduled(fixedDelay = 2000)
  @Transactional
  public void publishOutboxEvents() {
    List<OutboxEvent> events = outboxRepository.findTop50ByProcessedFalseOrderByCreatedAtAsc();

    if (events.isEmpty()) {
      return;
    }

    log.debug("Found {} outbox events to publish", events.size());

    for (OutboxEvent event : events) {
      try {
        if (dispatch(event)) {
          event.setProcessed(true);
          outboxRepository.save(event);
          log.info("Published outbox event: id={}, type={}", event.getId(), event.getType());
        } else {
          log.warn("Outbox event not delivered, will retry: id={}, type={}", event.getId(), event.getType());
        }
      } catch (JsonProcessingException e) {
        // a payload that cannot be read now never will be
        log.error("Unreadable outbox payload, dropping: id={}, type={}", event.getId(), event.getType(), e);
        event.setProcessed(true);
        outboxRepository.save(event);
      } catch (Exception e) {
        log.error("Failed to publish outbox event: id={}", event.getId(), e);
      }
    }
  }

  private boolean dispatch(OutboxEvent event) throws JsonProcessingException {
    Optional<OutboxEventType> type = OutboxEventType.fromValue(event.getType());
    if (type.isEmpty()) {
      log.warn("Unknown outbox event type, skipping: id={}, type={}", event.getId(), event.getType());
      return true;
    }

    switch (type.get()) {
      case ORDER_CREATED -> {
        OrderNotificationContract order = readOrder(event);
        return notificationDispatcher.sendOrderConfirmation(order, order.getCustomerEmail());
      }
      case ADMIN_NEW_ORDER -> {
        return notificationDispatcher.sendAdminNewOrderAlert(readOrder(event));
      }
      case ORDER_STATUS_CHANGED -> {
        OrderNotificationContract order = readOrder(event);
        return notificationDispatcher.sendOrderStatusUpdate(order, order.getPreviousStatus());
      }
      case SHIPPING_PAYMENT_LINK_CREATED -> {
        ShippingPaymentNoticeContract notice = readNotice(event);
        return notificationDispatcher.sendShippingPaymentLink(notice.getOrder(), notice.getPayment());
      }
      case SHIPPING_PAYMENT_UPDATED -> {
        ShippingPaymentNoticeContract notice = readNotice(event);
        return notificationDispatcher.sendShippingPaymentReceipt(notice.getOrder(), notice.getPayment());
      }
      default -> {
        return true;
      }
    }
  }

  private OrderNotificationContract readOrder(OutboxEvent event) throws JsonProcessingException {
    return objectMapper.readValue(event.getPayload(), OrderNotificationContract.class);
  }

  private ShippingPaymentNoticeContract readNotice(OutboxEvent event) throws JsonProcessingException {
    return objectMapper.readValue(event.getPayload(), ShippingPaymentNoticeContract.class);
  }

  @Scheduled(cron = "0 0 3 * * *")
  @Transactional
  public void cleanupProcessedEvents() {
    LocalDateTime cutoff = LocalDateTime.now().minusDays(1);
    log.info("Starting cleanup of processed outbox events older than {}", cutoff);

    int totalDeleted = 0;
    while (true) {
      List<OutboxEvent> batch = outboxRepository.findTop1000ByProcessedTrueAndCreatedAtBefore(cutoff);
      if (batch.isEmpty()) {
        break;
      }
      outboxRepository.deleteAll(batch);
      totalDeleted += batch.size();
      log.debug("Deleted batch of {} processed events", batch.size());
    }

    log.info("Cleanup completed. Total deleted: {}", totalDeleted);
  }
}
