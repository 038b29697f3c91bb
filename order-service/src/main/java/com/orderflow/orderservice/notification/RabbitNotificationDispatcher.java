package com.orderflow.orderservice.notification;

import com.orderflow.common.contracts.OrderNotificationContract;
import com.orderflow.common.contracts.ShippingPaymentContract;
import com.orderflow.common.contracts.ShippingPaymentNoticeContract;
import com.orderflow.orderservice.config.AmqpConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

/**
 * Hands notifications to the email/SMS workers over RabbitMQ.
 * Template rendering and delivery happen on their side.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RabbitNotificationDispatcher implements NotificationDispatcher {

    private final RabbitTemplate rabbitTemplate;

    @Override
    public boolean sendOrderConfirmation(OrderNotificationContract order, String email) {
        if (email == null || email.isBlank()) {
            log.warn("No email on order, skipping confirmation. orderId={}", order.getOrderId());
            return false;
        }
        return send(AmqpConfig.ROUTING_KEY_ORDER_CONFIRMATION, order, order);
    }

    @Override
    public boolean sendAdminNewOrderAlert(OrderNotificationContract order) {
        return send(AmqpConfig.ROUTING_KEY_ADMIN_NEW_ORDER, order, order);
    }

    @Override
    public boolean sendOrderStatusUpdate(OrderNotificationContract order, String previousStatus) {
        if (previousStatus != null && previousStatus.equals(order.getStatus())) {
            return true;
        }
        return send(AmqpConfig.ROUTING_KEY_ORDER_STATUS_UPDATE, order, order);
    }

    @Override
    public boolean sendShippingPaymentLink(OrderNotificationContract order, ShippingPaymentContract payload) {
        return send(AmqpConfig.ROUTING_KEY_SHIPPING_PAYMENT_LINK, order,
                ShippingPaymentNoticeContract.builder().order(order).payment(payload).build());
    }

    @Override
    public boolean sendShippingPaymentReceipt(OrderNotificationContract order, ShippingPaymentContract payload) {
        return send(AmqpConfig.ROUTING_KEY_SHIPPING_PAYMENT_RECEIPT, order,
                ShippingPaymentNoticeContract.builder().order(order).payment(payload).build());
    }

    private boolean send(String routingKey, OrderNotificationContract order, Object message) {
        try {
            rabbitTemplate.convertAndSend(AmqpConfig.NOTIFICATION_EXCHANGE, routingKey, message);
            log.info("Notification sent: routingKey={}, orderId={}", routingKey, order.getOrderId());
            return true;
        } catch (AmqpException e) {
            log.error("Failed to send notification: routingKey={}, orderId={}, error={}",
                    routingKey, order.getOrderId(), e.getMessage());
            return false;
        }
    }
}
