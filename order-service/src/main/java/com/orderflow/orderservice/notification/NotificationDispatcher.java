package com.orderflow.orderservice.notification;

import com.orderflow.common.contracts.OrderNotificationContract;
import com.orderflow.common.contracts.ShippingPaymentContract;

/**
 * Customer and operator notifications. Every method is best-effort:
 * it reports failure through its return value and must not throw.
 */
public interface NotificationDispatcher {

    boolean sendOrderConfirmation(OrderNotificationContract order, String email);

    boolean sendAdminNewOrderAlert(OrderNotificationContract order);

    boolean sendOrderStatusUpdate(OrderNotificationContract order, String previousStatus);

    boolean sendShippingPaymentLink(OrderNotificationContract order, ShippingPaymentContract payload);

    boolean sendShippingPaymentReceipt(OrderNotificationContract order, ShippingPaymentContract payload);
}
