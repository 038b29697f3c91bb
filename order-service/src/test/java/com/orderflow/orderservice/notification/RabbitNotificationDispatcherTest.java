package com.orderflow.orderservice.notification;

import com.orderflow.common.contracts.OrderNotificationContract;
import com.orderflow.common.contracts.ShippingPaymentContract;
import com.orderflow.common.contracts.ShippingPaymentNoticeContract;
import com.orderflow.orderservice.config.AmqpConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.net.ConnectException;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RabbitNotificationDispatcherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    @InjectMocks
    private RabbitNotificationDispatcher dispatcher;

    private final OrderNotificationContract order = OrderNotificationContract.builder()
            .orderId(UUID.randomUUID())
            .orderNumber("ORD1714557600000123")
            .customerEmail("asha@example.com")
            .status("SHIPPED")
            .build();

    @Test
    void sendOrderConfirmation_PublishesToNotificationExchange() {
        boolean sent = dispatcher.sendOrderConfirmation(order, "asha@example.com");

        assertThat(sent).isTrue();
        verify(rabbitTemplate).convertAndSend(AmqpConfig.NOTIFICATION_EXCHANGE,
                AmqpConfig.ROUTING_KEY_ORDER_CONFIRMATION, order);
    }

    @Test
    void sendOrderConfirmation_SkipsWithoutEmail() {
        assertThat(dispatcher.sendOrderConfirmation(order, " ")).isFalse();
        verifyNoInteractions(rabbitTemplate);
    }

    @Test
    void sendOrderStatusUpdate_ReturnsFalseWhenBrokerDown() {
        doThrow(new AmqpConnectException(new ConnectException("Connection refused")))
                .when(rabbitTemplate).convertAndSend(anyString(), anyString(), any(Object.class));

        assertThat(dispatcher.sendOrderStatusUpdate(order, "PROCESSING")).isFalse();
    }

    @Test
    void sendShippingPaymentLink_WrapsOrderAndPayment() {
        ShippingPaymentContract payment = ShippingPaymentContract.builder()
                .linkId("plink_1")
                .shortUrl("https://rzp.io/i/abc")
                .build();

        assertThat(dispatcher.sendShippingPaymentLink(order, payment)).isTrue();

        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(rabbitTemplate).convertAndSend(eq(AmqpConfig.NOTIFICATION_EXCHANGE),
                eq(AmqpConfig.ROUTING_KEY_SHIPPING_PAYMENT_LINK), message.capture());
        ShippingPaymentNoticeContract notice = (ShippingPaymentNoticeContract) message.getValue();
        assertThat(notice.getOrder()).isEqualTo(order);
        assertThat(notice.getPayment().getShortUrl()).isEqualTo("https://rzp.io/i/abc");
    }
}
