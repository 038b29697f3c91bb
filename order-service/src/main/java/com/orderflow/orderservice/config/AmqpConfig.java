package com.orderflow.orderservice.config;

import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * order-service only produces here. Email/SMS workers own the queues
 * bound to the notification exchange; the DLX is declared so their
 * queues can dead-letter with the same names.
 */
@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String NOTIFICATION_EXCHANGE = "notification_events_exchange";

    public static final String ROUTING_KEY_ORDER_CONFIRMATION = "notification.order_confirmation";
    public static final String ROUTING_KEY_ADMIN_NEW_ORDER = "notification.admin_new_order";
    public static final String ROUTING_KEY_ORDER_STATUS_UPDATE = "notification.order_status_update";
    public static final String ROUTING_KEY_SHIPPING_PAYMENT_LINK = "notification.shipping_payment_link";
    public static final String ROUTING_KEY_SHIPPING_PAYMENT_RECEIPT = "notification.shipping_payment_receipt";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange notificationEventsExchange() {
        return new TopicExchange(NOTIFICATION_EXCHANGE);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }
}
