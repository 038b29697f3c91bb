package com.orderflow.orderservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.orderflow.orderservice.gateway.SignatureVerifier;
import com.orderflow.orderservice.model.Order;
import com.orderflow.orderservice.model.OutboxEventType;
import com.orderflow.orderservice.model.Product;
import com.orderflow.orderservice.model.ShippingPayment;
import com.orderflow.orderservice.model.ShippingPaymentStatus;
import com.orderflow.orderservice.model.WebhookInboxEvent;
import com.orderflow.orderservice.repository.IdempotentEventRepository;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.OutboxRepository;
import com.orderflow.orderservice.repository.ProductRepository;
import com.orderflow.orderservice.repository.WebhookInboxRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class WebhookIntegrationTest extends AbstractIntegrationTest {

        private static final String WEBHOOK_SECRET = "test_webhook_secret";

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private ObjectMapper objectMapper;

        @Autowired
        private SignatureVerifier signatureVerifier;

        @Autowired
        private OrderRepository orderRepository;

        @Autowired
        private ProductRepository productRepository;

        @Autowired
        private OutboxRepository outboxRepository;

        @Autowired
        private WebhookInboxRepository inboxRepository;

        @Autowired
        private IdempotentEventRepository idempotentEventRepository;

        private UUID orderId;

        @BeforeEach
        void setUp() {
                Product product = productRepository.save(StockConcurrencyIntegrationTest.product(5));
                Order order = StockConcurrencyIntegrationTest.pendingOrder(product, 1);

                ShippingPayment shippingPayment = new ShippingPayment();
                shippingPayment.setLinkId("plink_it_" + UUID.randomUUID());
                shippingPayment.setShortUrl("https://rzp.io/i/test");
                shippingPayment.setStatus(ShippingPaymentStatus.PENDING);
                shippingPayment.setCurrency("INR");
                shippingPayment.setAmount(new BigDecimal("120"));
                shippingPayment.setAmountPaid(BigDecimal.ZERO);
                shippingPayment.setPaymentIds(new ArrayList<>());
                order.setShippingPayment(shippingPayment);

                orderId = orderRepository.save(order).getId();
        }

        @AfterEach
        void cleanup() {
                inboxRepository.deleteAll();
                idempotentEventRepository.deleteAll();
                outboxRepository.deleteAll();
                orderRepository.deleteAll();
                productRepository.deleteAll();
        }

        @Test
        void should_apply_payment_link_paid_once_when_delivered_twice() throws Exception {
                String linkId = orderRepository.findById(orderId).orElseThrow().getShippingPayment().getLinkId();
                byte[] body = paymentLinkPaid(linkId, "pay_it_1", 12000);
                String signature = signatureVerifier.sign(WEBHOOK_SECRET, body);

                deliver(body, signature, "evt_it_1");
                await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
                                assertThat(inboxRepository.findAll()).allMatch(WebhookInboxEvent::isProcessed));

                // same gateway delivery id, sent again
                deliver(body, signature, "evt_it_1");
                await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
                        assertThat(inboxRepository.findAll()).hasSize(2);
                        assertThat(inboxRepository.findAll()).allMatch(WebhookInboxEvent::isProcessed);
                });

                ShippingPayment shippingPayment = orderRepository.findById(orderId).orElseThrow().getShippingPayment();
                assertThat(shippingPayment.getStatus()).isEqualTo(ShippingPaymentStatus.PAID);
                assertThat(shippingPayment.getAmountPaid()).isEqualByComparingTo("120");
                assertThat(shippingPayment.getPaymentIds()).containsExactly("pay_it_1");
                assertThat(outboxRepository.findAll())
                                .filteredOn(event -> event.getType().equals(OutboxEventType.SHIPPING_PAYMENT_UPDATED.value()))
                                .hasSize(1);
        }

        @Test
        void should_ignore_replay_under_a_new_delivery_id() throws Exception {
                String linkId = orderRepository.findById(orderId).orElseThrow().getShippingPayment().getLinkId();
                byte[] body = paymentLinkPaid(linkId, "pay_it_2", 12000);
                String signature = signatureVerifier.sign(WEBHOOK_SECRET, body);

                deliver(body, signature, "evt_it_2a");
                await().atMost(10, TimeUnit.SECONDS).untilAsserted(() ->
                                assertThat(inboxRepository.findAll()).allMatch(WebhookInboxEvent::isProcessed));
                deliver(body, signature, "evt_it_2b");
                await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
                        assertThat(inboxRepository.findAll()).hasSize(2);
                        assertThat(inboxRepository.findAll()).allMatch(WebhookInboxEvent::isProcessed);
                });

                ShippingPayment shippingPayment = orderRepository.findById(orderId).orElseThrow().getShippingPayment();
                assertThat(shippingPayment.getAmountPaid()).isEqualByComparingTo("120");
                assertThat(shippingPayment.getPaymentIds()).containsExactly("pay_it_2");
        }

        @Test
        void should_acknowledge_but_drop_event_with_wrong_signature() throws Exception {
                String linkId = orderRepository.findById(orderId).orElseThrow().getShippingPayment().getLinkId();
                byte[] body = paymentLinkPaid(linkId, "pay_it_3", 12000);
                String forged = signatureVerifier.sign("not_the_secret", body);

                deliver(body, forged, "evt_it_3");

                assertThat(inboxRepository.findAll()).isEmpty();
                assertThat(orderRepository.findById(orderId).orElseThrow().getShippingPayment().getStatus())
                                .isEqualTo(ShippingPaymentStatus.PENDING);
        }

        @Test
        void should_reject_missing_signature_header() throws Exception {
                mockMvc.perform(post("/api/v1/webhooks/payments")
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{\"event\":\"payment.captured\"}"))
                                .andExpect(status().isBadRequest());

                assertThat(inboxRepository.findAll()).isEmpty();
        }

        private void deliver(byte[] body, String signature, String eventId) throws Exception {
                mockMvc.perform(post("/api/v1/webhooks/payments")
                                .contentType(MediaType.APPLICATION_JSON)
                                .header("X-Signature", signature)
                                .header("X-Event-Id", eventId)
                                .content(body))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.status").value("ok"));
        }

        private byte[] paymentLinkPaid(String linkId, String paymentId, long amountMinor) {
                ObjectNode root = objectMapper.createObjectNode();
                root.put("event", "payment_link.paid");
                ObjectNode payload = root.putObject("payload");
                payload.putObject("payment_link").putObject("entity").put("id", linkId).put("status", "paid");
                payload.putObject("payment").putObject("entity").put("id", paymentId).put("amount", amountMinor);
                return root.toString().getBytes(StandardCharsets.UTF_8);
        }
}
