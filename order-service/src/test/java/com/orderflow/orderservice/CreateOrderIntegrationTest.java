package com.orderflow.orderservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.orderflow.common.model.Address;
import com.orderflow.orderservice.dto.OrderItemRequest;
import com.orderflow.orderservice.dto.OrderRequest;
import com.orderflow.orderservice.exception.GatewayException;
import com.orderflow.orderservice.gateway.PaymentGatewayAdapter;
import com.orderflow.orderservice.model.OrderStatus;
import com.orderflow.orderservice.model.OutboxEventType;
import com.orderflow.orderservice.model.PaymentMethod;
import com.orderflow.orderservice.model.PaymentStatus;
import com.orderflow.orderservice.model.Product;
import com.orderflow.orderservice.repository.OrderRepository;
import com.orderflow.orderservice.repository.OutboxRepository;
import com.orderflow.orderservice.repository.ProductRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class CreateOrderIntegrationTest extends AbstractIntegrationTest {

        @Autowired
        private MockMvc mockMvc;

        @Autowired
        private ObjectMapper objectMapper;

        @Autowired
        private OrderRepository orderRepository;

        @Autowired
        private ProductRepository productRepository;

        @Autowired
        private OutboxRepository outboxRepository;

        @MockBean
        private PaymentGatewayAdapter paymentGatewayAdapter;

        private UUID userId;
        private Product product;

        @BeforeEach
        void setUp() {
                userId = UUID.randomUUID();
                product = productRepository.save(Product.builder()
                                .name("Steel washer")
                                .basePrice(new BigDecimal("100"))
                                .stockQuantity(40)
                                .build());
        }

        @AfterEach
        void cleanup() {
                outboxRepository.deleteAll();
                orderRepository.deleteAll();
                productRepository.deleteAll();
        }

        @Test
        void should_place_gateway_order_and_commit_stock() throws Exception {
                when(paymentGatewayAdapter.createIntent(eq(PaymentMethod.GATEWAY), any(), eq("INR"), anyString(), anyMap()))
                                .thenReturn("order_int_1");

                MvcResult result = mockMvc.perform(post("/api/v1/orders")
                                .with(jwt().jwt(builder -> builder.subject(userId.toString())))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(request(PaymentMethod.GATEWAY, 10))))
                                .andExpect(status().isCreated())
                                .andExpect(jsonPath("$.status").value("PENDING"))
                                .andExpect(jsonPath("$.paymentStatus").value("AWAITING_PAYMENT"))
                                .andExpect(jsonPath("$.gatewayOrderId").value("order_int_1"))
                                .andReturn();

                JsonNode response = objectMapper.readTree(result.getResponse().getContentAsString());
                UUID orderId = UUID.fromString(response.get("id").asText());

                // 10 x 100 = 1000, 18% tax, free shipping above 500
                assertThat(response.get("subtotal").decimalValue()).isEqualByComparingTo("1000");
                assertThat(response.get("tax").decimalValue()).isEqualByComparingTo("180");
                assertThat(response.get("shipping").decimalValue()).isEqualByComparingTo("0");
                assertThat(response.get("total").decimalValue()).isEqualByComparingTo("1180");

                assertThat(productRepository.findById(product.getId()).orElseThrow().getStockQuantity()).isEqualTo(30);
                assertThat(orderRepository.findById(orderId).orElseThrow().isInventoryCommitted()).isTrue();
                assertThat(outboxRepository.findAll())
                                .anyMatch(event -> event.getType().equals(OutboxEventType.ORDER_CREATED.value())
                                                && event.getAggregateId().equals(orderId.toString()));
        }

        @Test
        void should_compensate_when_gateway_rejects_intent() throws Exception {
                when(paymentGatewayAdapter.createIntent(any(), any(), anyString(), anyString(), anyMap()))
                                .thenThrow(new GatewayException("Payment gateway unavailable"));

                mockMvc.perform(post("/api/v1/orders")
                                .with(jwt().jwt(builder -> builder.subject(userId.toString())))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(request(PaymentMethod.GATEWAY, 10))))
                                .andExpect(status().isBadGateway());

                assertThat(orderRepository.findByUserIdOrderByCreatedAtDesc(userId)).isEmpty();
                assertThat(productRepository.findById(product.getId()).orElseThrow().getStockQuantity()).isEqualTo(40);
                assertThat(outboxRepository.findAll()).isEmpty();
        }

        @Test
        void should_reject_order_when_stock_cannot_cover_a_single_unit() throws Exception {
                product.setStockQuantity(0);
                productRepository.save(product);

                mockMvc.perform(post("/api/v1/orders")
                                .with(jwt().jwt(builder -> builder.subject(userId.toString())))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(request(PaymentMethod.GATEWAY, 5))))
                                .andExpect(status().isBadRequest());

                assertThat(orderRepository.findByUserIdOrderByCreatedAtDesc(userId)).isEmpty();
        }

        @Test
        void should_confirm_cod_order_and_expose_public_tracking() throws Exception {
                when(paymentGatewayAdapter.createIntent(eq(PaymentMethod.CASH_ON_DELIVERY), any(), anyString(), anyString(),
                                anyMap())).thenReturn("cod_int_1");

                MvcResult created = mockMvc.perform(post("/api/v1/orders")
                                .with(jwt().jwt(builder -> builder.subject(userId.toString())))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(request(PaymentMethod.CASH_ON_DELIVERY, 2))))
                                .andExpect(status().isCreated())
                                .andExpect(jsonPath("$.paymentStatus").value(PaymentStatus.COD_PENDING.name()))
                                .andReturn();
                JsonNode order = objectMapper.readTree(created.getResponse().getContentAsString());
                UUID orderId = UUID.fromString(order.get("id").asText());

                mockMvc.perform(post("/api/v1/orders/{orderId}/verify-payment", orderId)
                                .with(jwt().jwt(builder -> builder.subject(userId.toString())))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content("{}"))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.verified").value(true));

                assertThat(orderRepository.findById(orderId).orElseThrow().getStatus())
                                .isEqualTo(OrderStatus.CONFIRMED);

                mockMvc.perform(get("/api/v1/orders/track/{orderNumber}", order.get("orderNumber").asText().toLowerCase()))
                                .andExpect(status().isOk())
                                .andExpect(jsonPath("$.orderNumber").value(order.get("orderNumber").asText()))
                                .andExpect(jsonPath("$.status").value("CONFIRMED"));
        }

        @Test
        void should_hide_order_from_other_customers() throws Exception {
                when(paymentGatewayAdapter.createIntent(any(), any(), anyString(), anyString(), anyMap()))
                                .thenReturn("order_int_2");

                MvcResult created = mockMvc.perform(post("/api/v1/orders")
                                .with(jwt().jwt(builder -> builder.subject(userId.toString())))
                                .contentType(MediaType.APPLICATION_JSON)
                                .content(objectMapper.writeValueAsString(request(PaymentMethod.GATEWAY, 1))))
                                .andExpect(status().isCreated())
                                .andReturn();
                JsonNode order = objectMapper.readTree(created.getResponse().getContentAsString());
                UUID orderId = UUID.fromString(order.get("id").asText());

                mockMvc.perform(get("/api/v1/orders/{orderId}", orderId)
                                .with(jwt().jwt(builder -> builder.subject(UUID.randomUUID().toString()))))
                                .andExpect(status().isForbidden());
        }

        private OrderRequest request(PaymentMethod method, int quantity) {
                Address address = new Address();
                address.setFullName("Asha Rao");
                address.setPhone("9876543210");
                address.setLine1("14 Industrial Estate");
                address.setCity("Pune");
                address.setState("Maharashtra");
                address.setPostalCode("411001");
                address.setCountry("IN");

                OrderItemRequest item = new OrderItemRequest();
                item.setProductId(product.getId());
                item.setQuantity(quantity);

                OrderRequest request = new OrderRequest();
                request.setShippingAddress(address);
                request.setPaymentMethod(method);
                request.setEmail("asha@example.com");
                request.setItems(List.of(item));
                return request;
        }
}
