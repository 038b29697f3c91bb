package com.orderflow.orderservice.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.orderflow.orderservice.config.OrderflowProperties;
import com.orderflow.orderservice.exception.GatewayException;
import com.orderflow.orderservice.model.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class RazorpayPaymentGatewayAdapter implements PaymentGatewayAdapter {

    static final int MAX_RECEIPT_LENGTH = 40;
    static final String COD_PREFIX = "cod_";

    private final WebClient paymentGatewayWebClient;
    private final OrderflowProperties properties;
    private final SignatureVerifier signatureVerifier;

    @Override
    public String createIntent(PaymentMethod method, BigDecimal amount, String currency, String receipt,
            Map<String, String> notes) {
        String boundedReceipt = receipt.length() > MAX_RECEIPT_LENGTH
                ? receipt.substring(0, MAX_RECEIPT_LENGTH)
                : receipt;

        if (method == PaymentMethod.CASH_ON_DELIVERY) {
            String codId = COD_PREFIX + boundedReceipt.substring(boundedReceipt.indexOf('_') + 1);
            log.info("COD order, no gateway intent: receipt={}, gatewayOrderId={}", boundedReceipt, codId);
            return codId;
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", toMinorUnits(amount));
        body.put("currency", currency);
        body.put("receipt", boundedReceipt);
        body.put("notes", notes != null ? notes : Map.of());

        JsonNode response = post("/orders", body);
        String gatewayOrderId = response.path("id").asText(null);
        if (gatewayOrderId == null) {
            throw new GatewayException("Gateway order response did not contain an id");
        }
        log.info("Gateway intent created: receipt={}, gatewayOrderId={}", boundedReceipt, gatewayOrderId);
        return gatewayOrderId;
    }

    @Override
    public PaymentLink createPaymentLink(BigDecimal amount, String currency, PaymentLinkCustomer customer,
            String description, Map<String, String> notes) {
        Map<String, Object> customerBody = new HashMap<>();
        customerBody.put("name", customer.getName());
        customerBody.put("email", customer.getEmail());
        customerBody.put("contact", customer.getContact());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", toMinorUnits(amount));
        body.put("currency", currency);
        body.put("accept_partial", false);
        body.put("description", description);
        body.put("customer", customerBody);
        body.put("notify", Map.of("sms", true, "email", true));
        body.put("notes", notes != null ? notes : Map.of());

        JsonNode response = post("/payment_links", body);
        String linkId = response.path("id").asText(null);
        String shortUrl = response.path("short_url").asText(null);
        if (linkId == null || shortUrl == null) {
            throw new GatewayException("Gateway payment link response was incomplete");
        }
        log.info("Gateway payment link created: linkId={}", linkId);
        return PaymentLink.builder().linkId(linkId).shortUrl(shortUrl).build();
    }

    @Override
    public boolean verify(String gatewayOrderId, String paymentId, String signature) {
        if (gatewayOrderId == null || paymentId == null) {
            return false;
        }
        return signatureVerifier.verify(properties.getGateway().getKeySecret(),
                gatewayOrderId + "|" + paymentId, signature);
    }

    @Override
    public boolean verifyWebhook(byte[] rawBody, String signature) {
        return signatureVerifier.verify(properties.getGateway().getWebhookSecret(), rawBody, signature);
    }

    private JsonNode post(String path, Map<String, Object> body) {
        try {
            JsonNode response = paymentGatewayWebClient.post()
                    .uri(path)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .block(properties.getGateway().getTimeout());
            if (response == null) {
                throw new GatewayException("Empty response from payment gateway: " + path);
            }
            return response;
        } catch (WebClientResponseException e) {
            // upstream body can echo account details, keep it out of the message
            log.error("Payment gateway rejected call: path={}, status={}", path, e.getStatusCode());
            throw new GatewayException("Payment gateway returned " + e.getStatusCode().value(), e);
        } catch (GatewayException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Payment gateway call failed: path={}, error={}", path, e.getMessage());
            throw new GatewayException("Payment gateway unavailable", e);
        }
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
