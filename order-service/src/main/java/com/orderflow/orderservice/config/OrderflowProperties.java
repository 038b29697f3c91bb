package com.orderflow.orderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "orderflow")
public class OrderflowProperties {

    private Quantity quantity = new Quantity();
    private Pricing pricing = new Pricing();
    private Gateway gateway = new Gateway();
    private Webhook webhook = new Webhook();

    @Data
    public static class Quantity {
        // per-line ceiling regardless of stock
        private int globalMax = 500;
        // lines asking for more than this go to the sales team
        private int manualSalesThreshold = 100;
        private int defaultMoq = 1;
        // category slug -> minimum order quantity
        private Map<String, Integer> categoryMoq = new HashMap<>();
    }

    @Data
    public static class Pricing {
        private BigDecimal taxPercent = new BigDecimal("18");
        private BigDecimal shippingFee = new BigDecimal("50");
        private BigDecimal freeShippingAbove = new BigDecimal("500");
        private String currency = "INR";
    }

    @Data
    public static class Gateway {
        private String baseUrl = "https://api.razorpay.com/v1";
        private String keyId;
        private String keySecret;
        private String webhookSecret;
        private Duration timeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Webhook {
        // inbox rows older than this are picked up by the sweeper
        private Duration retryAfter = Duration.ofSeconds(30);
        private int maxAttempts = 5;
        private Duration idempotencyTtl = Duration.ofDays(7);
    }
}
