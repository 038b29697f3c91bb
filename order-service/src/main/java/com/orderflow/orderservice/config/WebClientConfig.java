package com.orderflow.orderservice.config;

import io.netty.channel.ChannelOption;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final OrderflowProperties properties;

    @Bean
    public WebClient paymentGatewayWebClient(WebClient.Builder builder) {
        OrderflowProperties.Gateway gateway = properties.getGateway();
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) gateway.getTimeout().toMillis())
                .responseTimeout(gateway.getTimeout());

        return builder
                .baseUrl(gateway.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeaders(headers -> {
                    if (gateway.getKeyId() != null && gateway.getKeySecret() != null) {
                        headers.setBasicAuth(gateway.getKeyId(), gateway.getKeySecret());
                    }
                })
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
