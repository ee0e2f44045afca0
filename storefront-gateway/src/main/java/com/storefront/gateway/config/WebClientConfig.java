package com.storefront.gateway.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient ordersServiceWebClient(WebClient.Builder builder, OrdersClientProperties properties) {
        return builder.baseUrl(properties.getBaseUrl()).build();
    }
}
