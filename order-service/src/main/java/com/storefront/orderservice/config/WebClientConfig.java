package com.storefront.orderservice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    // The auto-configured builder already carries the shared snake_case ObjectMapper
    @Bean
    public WebClient inventoryServiceWebClient(WebClient.Builder builder, InventoryClientProperties properties) {
        return builder.baseUrl(properties.getBaseUrl()).build();
    }
}
