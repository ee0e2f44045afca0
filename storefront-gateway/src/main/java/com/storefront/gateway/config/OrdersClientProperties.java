package com.storefront.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "orders.client")
public class OrdersClientProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8001";

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(10);

    // creation walks every item through inventory, so it gets a longer budget
    @NotNull
    private Duration createTimeout = Duration.ofSeconds(30);
}
