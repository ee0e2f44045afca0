package com.storefront.orderservice.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "inventory.client")
public class InventoryClientProperties {

    @NotBlank
    private String baseUrl = "http://localhost:8000";

    // applied to every outbound call; expiry is reported as "service unavailable"
    @NotNull
    private Duration timeout = Duration.ofSeconds(10);
}
