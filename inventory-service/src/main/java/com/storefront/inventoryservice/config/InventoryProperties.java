package com.storefront.inventoryservice.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Products loaded into the in-memory store at startup ({@code inventory.products}).
 */
@Data
@Validated
@ConfigurationProperties(prefix = "inventory")
public class InventoryProperties {

    @Valid
    private List<SeedProduct> products = new ArrayList<>();

    @Data
    public static class SeedProduct {
        @NotBlank
        private String id;

        @NotBlank
        private String name;

        @NotNull
        @PositiveOrZero
        private Integer stock;

        @NotNull
        @PositiveOrZero
        private BigDecimal price;
    }
}
