package com.storefront.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Snapshot of a single product as served by inventory-service
 * {@code GET /api/inventory/{productId}} and read by order-service before it
 * reserves stock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryItemResponse {
    private String productId;
    private String name;
    private Integer stock;
    private BigDecimal price;
    private boolean available;
}
