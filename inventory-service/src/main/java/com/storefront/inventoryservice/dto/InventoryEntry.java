package com.storefront.inventoryservice.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

// One value of the "items" map in GET /api/inventory, keyed by product id
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InventoryEntry {
    private String name;
    private Integer stock;
    private BigDecimal price;
}
