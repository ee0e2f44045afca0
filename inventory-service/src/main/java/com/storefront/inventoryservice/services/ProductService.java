package com.storefront.inventoryservice.services;

import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.common.dto.ReserveStockResponse;
import com.storefront.inventoryservice.dto.InventoryListResponse;

public interface ProductService {

    // Listing
    InventoryListResponse getAllProducts();

    // Single product snapshot, no side effects
    InventoryItemResponse getProductById(String productId);

    /**
     * Reserves stock: checks and decrements in one atomic step.
     * This is the only operation that changes a product's stock.
     */
    ReserveStockResponse reserveProduct(String productId, int quantity);
}
